package com.weixiao.gitcad.lock;

import com.google.gson.JsonParseException;
import com.weixiao.gitcad.repo.ArchivePaths;
import com.weixiao.gitcad.repo.Workspace;
import com.weixiao.gitcad.result.ErrorKind;
import com.weixiao.gitcad.result.Failure;
import com.weixiao.gitcad.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 锁协调器：通过 git lfs 锁定归档的代理锁文件（展开目录下的 .lockfile），保证每个归档至多一个写者。
 * <p>
 * 锁状态只存在于锁原语中，本类不缓存；每次查询都重新执行 git lfs locks。
 * 调用方显式传入 actor（当前用户），不从全局状态读取。
 */
public class LockCoordinator {

    private static final Logger log = LoggerFactory.getLogger(LockCoordinator.class);

    private final ArchivePaths paths;
    private final CommandRunner runner;
    private final Duration timeout;

    public LockCoordinator(ArchivePaths paths, CommandRunner runner) {
        this(paths, runner, CommandRunner.DEFAULT_TIMEOUT);
    }

    public LockCoordinator(ArchivePaths paths, CommandRunner runner, Duration timeout) {
        this.paths = paths;
        this.runner = runner;
        this.timeout = timeout;
    }

    /**
     * 为 actor 锁定归档。
     * <ol>
     *   <li>代理锁文件不存在时创建并 git add</li>
     *   <li>非 force：先查锁列表，自己已持有即成功，他人持有返回 ALREADY_LOCKED(owner)</li>
     *   <li>force：先 unlock --force 再 lock</li>
     * </ol>
     *
     * @return 成功时为代理锁文件相对仓库根的路径
     */
    public Result<String> acquire(Path archive, String actor, boolean force) {
        String identity = paths.archiveIdentity(archive);
        String marker = paths.lockfileRelative(archive);
        log.debug("acquire {} via {} actor={} force={}", identity, marker, actor, force);

        Result<Void> prepared = ensureMarker(archive, marker);
        if (!prepared.isOk()) {
            return prepared.castFailure();
        }

        if (!force) {
            Result<List<LockRecord>> active = listActive();
            if (active.isOk()) {
                Optional<LockRecord> existing = find(active.getValue(), marker);
                if (existing.isPresent()) {
                    String owner = existing.get().getOwner();
                    if (owner.equals(actor)) {
                        log.info("{} is already locked by {}", identity, actor);
                        return Result.success(marker);
                    }
                    log.info("{} is locked by {}", identity, owner);
                    return Result.failure(Failure.alreadyLocked(owner, identity + " is already locked by " + owner));
                }
            } else if (active.getKind() == ErrorKind.TIMEOUT) {
                return active.castFailure();
            } else {
                // 查询失败时以 lock 本身的结果为准
                log.warn("cannot list locks before locking {}: {}", identity, active.getFailure());
            }
        } else {
            Result<CommandResult> unlocked = git(List.of("git", "lfs", "unlock", "--force", marker));
            if (!unlocked.isOk()) {
                return unlocked.castFailure();
            }
            if (!unlocked.getValue().isSuccess()) {
                log.warn("force unlock of {} failed (may not be locked): {}", marker, unlocked.getValue().errorText());
            }
        }

        Result<CommandResult> locked = git(List.of("git", "lfs", "lock", marker));
        if (!locked.isOk()) {
            return locked.castFailure();
        }
        CommandResult r = locked.getValue();
        if (r.isSuccess()) {
            log.info("locked {} for {}", identity, actor);
            return Result.success(marker);
        }
        String error = r.errorText();
        if (LockListParser.isAlreadyLocked(error)) {
            String owner = LockListParser.ownerFromError(error);
            return Result.failure(Failure.alreadyLocked(owner, identity + " is already locked by " + owner));
        }
        log.warn("git lfs lock {} failed: {}", marker, error);
        return Result.failure(ErrorKind.COMMAND_FAILED, "cannot lock " + identity + ": " + error);
    }

    /**
     * 释放锁；force 时可解除他人的锁（需要服务端权限）。
     */
    public Result<String> release(Path archive, String actor, boolean force) {
        String identity = paths.archiveIdentity(archive);
        String marker = paths.lockfileRelative(archive);
        log.debug("release {} via {} actor={} force={}", identity, marker, actor, force);
        List<String> cmd = new ArrayList<>(List.of("git", "lfs", "unlock", marker));
        if (force) {
            cmd.add("--force");
        }
        Result<CommandResult> unlocked = git(cmd);
        if (!unlocked.isOk()) {
            return unlocked.castFailure();
        }
        CommandResult r = unlocked.getValue();
        if (r.isSuccess()) {
            log.info("unlocked {}", identity);
            return Result.success(marker);
        }
        String error = r.errorText();
        if (LockListParser.isNotLocked(error)) {
            return Result.failure(ErrorKind.NOT_LOCKED, identity + " is not locked");
        }
        log.warn("git lfs unlock {} failed: {}", marker, error);
        return Result.failure(ErrorKind.COMMAND_FAILED, "cannot unlock " + identity + ": " + error);
    }

    /**
     * 当前全部活动锁：优先 --json 结构化输出，失败或无法解析时退回文本解析。
     */
    public Result<List<LockRecord>> listActive() {
        Result<CommandResult> json = git(List.of("git", "lfs", "locks", "--json"));
        if (!json.isOk()) {
            return json.castFailure();
        }
        if (json.getValue().isSuccess()) {
            try {
                return Result.success(LockListParser.parseJson(json.getValue().getStdout()));
            } catch (JsonParseException e) {
                log.debug("lock list is not json, falling back to text: {}", e.getMessage());
            }
        }
        Result<CommandResult> text = git(List.of("git", "lfs", "locks"));
        if (!text.isOk()) {
            return text.castFailure();
        }
        if (!text.getValue().isSuccess()) {
            String error = text.getValue().errorText();
            log.warn("git lfs locks failed: {}", error);
            return Result.failure(ErrorKind.COMMAND_FAILED, "cannot list locks: " + error);
        }
        return Result.success(LockListParser.parseText(text.getValue().getStdout()));
    }

    /**
     * 活动锁，并为每条记录标出对应的归档：对工作区中的每个 .FCStd 计算代理锁文件路径后匹配。
     * 只用正向映射，匹配不到的记录 archive 为 null。
     */
    public Result<List<LockRecord>> listWithArchives() {
        Result<List<LockRecord>> active = listActive();
        if (!active.isOk()) {
            return active;
        }
        Map<String, String> markerToArchive = new HashMap<>();
        try {
            for (String rel : Workspace.listFiles(paths.getRepoRoot())) {
                if (ArchivePaths.isArchive(rel)) {
                    markerToArchive.put(paths.lockfileRelative(Path.of(rel)), rel);
                }
            }
        } catch (IOException e) {
            log.warn("cannot scan workspace for archives: {}", e.getMessage());
        }
        List<LockRecord> resolved = new ArrayList<>();
        for (LockRecord r : active.getValue()) {
            resolved.add(r.withArchive(markerToArchive.get(r.getPosixPath())));
        }
        return Result.success(resolved);
    }

    /** 归档当前的锁持有者；未锁定时为空。 */
    public Result<Optional<String>> ownerOf(Path archive) {
        String marker = paths.lockfileRelative(archive);
        return listActive().map(records -> find(records, marker).map(LockRecord::getOwner));
    }

    /**
     * 归档是否由 actor 持有锁（每次都重新查询）。
     */
    public Result<Boolean> isLockedBy(Path archive, String actor) {
        return ownerOf(archive).map(owner -> owner.isPresent() && owner.get().equals(actor));
    }

    private Result<Void> ensureMarker(Path archive, String marker) {
        Path lockfile = paths.lockfile(archive);
        if (Files.exists(lockfile)) {
            return Result.success(null);
        }
        try {
            Files.createDirectories(lockfile.getParent());
            Files.createFile(lockfile);
        } catch (IOException e) {
            log.error("cannot create lockfile {}", lockfile, e);
            return Result.failure(ErrorKind.IO_ERROR, "cannot create " + marker + ": " + e.getMessage());
        }
        log.debug("created lockfile {}", lockfile);
        Result<CommandResult> added = git(List.of("git", "add", marker));
        if (!added.isOk()) {
            return added.castFailure();
        }
        if (!added.getValue().isSuccess()) {
            log.warn("git add {} failed: {}", marker, added.getValue().errorText());
        }
        return Result.success(null);
    }

    private static Optional<LockRecord> find(List<LockRecord> records, String marker) {
        return records.stream().filter(r -> marker.equals(r.getPosixPath())).findFirst();
    }

    /** 运行命令；超时与无法启动转换为失败，非零退出码留给调用方判断。 */
    private Result<CommandResult> git(List<String> command) {
        CommandResult r;
        try {
            r = runner.run(paths.getRepoRoot(), command, null, timeout);
        } catch (IOException e) {
            log.error("cannot run {}", command, e);
            return Result.failure(ErrorKind.COMMAND_FAILED, "cannot run " + String.join(" ", command) + ": " + e.getMessage());
        }
        if (r.isTimedOut()) {
            return Result.failure(ErrorKind.TIMEOUT,
                    String.join(" ", command) + " timed out after " + timeout.toSeconds() + "s");
        }
        return Result.success(r);
    }
}
