package com.weixiao.gitcad.lifecycle;

import com.weixiao.gitcad.archive.ArchiveTransformer;
import com.weixiao.gitcad.archive.ChangeFile;
import com.weixiao.gitcad.archive.ImportResult;
import com.weixiao.gitcad.config.RepositoryConfig;
import com.weixiao.gitcad.git.GitClient;
import com.weixiao.gitcad.git.PushRefUpdate;
import com.weixiao.gitcad.lock.CommandRunner;
import com.weixiao.gitcad.lock.LockCoordinator;
import com.weixiao.gitcad.lock.LockRecord;
import com.weixiao.gitcad.repo.ArchivePaths;
import com.weixiao.gitcad.repo.Repository;
import com.weixiao.gitcad.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 生命周期状态机：每个 git 钩子是一个独立入口，按事件类型分派，总是返回退出码并结束。
 * <ul>
 *   <li>pre-commit：暂存的 .FCStd 必须是空壳；要求锁时 actor 必须持有每个涉及归档的锁</li>
 *   <li>post-checkout / post-merge / post-rewrite：先跑 git lfs 同名钩子与 lfs pull，再导入变化的归档</li>
 *   <li>pre-push：要求锁时，推送范围内改动的每个归档都必须由 actor 持锁</li>
 * </ul>
 * 任何未预期的异常（含配置加载）在此边界捕获，返回 {@link ExitCodes#FATAL}。
 */
public class LifecycleStateMachine {

    private static final Logger log = LoggerFactory.getLogger(LifecycleStateMachine.class);

    private static final String ORIG_HEAD = "ORIG_HEAD";
    private static final String HEAD = "HEAD";
    private static final String BRANCH_CHECKOUT = "1";
    private static final String REWRITE_REBASE = "rebase";

    private final Repository repo;
    private final GitClient git;
    private final CommandRunner runner;
    private final PrintStream err;

    /**
     * @param runner 锁原语使用的命令执行器
     * @param err    面向用户的诊断输出（钩子的 stderr）
     */
    public LifecycleStateMachine(Repository repo, GitClient git, CommandRunner runner, PrintStream err) {
        this.repo = repo;
        this.git = git;
        this.runner = runner;
        this.err = err;
    }

    /**
     * 处理一个事件。
     *
     * @param actor 当前用户；可以为 null，要求锁的事件会因此拒绝
     * @return {@link ExitCodes} 之一
     */
    public int dispatch(LifecycleEvent event, String actor) {
        log.debug("dispatch {} actor={} repo={}", event, actor, repo.getRoot());
        try {
            Context ctx = new Context(repo.loadConfig());
            if (event instanceof LifecycleEvent.PreCommit) {
                return preCommit(ctx, actor);
            }
            if (event instanceof LifecycleEvent.PostCheckout) {
                return postCheckout(ctx, (LifecycleEvent.PostCheckout) event);
            }
            if (event instanceof LifecycleEvent.PostMerge) {
                return postMerge(ctx, (LifecycleEvent.PostMerge) event);
            }
            if (event instanceof LifecycleEvent.PostRewrite) {
                return postRewrite(ctx, (LifecycleEvent.PostRewrite) event);
            }
            if (event instanceof LifecycleEvent.PrePush) {
                return prePush(ctx, (LifecycleEvent.PrePush) event, actor);
            }
            err.println("fatal: unknown lifecycle event: " + event);
            return ExitCodes.FATAL;
        } catch (Exception e) {
            log.error("{} hook failed", event.hookName(), e);
            err.println("fatal: " + event.hookName() + " hook failed: " + e);
            return ExitCodes.FATAL;
        }
    }

    private int preCommit(Context ctx, String actor) throws IOException {
        Result<List<String>> staged = git.stagedPaths();
        if (!staged.isOk()) {
            err.println("fatal: cannot list staged files: " + staged.getFailure().getMessage());
            return ExitCodes.FATAL;
        }

        List<String> dirty = new ArrayList<>();
        Set<String> touched = new LinkedHashSet<>();
        for (String rel : staged.getValue()) {
            if (ArchivePaths.isArchive(rel)) {
                touched.add(rel);
                Path file = repo.getRoot().resolve(rel);
                if (Files.isRegularFile(file) && !ctx.transformer.isExportedForm(file)) {
                    dirty.add(rel);
                    err.println("error: " + rel + " is not empty (" + Files.size(file) + " bytes)");
                }
            } else if (ArchivePaths.isChangefile(rel)) {
                archiveOf(rel).ifPresent(touched::add);
            }
        }
        if (!dirty.isEmpty()) {
            err.println("hint: export it with `gitcad export <file>` and stage the expanded directory instead");
            log.info("pre-commit blocked: {} non-empty archive(s)", dirty.size());
            return ExitCodes.BLOCKED;
        }

        if (!ctx.config.isRequireLock()) {
            return ExitCodes.OK;
        }
        if (isBlank(actor)) {
            err.println("error: no user configured; set `git config user.name` or pass --actor");
            return ExitCodes.BLOCKED;
        }
        return checkLocks(ctx, touched, actor, "commit");
    }

    private int postCheckout(Context ctx, LifecycleEvent.PostCheckout event) throws IOException {
        passthrough(event.hookName(), List.of(event.getOldRef(), event.getNewRef(), event.getBranchFlag()), null);
        if (!BRANCH_CHECKOUT.equals(event.getBranchFlag())) {
            log.debug("file checkout, nothing to import");
            return ExitCodes.OK;
        }
        if (repo.isRebaseInProgress()) {
            log.info("rebase in progress, post-rewrite will import");
            return ExitCodes.OK;
        }
        pull();
        List<String> changefiles;
        if (PushRefUpdate.isZero(event.getOldRef())) {
            changefiles = allChangefiles();
        } else {
            changefiles = changedChangefiles(event.getOldRef(), event.getNewRef());
        }
        return importAll(ctx, changefiles);
    }

    private int postMerge(Context ctx, LifecycleEvent.PostMerge event) throws IOException {
        passthrough(event.hookName(), List.of(event.getSquash()), null);
        pull();
        if (!git.revisionExists(ORIG_HEAD)) {
            log.info("no ORIG_HEAD, nothing to import");
            return ExitCodes.OK;
        }
        return importAll(ctx, changedChangefiles(ORIG_HEAD, HEAD));
    }

    private int postRewrite(Context ctx, LifecycleEvent.PostRewrite event) throws IOException {
        passthrough(event.hookName(), List.of(event.getKind()), event.getStdin());
        if (!REWRITE_REBASE.equals(event.getKind())) {
            log.debug("rewrite kind {} needs no import", event.getKind());
            return ExitCodes.OK;
        }
        pull();
        return importAll(ctx, allChangefiles());
    }

    private int prePush(Context ctx, LifecycleEvent.PrePush event, String actor) {
        String stdin = event.getRefLines().isEmpty() ? "" : String.join("\n", event.getRefLines()) + "\n";
        passthrough(event.hookName(), List.of(event.getRemoteName(), event.getRemoteUrl()), stdin);
        if (!ctx.config.isRequireLock()) {
            return ExitCodes.OK;
        }

        List<PushRefUpdate> updates = new ArrayList<>();
        for (String line : event.getRefLines()) {
            Optional<PushRefUpdate> u = PushRefUpdate.parse(line);
            if (u.isPresent()) {
                updates.add(u.get());
            } else if (!isBlank(line)) {
                log.warn("skip malformed pre-push line: {}", line);
            }
        }
        if (updates.isEmpty()) {
            return ExitCodes.OK;
        }
        if (isBlank(actor)) {
            err.println("error: no user configured; set `git config user.name` or pass --actor");
            return ExitCodes.BLOCKED;
        }

        Set<String> touched = new LinkedHashSet<>();
        for (PushRefUpdate u : updates) {
            if (u.isDelete()) {
                log.debug("skip deletion of {}", u.getRemoteRef());
                continue;
            }
            Result<List<String>> pushed = git.pushedPaths(u.getLocalOid(), u.getRemoteOid());
            if (!pushed.isOk()) {
                err.println("error: cannot determine files pushed to " + u.getRemoteRef() + ": "
                        + pushed.getFailure().getMessage());
                return ExitCodes.BLOCKED;
            }
            for (String rel : pushed.getValue()) {
                if (ArchivePaths.isChangefile(rel)) {
                    archiveOf(rel).ifPresent(touched::add);
                } else if (ArchivePaths.isArchive(rel)) {
                    touched.add(rel);
                }
            }
        }
        return checkLocks(ctx, touched, actor, "push");
    }

    /**
     * 检查 actor 是否持有 archives 中每个归档的锁；一次查询锁列表，逐个比对。
     */
    private int checkLocks(Context ctx, Set<String> archives, String actor, String action) {
        if (archives.isEmpty()) {
            return ExitCodes.OK;
        }
        Result<List<LockRecord>> active = ctx.locks.listActive();
        if (!active.isOk()) {
            err.println("error: cannot query locks: " + active.getFailure().getMessage());
            return ExitCodes.BLOCKED;
        }
        List<String> missing = new ArrayList<>();
        for (String archive : archives) {
            String marker = ctx.paths.lockfileRelative(Path.of(archive));
            boolean held = active.getValue().stream()
                    .anyMatch(r -> marker.equals(r.getPosixPath()) && actor.equals(r.getOwner()));
            if (!held) {
                missing.add(archive);
                err.println("error: you don't have a lock on " + archive);
            }
        }
        if (!missing.isEmpty()) {
            err.println("hint: use `gitcad lock <file>` before you " + action);
            log.info("{} blocked: {} archive(s) not locked by {}", action, missing.size(), actor);
            return ExitCodes.BLOCKED;
        }
        return ExitCodes.OK;
    }

    /** 导入每个指示文件对应的归档；单个失败只报告，其余照常，最后有失败则返回 BLOCKED。 */
    private int importAll(Context ctx, List<String> changefiles) {
        int failed = 0;
        for (String rel : changefiles) {
            Path changefile = repo.getRoot().resolve(rel);
            if (!Files.isRegularFile(changefile)) {
                log.debug("changefile {} no longer exists", rel);
                continue;
            }
            Result<String> archive = ChangeFile.readArchivePath(changefile);
            if (!archive.isOk()) {
                err.println("error: " + archive.getFailure().getMessage());
                failed++;
                continue;
            }
            Path target = repo.getRoot().resolve(archive.getValue()).normalize();
            Path tree = changefile.getParent().normalize();
            if (!target.startsWith(repo.getRoot()) || !ctx.paths.expandedTree(target).equals(tree)) {
                // 只导入按正向映射恰好落在本目录的归档，拒绝仓库外或别处的路径
                err.println("error: " + rel + " names " + archive.getValue() + ", which does not map to "
                        + repo.getRoot().relativize(tree));
                failed++;
                continue;
            }
            Result<ImportResult> imported = ctx.transformer.importArchive(tree, target);
            if (!imported.isOk()) {
                err.println("error: cannot import " + archive.getValue() + ": " + imported.getFailure().getMessage());
                failed++;
            } else {
                log.info("imported {}", archive.getValue());
            }
        }
        return failed == 0 ? ExitCodes.OK : ExitCodes.BLOCKED;
    }

    private List<String> changedChangefiles(String oldRev, String newRev) throws IOException {
        Result<List<String>> changed = git.changedPaths(oldRev, newRev);
        if (!changed.isOk()) {
            log.warn("cannot diff {}..{}, scanning whole tree: {}", oldRev, newRev, changed.getFailure());
            return allChangefiles();
        }
        List<String> result = new ArrayList<>();
        for (String rel : changed.getValue()) {
            if (ArchivePaths.isChangefile(rel)) {
                result.add(rel);
            }
        }
        return result;
    }

    private List<String> allChangefiles() throws IOException {
        return repo.getWorkspace().findByName(ArchivePaths.CHANGEFILE_NAME);
    }

    private Optional<String> archiveOf(String changefileRel) {
        Path changefile = repo.getRoot().resolve(changefileRel);
        if (!Files.isRegularFile(changefile)) {
            return Optional.empty();
        }
        Result<String> archive = ChangeFile.readArchivePath(changefile);
        if (!archive.isOk()) {
            log.warn("ignore unreadable changefile {}: {}", changefileRel, archive.getFailure());
            return Optional.empty();
        }
        return Optional.of(archive.getValue());
    }

    private void passthrough(String hookName, List<String> args, String stdin) {
        Result<Void> r = git.runLfsHook(hookName, args, stdin);
        if (!r.isOk()) {
            err.println("warning: git-lfs " + hookName + " failed: " + r.getFailure().getMessage());
        }
    }

    private void pull() {
        Result<Void> r = git.lfsPull();
        if (!r.isOk()) {
            err.println("warning: git lfs pull failed: " + r.getFailure().getMessage());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /** 一次调用内的配置快照及由它派生的组件。 */
    private final class Context {
        final RepositoryConfig config;
        final ArchivePaths paths;
        final ArchiveTransformer transformer;
        final LockCoordinator locks;

        Context(RepositoryConfig config) {
            this.config = config;
            this.paths = new ArchivePaths(repo.getRoot(), config);
            this.transformer = new ArchiveTransformer(paths);
            this.locks = new LockCoordinator(paths, runner);
        }
    }
}
