package com.weixiao.gitcad.repo;

import com.weixiao.gitcad.config.ConfigLoader;
import com.weixiao.gitcad.config.RepositoryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 仓库：定位 .git（目录，或 worktree 中的 "gitdir:" 文件），提供工作区与配置。
 */
public final class Repository {

    private static final Logger log = LoggerFactory.getLogger(Repository.class);

    private static final String GIT_DIR = ".git";
    private static final String GITDIR_PREFIX = "gitdir:";
    private static final String REBASE_MERGE = "rebase-merge";
    private static final String REBASE_APPLY = "rebase-apply";
    private static final String COMMONDIR = "commondir";
    private static final String HOOKS_DIR = "hooks";

    private final Path root;   // 工作区根
    private final Path gitDir; // 实际的 git 目录
    private final Workspace workspace;

    /**
     * 以给定路径为仓库根（工作区根），解析出实际的 git 目录。
     */
    public Repository(Path root) {
        this.root = root.toAbsolutePath().normalize();
        this.gitDir = resolveGitDir(this.root);
        this.workspace = new Workspace(this.root);
    }

    /**
     * 从 start 向上查找包含 .git 的目录作为仓库根；未找到返回 null。
     */
    public static Repository find(Path start) {
        Path current = start.toAbsolutePath().normalize();
        log.debug("find repo start={}", current);
        while (current != null) {
            if (Files.exists(current.resolve(GIT_DIR))) {
                log.debug("found repo at {}", current);
                return new Repository(current);
            }
            current = current.getParent();
        }
        log.debug("no repo found");
        return null;
    }

    /**
     * .git 为文件时（worktree / submodule）读取其中的 "gitdir: &lt;path&gt;"；读取失败则退回 root/.git。
     */
    private static Path resolveGitDir(Path root) {
        Path dotGit = root.resolve(GIT_DIR);
        if (!Files.isRegularFile(dotGit)) {
            return dotGit;
        }
        try {
            String content = Files.readString(dotGit, StandardCharsets.UTF_8).trim();
            if (content.startsWith(GITDIR_PREFIX)) {
                Path target = Path.of(content.substring(GITDIR_PREFIX.length()).trim());
                return root.resolve(target).normalize();
            }
        } catch (IOException e) {
            log.warn("cannot read {}: {}", dotGit, e.getMessage());
        }
        return dotGit;
    }

    /**
     * 是否有 rebase 正在进行（由 post-rewrite 负责导入，post-checkout 需跳过）。
     */
    public boolean isRebaseInProgress() {
        return Files.exists(gitDir.resolve(REBASE_MERGE)) || Files.exists(gitDir.resolve(REBASE_APPLY));
    }

    /**
     * 公共 git 目录：linked worktree 的 git 目录中有 commondir 文件指向主仓库的 .git，否则就是 git 目录本身。
     */
    public Path getCommonDir() {
        Path file = gitDir.resolve(COMMONDIR);
        if (!Files.isRegularFile(file)) {
            return gitDir;
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8).trim();
            if (!content.isEmpty()) {
                return gitDir.resolve(content).normalize();
            }
        } catch (IOException e) {
            log.warn("cannot read {}: {}", file, e.getMessage());
        }
        return gitDir;
    }

    /** 默认钩子目录，git 从公共目录读取钩子。 */
    public Path getHooksDir() {
        return getCommonDir().resolve(HOOKS_DIR);
    }

    /** 读取本仓库配置（每次调用都重新读取）。 */
    public RepositoryConfig loadConfig() {
        return ConfigLoader.load(root);
    }

    /** 工作区根目录（即仓库根）。 */
    public Path getRoot() {
        return root;
    }

    /** git 目录路径。 */
    public Path getGitDir() {
        return gitDir;
    }

    /** 工作区，用于列出文件、计算相对路径。 */
    public Workspace getWorkspace() {
        return workspace;
    }
}
