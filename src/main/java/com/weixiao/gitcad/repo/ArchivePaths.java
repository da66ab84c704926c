package com.weixiao.gitcad.repo;

import com.weixiao.gitcad.config.RepositoryConfig;

import java.nio.file.Path;
import java.util.Locale;

/**
 * 归档路径映射（单向：归档 -> 展开目录 / 代理锁文件 / 变更指示文件）。
 * 示例（默认配置）：parts/bracket.FCStd -> parts/bracket_uncompressed/、parts/bracket_uncompressed/.lockfile。
 * 锁协调器始终接收归档本身的逻辑路径，不需要从锁文件路径反推归档。
 */
public final class ArchivePaths {

    public static final String ARCHIVE_EXTENSION = ".fcstd";
    public static final String LOCKFILE_NAME = ".lockfile";
    public static final String CHANGEFILE_NAME = ".changefile";

    private final Path repoRoot;
    private final RepositoryConfig config;

    public ArchivePaths(Path repoRoot, RepositoryConfig config) {
        this.repoRoot = repoRoot.toAbsolutePath().normalize();
        this.config = config;
    }

    /** 文件名是否为归档（.FCStd，大小写不敏感）。 */
    public static boolean isArchive(String pathOrName) {
        return pathOrName.toLowerCase(Locale.ROOT).endsWith(ARCHIVE_EXTENSION);
    }

    /** 文件名是否为变更指示文件 .changefile。 */
    public static boolean isChangefile(String pathOrName) {
        String name = pathOrName.substring(pathOrName.replace('\\', '/').lastIndexOf('/') + 1);
        return CHANGEFILE_NAME.equals(name);
    }

    /**
     * 归档对应的展开目录（绝对路径）：parent/[subdir/]prefix + stem + suffix。
     *
     * @param archive 归档路径，相对仓库根或绝对路径均可；不在仓库内时只取文件名
     */
    public Path expandedTree(Path archive) {
        Path rel = relativeToRepo(archive);
        String fileName = rel.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String dirName = config.getUncompressedPrefix() + stem + config.getUncompressedSuffix();
        Path parent = rel.getParent() != null ? repoRoot.resolve(rel.getParent()) : repoRoot;
        if (config.isSubdirectoryMode()) {
            parent = parent.resolve(config.getSubdirectoryName());
        }
        return parent.resolve(dirName).normalize();
    }

    /** 代理锁文件（锁原语实际锁定的路径，绝对路径）。 */
    public Path lockfile(Path archive) {
        return expandedTree(archive).resolve(LOCKFILE_NAME);
    }

    /** 代理锁文件相对仓库根的 POSIX 路径，即锁原语看到的路径。 */
    public String lockfileRelative(Path archive) {
        return Workspace.toPosix(repoRoot.relativize(lockfile(archive)));
    }

    /** 归档相对仓库根的 POSIX 路径（即 ArchiveIdentity）。 */
    public String archiveIdentity(Path archive) {
        return Workspace.toPosix(relativeToRepo(archive));
    }

    private Path relativeToRepo(Path archive) {
        if (!archive.isAbsolute()) {
            return archive.normalize();
        }
        Path abs = archive.normalize();
        if (abs.startsWith(repoRoot)) {
            return repoRoot.relativize(abs);
        }
        return abs.getFileName();
    }

    public Path getRepoRoot() {
        return repoRoot;
    }

    public RepositoryConfig getConfig() {
        return config;
    }
}
