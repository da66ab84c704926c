package com.weixiao.gitcad.archive;

import com.weixiao.gitcad.config.RepositoryConfig;
import com.weixiao.gitcad.repo.ArchivePaths;
import com.weixiao.gitcad.repo.Workspace;
import com.weixiao.gitcad.result.ErrorKind;
import com.weixiao.gitcad.result.Result;
import com.weixiao.gitcad.utils.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

/**
 * 归档转换器：.FCStd（ZIP）与可 diff 的展开目录之间的双向转换。
 * <p>
 * 导出：校验 -> 在同级临时目录中按名字排序解压（保留旧的 .lockfile / .changefile）->
 * 顶层无扩展名成员移入 no_extension/ -> 按 glob 打包二进制成员 -> 写 .changefile -> 换入展开目录。
 * 导入：先解开分块 -> 按排序遍历目录写新归档 -> 临时文件 fsync 后原子替换。
 */
public final class ArchiveTransformer {

    private static final Logger log = LoggerFactory.getLogger(ArchiveTransformer.class);

    /** 不超过该字节数的归档视为"已导出的空壳"，可以提交。 */
    public static final long EMPTY_THRESHOLD_BYTES = 1024;
    public static final String NO_EXTENSION_DIR = "no_extension";

    private static final long FIXED_ENTRY_TIME = 315619200000L;

    private final ArchivePaths paths;
    private final ChunkPacker packer;

    public ArchiveTransformer(ArchivePaths paths) {
        this(paths, new ChunkPacker());
    }

    public ArchiveTransformer(ArchivePaths paths, ChunkPacker packer) {
        this.paths = paths;
        this.packer = packer;
    }

    /** 导出到配置映射出的展开目录。 */
    public Result<ExportResult> export(Path archive) {
        return export(archive, null);
    }

    /**
     * 把归档导出为展开目录。
     *
     * @param archive  归档路径，相对仓库根或绝对
     * @param treeRoot 目标目录；null 时使用 {@link ArchivePaths#expandedTree(Path)}
     */
    public Result<ExportResult> export(Path archive, Path treeRoot) {
        RepositoryConfig config = paths.getConfig();
        Path abs = paths.getRepoRoot().resolve(archive).normalize();
        Path tree = treeRoot != null ? paths.getRepoRoot().resolve(treeRoot).normalize() : paths.expandedTree(abs);
        log.debug("export {} -> {}", abs, tree);

        if (!Files.exists(abs)) {
            return Result.failure(ErrorKind.NOT_FOUND, "archive not found: " + abs);
        }
        if (!Files.isRegularFile(abs) || !ArchivePaths.isArchive(abs.getFileName().toString())) {
            return Result.failure(ErrorKind.WRONG_FILE_TYPE, "not a .FCStd file: " + abs);
        }
        if (!Files.isReadable(abs)) {
            return Result.failure(ErrorKind.PERMISSION_DENIED, "cannot read archive: " + abs);
        }

        // 先在同级的临时目录里完整生成，成功后再换入；失败时旧目录保持原样
        Path staging = tree.resolveSibling("." + tree.getFileName() + ".export");
        try {
            Result<ExportResult> built = build(abs, tree, staging, config);
            if (!built.isOk()) {
                return built;
            }
            swapIn(staging, tree);
            log.info("exported {} ({} member(s), {} chunked) to {}", abs.getFileName(),
                    built.getValue().getMemberCount(), built.getValue().getChunkedCount(), tree);
            return built;
        } catch (IOException e) {
            return ioFailure("export of " + abs.getFileName(), e);
        } finally {
            try {
                deleteRecursively(staging);
            } catch (IOException e) {
                log.warn("cannot remove staging directory {}: {}", staging, e.getMessage());
            }
        }
    }

    /**
     * 在 staging 中生成 tree 的新内容：旧目录顶层的 .lockfile / .changefile 先复制过来，再解压、打包、写 .changefile。
     */
    private Result<ExportResult> build(Path abs, Path tree, Path staging, RepositoryConfig config) throws IOException {
        int memberCount;
        String digest;
        try (ZipFile zip = new ZipFile(abs.toFile())) {
            // 名字 -> 目录内相对路径，按成员名排序
            TreeMap<String, String> layout = new TreeMap<>();
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (entry.isDirectory()) continue;
                String target = treePathFor(entry.getName());
                if (escapes(tree, target)) {
                    return Result.failure(ErrorKind.CORRUPT_ARCHIVE,
                            "archive entry escapes the expanded tree: " + entry.getName());
                }
                layout.put(entry.getName(), target);
            }

            deleteRecursively(staging);
            Files.createDirectories(staging);
            copyMarkers(tree, staging);
            MessageDigest md = HexUtils.sha256();
            for (Map.Entry<String, String> e : layout.entrySet()) {
                Path target = staging.resolve(e.getValue());
                Files.createDirectories(target.getParent());
                md.update(e.getKey().getBytes(StandardCharsets.UTF_8));
                md.update((byte) 0);
                try (InputStream in = new DigestInputStream(zip.getInputStream(zip.getEntry(e.getKey())), md)) {
                    Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                }
                log.debug("extracted {} -> {}", e.getKey(), e.getValue());
            }
            memberCount = layout.size();
            digest = HexUtils.bytesToHex(md.digest());
        }

        int chunked = 0;
        if (config.isCompressBinaries()) {
            List<PosixGlob> globs = PosixGlob.compileAll(config.getBinaryPatterns());
            List<String> candidates = Workspace.listFiles(staging).stream()
                    .filter(p -> !isMarker(p))
                    .filter(p -> PosixGlob.matchesAny(globs, p))
                    .collect(Collectors.toList());
            Result<List<ChunkArchive>> packed = packer.pack(staging, candidates, config.getMaxChunkBytes(),
                    config.getCompressionLevel(), config.getChunkPrefix());
            if (!packed.isOk()) {
                log.warn("export of {} failed while packing: {}", abs, packed.getFailure());
                return packed.castFailure();
            }
            for (ChunkArchive c : packed.getValue()) {
                chunked += c.getMembers().size();
            }
        }

        ChangeFile.write(staging.resolve(ArchivePaths.CHANGEFILE_NAME), paths.archiveIdentity(abs), digest);
        return Result.success(new ExportResult(tree, memberCount, chunked));
    }

    /** 从配置映射出的展开目录导入。 */
    public Result<ImportResult> importArchive(Path archive) {
        Path abs = paths.getRepoRoot().resolve(archive).normalize();
        return importArchive(paths.expandedTree(abs), abs);
    }

    /**
     * 把展开目录写回归档；归档要么完整替换，要么保持原样。
     */
    public Result<ImportResult> importArchive(Path treeRoot, Path archive) {
        RepositoryConfig config = paths.getConfig();
        Path tree = paths.getRepoRoot().resolve(treeRoot).normalize();
        Path abs = paths.getRepoRoot().resolve(archive).normalize();
        log.debug("import {} -> {}", tree, abs);

        if (!Files.exists(tree)) {
            return Result.failure(ErrorKind.NOT_FOUND, "expanded tree not found: " + tree);
        }
        if (!Files.isDirectory(tree)) {
            return Result.failure(ErrorKind.WRONG_FILE_TYPE, "expanded tree is not a directory: " + tree);
        }
        if (!ArchivePaths.isArchive(abs.getFileName().toString())) {
            return Result.failure(ErrorKind.WRONG_FILE_TYPE, "not a .FCStd file: " + abs);
        }
        if (!abs.startsWith(paths.getRepoRoot())) {
            return Result.failure(ErrorKind.PERMISSION_DENIED, "archive is outside the repository: " + abs);
        }

        int unchunked = 0;
        if (config.isCompressBinaries()) {
            Result<Integer> unpacked = packer.unpack(tree, config.getChunkPrefix());
            if (!unpacked.isOk()) {
                log.warn("import of {} failed while unpacking: {}", abs, unpacked.getFailure());
                return unpacked.castFailure();
            }
            unchunked = unpacked.getValue();
        }

        Path temp = abs.resolveSibling("." + abs.getFileName() + ".tmp");
        int members = 0;
        try {
            List<String> files = Workspace.listFiles(tree);
            Files.createDirectories(abs.getParent());
            try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(temp))) {
                for (String rel : files) {
                    if (isMarker(rel)) continue;
                    if (config.isCompressBinaries() && !rel.contains("/")
                            && ChunkPacker.isChunkName(rel, config.getChunkPrefix())) {
                        continue;
                    }
                    ZipEntry entry = new ZipEntry(archiveNameFor(rel));
                    entry.setTime(FIXED_ENTRY_TIME);
                    zip.putNextEntry(entry);
                    Files.copy(tree.resolve(rel), zip);
                    zip.closeEntry();
                    members++;
                }
            }
            if (members == 0) {
                return Result.failure(ErrorKind.NOT_FOUND, "expanded tree has no members: " + tree);
            }
            try (FileChannel ch = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                ch.force(true);
            }
            ChunkPacker.moveIntoPlace(temp, abs);
        } catch (IOException e) {
            return ioFailure("import of " + abs.getFileName(), e);
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                log.warn("cannot remove temp file {}: {}", temp, e.getMessage());
            }
        }
        log.info("imported {} ({} member(s), {} from chunks) from {}", abs.getFileName(), members, unchunked, tree);
        return Result.success(new ImportResult(abs, members, unchunked));
    }

    /**
     * 归档是否处于"已导出"状态（不超过阈值，或文件不存在）。
     */
    public boolean isExportedForm(Path archive) throws IOException {
        Path abs = paths.getRepoRoot().resolve(archive).normalize();
        if (!Files.exists(abs)) {
            return true;
        }
        return Files.size(abs) <= EMPTY_THRESHOLD_BYTES;
    }

    /** 成员名 -> 目录内相对路径：顶层无扩展名的成员放到 no_extension/ 下。 */
    static String treePathFor(String memberName) {
        String name = memberName.replace('\\', '/');
        if (!name.contains("/") && !name.contains(".")) {
            return NO_EXTENSION_DIR + "/" + name;
        }
        return name;
    }

    /** 目录内相对路径 -> 成员名，treePathFor 的逆。 */
    static String archiveNameFor(String treePath) {
        String prefix = NO_EXTENSION_DIR + "/";
        if (treePath.startsWith(prefix) && treePath.indexOf('/', prefix.length()) < 0) {
            return treePath.substring(prefix.length());
        }
        return treePath;
    }

    private static boolean isMarker(String rel) {
        return ArchivePaths.LOCKFILE_NAME.equals(rel) || ArchivePaths.CHANGEFILE_NAME.equals(rel);
    }

    private static boolean escapes(Path tree, String rel) {
        if (rel.isEmpty() || rel.startsWith("/")) {
            return true;
        }
        Path root = tree.toAbsolutePath().normalize();
        Path target = root.resolve(rel).normalize();
        return !target.startsWith(root) || target.equals(root);
    }

    private static void copyMarkers(Path tree, Path staging) throws IOException {
        for (String name : List.of(ArchivePaths.LOCKFILE_NAME, ArchivePaths.CHANGEFILE_NAME)) {
            Path marker = tree.resolve(name);
            if (Files.isRegularFile(marker)) {
                Files.copy(marker, staging.resolve(name), StandardCopyOption.COPY_ATTRIBUTES);
            }
        }
    }

    /**
     * 用 staging 替换 tree：旧目录先改名让位，新目录改名就位，最后删除旧目录。
     */
    private static void swapIn(Path staging, Path tree) throws IOException {
        Files.createDirectories(tree.toAbsolutePath().getParent());
        Path retired = tree.resolveSibling("." + tree.getFileName() + ".old");
        deleteRecursively(retired);
        boolean hadTree = Files.exists(tree);
        if (hadTree) {
            Files.move(tree, retired);
        }
        try {
            Files.move(staging, tree);
        } catch (IOException e) {
            if (hadTree) {
                Files.move(retired, tree);
            }
            throw e;
        }
        deleteRecursively(retired);
        log.debug("swapped {} into {}", staging, tree);
    }

    static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        List<Path> doomed;
        try (Stream<Path> stream = Files.walk(dir)) {
            doomed = stream.collect(Collectors.toList());
        }
        doomed.sort(Comparator.comparingInt(Path::getNameCount).reversed());
        for (Path p : doomed) {
            Files.deleteIfExists(p);
        }
    }

    private static <T> Result<T> ioFailure(String action, IOException e) {
        if (e instanceof ZipException) {
            log.warn("{} failed: corrupt archive: {}", action, e.getMessage());
            return Result.failure(ErrorKind.CORRUPT_ARCHIVE, action + " failed: corrupt archive: " + e.getMessage());
        }
        if (e instanceof AccessDeniedException) {
            log.warn("{} failed: permission denied: {}", action, e.getMessage());
            return Result.failure(ErrorKind.PERMISSION_DENIED, action + " failed: permission denied: " + e.getMessage());
        }
        if (e instanceof NoSuchFileException) {
            log.warn("{} failed: not found: {}", action, e.getMessage());
            return Result.failure(ErrorKind.NOT_FOUND, action + " failed: not found: " + e.getMessage());
        }
        log.error("{} failed", action, e);
        return Result.failure(ErrorKind.IO_ERROR, action + " failed: " + e.getMessage());
    }
}
