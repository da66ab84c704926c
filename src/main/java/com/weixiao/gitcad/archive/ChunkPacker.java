package com.weixiao.gitcad.archive;

import com.weixiao.gitcad.result.ErrorKind;
import com.weixiao.gitcad.result.Result;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.CRC32;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * 分块打包器：把展开目录中的二进制成员贪心装入大小受限、顺序编号的 zip（prefix1.zip, prefix2.zip ...）。
 * <p>
 * 每个文件只压缩一次（原始 deflate 数据 + CRC），拼装分块时通过 addRawArchiveEntry 直接拷贝压缩数据，
 * 因此"试探性加入"只需重新拼装、不需重新压缩；试探时写入计数流，只取字节数。
 * 落盘：先写同目录临时文件并 fsync，再原子重命名；原文件只在其所在分块落盘后才删除。
 */
public final class ChunkPacker {

    private static final Logger log = LoggerFactory.getLogger(ChunkPacker.class);

    private static final String CHUNK_SUFFIX = ".zip";
    /** 固定的成员时间戳（1980-01-02，任何时区都在 DOS 时间范围内），保证重复导出字节一致。 */
    private static final long FIXED_ENTRY_TIME = 315619200000L;

    /**
     * 把 candidates 依次装入分块。
     *
     * @param treeRoot   展开目录根
     * @param candidates 相对 treeRoot 的 POSIX 路径，调用方负责稳定排序；文件名以 prefix 开头的会被排除
     * @param cap        单个分块最大字节数
     * @param level      deflate 级别 0-9
     * @param prefix     分块文件名前缀
     * @return 已落盘的分块，序号 1..N 连续；单个文件放不下时返回 FILE_TOO_LARGE
     */
    public Result<List<ChunkArchive>> pack(Path treeRoot, List<String> candidates, long cap, int level, String prefix) {
        List<String> todo = new ArrayList<>();
        for (String c : candidates) {
            if (fileName(c).startsWith(prefix)) {
                log.debug("skip already packed file {}", c);
                continue;
            }
            todo.add(c);
        }
        List<ChunkArchive> produced = new ArrayList<>();
        if (todo.isEmpty()) {
            log.debug("no binary files to pack under {}", treeRoot);
            return Result.success(produced);
        }
        log.info("packing {} binary file(s) under {} cap={} level={}", todo.size(), treeRoot, cap, level);

        List<CompressedMember> current = new ArrayList<>();
        int index = 1;
        int i = 0;
        CompressedMember pending = null;
        try {
            while (i < todo.size()) {
                String rel = todo.get(i);
                if (pending == null) {
                    pending = compress(treeRoot, rel, level);
                }
                current.add(pending);
                long size = measure(current);
                if (size <= cap) {
                    pending = null;
                    i++;
                    continue;
                }
                current.remove(current.size() - 1);
                // 空分块里也放不下：再 flush 只会无限循环
                if (current.isEmpty()) {
                    String msg = String.format(Locale.ROOT,
                            "max chunk size %d bytes and compression level %d is too small for '%s' (%d bytes, %d compressed)",
                            cap, level, rel, pending.size, size);
                    log.warn("pack aborted: {}", msg);
                    return Result.failure(ErrorKind.FILE_TOO_LARGE, msg);
                }
                produced.add(flush(treeRoot, prefix, index++, current));
                current.clear();
                log.debug("retrying {} in a fresh chunk", rel);
            }
            if (!current.isEmpty()) {
                produced.add(flush(treeRoot, prefix, index, current));
            }
        } catch (AccessDeniedException e) {
            log.error("pack failed", e);
            return Result.failure(ErrorKind.PERMISSION_DENIED, "permission denied: " + e.getMessage());
        } catch (IOException e) {
            log.error("pack failed", e);
            return Result.failure(ErrorKind.IO_ERROR, "binary packing failed: " + e.getMessage());
        }
        log.info("packed {} file(s) into {} chunk(s)", todo.size(), produced.size());
        return Result.success(produced);
    }

    /**
     * 按序号升序解压 treeRoot 下所有 prefix&lt;n&gt;.zip，成员写回其记录的相对路径；分块文件本身保留。
     *
     * @return 解出的成员数
     */
    public Result<Integer> unpack(Path treeRoot, String prefix) {
        List<Path> chunks;
        try {
            chunks = listChunks(treeRoot, prefix);
        } catch (IOException e) {
            log.error("cannot list chunks under {}", treeRoot, e);
            return Result.failure(ErrorKind.IO_ERROR, "cannot list chunks: " + e.getMessage());
        }
        if (chunks.isEmpty()) {
            log.debug("no chunk archives under {}", treeRoot);
            return Result.success(0);
        }
        log.info("unpacking {} chunk archive(s) under {}", chunks.size(), treeRoot);
        Path root = treeRoot.toAbsolutePath().normalize();
        int extracted = 0;
        for (Path chunk : chunks) {
            try (ZipFile zip = new ZipFile(chunk.toFile())) {
                Enumeration<? extends ZipEntry> entries = zip.entries();
                while (entries.hasMoreElements()) {
                    ZipEntry entry = entries.nextElement();
                    if (entry.isDirectory()) continue;
                    Path target = root.resolve(entry.getName()).normalize();
                    if (!target.startsWith(root) || target.equals(root)) {
                        return Result.failure(ErrorKind.CORRUPT_ARCHIVE,
                                "chunk " + chunk.getFileName() + " has entry outside tree: " + entry.getName());
                    }
                    Files.createDirectories(target.getParent());
                    try (InputStream in = zip.getInputStream(entry)) {
                        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                    }
                    extracted++;
                    log.debug("unpacked {} from {}", entry.getName(), chunk.getFileName());
                }
            } catch (ZipException e) {
                log.warn("corrupt chunk {}: {}", chunk, e.getMessage());
                return Result.failure(ErrorKind.CORRUPT_ARCHIVE, "corrupt chunk archive " + chunk.getFileName() + ": " + e.getMessage());
            } catch (AccessDeniedException e) {
                return Result.failure(ErrorKind.PERMISSION_DENIED, "permission denied: " + e.getMessage());
            } catch (IOException e) {
                log.error("unpack failed for {}", chunk, e);
                return Result.failure(ErrorKind.IO_ERROR, "cannot unpack " + chunk.getFileName() + ": " + e.getMessage());
            }
        }
        log.info("unpacked {} file(s)", extracted);
        return Result.success(extracted);
    }

    /**
     * 列出 treeRoot 下（仅一层）的分块归档，按数字序号升序。
     */
    public static List<Path> listChunks(Path treeRoot, String prefix) throws IOException {
        if (!Files.isDirectory(treeRoot)) {
            return List.of();
        }
        Pattern p = chunkNamePattern(prefix);
        try (Stream<Path> stream = Files.list(treeRoot)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(f -> p.matcher(f.getFileName().toString()).matches())
                    .sorted(Comparator.comparingLong(f -> chunkIndex(p, f)))
                    .collect(Collectors.toList());
        }
    }

    /** 文件名是否形如 prefix&lt;n&gt;.zip。 */
    public static boolean isChunkName(String fileName, String prefix) {
        return chunkNamePattern(prefix).matcher(fileName).matches();
    }

    private static Pattern chunkNamePattern(String prefix) {
        return Pattern.compile(Pattern.quote(prefix) + "(\\d+)" + Pattern.quote(CHUNK_SUFFIX));
    }

    private static long chunkIndex(Pattern p, Path f) {
        Matcher m = p.matcher(f.getFileName().toString());
        if (!m.matches()) return Long.MAX_VALUE;
        try {
            return Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * 读取文件并压缩为原始 deflate 数据（无 zlib 头），同时计算 CRC32。
     */
    private static CompressedMember compress(Path treeRoot, String rel, int level) throws IOException {
        byte[] data = Files.readAllBytes(treeRoot.resolve(rel));
        CRC32 crc = new CRC32();
        crc.update(data);
        Deflater deflater = new Deflater(level, true);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            deflater.setInput(data);
            deflater.finish();
            byte[] buf = new byte[64 * 1024];
            while (!deflater.finished()) {
                int n = deflater.deflate(buf);
                out.write(buf, 0, n);
            }
        } finally {
            deflater.end();
        }
        log.debug("compressed {} {} -> {} bytes", rel, data.length, out.size());
        return new CompressedMember(rel, data.length, crc.getValue(), out.toByteArray());
    }

    /** 拼装到计数流，返回分块的精确字节数。 */
    private static long measure(List<CompressedMember> members) throws IOException {
        CountingOutputStream counter = new CountingOutputStream(OutputStream.nullOutputStream());
        writeChunk(members, counter);
        return counter.count;
    }

    private static void writeChunk(List<CompressedMember> members, OutputStream target) throws IOException {
        try (ZipArchiveOutputStream zip = new ZipArchiveOutputStream(target)) {
            for (CompressedMember m : members) {
                ZipArchiveEntry entry = new ZipArchiveEntry(m.name);
                entry.setMethod(ZipEntry.DEFLATED);
                entry.setSize(m.size);
                entry.setCompressedSize(m.data.length);
                entry.setCrc(m.crc);
                entry.setTime(FIXED_ENTRY_TIME);
                zip.addRawArchiveEntry(entry, new ByteArrayInputStream(m.data));
            }
            zip.finish();
        }
    }

    /**
     * 写临时文件 -> fsync -> 原子重命名为 prefix&lt;index&gt;.zip，之后才删除原文件。
     */
    private static ChunkArchive flush(Path treeRoot, String prefix, int index, List<CompressedMember> members) throws IOException {
        Path target = treeRoot.resolve(prefix + index + CHUNK_SUFFIX);
        Path temp = treeRoot.resolve("." + prefix + index + CHUNK_SUFFIX + ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                writeChunk(members, out);
            }
            try (FileChannel ch = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                ch.force(true);
            }
            moveIntoPlace(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
        List<String> names = new ArrayList<>();
        for (CompressedMember m : members) {
            Files.deleteIfExists(treeRoot.resolve(m.name));
            names.add(m.name);
        }
        long size = Files.size(target);
        log.info("wrote chunk {} ({} bytes, {} member(s))", target.getFileName(), size, names.size());
        return new ChunkArchive(index, target, size, List.copyOf(names));
    }

    /** 原子替换；文件系统不支持原子移动时退回普通替换。 */
    static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("atomic move not supported for {}, falling back", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static String fileName(String relPosix) {
        return relPosix.substring(relPosix.lastIndexOf('/') + 1);
    }

    /** 已压缩的成员：名字、原始大小、CRC、原始 deflate 数据。 */
    private static final class CompressedMember {
        final String name;
        final long size;
        final long crc;
        final byte[] data;

        CompressedMember(String name, long size, long crc, byte[] data) {
            this.name = name;
            this.size = size;
            this.crc = crc;
            this.data = data;
        }
    }

    private static final class CountingOutputStream extends FilterOutputStream {
        long count;

        CountingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(int b) throws IOException {
            out.write(b);
            count++;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
            count += len;
        }
    }
}
