package com.weixiao.gitcad.archive;

import com.weixiao.gitcad.result.ErrorKind;
import com.weixiao.gitcad.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * 变更指示文件 .changefile：记录展开目录对应的归档（相对仓库根），外加一行内容摘要。
 * <pre>
 * FCStd_file_relpath='parts/bracket.FCStd'
 * content_sha256=3f2a...
 * </pre>
 * 内容不变时不重写，因此 git 只在归档内容变化时看到它变化。
 */
public final class ChangeFile {

    private static final Logger log = LoggerFactory.getLogger(ChangeFile.class);

    static final String RELPATH_KEY = "FCStd_file_relpath=";
    static final String DIGEST_KEY = "content_sha256=";

    private ChangeFile() {
    }

    /**
     * 写入指示文件；已有内容相同则不动。
     *
     * @return 是否实际写入
     */
    public static boolean write(Path changefile, String archiveRelPath, String contentDigest) throws IOException {
        String content = RELPATH_KEY + "'" + archiveRelPath + "'\n" + DIGEST_KEY + contentDigest + "\n";
        if (Files.isRegularFile(changefile)
                && content.equals(Files.readString(changefile, StandardCharsets.UTF_8))) {
            log.debug("changefile {} unchanged", changefile);
            return false;
        }
        Files.createDirectories(changefile.getParent());
        Files.writeString(changefile, content, StandardCharsets.UTF_8);
        log.debug("wrote changefile {} -> {}", changefile, archiveRelPath);
        return true;
    }

    /**
     * 读取指示文件中记录的归档相对路径。
     * 文件不存在为 NOT_FOUND，缺少该行为 CORRUPT_ARCHIVE。
     */
    public static Result<String> readArchivePath(Path changefile) {
        List<String> lines;
        try {
            lines = Files.readAllLines(changefile, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Result.failure(ErrorKind.NOT_FOUND, "changefile not found: " + changefile);
        } catch (IOException e) {
            log.warn("cannot read changefile {}: {}", changefile, e.getMessage());
            return Result.failure(ErrorKind.IO_ERROR, "cannot read " + changefile + ": " + e.getMessage());
        }
        for (String line : lines) {
            String trimmed = line.trim();
            if (!trimmed.startsWith(RELPATH_KEY)) continue;
            String value = trimmed.substring(RELPATH_KEY.length()).trim();
            if (value.length() >= 2 && (value.startsWith("'") && value.endsWith("'")
                    || value.startsWith("\"") && value.endsWith("\""))) {
                value = value.substring(1, value.length() - 1);
            }
            if (!value.isEmpty()) {
                return Result.success(value.replace('\\', '/'));
            }
        }
        return Result.failure(ErrorKind.CORRUPT_ARCHIVE, "changefile has no " + RELPATH_KEY + " line: " + changefile);
    }
}
