package com.weixiao.gitcad.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 工作区：递归列出目录下的普通文件（排除 .git），路径统一为 / 分隔并排序，保证遍历顺序稳定。
 */
public final class Workspace {

    private static final Logger log = LoggerFactory.getLogger(Workspace.class);

    private static final String GIT_DIR = ".git";
    private final Path root;

    /**
     * 以给定路径为工作区根目录。
     */
    public Workspace(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    /**
     * 递归列出 baseDir 下的所有普通文件，返回相对 baseDir 的 POSIX 路径（如 "a/b.txt"），按字典序排序。
     * baseDir 不存在或不是目录时返回空列表。
     */
    public static List<String> listFiles(Path baseDir) throws IOException {
        List<String> files = new ArrayList<>();
        if (!Files.isDirectory(baseDir)) {
            return files;
        }
        try (Stream<Path> stream = Files.walk(baseDir)) {
            for (Path p : (Iterable<Path>) stream::iterator) {
                if (!Files.isRegularFile(p)) continue;
                Path rel = baseDir.relativize(p);
                if (rel.getNameCount() > 0 && GIT_DIR.equals(rel.getName(0).toString())) continue;
                files.add(toPosix(rel));
            }
        }
        files.sort(String::compareTo);
        log.debug("listFiles baseDir={} count={}", baseDir, files.size());
        return files;
    }

    /**
     * 在整个工作区中查找文件名等于 fileName 的文件，返回相对仓库根的 POSIX 路径（已排序）。
     */
    public List<String> findByName(String fileName) throws IOException {
        return listFiles(root).stream()
                .filter(p -> fileName.equals(p.substring(p.lastIndexOf('/') + 1)))
                .collect(Collectors.toList());
    }

    /** 与平台分隔符无关的 POSIX 形式（\ 统一为 /）。 */
    public static String toPosix(Path relative) {
        return relative.toString().replace('\\', '/');
    }
}
