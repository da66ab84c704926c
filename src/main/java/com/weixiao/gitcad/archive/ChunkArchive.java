package com.weixiao.gitcad.archive;

import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * 一个已落盘的分块归档：序号（从 1 起连续）、路径、字节数、包含的成员（相对展开目录的 POSIX 路径）。
 */
@Value
public class ChunkArchive {
    int index;
    Path path;
    long size;
    List<String> members;
}
