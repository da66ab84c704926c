package com.weixiao.gitcad.archive;

import lombok.Value;

import java.nio.file.Path;

/**
 * 导出结果：展开目录、归档成员数、被打包进分块的成员数。
 */
@Value
public class ExportResult {
    Path treeRoot;
    int memberCount;
    int chunkedCount;
}
