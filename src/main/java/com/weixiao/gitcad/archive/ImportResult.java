package com.weixiao.gitcad.archive;

import lombok.Value;

import java.nio.file.Path;

/**
 * 导入结果：写出的归档、写入的成员数、从分块中解出的成员数。
 */
@Value
public class ImportResult {
    Path archive;
    int memberCount;
    int unchunkedCount;
}
