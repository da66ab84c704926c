package com.weixiao.gitcad.config;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 仓库级配置快照：每次生命周期调用加载一次，操作期间不修改。
 * 缺省值与 GitCAD 的 config.json 默认值一致。
 */
@Value
@Builder(toBuilder = true)
public class RepositoryConfig {

    public static final long GIB = 1024L * 1024L * 1024L;
    public static final List<String> DEFAULT_BINARY_PATTERNS = List.of("*.brp", "*.Map.*", "no_extension/*");

    /** 展开目录名前缀，如 "" */
    @Builder.Default
    String uncompressedPrefix = "";

    /** 展开目录名后缀，如 "_uncompressed"：parts/bracket.FCStd -> parts/bracket_uncompressed */
    @Builder.Default
    String uncompressedSuffix = "_uncompressed";

    /** 为 true 时展开目录放在同级的 subdirectoryName 子目录中 */
    @Builder.Default
    boolean subdirectoryMode = false;

    @Builder.Default
    String subdirectoryName = ".freecad_data";

    /** 是否要求提交 / 推送前持有锁 */
    @Builder.Default
    boolean requireLock = true;

    /** 是否把匹配 binaryPatterns 的成员打包进分块归档 */
    @Builder.Default
    boolean compressBinaries = true;

    @Builder.Default
    List<String> binaryPatterns = DEFAULT_BINARY_PATTERNS;

    /** 单个分块归档的最大字节数 */
    @Builder.Default
    long maxChunkBytes = 2 * GIB;

    /** Deflate 压缩级别 0-9 */
    @Builder.Default
    int compressionLevel = 6;

    /** 分块归档文件名前缀：binaries_1.zip, binaries_2.zip ... */
    @Builder.Default
    String chunkPrefix = "binaries_";

    /** 全部取默认值的配置。 */
    public static RepositoryConfig defaults() {
        return RepositoryConfig.builder().build();
    }
}
