package com.weixiao.gitcad.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * 读取 / 写入仓库配置。
 * 位置：优先 .gitpdm/config.json，其次旧版 FreeCAD_Automation/config.json。
 * 支持两种格式：本项目的扁平格式（snake_case 键）与 GitCAD 的嵌套格式。
 * 文件缺失或内容非法时回退默认值并记 warn，从不因配置问题失败。
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_DIR = ".gitpdm";
    public static final String LEGACY_CONFIG_DIR = "FreeCAD_Automation";
    public static final String CONFIG_FILE = "config.json";

    // 扁平格式
    private static final String KEY_SUFFIX = "uncompressed_suffix";
    private static final String KEY_PREFIX = "uncompressed_prefix";
    private static final String KEY_SUBDIR_MODE = "subdirectory_mode";
    private static final String KEY_SUBDIR_NAME = "subdirectory_name";
    private static final String KEY_REQUIRE_LOCK = "require_lock";
    private static final String KEY_COMPRESS = "compress_binaries";
    private static final String KEY_PATTERNS = "binary_patterns";
    private static final String KEY_MAX_GB = "max_compressed_size_gb";
    private static final String KEY_LEVEL = "compression_level";
    private static final String KEY_ZIP_PREFIX = "zip_file_prefix";

    // GitCAD 嵌套格式
    private static final String GC_STRUCTURE = "uncompressed-directory-structure";
    private static final String GC_SUFFIX = "uncompressed-directory-suffix";
    private static final String GC_PREFIX = "uncompressed-directory-prefix";
    private static final String GC_SUBDIR = "subdirectory";
    private static final String GC_SUBDIR_MODE = "put-uncompressed-directory-in-subdirectory";
    private static final String GC_SUBDIR_NAME = "subdirectory-name";
    private static final String GC_REQUIRE_LOCK = "require-lock-to-modify-FreeCAD-files";
    private static final String GC_COMPRESS = "compress-non-human-readable-FreeCAD-files";
    private static final String GC_ENABLED = "enabled";
    private static final String GC_PATTERNS = "files-to-compress";
    private static final String GC_MAX_GB = "max-compressed-file-size-gigabyte";
    private static final String GC_LEVEL = "compression-level";
    private static final String GC_ZIP_PREFIX = "zip-file-prefix";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private ConfigLoader() {
    }

    /** 新位置的配置文件路径（save 总是写到这里）。 */
    public static Path configPath(Path repoRoot) {
        return repoRoot.resolve(CONFIG_DIR).resolve(CONFIG_FILE);
    }

    /** 是否存在任一位置的配置文件。 */
    public static boolean hasConfig(Path repoRoot) {
        return Files.isRegularFile(configPath(repoRoot))
                || Files.isRegularFile(repoRoot.resolve(LEGACY_CONFIG_DIR).resolve(CONFIG_FILE));
    }

    /**
     * 加载仓库配置；任何问题都回退到默认值。
     */
    public static RepositoryConfig load(Path repoRoot) {
        Path file = configPath(repoRoot);
        if (!Files.isRegularFile(file)) {
            file = repoRoot.resolve(LEGACY_CONFIG_DIR).resolve(CONFIG_FILE);
        }
        if (!Files.isRegularFile(file)) {
            log.debug("no config file under {}, using defaults", repoRoot);
            return RepositoryConfig.defaults();
        }
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            RepositoryConfig config = parse(text);
            log.debug("loaded config from {}: {}", file, config);
            return config;
        } catch (IOException e) {
            log.warn("cannot read config {}, using defaults: {}", file, e.getMessage());
            return RepositoryConfig.defaults();
        }
    }

    /**
     * 解析 JSON 文本：自动识别扁平 / GitCAD 格式；整体非法时返回默认值，单个字段非法时该字段取默认值。
     */
    public static RepositoryConfig parse(String json) {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            log.warn("invalid JSON in config, using defaults: {}", e.getMessage());
            return RepositoryConfig.defaults();
        }
        if (root == null || !root.isJsonObject()) {
            log.warn("config root is not a JSON object, using defaults");
            return RepositoryConfig.defaults();
        }
        JsonObject obj = root.getAsJsonObject();
        if (obj.has(GC_STRUCTURE) || obj.has(GC_COMPRESS) || obj.has(GC_REQUIRE_LOCK)) {
            return parseGitCadFormat(obj);
        }
        return parseFlatFormat(obj);
    }

    private static RepositoryConfig parseFlatFormat(JsonObject obj) {
        RepositoryConfig d = RepositoryConfig.defaults();
        return RepositoryConfig.builder()
                .uncompressedSuffix(string(obj, KEY_SUFFIX, d.getUncompressedSuffix()))
                .uncompressedPrefix(string(obj, KEY_PREFIX, d.getUncompressedPrefix()))
                .subdirectoryMode(bool(obj, KEY_SUBDIR_MODE, d.isSubdirectoryMode()))
                .subdirectoryName(string(obj, KEY_SUBDIR_NAME, d.getSubdirectoryName()))
                .requireLock(bool(obj, KEY_REQUIRE_LOCK, d.isRequireLock()))
                .compressBinaries(bool(obj, KEY_COMPRESS, d.isCompressBinaries()))
                .binaryPatterns(stringList(obj, KEY_PATTERNS, d.getBinaryPatterns()))
                .maxChunkBytes(gigabytes(obj, KEY_MAX_GB, d.getMaxChunkBytes()))
                .compressionLevel(level(obj, KEY_LEVEL, d.getCompressionLevel()))
                .chunkPrefix(nonEmpty(string(obj, KEY_ZIP_PREFIX, d.getChunkPrefix()), d.getChunkPrefix()))
                .build();
    }

    private static RepositoryConfig parseGitCadFormat(JsonObject obj) {
        RepositoryConfig d = RepositoryConfig.defaults();
        JsonObject structure = object(obj, GC_STRUCTURE);
        JsonObject subdir = object(structure, GC_SUBDIR);
        JsonObject compress = object(obj, GC_COMPRESS);
        return RepositoryConfig.builder()
                .uncompressedSuffix(string(structure, GC_SUFFIX, d.getUncompressedSuffix()))
                .uncompressedPrefix(string(structure, GC_PREFIX, d.getUncompressedPrefix()))
                .subdirectoryMode(bool(subdir, GC_SUBDIR_MODE, d.isSubdirectoryMode()))
                .subdirectoryName(string(subdir, GC_SUBDIR_NAME, d.getSubdirectoryName()))
                .requireLock(bool(obj, GC_REQUIRE_LOCK, d.isRequireLock()))
                .compressBinaries(bool(compress, GC_ENABLED, d.isCompressBinaries()))
                .binaryPatterns(stringList(compress, GC_PATTERNS, d.getBinaryPatterns()))
                .maxChunkBytes(gigabytes(compress, GC_MAX_GB, d.getMaxChunkBytes()))
                .compressionLevel(level(compress, GC_LEVEL, d.getCompressionLevel()))
                .chunkPrefix(nonEmpty(string(compress, GC_ZIP_PREFIX, d.getChunkPrefix()), d.getChunkPrefix()))
                .build();
    }

    /**
     * 以扁平格式写入 .gitpdm/config.json（先写临时文件再替换）。
     */
    public static void save(Path repoRoot, RepositoryConfig config) throws IOException {
        JsonObject obj = new JsonObject();
        obj.addProperty(KEY_SUFFIX, config.getUncompressedSuffix());
        obj.addProperty(KEY_PREFIX, config.getUncompressedPrefix());
        obj.addProperty(KEY_SUBDIR_MODE, config.isSubdirectoryMode());
        obj.addProperty(KEY_SUBDIR_NAME, config.getSubdirectoryName());
        obj.addProperty(KEY_REQUIRE_LOCK, config.isRequireLock());
        obj.addProperty(KEY_COMPRESS, config.isCompressBinaries());
        JsonArray patterns = new JsonArray();
        config.getBinaryPatterns().forEach(patterns::add);
        obj.add(KEY_PATTERNS, patterns);
        obj.addProperty(KEY_MAX_GB, (double) config.getMaxChunkBytes() / RepositoryConfig.GIB);
        obj.addProperty(KEY_LEVEL, config.getCompressionLevel());
        obj.addProperty(KEY_ZIP_PREFIX, config.getChunkPrefix());

        Path file = configPath(repoRoot);
        Files.createDirectories(file.getParent());
        Path temp = file.resolveSibling(CONFIG_FILE + ".tmp");
        try {
            Files.writeString(temp, GSON.toJson(obj) + "\n", StandardCharsets.UTF_8);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("saved config to {}", file);
    }

    private static JsonObject object(JsonObject parent, String key) {
        if (parent == null) return null;
        JsonElement e = parent.get(key);
        if (e == null || e.isJsonNull()) return null;
        if (!e.isJsonObject()) {
            log.warn("config field '{}' is not an object, using defaults", key);
            return null;
        }
        return e.getAsJsonObject();
    }

    private static JsonPrimitive primitive(JsonObject parent, String key) {
        if (parent == null) return null;
        JsonElement e = parent.get(key);
        if (e == null || e.isJsonNull()) return null;
        if (!e.isJsonPrimitive()) {
            log.warn("config field '{}' has wrong type, using default", key);
            return null;
        }
        return e.getAsJsonPrimitive();
    }

    private static String string(JsonObject parent, String key, String def) {
        JsonPrimitive p = primitive(parent, key);
        if (p == null) return def;
        if (!p.isString()) {
            log.warn("config field '{}' is not a string, using default", key);
            return def;
        }
        return p.getAsString();
    }

    private static boolean bool(JsonObject parent, String key, boolean def) {
        JsonPrimitive p = primitive(parent, key);
        if (p == null) return def;
        if (!p.isBoolean()) {
            log.warn("config field '{}' is not a boolean, using default", key);
            return def;
        }
        return p.getAsBoolean();
    }

    private static long gigabytes(JsonObject parent, String key, long defBytes) {
        JsonPrimitive p = primitive(parent, key);
        if (p == null) return defBytes;
        if (!p.isNumber() || p.getAsDouble() <= 0) {
            log.warn("config field '{}' is not a positive number, using default", key);
            return defBytes;
        }
        return (long) (p.getAsDouble() * RepositoryConfig.GIB);
    }

    private static int level(JsonObject parent, String key, int def) {
        JsonPrimitive p = primitive(parent, key);
        if (p == null) return def;
        if (!p.isNumber()) {
            log.warn("config field '{}' is not a number, using default", key);
            return def;
        }
        return Math.max(0, Math.min(9, p.getAsInt()));
    }

    private static List<String> stringList(JsonObject parent, String key, List<String> def) {
        if (parent == null) return def;
        JsonElement e = parent.get(key);
        if (e == null || e.isJsonNull()) return def;
        if (!e.isJsonArray()) {
            log.warn("config field '{}' is not an array, using default", key);
            return def;
        }
        List<String> out = new ArrayList<>();
        for (JsonElement item : e.getAsJsonArray()) {
            if (item.isJsonPrimitive() && item.getAsJsonPrimitive().isString()) {
                out.add(item.getAsString());
            } else {
                log.warn("ignoring non-string entry in '{}': {}", key, item);
            }
        }
        return List.copyOf(out);
    }

    private static String nonEmpty(String value, String def) {
        return value == null || value.isEmpty() ? def : value;
    }
}
