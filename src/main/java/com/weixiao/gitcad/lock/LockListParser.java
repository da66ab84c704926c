package com.weixiao.gitcad.lock;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 解析锁原语的输出。
 * <ul>
 *   <li>结构化：{@code git lfs locks --json}，形如 [{"id":"1","path":"a/.lockfile","owner":{"name":"alice"}}]</li>
 *   <li>文本：每行 path、owner、可选 ID，优先按制表符分隔，否则按空白；以 -- 开头的行忽略</li>
 * </ul>
 */
public final class LockListParser {

    private static final Logger log = LoggerFactory.getLogger(LockListParser.class);

    static final String UNKNOWN_OWNER = "another user";
    private static final Pattern BY_OWNER = Pattern.compile("\\bby\\s+['\"]?([^\\s'\"]+)", Pattern.CASE_INSENSITIVE);

    private LockListParser() {
    }

    /**
     * 解析 --json 输出；不是合法 JSON 数组时抛 JsonParseException，由调用方退回文本解析。
     */
    public static List<LockRecord> parseJson(String json) {
        JsonElement root = JsonParser.parseString(json == null ? "" : json.trim());
        if (!root.isJsonArray()) {
            throw new JsonParseException("expected a JSON array of locks");
        }
        JsonArray array = root.getAsJsonArray();
        List<LockRecord> records = new ArrayList<>();
        for (JsonElement e : array) {
            if (!e.isJsonObject()) continue;
            JsonObject o = e.getAsJsonObject();
            String path = string(o, "path");
            if (path == null || path.isEmpty()) continue;
            String owner = null;
            JsonElement ownerEl = o.get("owner");
            if (ownerEl != null && ownerEl.isJsonObject()) {
                owner = string(ownerEl.getAsJsonObject(), "name");
            } else if (ownerEl != null && ownerEl.isJsonPrimitive()) {
                owner = ownerEl.getAsString();
            }
            String id = string(o, "id");
            records.add(new LockRecord(path, owner != null ? owner : UNKNOWN_OWNER, id != null ? id : ""));
        }
        log.debug("parsed {} lock(s) from json", records.size());
        return records;
    }

    /**
     * 解析人类可读的文本输出，格式不对的行跳过。
     */
    public static List<LockRecord> parseText(String output) {
        List<LockRecord> records = new ArrayList<>();
        if (output == null) {
            return records;
        }
        for (String line : output.split("\\R")) {
            if (line.isBlank() || line.trim().startsWith("--")) continue;
            String[] parts = line.contains("\t") ? line.split("\t") : line.trim().split("\\s+");
            if (parts.length < 2) {
                log.debug("skip unparseable lock line: {}", line);
                continue;
            }
            String path = parts[0].trim();
            String owner = parts[1].trim();
            String id = parts.length > 2 ? parts[2].trim() : "";
            if (id.regionMatches(true, 0, "ID:", 0, 3)) {
                id = id.substring(3);
            }
            records.add(new LockRecord(path, owner, id));
        }
        log.debug("parsed {} lock(s) from text", records.size());
        return records;
    }

    /**
     * 从 "already locked" 错误信息中尽力取出持有者：取 "by" 后的第一个词；取不到返回 "another user"。
     * 例："Lock exists: locked by bob" -> bob。
     */
    public static String ownerFromError(String message) {
        if (message == null) {
            return UNKNOWN_OWNER;
        }
        Matcher m = BY_OWNER.matcher(message);
        if (m.find()) {
            String owner = m.group(1).replaceAll("[.,;:)]+$", "");
            if (!owner.isEmpty()) {
                return owner;
            }
        }
        return UNKNOWN_OWNER;
    }

    /** 错误信息是否表示"已被锁定"。 */
    public static boolean isAlreadyLocked(String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        return lower.contains("already locked") || lower.contains("lock exists");
    }

    /** 错误信息是否表示"未被锁定"。 */
    public static boolean isNotLocked(String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        return lower.contains("not locked") || lower.contains("no matching locks");
    }

    private static String string(JsonObject o, String key) {
        JsonElement e = o.get(key);
        if (e == null || e.isJsonNull() || !e.isJsonPrimitive()) {
            return null;
        }
        return e.getAsString();
    }
}
