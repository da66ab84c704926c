package com.weixiao.gitcad.archive;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * POSIX 风格路径 glob：与 GitCAD 的匹配语义一致。
 * 相对模式从路径末尾逐段匹配（"*.brp" 匹配 "a/b/x.brp"，"no_extension/*" 匹配 "no_extension/Shape"）；
 * 以 / 开头的模式要求段数完全相同。每段支持 *、?、[...]，不跨越 /。
 * 路径中的 \ 一律视为 /，与宿主平台无关。
 */
public final class PosixGlob {

    private final String pattern;
    private final boolean anchored;
    private final List<Pattern> segments;

    public PosixGlob(String pattern) {
        this.pattern = pattern;
        String normalized = pattern.replace('\\', '/');
        this.anchored = normalized.startsWith("/");
        this.segments = new ArrayList<>();
        for (String part : normalized.split("/")) {
            if (part.isEmpty()) continue;
            segments.add(Pattern.compile(toRegex(part)));
        }
    }

    /** relativePath 相对展开目录根，可使用任意分隔符。 */
    public boolean matches(String relativePath) {
        if (segments.isEmpty()) return false;
        List<String> parts = new ArrayList<>();
        for (String p : relativePath.replace('\\', '/').split("/")) {
            if (!p.isEmpty()) parts.add(p);
        }
        if (anchored ? parts.size() != segments.size() : parts.size() < segments.size()) {
            return false;
        }
        int offset = parts.size() - segments.size();
        for (int i = 0; i < segments.size(); i++) {
            if (!segments.get(i).matcher(parts.get(offset + i)).matches()) {
                return false;
            }
        }
        return true;
    }

    /** 任一模式匹配即为 true。 */
    public static boolean matchesAny(List<PosixGlob> globs, String relativePath) {
        for (PosixGlob g : globs) {
            if (g.matches(relativePath)) return true;
        }
        return false;
    }

    public static List<PosixGlob> compileAll(List<String> patterns) {
        List<PosixGlob> out = new ArrayList<>();
        for (String p : patterns) out.add(new PosixGlob(p));
        return out;
    }

    private static String toRegex(String segment) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < segment.length()) {
            char c = segment.charAt(i);
            if (c == '*') {
                sb.append("[^/]*");
            } else if (c == '?') {
                sb.append("[^/]");
            } else if (c == '[') {
                int close = segment.indexOf(']', i + 2);
                if (close < 0) {
                    sb.append("\\[");
                } else {
                    String body = segment.substring(i + 1, close);
                    if (body.startsWith("!")) body = "^" + body.substring(1);
                    sb.append('[').append(body.replace("\\", "\\\\")).append(']');
                    i = close;
                }
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
