package com.weixiao.gitcad.git;

import lombok.Value;

import java.util.Optional;

/**
 * pre-push 标准输入中的一行：&lt;local ref&gt; &lt;local oid&gt; &lt;remote ref&gt; &lt;remote oid&gt;。
 */
@Value
public class PushRefUpdate {

    String localRef;
    String localOid;
    String remoteRef;
    String remoteOid;

    /** 解析一行；字段数不是 4 或 oid 不是十六进制时返回空。 */
    public static Optional<PushRefUpdate> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String[] parts = line.trim().split("\\s+");
        if (parts.length != 4 || !isHex(parts[1]) || !isHex(parts[3])) {
            return Optional.empty();
        }
        return Optional.of(new PushRefUpdate(parts[0], parts[1], parts[2], parts[3]));
    }

    /** 删除远端 ref（本地 oid 全零）。 */
    public boolean isDelete() {
        return isZero(localOid);
    }

    public static boolean isZero(String oid) {
        return oid != null && !oid.isEmpty() && oid.chars().allMatch(c -> c == '0');
    }

    private static boolean isHex(String s) {
        return s.length() >= 4 && s.chars().allMatch(c -> (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F'));
    }
}
