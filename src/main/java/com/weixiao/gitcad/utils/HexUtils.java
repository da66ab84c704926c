package com.weixiao.gitcad.utils;

import lombok.experimental.UtilityClass;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 十六进制与摘要工具，用于 .changefile 中的内容摘要。
 */
@UtilityClass
public class HexUtils {

    /**
     * 将字节数组转为小写十六进制字符串。
     * 例：32 字节 SHA-256 digest → 64 字符。
     *
     * @param bytes 任意长度
     * @return 小写 hex 字符串
     */
    public static String bytesToHex(byte[] bytes) {
        if (bytes == null) return "";
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b & 0xff));
        }
        return sb.toString();
    }

    /** 新建 SHA-256 摘要器；JDK 必定提供该算法，取不到视为环境错误。 */
    public static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
