package com.tfstage.extract;

/**
 * 按 UTF-8 字节上限截断字符串，只在码点边界处截断。
 *
 * <p>截断是有损的：超长词项只保留不超过上限的最长码点前缀，
 * 不同原词可能截断为同一词项。
 */
public final class Utf8Truncator {
    private Utf8Truncator() {
        // 工具类，禁止实例化
    }

    /**
     * 计算字符串的 UTF-8 编码字节数（孤立代理项按替换字符 '?' 计 1 字节）。
     */
    public static int utf8Length(String value) {
        int length = 0;
        int index = 0;
        while (index < value.length()) {
            int codePoint = value.codePointAt(index);
            length += encodedLength(codePoint);
            index += Character.charCount(codePoint);
        }
        return length;
    }

    /**
     * 从尾部逐个丢弃码点，直到 UTF-8 长度不超过上限。
     *
     * @param value 原始字符串
     * @param maxBytes 字节上限
     * @return 原串的码点前缀，UTF-8 长度不超过 maxBytes
     */
    public static String truncate(String value, int maxBytes) {
        if (maxBytes < 0) {
            throw new IllegalArgumentException("maxBytes 不能为负数: " + maxBytes);
        }
        if (value == null || value.length() * 4 <= maxBytes) {
            return value;
        }
        int usedBytes = 0;
        int index = 0;
        while (index < value.length()) {
            int codePoint = value.codePointAt(index);
            int codePointBytes = encodedLength(codePoint);
            if (usedBytes + codePointBytes > maxBytes) {
                return value.substring(0, index);
            }
            usedBytes += codePointBytes;
            index += Character.charCount(codePoint);
        }
        return value;
    }

    private static int encodedLength(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        if (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE) {
            return 1;
        }
        if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }
}
