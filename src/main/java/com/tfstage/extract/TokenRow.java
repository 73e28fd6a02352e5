package com.tfstage.extract;

/**
 * 词频记录：(语言, 卷 ID, 词项) → 计数。
 */
public record TokenRow(String language, String volumeId, String token, long count) {
    public TokenRow {
        if (count < 0) {
            throw new IllegalArgumentException("count 不能为负数: " + count);
        }
    }
}
