package com.tfstage.storage;

/**
 * 存储行：首键（卷 ID 或语言）、词项、计数。
 */
public record StoreRow(String key, String token, long count) {
}
