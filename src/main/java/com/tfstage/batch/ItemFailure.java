package com.tfstage.batch;

/**
 * 批内单项失败：解码错误、结构错误或抽取拒绝。
 */
public record ItemFailure(String volumeId, String reason) {
}
