package com.tfstage.extract;

/**
 * 单项抽取失败的描述。
 */
public record ExtractError(String volumeId, String reason, Throwable cause) {

    public ExtractError(String volumeId, String reason) {
        this(volumeId, reason, null);
    }
}
