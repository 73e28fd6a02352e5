package com.tfstage.storage;

import java.io.IOException;

/**
 * 存储文件结构损坏（魔数、版本、截断尾部、CRC 不符）。
 */
public class StoreFormatException extends IOException {
    private final long offset;

    public StoreFormatException(String message, long offset) {
        super(message + ", offset=" + offset);
        this.offset = offset;
    }

    public long getOffset() {
        return offset;
    }
}
