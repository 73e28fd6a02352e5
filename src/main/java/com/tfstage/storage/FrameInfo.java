package com.tfstage.storage;

/**
 * 追加帧索引项，记录帧在文件中的位置与列宽。
 */
public record FrameInfo(StoreTable table, long offset, int rowCount, int keyWidth, int tokenWidth) {

    /** 帧头字节数：magic + table + rowCount + 两个列宽 */
    static final int HEADER_BYTES = Integer.BYTES + 1 + Integer.BYTES + 1 + 1;

    /** 批提交记录字节数：magic + 批序号 + CRC32 */
    static final int COMMIT_BYTES = Integer.BYTES + Long.BYTES + Integer.BYTES;

    long payloadBytes() {
        return (long) rowCount * (keyWidth + tokenWidth + Long.BYTES);
    }

    /**
     * 帧总长度，含尾部 CRC32。
     */
    long totalBytes() {
        return HEADER_BYTES + payloadBytes() + Integer.BYTES;
    }

    long keyColumnOffset() {
        return offset + HEADER_BYTES;
    }

    long tokenColumnOffset() {
        return keyColumnOffset() + (long) rowCount * keyWidth;
    }

    long countColumnOffset() {
        return tokenColumnOffset() + (long) rowCount * tokenWidth;
    }
}
