package com.tfstage.storage;

import com.tfstage.config.Constants;

/**
 * 存储文件中的两张表及其定宽列。
 */
public enum StoreTable {
    /** 卷级词频：(卷 ID, 词项) → 计数，不含语言列 */
    DOCS("/tf/docs", (byte) 1, Constants.VOLUME_ID_WIDTH, Constants.TOKEN_WIDTH),
    /** 语料级词频：(语言, 词项) → 批内合计 */
    CORPUS("/tf/corpus", (byte) 2, Constants.LANGUAGE_WIDTH, Constants.TOKEN_WIDTH);

    private final String key;
    private final byte code;
    private final int keyWidth;
    private final int tokenWidth;

    StoreTable(String key, byte code, int keyWidth, int tokenWidth) {
        this.key = key;
        this.code = code;
        this.keyWidth = keyWidth;
        this.tokenWidth = tokenWidth;
    }

    public String key() {
        return key;
    }

    public byte code() {
        return code;
    }

    public int keyWidth() {
        return keyWidth;
    }

    public int tokenWidth() {
        return tokenWidth;
    }

    static StoreTable fromCode(byte code) {
        for (StoreTable table : values()) {
            if (table.code == code) {
                return table;
            }
        }
        return null;
    }
}
