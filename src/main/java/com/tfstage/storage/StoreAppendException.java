package com.tfstage.storage;

import java.io.IOException;

/**
 * 批量追加失败；整批不计入检查点，存储已回滚到追加前长度。
 */
public class StoreAppendException extends IOException {

    public StoreAppendException(String message) {
        super(message);
    }

    public StoreAppendException(String message, Throwable cause) {
        super(message, cause);
    }
}
