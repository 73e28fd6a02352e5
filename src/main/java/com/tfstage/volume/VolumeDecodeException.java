package com.tfstage.volume;

import java.nio.file.Path;

/**
 * 单个卷解码失败，属于可跳过的单项错误。
 */
public class VolumeDecodeException extends Exception {
    private final Path path;

    public VolumeDecodeException(String message, Path path) {
        super(message + ": " + path);
        this.path = path;
    }

    public VolumeDecodeException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
