package com.tfstage.recovery;

import java.nio.file.Path;
import java.util.List;

/**
 * 单个存储文件的恢复扫描结果。
 *
 * @param recovered 存在于存储但不在检查点中的卷 ID（按从新到旧的发现顺序）
 * @param rowsScanned 实际扫描的卷 ID 列行数
 * @param stoppedEarly 是否因整窗均已检查点而提前停止
 * @param error 文件结构错误描述；非空时 recovered 为空
 */
public record ScanReport(Path storeFile, List<String> recovered, long rowsScanned, boolean stoppedEarly, String error) {
    public ScanReport {
        recovered = List.copyOf(recovered);
    }

    public boolean failed() {
        return error != null;
    }

    static ScanReport failure(Path storeFile, String error) {
        return new ScanReport(storeFile, List.of(), 0L, false, error);
    }
}
