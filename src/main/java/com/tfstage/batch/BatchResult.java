package com.tfstage.batch;

import java.util.List;

/**
 * 一批的处理结果，经完成通道回传调度线程。
 *
 * <p>{@code done} 非空表示两张表均已追加成功；{@code appendError} 非空表示整批未完成，
 * 此时 {@code done} 必为空。
 */
public record BatchResult(
    int batchIndex,
    String workerId,
    List<String> done,
    List<ItemFailure> failures,
    String appendError,
    long docRows,
    long corpusRows,
    long elapsedMs
) {
    public BatchResult {
        done = List.copyOf(done);
        failures = List.copyOf(failures);
        if (appendError != null && !done.isEmpty()) {
            throw new IllegalArgumentException("追加失败的批不能带有已完成 ID");
        }
    }

    public boolean isEmpty() {
        return done.isEmpty();
    }

    public boolean appendFailed() {
        return appendError != null;
    }

    /**
     * 工作线程异常终止时的失败结果。
     */
    public static BatchResult crashed(Batch batch, String workerId, Throwable cause) {
        return new BatchResult(batch.index(), workerId, List.of(), List.of(),
            "工作线程异常: " + cause, 0L, 0L, 0L);
    }
}
