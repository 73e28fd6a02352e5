package com.tfstage.pipeline;

import com.tfstage.storage.RunSummary;

import java.time.Instant;
import java.util.List;

/**
 * 一次调度运行的汇总。
 *
 * @param problemBatches 未产生已完成 ID 的批序号（追加失败、全部单项失败或工作线程异常）
 * @param outstandingBatches 运行结束时既未完成也未撤回的批数（卡死时非零）
 * @param withdrawnBatches 因停止请求或卡死而撤回、从未开始的批数
 */
public record DispatchReport(
    String runId,
    int batchesPlanned,
    int batchesDispatched,
    int batchesCompleted,
    List<Integer> problemBatches,
    int identifiersCheckpointed,
    int itemFailures,
    int outstandingBatches,
    int withdrawnBatches,
    boolean stopped,
    boolean stalled,
    Instant startTime,
    Instant endTime
) {
    public DispatchReport {
        problemBatches = List.copyOf(problemBatches);
    }

    public int problemBatchCount() {
        return problemBatches.size();
    }

    public long elapsedMs() {
        return endTime.toEpochMilli() - startTime.toEpochMilli();
    }

    public RunSummary toRunSummary() {
        return new RunSummary(runId, batchesPlanned, batchesCompleted, problemBatches.size(),
            identifiersCheckpointed, itemFailures, stopped, stalled, startTime, endTime);
    }
}
