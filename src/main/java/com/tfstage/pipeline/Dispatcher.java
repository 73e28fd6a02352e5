package com.tfstage.pipeline;

import com.tfstage.batch.Batch;
import com.tfstage.batch.BatchResult;
import com.tfstage.checkpoint.CheckpointLog;
import com.tfstage.config.Constants;
import com.tfstage.config.StagingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 调度器：把批分发给固定工作线程池，按完成顺序消费结果并立即写入检查点。
 *
 * <p>调度线程是检查点日志的唯一写者。结果为空的批只记录错误、计入问题批，由操作者重跑修复。
 * 停止请求只停止投放新批，已开始的批会完成并写入检查点；连续超时达到上限视为卡死，
 * 撤回未开始的批，再给仍在运行的批一个超时周期收尾后返回。
 */
public class Dispatcher {
    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

    private final StagingConfig config;
    private final CheckpointLog checkpointLog;
    private final ProcessorFactory processorFactory;
    private volatile boolean stopRequested;

    public Dispatcher(StagingConfig config, CheckpointLog checkpointLog, ProcessorFactory processorFactory) {
        this.config = config;
        this.checkpointLog = checkpointLog;
        this.processorFactory = processorFactory;
    }

    /**
     * 请求停止：不再投放新批，等待已开始的批完成。
     */
    public void requestStop() {
        stopRequested = true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    /**
     * 执行调度。
     *
     * @param runId 运行标识
     * @param batches 待处理批
     * @return 调度汇总
     * @throws IOException 写检查点失败时抛出（调度线程自身无法继续）
     * @throws InterruptedException 调度线程被中断时抛出
     */
    public DispatchReport dispatch(String runId, List<Batch> batches) throws IOException, InterruptedException {
        Instant startTime = Instant.now();
        int workers = config.getWorkers();
        int maxInFlight = workers + Math.min(workers, Constants.BATCH_QUEUE_CAPACITY);
        long timeoutMillis = config.getResultTimeout().toMillis();
        Tally tally = new Tally(batches.size());

        logger.info("开始调度: run={}, batches={}, workers={}, batchSize={}", runId, batches.size(), workers,
            config.getBatchSize());
        WorkerPool pool = new WorkerPool(workers, runId, processorFactory);
        try {
            Iterator<Batch> pending = batches.iterator();
            int consecutiveStalls = 0;
            while (true) {
                while (!stopRequested && tally.inFlight < maxInFlight && pending.hasNext()) {
                    pool.submit(pending.next());
                    tally.dispatched++;
                    tally.inFlight++;
                }
                if (stopRequested) {
                    withdraw(pool, tally, "收到停止请求");
                }
                if (tally.inFlight == 0) {
                    break;
                }

                BatchResult result = pool.poll(timeoutMillis, TimeUnit.MILLISECONDS);
                if (result == null) {
                    consecutiveStalls++;
                    logger.warn("等待批结果超时: inFlight={}, stalls={}/{}", tally.inFlight, consecutiveStalls,
                        config.getMaxStalls());
                    if (consecutiveStalls >= config.getMaxStalls()) {
                        tally.stalled = true;
                        withdraw(pool, tally, "工作线程疑似卡死");
                        break;
                    }
                    continue;
                }
                consecutiveStalls = 0;
                handle(result, tally);
            }

            if (tally.stalled) {
                pool.shutdown(timeoutMillis);
                BatchResult late;
                while ((late = pool.poll(0L, TimeUnit.MILLISECONDS)) != null) {
                    handle(late, tally);
                }
                logger.error("放弃等待卡死的批: outstanding={}", tally.inFlight);
            }
        } finally {
            int alive = pool.shutdown(tally.stalled ? 1L : 0L);
            if (alive > 0) {
                logger.error("调度结束时仍有 {} 个工作线程未退出", alive);
            }
        }

        DispatchReport report = new DispatchReport(runId, batches.size(), tally.dispatched, tally.completed,
            tally.problemBatches, tally.checkpointed, tally.itemFailures, tally.inFlight, tally.withdrawn,
            stopRequested, tally.stalled, startTime, Instant.now());
        logger.info("调度结束: run={}, completed={}/{}, checkpointed={}, problemBatches={}, itemFailures={}, elapsed={}ms",
            runId, tally.completed, batches.size(), tally.checkpointed, report.problemBatchCount(), tally.itemFailures,
            report.elapsedMs());
        return report;
    }

    /**
     * 消费一个批结果：非空结果立即写入检查点，空结果计入问题批。
     */
    private void handle(BatchResult result, Tally tally) throws IOException {
        tally.inFlight--;
        tally.completed++;
        tally.itemFailures += result.failures().size();
        if (result.isEmpty()) {
            tally.problemBatches.add(result.batchIndex());
            logger.error("批结果为空，需重跑: batch={}, worker={}, appendError={}, failures={}",
                result.batchIndex(), result.workerId(), result.appendError(), result.failures().size());
        } else {
            tally.checkpointed += checkpointLog.append(result.done());
        }
        if (tally.completed % config.getProgressInterval() == 0) {
            logger.info("进度: {}/{} 批, 已检查点 {} 个 ID, 问题批 {}", tally.completed, tally.planned,
                tally.checkpointed, tally.problemBatches.size());
        }
    }

    private void withdraw(WorkerPool pool, Tally tally, String reason) {
        int cancelled = pool.cancelPending().size();
        if (cancelled > 0) {
            logger.warn("{}，撤回未开始的批: {}", reason, cancelled);
        }
        tally.withdrawn += cancelled;
        tally.inFlight -= cancelled;
    }

    /**
     * 调度过程中的计数，仅由调度线程访问。
     */
    private static final class Tally {
        private final int planned;
        private final List<Integer> problemBatches = new ArrayList<>();
        private int dispatched;
        private int inFlight;
        private int completed;
        private int checkpointed;
        private int itemFailures;
        private int withdrawn;
        private boolean stalled;

        private Tally(int planned) {
            this.planned = planned;
        }
    }
}
