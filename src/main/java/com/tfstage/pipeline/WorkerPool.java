package com.tfstage.pipeline;

import com.tfstage.batch.Batch;
import com.tfstage.batch.BatchProcessor;
import com.tfstage.batch.BatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 固定大小的工作线程池：批队列入、完成通道出。
 *
 * <p>每个工作线程单线程顺序处理批，持有一个独占存储；结果按完成顺序放入完成通道，
 * 慢批不会阻塞快批。关闭时向批队列投放毒丸，已开始的批会完整执行。
 *
 * <p>工作单元是同一 JVM 内的线程而非独立进程：每个存储文件仍只有一个写者，但内存溢出或 JVM 崩溃
 * 会同时终止全部工作线程。这种情况下未提交的批不会出现在存储中（读取端只承认带提交记录的批），
 * 也不会进入检查点，重跑即可补齐。
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    /** 毒丸对象，用于通知工作线程退出 */
    private static final Batch POISON = new Batch(0, List.of());

    /** 日志 MDC 键，日志配置据此按工作线程拆分文件 */
    public static final String MDC_WORKER_KEY = "worker";

    private final BlockingQueue<Batch> batchQueue = new LinkedBlockingQueue<>();
    private final BlockingQueue<BatchResult> completions = new LinkedBlockingQueue<>();
    private final List<Thread> threads = new ArrayList<>();
    private final List<String> workerIds = new ArrayList<>();
    private boolean shutdown;

    /**
     * 创建并启动工作线程。
     *
     * @param workerCount 工作线程数
     * @param runId 运行标识，用于组成工作线程标识
     * @param processorFactory 处理器工厂
     */
    public WorkerPool(int workerCount, String runId, ProcessorFactory processorFactory) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount 必须为正数: " + workerCount);
        }
        for (int index = 0; index < workerCount; index++) {
            String workerId = runId + "-w" + index;
            Thread thread = new Thread(() -> workerLoop(workerId, processorFactory), "tf-" + workerId);
            thread.setDaemon(true);
            threads.add(thread);
            workerIds.add(workerId);
        }
        threads.forEach(Thread::start);
    }

    public List<String> workerIds() {
        return List.copyOf(workerIds);
    }

    /**
     * 提交一批；队列无界，不阻塞。
     */
    public void submit(Batch batch) {
        if (shutdown) {
            throw new IllegalStateException("WorkerPool 已关闭");
        }
        batchQueue.add(batch);
    }

    /**
     * 从完成通道取一个结果，超时返回 null。
     */
    public BatchResult poll(long timeout, TimeUnit unit) throws InterruptedException {
        return completions.poll(timeout, unit);
    }

    /**
     * 撤回尚未开始的批，返回被撤回的批。
     */
    public List<Batch> cancelPending() {
        List<Batch> drained = new ArrayList<>();
        batchQueue.drainTo(drained);
        drained.removeIf(batch -> batch == POISON);
        return drained;
    }

    /**
     * 投放毒丸并等待工作线程退出。
     *
     * @param timeoutMillis 每个线程的最长等待时间，0 表示一直等待
     * @return 超时仍未退出的线程数
     */
    public int shutdown(long timeoutMillis) throws InterruptedException {
        if (!shutdown) {
            shutdown = true;
            for (int index = 0; index < threads.size(); index++) {
                batchQueue.add(POISON);
            }
        }
        int alive = 0;
        for (Thread thread : threads) {
            thread.join(timeoutMillis);
            if (thread.isAlive()) {
                alive++;
            }
        }
        return alive;
    }

    @Override
    public void close() throws InterruptedException {
        int alive = shutdown(0L);
        if (alive > 0) {
            logger.warn("仍有工作线程未退出: {}", alive);
        }
    }

    private void workerLoop(String workerId, ProcessorFactory processorFactory) {
        MDC.put(MDC_WORKER_KEY, workerId);
        try {
            BatchProcessor processor = openProcessor(workerId, processorFactory);
            if (processor == null) {
                return;
            }
            try (processor) {
                logger.info("工作线程启动: {}", workerId);
                while (true) {
                    Batch batch = batchQueue.take();
                    if (batch == POISON) {
                        break;
                    }
                    completions.add(runBatch(processor, batch, workerId));
                }
            } catch (IOException exception) {
                logger.error("关闭工作线程存储失败: {}", workerId, exception);
            }
            logger.info("工作线程退出: {}", workerId);
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            logger.warn("工作线程被中断: {}", workerId);
        } finally {
            MDC.remove(MDC_WORKER_KEY);
        }
    }

    /**
     * 创建处理器；失败时该线程改为把收到的每一批都报告为失败，避免调度线程空等。
     */
    private BatchProcessor openProcessor(String workerId, ProcessorFactory processorFactory) throws InterruptedException {
        try {
            return processorFactory.create(workerId);
        } catch (IOException | RuntimeException exception) {
            logger.error("创建批处理器失败: {}", workerId, exception);
            while (true) {
                Batch batch = batchQueue.take();
                if (batch == POISON) {
                    return null;
                }
                completions.add(BatchResult.crashed(batch, workerId, exception));
            }
        }
    }

    private BatchResult runBatch(BatchProcessor processor, Batch batch, String workerId) {
        try {
            return processor.processBatch(batch);
        } catch (RuntimeException exception) {
            logger.error("批处理异常: batch={}, worker={}", batch.index(), workerId, exception);
            return BatchResult.crashed(batch, workerId, exception);
        }
    }
}
