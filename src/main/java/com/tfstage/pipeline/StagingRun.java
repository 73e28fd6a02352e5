package com.tfstage.pipeline;

import com.tfstage.batch.Batch;
import com.tfstage.batch.BatchProcessor;
import com.tfstage.batch.CorpusTrimPolicy;
import com.tfstage.checkpoint.CheckpointLog;
import com.tfstage.checkpoint.CorpusManifest;
import com.tfstage.config.Constants;
import com.tfstage.config.StagingConfig;
import com.tfstage.extract.TokenExtractor;
import com.tfstage.storage.StoreWriter;
import com.tfstage.volume.VolumeDecoder;
import com.tfstage.volume.VolumePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 一次完整运行：读清单、读检查点、计算剩余工作、调度并写运行汇总。
 */
public class StagingRun {
    private static final Logger logger = LoggerFactory.getLogger(StagingRun.class);
    private static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final StagingConfig config;
    private final ProcessorFactory processorFactory;
    private volatile Dispatcher activeDispatcher;
    private volatile boolean stopRequested;

    /**
     * 使用默认处理器工厂：每个工作线程一个 {@link StoreWriter}，文件名为工作线程标识。
     */
    public StagingRun(StagingConfig config, VolumeDecoder decoder) {
        this(config, defaultProcessorFactory(config, decoder));
    }

    public StagingRun(StagingConfig config, ProcessorFactory processorFactory) {
        this.config = config.validate();
        this.processorFactory = processorFactory;
    }

    /**
     * 运行前的工作计划。
     */
    public record Plan(int totalIdentifiers, int doneIdentifiers, int remainingIdentifiers, List<Batch> batches) {
    }

    /**
     * 计算剩余工作，不产生任何副作用。
     *
     * @return 工作计划
     * @throws IOException 清单或检查点读取失败时抛出
     */
    public Plan plan() throws IOException {
        List<String> allIdentifiers = CorpusManifest.readIdentifiers(config.getManifestPath(), config.getVolumeSuffix());
        Set<String> doneSet = CheckpointLog.load(config.getCheckpointPath());
        WorkPartitioner partitioner = new WorkPartitioner(config.getBatchSize());
        List<Batch> batches = partitioner.remainingWork(allIdentifiers, doneSet);
        int remaining = 0;
        for (Batch batch : batches) {
            remaining += batch.size();
        }
        return new Plan(allIdentifiers.size(), doneSet.size(), remaining, batches);
    }

    /**
     * 执行一次运行。
     *
     * @return 调度汇总
     * @throws IOException 清单、检查点或汇总写入失败时抛出
     * @throws InterruptedException 调度线程被中断时抛出
     */
    public DispatchReport execute() throws IOException, InterruptedException {
        Plan plan = plan();
        String runId = newRunId();
        logger.info("运行计划: run={}, total={}, done={}, remaining={}, batches={}", runId, plan.totalIdentifiers(),
            plan.doneIdentifiers(), plan.remainingIdentifiers(), plan.batches().size());
        Files.createDirectories(config.getStoreDir());

        DispatchReport report;
        try (CheckpointLog checkpointLog = new CheckpointLog(config.getCheckpointPath())) {
            Dispatcher dispatcher = new Dispatcher(config, checkpointLog, processorFactory);
            activeDispatcher = dispatcher;
            if (stopRequested) {
                dispatcher.requestStop();
            }
            try {
                report = dispatcher.dispatch(runId, plan.batches());
            } finally {
                activeDispatcher = null;
            }
        }

        Path summaryFile = config.getStoreDir().resolve(Constants.RUN_SUMMARY_FILE_NAME);
        report.toRunSummary().writeTo(summaryFile.toFile());
        return report;
    }

    /**
     * 请求停止当前运行；运行尚未开始时在开始后立即生效。
     */
    public void requestStop() {
        stopRequested = true;
        Dispatcher dispatcher = activeDispatcher;
        if (dispatcher != null) {
            dispatcher.requestStop();
        }
    }

    /**
     * 生成运行标识：时间戳加随机后缀，保证每次运行的存储文件名不同。
     */
    static String newRunId() {
        return LocalDateTime.now().format(RUN_ID_FORMAT) + "-" + Integer.toHexString(ThreadLocalRandom.current().nextInt(0x1000, 0x10000));
    }

    static ProcessorFactory defaultProcessorFactory(StagingConfig config, VolumeDecoder decoder) {
        VolumePaths volumePaths = new VolumePaths(config.getDataDir(), config.getVolumeSuffix());
        CorpusTrimPolicy trimPolicy = new CorpusTrimPolicy(config.getTrimLanguage(), config.getTrimMinCount());
        return workerId -> new BatchProcessor(decoder, volumePaths, new TokenExtractor(), trimPolicy,
            new StoreWriter(config.getStoreDir().resolve(workerId + Constants.STORE_FILE_SUFFIX), workerId), workerId);
    }
}
