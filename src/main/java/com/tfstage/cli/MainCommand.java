package com.tfstage.cli;

import com.tfstage.checkpoint.CheckpointLog;
import com.tfstage.config.Constants;
import com.tfstage.config.StagingConfig;
import com.tfstage.pipeline.DispatchReport;
import com.tfstage.pipeline.StagingRun;
import com.tfstage.recovery.RecoveryScanner;
import com.tfstage.recovery.ScanReport;
import com.tfstage.storage.FrameInfo;
import com.tfstage.storage.RunSummary;
import com.tfstage.storage.StoreReader;
import com.tfstage.storage.StoreTable;
import com.tfstage.volume.FeatureFileDecoder;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
    name = "tfs",
    description = "📚 词频暂存流水线：批量抽取卷词频并写入列式存储",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.RunSubcommand.class,
        MainCommand.StatusSubcommand.class,
        MainCommand.RecoverSubcommand.class,
        MainCommand.InspectSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"-c", "--config"}, description = "JSON 配置文件路径")
    private File configFile;

    @Option(names = {"--manifest"}, description = "语料清单文件路径")
    private Path manifest;

    @Option(names = {"--checkpoint"}, description = "检查点日志路径")
    private Path checkpoint;

    @Option(names = {"--store-dir"}, description = "存储文件目录")
    private Path storeDir;

    @Option(names = {"--data-dir"}, description = "特征文件根目录")
    private Path dataDir;

    @Option(names = {"--suffix"}, description = "特征文件后缀（.json 或 .json.gz）")
    private String volumeSuffix;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("📚 词频暂存流水线");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 合并配置文件与命令行参数，命令行优先。
     */
    StagingConfig baseConfig() throws IOException {
        StagingConfig config = configFile != null ? StagingConfig.readFrom(configFile) : StagingConfig.defaults();
        if (manifest != null) {
            config.setManifestPath(manifest);
        }
        if (checkpoint != null) {
            config.setCheckpointPath(checkpoint);
        }
        if (storeDir != null) {
            config.setStoreDir(storeDir);
        }
        if (dataDir != null) {
            config.setDataDir(dataDir);
        }
        if (volumeSuffix != null) {
            config.setVolumeSuffix(volumeSuffix);
        }
        return config;
    }

    static String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        if (bytes < 1024 * 1024L) {
            return String.format("%.2f KB", bytes / 1024.0);
        }
        if (bytes < 1024 * 1024L * 1024L) {
            return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
        }
        return String.format("%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
    }

    @Command(name = "run", description = "🚀 处理剩余卷并写入存储")
    static class RunSubcommand implements Callable<Integer> {

        @Option(names = {"-b", "--batch-size"}, description = "每批卷数")
        private Integer batchSize;

        @Option(names = {"-w", "--workers"}, description = "工作线程数")
        private Integer workers;

        @Option(names = {"--trim-language"}, description = "语料表裁剪语言")
        private String trimLanguage;

        @Option(names = {"--trim-min-count"}, description = "裁剪语言下保留的最小计数，0 表示不裁剪")
        private Integer trimMinCount;

        @Option(names = {"--result-timeout"}, description = "等待结果的超时秒数")
        private Long resultTimeoutSeconds;

        @Option(names = {"--max-stalls"}, description = "连续超时多少次判定为卡死")
        private Integer maxStalls;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            StagingConfig config;
            try {
                config = main.baseConfig();
                applyOverrides(config);
                config.validate();
            } catch (IOException | IllegalArgumentException exception) {
                System.err.println("❌ 配置无效: " + exception.getMessage());
                return 1;
            }

            System.out.println("🚀 开始处理...");
            System.out.println("📄 清单: " + config.getManifestPath());
            System.out.println("📁 存储目录: " + config.getStoreDir());
            System.out.println("🔧 线程数: " + config.getWorkers() + "，批大小: " + config.getBatchSize());

            StagingRun run = new StagingRun(config, new FeatureFileDecoder());
            long stopWaitMillis = config.getResultTimeout().toMillis();
            CountDownLatch finished = new CountDownLatch(1);
            Thread stopHook = new Thread(() -> {
                run.requestStop();
                try {
                    finished.await(stopWaitMillis, TimeUnit.MILLISECONDS);
                } catch (InterruptedException exception) {
                    Thread.currentThread().interrupt();
                }
            }, "tfs-stop");
            Runtime.getRuntime().addShutdownHook(stopHook);
            try {
                DispatchReport report = run.execute();
                printReport(report);
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 运行失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            } finally {
                finished.countDown();
                removeHook(stopHook);
            }
        }

        private void applyOverrides(StagingConfig config) {
            if (batchSize != null) {
                config.setBatchSize(batchSize);
            }
            if (workers != null) {
                config.setWorkers(workers);
            }
            if (trimLanguage != null) {
                config.setTrimLanguage(trimLanguage);
            }
            if (trimMinCount != null) {
                config.setTrimMinCount(trimMinCount);
            }
            if (resultTimeoutSeconds != null) {
                config.setResultTimeout(Duration.ofSeconds(resultTimeoutSeconds));
            }
            if (maxStalls != null) {
                config.setMaxStalls(maxStalls);
            }
        }

        private void removeHook(Thread hook) {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException exception) {
                // 已在关闭过程中，钩子会自行结束
                System.err.println("⚠️ JVM 正在关闭: " + exception.getMessage());
            }
        }

        private void printReport(DispatchReport report) {
            if (report.stopped()) {
                System.out.println("⏹️ 运行已按请求停止");
            } else if (report.stalled()) {
                System.out.println("⚠️ 工作线程无响应，运行已中止");
            } else {
                System.out.println("✅ 运行完成！");
            }
            System.out.println("📊 统计:");
            System.out.println("   运行标识: " + report.runId());
            System.out.println("   计划批数: " + report.batchesPlanned());
            System.out.println("   完成批数: " + report.batchesCompleted());
            System.out.println("   问题批数: " + report.problemBatchCount());
            System.out.println("   新增检查点: " + report.identifiersCheckpointed());
            System.out.println("   单项失败: " + report.itemFailures());
            if (report.outstandingBatches() > 0 || report.withdrawnBatches() > 0) {
                System.out.println("   未完成批数: " + report.outstandingBatches() + "，撤回批数: " + report.withdrawnBatches());
            }
            System.out.println("   用时: " + report.elapsedMs() + "ms");
            if (report.problemBatchCount() > 0) {
                System.out.println("💡 重新运行即可重试问题批；存储与检查点不一致时可执行 recover");
            }
        }
    }

    @Command(name = "status", description = "📊 查看进度与存储统计")
    static class StatusSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                StagingConfig config = main.baseConfig().validate();
                StagingRun.Plan plan = new StagingRun(config, new FeatureFileDecoder()).plan();

                System.out.println("📊 运行进度");
                System.out.println("═══════════");
                System.out.println("📄 清单卷数: " + plan.totalIdentifiers());
                System.out.println("✅ 已检查点: " + plan.doneIdentifiers());
                System.out.println("⏳ 剩余卷数: " + plan.remainingIdentifiers());
                System.out.println("📦 剩余批数: " + plan.batches().size());

                List<Path> storeFiles = RecoveryScanner.listStoreFiles(config.getStoreDir());
                System.out.println("💾 存储文件: " + storeFiles.size());
                for (Path storeFile : storeFiles) {
                    printStoreLine(storeFile);
                }

                Path summaryFile = config.getStoreDir().resolve(Constants.RUN_SUMMARY_FILE_NAME);
                if (Files.exists(summaryFile)) {
                    RunSummary summary = RunSummary.readFrom(summaryFile.toFile());
                    System.out.println("🕒 上次运行: " + summary.runId() + "，问题批数 " + summary.problemBatches()
                        + "，新增检查点 " + summary.identifiersCheckpointed());
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printStoreLine(Path storeFile) throws IOException {
            long size = Files.size(storeFile);
            try (StoreReader reader = new StoreReader(storeFile)) {
                System.out.printf("   %s  %s  docs=%d  corpus=%d%n", storeFile.getFileName(), formatBytes(size),
                    reader.rowCount(StoreTable.DOCS), reader.rowCount(StoreTable.CORPUS));
                if (reader.hasUncommittedTail()) {
                    System.out.printf("   ⚠️ 尾部未提交 %s: %s%n", formatBytes(reader.uncommittedBytes()), reader.uncommittedTail());
                }
            } catch (IOException exception) {
                System.out.printf("   %s  %s  ⚠️ %s%n", storeFile.getFileName(), formatBytes(size), exception.getMessage());
            }
        }
    }

    @Command(name = "recover", description = "🩹 对账存储与检查点，找回已写入但未记录的卷")
    static class RecoverSubcommand implements Callable<Integer> {

        @Parameters(description = "要扫描的存储文件；缺省扫描存储目录下全部文件", arity = "0..*")
        private List<Path> storeFiles;

        @Option(names = {"--window"}, description = "反向扫描窗口大小")
        private Integer window;

        @Option(names = {"--apply"}, description = "将找回的卷 ID 追加到检查点", defaultValue = "false")
        private boolean apply;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                StagingConfig config = main.baseConfig();
                if (window != null) {
                    config.setScanWindow(window);
                }
                config.validate();
                RecoveryScanner scanner = new RecoveryScanner(config.getScanWindow(), config.compiledIdPattern());
                Set<String> doneSet = CheckpointLog.load(config.getCheckpointPath());

                List<ScanReport> reports;
                if (storeFiles == null || storeFiles.isEmpty()) {
                    reports = scanner.scanAll(config.getStoreDir(), doneSet);
                } else {
                    reports = storeFiles.stream().map(file -> scanner.reconcile(file, doneSet)).toList();
                }

                System.out.println("🩹 恢复扫描");
                System.out.println("═══════════");
                int errors = 0;
                for (ScanReport report : reports) {
                    if (report.failed()) {
                        errors++;
                        System.out.println("❌ " + report.storeFile().getFileName() + ": " + report.error());
                    } else {
                        System.out.println("📦 " + report.storeFile().getFileName() + ": 扫描 " + report.rowsScanned()
                            + " 行，找回 " + report.recovered().size());
                    }
                }
                List<String> recovered = RecoveryScanner.mergeRecovered(reports);
                System.out.println("🔎 共找回 " + recovered.size() + " 个卷 ID");

                if (apply && !recovered.isEmpty()) {
                    try (CheckpointLog checkpointLog = new CheckpointLog(config.getCheckpointPath())) {
                        int written = checkpointLog.append(recovered);
                        System.out.println("✅ 已追加到检查点: " + written);
                    }
                } else if (!recovered.isEmpty()) {
                    recovered.forEach(id -> System.out.println("   " + id));
                    System.out.println("💡 使用 --apply 写入检查点");
                }
                return errors == 0 ? 0 : 2;
            } catch (Exception exception) {
                System.err.println("❌ 恢复失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }

    @Command(name = "inspect", description = "🔬 校验并概览单个存储文件")
    static class InspectSubcommand implements Callable<Integer> {

        @Parameters(description = "存储文件路径", arity = "1")
        private Path storeFile;

        @Option(names = {"--frames"}, description = "列出每个帧", defaultValue = "false")
        private boolean listFrames;

        @Override
        public Integer call() {
            try (StoreReader reader = new StoreReader(storeFile)) {
                System.out.println("🔬 " + storeFile);
                System.out.println("   工作线程: " + reader.workerId());
                System.out.println("   大小: " + formatBytes(Files.size(storeFile)));
                for (StoreTable table : StoreTable.values()) {
                    System.out.printf("   %s: %d 帧, %d 行%n", table.key(), reader.frames(table).size(), reader.rowCount(table));
                }
                if (listFrames) {
                    for (FrameInfo frame : reader.frames()) {
                        System.out.printf("   @%d %s rows=%d%n", frame.offset(), frame.table().key(), frame.rowCount());
                    }
                }
                System.out.println("   已提交批数: " + reader.committedBatches());
                reader.verifyAll();
                if (reader.hasUncommittedTail()) {
                    System.out.println("⚠️ 尾部存在未提交的数据 (" + formatBytes(reader.uncommittedBytes()) + "): "
                        + reader.uncommittedTail());
                    return 1;
                }
                System.out.println("✅ 校验通过");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 校验失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
