package com.tfstage.config;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 流水线运行时配置
 * 
 * 显式传入分区器与调度器，取代模块级全局路径；支持从 JSON 配置文件或 CLI 参数注入，覆盖 Constants 默认值
 */
public class StagingConfig {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private Path manifestPath = Paths.get("./manifest.txt");
    private Path checkpointPath = Paths.get("./" + Constants.CHECKPOINT_FILE_NAME);
    private Path storeDir = Paths.get("./stores");
    private Path dataDir = Paths.get("./data");
    private String volumeSuffix = Constants.DEFAULT_VOLUME_SUFFIX;
    private int batchSize = Constants.DEFAULT_BATCH_SIZE;
    private int workers = Constants.DEFAULT_WORKERS;
    private String trimLanguage = Constants.DEFAULT_TRIM_LANGUAGE;
    private int trimMinCount = Constants.DEFAULT_TRIM_MIN_COUNT;
    private Duration resultTimeout = Duration.ofSeconds(Constants.DEFAULT_RESULT_TIMEOUT_SECONDS);
    private int maxStalls = Constants.DEFAULT_MAX_STALLS;
    private int progressInterval = Constants.PROGRESS_INTERVAL;
    private int scanWindow = Constants.DEFAULT_SCAN_WINDOW;
    private String idPattern = Constants.DEFAULT_ID_PATTERN;
    
    public Path getManifestPath() {
        return manifestPath;
    }
    
    public void setManifestPath(Path manifestPath) {
        this.manifestPath = manifestPath;
    }
    
    public Path getCheckpointPath() {
        return checkpointPath;
    }
    
    public void setCheckpointPath(Path checkpointPath) {
        this.checkpointPath = checkpointPath;
    }
    
    public Path getStoreDir() {
        return storeDir;
    }
    
    public void setStoreDir(Path storeDir) {
        this.storeDir = storeDir;
    }
    
    public Path getDataDir() {
        return dataDir;
    }
    
    public void setDataDir(Path dataDir) {
        this.dataDir = dataDir;
    }
    
    public String getVolumeSuffix() {
        return volumeSuffix;
    }
    
    public void setVolumeSuffix(String volumeSuffix) {
        this.volumeSuffix = volumeSuffix;
    }
    
    public int getBatchSize() {
        return batchSize;
    }
    
    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }
    
    public int getWorkers() {
        return workers;
    }
    
    public void setWorkers(int workers) {
        this.workers = workers;
    }
    
    /**
     * 需要按批内计数稀疏裁剪的主导语言；为空表示关闭裁剪。
     */
    public String getTrimLanguage() {
        return trimLanguage;
    }
    
    public void setTrimLanguage(String trimLanguage) {
        this.trimLanguage = trimLanguage;
    }
    
    public int getTrimMinCount() {
        return trimMinCount;
    }
    
    public void setTrimMinCount(int trimMinCount) {
        this.trimMinCount = trimMinCount;
    }
    
    public Duration getResultTimeout() {
        return resultTimeout;
    }
    
    public void setResultTimeout(Duration resultTimeout) {
        this.resultTimeout = resultTimeout;
    }
    
    public int getMaxStalls() {
        return maxStalls;
    }
    
    public void setMaxStalls(int maxStalls) {
        this.maxStalls = maxStalls;
    }
    
    public int getProgressInterval() {
        return progressInterval;
    }
    
    public void setProgressInterval(int progressInterval) {
        this.progressInterval = progressInterval;
    }
    
    public int getScanWindow() {
        return scanWindow;
    }
    
    public void setScanWindow(int scanWindow) {
        this.scanWindow = scanWindow;
    }
    
    public String getIdPattern() {
        return idPattern;
    }
    
    public void setIdPattern(String idPattern) {
        this.idPattern = idPattern;
    }

    /**
     * 编译卷 ID 命名空间正则。
     */
    public Pattern compiledIdPattern() {
        return Pattern.compile(idPattern);
    }

    /**
     * 校验配置取值，非法时抛出 IllegalArgumentException。
     */
    public StagingConfig validate() {
        if (manifestPath == null || checkpointPath == null || storeDir == null || dataDir == null) {
            throw new IllegalArgumentException("manifest、checkpoint、store、data 路径均不能为空");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize 必须为正数: " + batchSize);
        }
        if (workers <= 0 || workers > Constants.MAX_WORKERS) {
            throw new IllegalArgumentException("workers 超出范围 [1, " + Constants.MAX_WORKERS + "]: " + workers);
        }
        if (trimMinCount < 0) {
            throw new IllegalArgumentException("trimMinCount 不能为负数: " + trimMinCount);
        }
        if (resultTimeout == null || resultTimeout.isNegative() || resultTimeout.isZero()) {
            throw new IllegalArgumentException("resultTimeout 必须为正: " + resultTimeout);
        }
        if (maxStalls <= 0) {
            throw new IllegalArgumentException("maxStalls 必须为正数: " + maxStalls);
        }
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("progressInterval 必须为正数: " + progressInterval);
        }
        if (scanWindow <= 0) {
            throw new IllegalArgumentException("scanWindow 必须为正数: " + scanWindow);
        }
        if (volumeSuffix == null) {
            throw new IllegalArgumentException("volumeSuffix 不能为空");
        }
        try {
            compiledIdPattern();
        } catch (PatternSyntaxException exception) {
            throw new IllegalArgumentException("idPattern 不是合法正则: " + idPattern, exception);
        }
        return this;
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static StagingConfig defaults() {
        return new StagingConfig();
    }

    /**
     * 从 JSON 配置文件读取，仅覆盖文件中出现的键。
     *
     * @param file 配置文件
     * @return 合并默认值后的配置
     * @throws IOException 读取或解析失败时抛出
     */
    public static StagingConfig readFrom(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("配置文件不能为空");
        }
        FileOptions options;
        try {
            options = OBJECT_MAPPER.readValue(file, FileOptions.class);
        } catch (IOException exception) {
            throw new IOException("读取配置文件失败: " + file.getAbsolutePath(), exception);
        }
        StagingConfig config = defaults();
        options.applyTo(config);
        return config;
    }

    /**
     * 配置文件的 JSON 形态，路径以字符串表示，缺省键为 null。
     */
    record FileOptions(
        String manifest,
        String checkpoint,
        String storeDir,
        String dataDir,
        String volumeSuffix,
        Integer batchSize,
        Integer workers,
        String trimLanguage,
        Integer trimMinCount,
        Long resultTimeoutSeconds,
        Integer maxStalls,
        Integer progressInterval,
        Integer scanWindow,
        String idPattern
    ) {
        void applyTo(StagingConfig config) {
            if (manifest != null) {
                config.setManifestPath(Paths.get(manifest));
            }
            if (checkpoint != null) {
                config.setCheckpointPath(Paths.get(checkpoint));
            }
            if (storeDir != null) {
                config.setStoreDir(Paths.get(storeDir));
            }
            if (dataDir != null) {
                config.setDataDir(Paths.get(dataDir));
            }
            if (volumeSuffix != null) {
                config.setVolumeSuffix(volumeSuffix);
            }
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
            if (progressInterval != null) {
                config.setProgressInterval(progressInterval);
            }
            if (scanWindow != null) {
                config.setScanWindow(scanWindow);
            }
            if (idPattern != null) {
                config.setIdPattern(idPattern);
            }
        }
    }
}
