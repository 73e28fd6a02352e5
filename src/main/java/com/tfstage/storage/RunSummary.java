package com.tfstage.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.File;
import java.io.IOException;
import java.time.Instant;

/**
 * 运行汇总，写在存储目录下，描述一次调度运行的统计与结束状态。
 */
public record RunSummary(
    String runId,
    int batchesPlanned,
    int batchesCompleted,
    int problemBatches,
    int identifiersCheckpointed,
    int itemFailures,
    boolean stopped,
    boolean stalled,
    Instant startTime,
    Instant endTime
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * 将运行汇总写入指定 JSON 文件。
     *
     * @param file 汇总文件
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("汇总文件不能为空");
        }
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file, this);
        } catch (IOException exception) {
            throw new IOException("写入运行汇总失败: " + file.getAbsolutePath(), exception);
        }
    }

    /**
     * 从指定 JSON 文件读取运行汇总。
     *
     * @param file 汇总文件
     * @return 反序列化后的运行汇总
     * @throws IOException 读取或解析失败时抛出
     */
    public static RunSummary readFrom(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("汇总文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(file, RunSummary.class);
        } catch (IOException exception) {
            throw new IOException("读取运行汇总失败: " + file.getAbsolutePath(), exception);
        }
    }
}
