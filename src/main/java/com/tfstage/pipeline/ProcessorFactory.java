package com.tfstage.pipeline;

import com.tfstage.batch.BatchProcessor;

import java.io.IOException;

/**
 * 为每个工作线程创建独占存储的批处理器。
 */
@FunctionalInterface
public interface ProcessorFactory {

    /**
     * 创建工作线程的处理器。
     *
     * @param workerId 工作线程标识，同时决定其存储文件名
     * @return 绑定到该工作线程独占存储的处理器
     */
    BatchProcessor create(String workerId) throws IOException;
}
