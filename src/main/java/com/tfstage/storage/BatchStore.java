package com.tfstage.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 单个工作线程独占的批量存储。
 */
public interface BatchStore extends AutoCloseable {

    /**
     * 以一次事务追加一批的两张表；失败时存储保持追加前状态。
     *
     * @param docRows /tf/docs 行：(卷 ID, 词项, 计数)
     * @param corpusRows /tf/corpus 行：(语言, 词项, 计数)
     * @throws StoreAppendException 任一表追加失败时抛出
     */
    void append(List<StoreRow> docRows, List<StoreRow> corpusRows) throws StoreAppendException;

    /**
     * 存储文件路径。
     */
    Path path();

    @Override
    void close() throws IOException;
}
