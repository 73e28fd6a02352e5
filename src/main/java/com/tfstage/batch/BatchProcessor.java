package com.tfstage.batch;

import com.tfstage.extract.ExtractError;
import com.tfstage.extract.ExtractionResult;
import com.tfstage.extract.TokenExtractor;
import com.tfstage.extract.TokenRow;
import com.tfstage.extract.TokenTable;
import com.tfstage.storage.BatchStore;
import com.tfstage.storage.StoreAppendException;
import com.tfstage.storage.StoreRow;
import com.tfstage.volume.DecodedVolume;
import com.tfstage.volume.VolumeDecodeException;
import com.tfstage.volume.VolumeDecoder;
import com.tfstage.volume.VolumePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 批处理器：逐项解码并抽取，合并为批级词频表后以一次事务追加到工作线程独占的存储。
 *
 * <p>单项失败只记录并跳过，不中断整批；两张表都追加成功才返回已完成 ID，
 * 追加失败时整批不计入完成，等待下次运行重试。
 */
public class BatchProcessor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BatchProcessor.class);

    private final VolumeDecoder decoder;
    private final VolumePaths volumePaths;
    private final TokenExtractor extractor;
    private final CorpusTrimPolicy trimPolicy;
    private final BatchStore store;
    private final String workerId;

    public BatchProcessor(VolumeDecoder decoder, VolumePaths volumePaths, TokenExtractor extractor,
                          CorpusTrimPolicy trimPolicy, BatchStore store, String workerId) {
        this.decoder = decoder;
        this.volumePaths = volumePaths;
        this.extractor = extractor;
        this.trimPolicy = trimPolicy == null ? CorpusTrimPolicy.NONE : trimPolicy;
        this.store = store;
        this.workerId = workerId;
    }

    public String workerId() {
        return workerId;
    }

    /**
     * 处理一批卷。
     *
     * @param batch 待处理批
     * @return 批结果；追加失败时 done 为空
     */
    public BatchResult processBatch(Batch batch) {
        long startNanos = System.nanoTime();
        List<TokenTable> tables = new ArrayList<>(batch.size());
        List<ItemFailure> failures = new ArrayList<>();
        List<String> processed = new ArrayList<>(batch.size());

        for (String volumeId : batch.identifiers()) {
            ExtractionResult result = processItem(volumeId);
            if (result instanceof ExtractionResult.Extracted extracted) {
                tables.add(extracted.table());
                processed.add(volumeId);
            } else if (result instanceof ExtractionResult.Empty) {
                logger.debug("卷词频为空，跳过: batch={}, volume={}", batch.index(), volumeId);
                processed.add(volumeId);
            } else if (result instanceof ExtractionResult.Failed failed) {
                failures.add(new ItemFailure(volumeId, failed.error().reason()));
                if (failed.error().cause() != null) {
                    logger.warn("卷处理失败: batch={}, volume={}, reason={}", batch.index(), volumeId,
                        failed.error().reason(), failed.error().cause());
                } else {
                    logger.warn("卷处理失败: batch={}, volume={}, reason={}", batch.index(), volumeId,
                        failed.error().reason());
                }
            }
        }

        TokenTable batchTable = TokenTable.concat(tables);
        List<StoreRow> docRows = toDocRows(batchTable);
        List<StoreRow> corpusRows = toCorpusRows(batchTable);
        long elapsedMs;
        try {
            store.append(docRows, corpusRows);
        } catch (StoreAppendException exception) {
            elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
            logger.error("批次追加失败，整批不计入完成: batch={}, volumes={}, store={}", batch.index(), batch.size(),
                store.path(), exception);
            return new BatchResult(batch.index(), workerId, List.of(), failures, exception.getMessage(),
                0L, 0L, elapsedMs);
        }

        elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.info("批次完成: batch={}, done={}, failed={}, docRows={}, corpusRows={}, elapsed={}ms",
            batch.index(), processed.size(), failures.size(), docRows.size(), corpusRows.size(), elapsedMs);
        return new BatchResult(batch.index(), workerId, processed, failures, null,
            docRows.size(), corpusRows.size(), elapsedMs);
    }

    /**
     * 解码并抽取单卷，所有单项异常都转换为失败结果。
     */
    private ExtractionResult processItem(String volumeId) {
        Path path;
        try {
            path = volumePaths.resolve(volumeId);
        } catch (IllegalArgumentException exception) {
            return failed(volumeId, "无法映射卷路径: " + exception.getMessage(), null);
        }
        try {
            DecodedVolume volume = decoder.decode(path);
            if (!volumeId.equals(volume.id())) {
                return failed(volumeId, "卷文件 ID 不一致: file=" + volume.id(), null);
            }
            return extractor.extract(volume);
        } catch (VolumeDecodeException exception) {
            return failed(volumeId, exception.getMessage(), exception);
        } catch (RuntimeException exception) {
            return failed(volumeId, "卷结构异常: " + exception, exception);
        }
    }

    private static ExtractionResult failed(String volumeId, String reason, Throwable cause) {
        return new ExtractionResult.Failed(new ExtractError(volumeId, reason, cause));
    }

    /**
     * (卷 ID, 词项) → 计数投影，丢弃语言列。
     */
    static List<StoreRow> toDocRows(TokenTable table) {
        List<StoreRow> rows = new ArrayList<>(table.size());
        for (TokenRow row : table.rows()) {
            rows.add(new StoreRow(row.volumeId(), row.token(), row.count()));
        }
        return rows;
    }

    /**
     * 按 (语言, 词项) 汇总批内计数，并应用裁剪策略。
     */
    List<StoreRow> toCorpusRows(TokenTable table) {
        Map<String, Map<String, Long>> grouped = new TreeMap<>();
        for (TokenRow row : table.rows()) {
            grouped.computeIfAbsent(row.language(), ignored -> new TreeMap<>())
                .merge(row.token(), row.count(), Long::sum);
        }
        List<StoreRow> rows = new ArrayList<>();
        for (Map.Entry<String, Map<String, Long>> languageEntry : grouped.entrySet()) {
            for (Map.Entry<String, Long> tokenEntry : languageEntry.getValue().entrySet()) {
                if (trimPolicy.keep(languageEntry.getKey(), tokenEntry.getValue())) {
                    rows.add(new StoreRow(languageEntry.getKey(), tokenEntry.getKey(), tokenEntry.getValue()));
                }
            }
        }
        return rows;
    }

    /**
     * 关闭工作线程独占的存储。
     */
    @Override
    public void close() throws IOException {
        store.close();
    }
}
