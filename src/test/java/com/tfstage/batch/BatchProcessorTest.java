package com.tfstage.batch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tfstage.extract.TokenExtractor;
import com.tfstage.storage.BatchStore;
import com.tfstage.storage.StoreAppendException;
import com.tfstage.storage.StoreRow;
import com.tfstage.volume.DecodedVolume;
import com.tfstage.volume.FeatureVolume;
import com.tfstage.volume.LanguageTag;
import com.tfstage.volume.VolumeDecodeException;
import com.tfstage.volume.VolumeDecoder;
import com.tfstage.volume.VolumePaths;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BatchProcessorTest {

    private static final String SUFFIX = ".json";

    private final Map<String, DecodedVolume> volumes = new HashMap<>();
    private final RecordingStore store = new RecordingStore();

    /**
     * 记录每次追加内容的内存存储。
     */
    private static final class RecordingStore implements BatchStore {
        private final List<List<StoreRow>> docAppends = new ArrayList<>();
        private final List<List<StoreRow>> corpusAppends = new ArrayList<>();
        private boolean failNext;
        private boolean closed;

        @Override
        public void append(List<StoreRow> docRows, List<StoreRow> corpusRows) throws StoreAppendException {
            if (failNext) {
                failNext = false;
                throw new StoreAppendException("模拟写入失败");
            }
            docAppends.add(docRows);
            corpusAppends.add(corpusRows);
        }

        @Override
        public Path path() {
            return Path.of("memory.tfs");
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private final VolumeDecoder decoder = path -> {
        String volumeId = VolumePaths.idFromPath(path.toString(), SUFFIX);
        if (volumeId.startsWith("bad.")) {
            throw new VolumeDecodeException("文件损坏", path);
        }
        if (volumeId.startsWith("boom.")) {
            throw new IllegalStateException("结构异常");
        }
        DecodedVolume volume = volumes.get(volumeId);
        if (volume == null) {
            throw new VolumeDecodeException("卷文件不存在", path);
        }
        return volume;
    };

    private BatchProcessor processor(CorpusTrimPolicy trimPolicy) {
        return new BatchProcessor(decoder, new VolumePaths(Path.of("data"), SUFFIX), new TokenExtractor(),
            trimPolicy, store, "test-w0");
    }

    private void addVolume(String id, String language, Map<String, Long> counts) {
        Map<String, Map<String, Long>> tokenPosCount = new HashMap<>();
        counts.forEach((token, count) -> tokenPosCount.put(token, Map.of("NN", count)));
        volumes.put(id, new FeatureVolume(id, LanguageTag.of(language), List.of(new FeatureVolume.Page(1, tokenPosCount))));
    }

    @Test
    @DisplayName("单项失败不影响同批其他卷")
    void badItemDoesNotAbortBatch() {
        addVolume("mdp.a", "eng", Map.of("whale", 3L));
        addVolume("mdp.empty", "eng", Map.of());

        BatchResult result = processor(CorpusTrimPolicy.NONE)
            .processBatch(new Batch(7, List.of("mdp.a", "bad.b", "boom.c", "mdp.empty", "mdp.missing")));

        assertEquals(7, result.batchIndex());
        assertEquals("test-w0", result.workerId());
        assertEquals(List.of("mdp.a", "mdp.empty"), result.done());
        assertEquals(List.of("bad.b", "boom.c", "mdp.missing"),
            result.failures().stream().map(ItemFailure::volumeId).toList());
        assertNull(result.appendError());
        assertEquals(List.of(List.of(new StoreRow("mdp.a", "whale", 3L))), store.docAppends);
    }

    @Test
    void mismatchedVolumeIdIsItemFailure() {
        addVolume("mdp.a", "eng", Map.of("whale", 3L));
        volumes.put("mdp.b", volumes.get("mdp.a"));

        BatchResult result = processor(CorpusTrimPolicy.NONE).processBatch(new Batch(0, List.of("mdp.b")));

        assertTrue(result.isEmpty());
        assertEquals(1, result.failures().size());
        assertTrue(result.failures().get(0).reason().contains("mdp.a"));
    }

    @Test
    @DisplayName("追加失败时整批不计入完成")
    void appendFailureYieldsEmptyDone() {
        addVolume("mdp.a", "eng", Map.of("whale", 3L));
        addVolume("mdp.b", "eng", Map.of("sea", 1L));
        store.failNext = true;

        BatchResult result = processor(CorpusTrimPolicy.NONE).processBatch(new Batch(3, List.of("mdp.a", "mdp.b")));

        assertTrue(result.isEmpty());
        assertTrue(result.appendFailed());
        assertEquals(0L, result.docRows());
        assertTrue(store.docAppends.isEmpty());
    }

    @Test
    @DisplayName("语料表只裁剪主导语言的低频词项")
    void corpusTrimIsAsymmetric() {
        addVolume("mdp.e1", "eng", Map.of("whale", 1L, "sea", 1L));
        addVolume("mdp.e2", "eng", Map.of("whale", 1L));
        addVolume("mdp.f1", "fre", Map.of("baleine", 1L));

        BatchResult result = processor(new CorpusTrimPolicy("eng", 2))
            .processBatch(new Batch(0, List.of("mdp.e1", "mdp.e2", "mdp.f1")));

        assertEquals(3, result.done().size());
        assertEquals(List.of(new StoreRow("eng", "whale", 2L), new StoreRow("fre", "baleine", 1L)),
            store.corpusAppends.get(0));
        assertEquals(4, store.docAppends.get(0).size());
        assertEquals(2L, result.corpusRows());
    }

    @Test
    void docRowsDropLanguageColumn() {
        addVolume("mdp.b", "ger", Map.of("und", 2L));
        addVolume("mdp.a", "eng", Map.of("and", 1L));

        processor(CorpusTrimPolicy.NONE).processBatch(new Batch(0, List.of("mdp.b", "mdp.a")));

        assertEquals(List.of(new StoreRow("mdp.a", "and", 1L), new StoreRow("mdp.b", "und", 2L)),
            store.docAppends.get(0));
    }

    @Test
    void closeReleasesStore() throws Exception {
        BatchProcessor batchProcessor = processor(CorpusTrimPolicy.defaults());
        assertFalse(store.closed);
        batchProcessor.close();
        assertTrue(store.closed);
    }
}
