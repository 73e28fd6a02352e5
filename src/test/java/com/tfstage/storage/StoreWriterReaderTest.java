package com.tfstage.storage;

import com.tfstage.config.Constants;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 存储文件写入、回滚、CRC 防护与反向扫描测试。
 */
class StoreWriterReaderTest {

    @TempDir
    Path tempDir;

    private static List<StoreRow> docs(String volumeId, String... tokens) {
        return Arrays.stream(tokens).map(token -> new StoreRow(volumeId, token, 1L)).toList();
    }

    /**
     * 在写 corpus 帧时失败的写入器，用于模拟两表事务中途失败。
     */
    private static class FailingCorpusWriter extends StoreWriter {
        private boolean failCorpus;

        FailingCorpusWriter(Path path, String workerId) {
            super(path, workerId);
        }

        @Override
        protected void writeFrame(RandomAccessFile target, ByteBuffer frame) throws IOException {
            if (failCorpus && frame.get(Integer.BYTES) == StoreTable.CORPUS.code()) {
                throw new IOException("磁盘已满");
            }
            super.writeFrame(target, frame);
        }
    }

    @Test
    void appendedFramesReadBack() throws IOException {
        Path file = tempDir.resolve("w0.tfs");
        try (StoreWriter writer = new StoreWriter(file, "run-w0")) {
            assertFalse(Files.exists(file));
            writer.append(
                List.of(new StoreRow("mdp.001", "whale", 6L), new StoreRow("mdp.001", "éclair", 2L)),
                List.of(new StoreRow("eng", "whale", 6L)));
            writer.append(docs("mdp.002", "sea"), List.of(new StoreRow("fre", "mer", 1L)));
            assertEquals(2L, writer.appendCount());
        }

        try (StoreReader reader = new StoreReader(file)) {
            assertEquals("run-w0", reader.workerId());
            assertEquals(4, reader.frames().size());
            assertEquals(3L, reader.rowCount(StoreTable.DOCS));
            assertEquals(2L, reader.rowCount(StoreTable.CORPUS));
            assertEquals(List.of(
                new StoreRow("mdp.001", "whale", 6L),
                new StoreRow("mdp.001", "éclair", 2L),
                new StoreRow("mdp.002", "sea", 1L)), reader.readAll(StoreTable.DOCS));
            assertEquals(new StoreRow("fre", "mer", 1L), reader.readAll(StoreTable.CORPUS).get(1));
            reader.verifyAll();
        }
    }

    @Test
    void reopenedWriterAppendsAfterExistingFrames() throws IOException {
        Path file = tempDir.resolve("w1.tfs");
        try (StoreWriter writer = new StoreWriter(file, "run-w1")) {
            writer.append(docs("mdp.001", "a"), List.of());
        }
        try (StoreWriter writer = new StoreWriter(file, "run-w1")) {
            writer.append(docs("mdp.002", "b"), List.of());
        }
        try (StoreReader reader = new StoreReader(file)) {
            assertEquals(2L, reader.rowCount(StoreTable.DOCS));
            assertEquals(0L, reader.rowCount(StoreTable.CORPUS));
        }

        StoreWriter foreign = new StoreWriter(file, "other-w9");
        assertThrows(StoreAppendException.class, () -> foreign.append(docs("mdp.003", "c"), List.of()));
        foreign.close();
    }

    @Test
    @DisplayName("corpus 帧失败时 docs 帧一并回滚")
    void failedCorpusFrameRollsBackDocsFrame() throws IOException {
        Path file = tempDir.resolve("w2.tfs");
        try (FailingCorpusWriter writer = new FailingCorpusWriter(file, "run-w2")) {
            writer.append(docs("mdp.001", "a", "b"), List.of(new StoreRow("eng", "a", 1L)));
            long committedLength = Files.size(file);

            writer.failCorpus = true;
            StoreAppendException exception = assertThrows(StoreAppendException.class,
                () -> writer.append(docs("mdp.002", "c"), List.of(new StoreRow("eng", "c", 1L))));
            assertTrue(exception.getMessage().contains("w2.tfs"));
            assertEquals(committedLength, Files.size(file));

            writer.failCorpus = false;
            writer.append(docs("mdp.003", "d"), List.of(new StoreRow("eng", "d", 1L)));
        }

        try (StoreReader reader = new StoreReader(file)) {
            assertEquals(List.of("mdp.001", "mdp.001", "mdp.003"),
                reader.readAll(StoreTable.DOCS).stream().map(StoreRow::key).toList());
            reader.verifyAll();
        }
    }

    @Test
    void failedFirstAppendLeavesNoFile() throws IOException {
        Path file = tempDir.resolve("w3.tfs");
        try (FailingCorpusWriter writer = new FailingCorpusWriter(file, "run-w3")) {
            writer.failCorpus = true;
            assertThrows(StoreAppendException.class,
                () -> writer.append(docs("mdp.001", "a"), List.of(new StoreRow("eng", "a", 1L))));
            assertFalse(Files.exists(file));
        }
    }

    @Test
    void overwideValueIsRejectedBeforeWriting() throws IOException {
        Path file = tempDir.resolve("w4.tfs");
        try (StoreWriter writer = new StoreWriter(file, "run-w4")) {
            String overwide = "t".repeat(Constants.TOKEN_WIDTH + 1);
            assertThrows(StoreAppendException.class, () -> writer.append(docs("mdp.001", overwide), List.of()));
            assertFalse(Files.exists(file));
        }
    }

    @Test
    void corruptedFrameFailsCrcCheck() throws IOException {
        Path file = tempDir.resolve("w5.tfs");
        try (StoreWriter writer = new StoreWriter(file, "run-w5")) {
            writer.append(docs("mdp.001", "a"), List.of());
        }
        try (RandomAccessFile raw = new RandomAccessFile(file.toFile(), "rw")) {
            long countPosition = raw.length() - FrameInfo.COMMIT_BYTES - Integer.BYTES - 1;
            raw.seek(countPosition);
            raw.writeByte(0x7F);
        }

        try (StoreReader reader = new StoreReader(file)) {
            FrameInfo frame = reader.frames().get(0);
            assertThrows(StoreFormatException.class, () -> reader.verifyFrame(frame));
            assertThrows(StoreFormatException.class, () -> reader.readRows(frame));
            assertEquals(List.of("mdp.001"), reader.readKeys(frame));
        }
    }

    @Test
    @DisplayName("提交记录被截断的批不可见，之前已提交的批照常可读")
    void truncatedCommitRecordHidesOnlyLastBatch() throws IOException {
        Path file = tempDir.resolve("w6.tfs");
        try (StoreWriter writer = new StoreWriter(file, "run-w6")) {
            writer.append(docs("mdp.a", "x"), List.of(new StoreRow("eng", "x", 1L)));
            writer.append(docs("mdp.b", "y"), List.of(new StoreRow("eng", "y", 1L)));
        }
        try (RandomAccessFile raw = new RandomAccessFile(file.toFile(), "rw")) {
            raw.setLength(raw.length() - 3);
        }

        try (StoreReader reader = new StoreReader(file)) {
            assertTrue(reader.hasUncommittedTail());
            assertEquals(1L, reader.committedBatches());
            assertEquals(List.of(new StoreRow("mdp.a", "x", 1L)), reader.readAll(StoreTable.DOCS));
            assertEquals(List.of(new StoreRow("eng", "x", 1L)), reader.readAll(StoreTable.CORPUS));
            reader.verifyAll();
        }
    }

    @Test
    @DisplayName("只写完 docs 帧就中断的批整体不可见")
    void batchCutBeforeCorpusFrameIsNotVisible() throws IOException {
        Path file = tempDir.resolve("w8.tfs");
        try (StoreWriter writer = new StoreWriter(file, "run-w8")) {
            writer.append(docs("mdp.a", "x"), List.of(new StoreRow("eng", "x", 1L)));
            writer.append(docs("mdp.b", "y"), List.of(new StoreRow("eng", "y", 1L)));
        }
        long secondCorpusOffset;
        try (StoreReader reader = new StoreReader(file)) {
            FrameInfo secondCorpus = reader.frames().get(3);
            assertEquals(StoreTable.CORPUS, secondCorpus.table());
            secondCorpusOffset = secondCorpus.offset();
        }
        try (RandomAccessFile raw = new RandomAccessFile(file.toFile(), "rw")) {
            raw.setLength(secondCorpusOffset);
        }

        try (StoreReader reader = new StoreReader(file)) {
            assertTrue(reader.hasUncommittedTail());
            assertTrue(reader.uncommittedTail().contains("缺少提交记录"));
            assertEquals(List.of("mdp.a"), reader.readAll(StoreTable.DOCS).stream().map(StoreRow::key).toList());
            assertEquals(1L, reader.rowCount(StoreTable.CORPUS));
            assertEquals(2, reader.frames().size());
        }
    }

    @Test
    void reopenedWriterDropsUncommittedTailBeforeAppending() throws IOException {
        Path file = tempDir.resolve("w9.tfs");
        try (StoreWriter writer = new StoreWriter(file, "run-w9")) {
            writer.append(docs("mdp.a", "x"), List.of(new StoreRow("eng", "x", 1L)));
            writer.append(docs("mdp.b", "y"), List.of(new StoreRow("eng", "y", 1L)));
        }
        try (RandomAccessFile raw = new RandomAccessFile(file.toFile(), "rw")) {
            raw.setLength(raw.length() - FrameInfo.COMMIT_BYTES);
        }

        try (StoreWriter writer = new StoreWriter(file, "run-w9")) {
            writer.append(docs("mdp.c", "z"), List.of(new StoreRow("eng", "z", 1L)));
        }

        try (StoreReader reader = new StoreReader(file)) {
            assertFalse(reader.hasUncommittedTail());
            assertEquals(2L, reader.committedBatches());
            assertEquals(List.of("mdp.a", "mdp.c"), reader.readAll(StoreTable.DOCS).stream().map(StoreRow::key).toList());
        }
    }

    @Test
    @DisplayName("回滚失败后写入器停用，已提交的批不受影响")
    void failedRollbackDisablesWriter() throws IOException {
        Path file = tempDir.resolve("w10.tfs");
        FailingCorpusWriter writer = new FailingCorpusWriter(file, "run-w10") {
            @Override
            protected void truncate(RandomAccessFile target, long length) throws IOException {
                throw new IOException("截断失败");
            }
        };
        try (writer) {
            writer.append(docs("mdp.a", "x"), List.of(new StoreRow("eng", "x", 1L)));

            writer.failCorpus = true;
            StoreAppendException failure = assertThrows(StoreAppendException.class,
                () -> writer.append(docs("mdp.b", "y"), List.of(new StoreRow("eng", "y", 1L))));
            assertEquals(1, failure.getSuppressed().length);
            assertTrue(writer.isBroken());

            writer.failCorpus = false;
            assertThrows(StoreAppendException.class,
                () -> writer.append(docs("mdp.c", "z"), List.of(new StoreRow("eng", "z", 1L))));
            assertEquals(1L, writer.appendCount());
        }

        try (StoreReader reader = new StoreReader(file)) {
            assertTrue(reader.hasUncommittedTail());
            assertEquals(List.of("mdp.a"), reader.readAll(StoreTable.DOCS).stream().map(StoreRow::key).toList());
        }
    }

    @Test
    void foreignFileIsRejected() throws IOException {
        Path file = tempDir.resolve("foreign.tfs");
        Files.write(file, new byte[] {1, 2, 3, 4, 5, 6, 7, 8});

        assertThrows(StoreFormatException.class, () -> new StoreReader(file));
    }

    @Test
    void reverseKeysWalkFromNewestToOldest() throws IOException {
        Path file = tempDir.resolve("w7.tfs");
        try (StoreWriter writer = new StoreWriter(file, "run-w7")) {
            writer.append(docs("mdp.a", "x", "y"), List.of());
            writer.append(docs("mdp.b", "x"), List.of());
            writer.append(docs("mdp.c", "x", "y"), List.of());
        }

        try (StoreReader reader = new StoreReader(file)) {
            StoreReader.ReverseKeyCursor cursor = reader.reverseKeys(StoreTable.DOCS, 2);
            assertEquals(List.of("mdp.c", "mdp.c"), cursor.nextWindow());
            assertEquals(List.of("mdp.b", "mdp.a"), cursor.nextWindow());
            assertEquals(List.of("mdp.a"), cursor.nextWindow());
            assertTrue(cursor.nextWindow().isEmpty());
        }
    }

    @Test
    void runSummaryRoundTripsThroughJson() throws IOException {
        Path file = tempDir.resolve("run-summary.json");
        RunSummary summary = new RunSummary("20261017-101500-abcd", 40, 40, 1, 998, 2, false, false,
            Instant.parse("2026-10-17T10:15:00Z"), Instant.parse("2026-10-17T10:16:30Z"));

        summary.writeTo(file.toFile());

        assertEquals(summary, RunSummary.readFrom(file.toFile()));
        assertTrue(Files.readString(file).contains("2026-10-17T10:15:00Z"));
    }
}
