package com.tfstage.storage;

import com.tfstage.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 存储文件写入器，每个工作线程独占一个文件。
 *
 * <p>文件在第一次追加时才创建。每次 {@link #append} 写入一个 /tf/docs 帧和一个 /tf/corpus 帧并落盘，
 * 再写入批提交记录并再次落盘；读取端只承认带提交记录的批。任一步失败都把文件截回追加前长度，
 * 已提交的帧从不改写。回滚本身失败时写入器停用，之后的追加一律失败。
 */
public class StoreWriter implements BatchStore {
    private static final Logger logger = LoggerFactory.getLogger(StoreWriter.class);

    private final Path path;
    private final String workerId;
    private RandomAccessFile randomAccessFile;
    private long appendCount;
    private long committedBatches;
    private boolean broken;
    private boolean closed;

    /**
     * 创建写入器，不触碰磁盘。
     *
     * @param path 存储文件路径
     * @param workerId 所属工作线程标识，写入文件头
     */
    public StoreWriter(Path path, String workerId) {
        if (path == null) {
            throw new IllegalArgumentException("存储文件不能为空");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId 不能为空");
        }
        if (workerId.getBytes(StandardCharsets.UTF_8).length > Short.MAX_VALUE) {
            throw new IllegalArgumentException("workerId 过长: " + workerId);
        }
        this.path = path;
        this.workerId = workerId;
    }

    @Override
    public Path path() {
        return path;
    }

    public String workerId() {
        return workerId;
    }

    /**
     * 已成功提交的追加次数。
     */
    public long appendCount() {
        return appendCount;
    }

    @Override
    public void append(List<StoreRow> docRows, List<StoreRow> corpusRows) throws StoreAppendException {
        ensureOpen();
        if (broken) {
            throw new StoreAppendException("存储文件回滚失败后写入器已停用: file=" + path.getFileName());
        }
        ByteBuffer docsFrame;
        ByteBuffer corpusFrame;
        try {
            docsFrame = encodeFrame(StoreTable.DOCS, docRows);
            corpusFrame = encodeFrame(StoreTable.CORPUS, corpusRows);
        } catch (IllegalArgumentException exception) {
            throw new StoreAppendException("编码追加帧失败: file=" + path.getFileName() + ", " + exception.getMessage(), exception);
        }
        if (docsFrame == null && corpusFrame == null) {
            return;
        }

        long committedLength = -1L;
        try {
            openFile();
            committedLength = randomAccessFile.length();
            randomAccessFile.seek(committedLength);
            if (committedLength == 0L) {
                writeHeader();
            }
            if (docsFrame != null) {
                writeFrame(randomAccessFile, docsFrame);
            }
            if (corpusFrame != null) {
                writeFrame(randomAccessFile, corpusFrame);
            }
            randomAccessFile.getChannel().force(true);
            writeFrame(randomAccessFile, encodeCommit(committedBatches + 1));
            randomAccessFile.getChannel().force(true);
            committedBatches++;
            appendCount++;
        } catch (IOException | RuntimeException exception) {
            StoreAppendException appendException = new StoreAppendException(
                "追加批次失败: file=" + path.getFileName() + ", docs=" + sizeOf(docRows) + ", corpus=" + sizeOf(corpusRows),
                exception);
            rollback(committedLength, appendException);
            throw appendException;
        }
    }

    /**
     * 写入一段已编码的记录（帧或提交记录）；测试可覆盖以模拟写入中途失败。
     */
    protected void writeFrame(RandomAccessFile target, ByteBuffer frame) throws IOException {
        target.write(frame.array(), 0, frame.limit());
    }

    /**
     * 把文件截回指定长度并落盘；测试可覆盖以模拟回滚失败。
     */
    protected void truncate(RandomAccessFile target, long length) throws IOException {
        target.setLength(length);
        target.getChannel().force(true);
    }

    /**
     * 回滚失败后写入器停用，之后的追加一律失败。
     */
    public boolean isBroken() {
        return broken;
    }

        @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (randomAccessFile != null) {
            randomAccessFile.close();
        }
    }

    /**
     * 打开或创建文件；已存在的文件需通过头部校验，尾部未提交的数据被截掉。
     */
    private void openFile() throws IOException {
        if (randomAccessFile != null) {
            return;
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        long committedLength = 0L;
        if (Files.exists(path) && Files.size(path) > 0L) {
            try (StoreReader reader = new StoreReader(path)) {
                if (!workerId.equals(reader.workerId())) {
                    throw new StoreFormatException("存储文件属于其他工作线程: " + reader.workerId(), 0L);
                }
                if (reader.hasUncommittedTail()) {
                    logger.warn("存储文件尾部存在未提交的数据，续写前截掉: file={}, bytes={}, {}", path,
                        reader.uncommittedBytes(), reader.uncommittedTail());
                }
                committedLength = reader.committedLength();
                committedBatches = reader.committedBatches();
            }
        }
        RandomAccessFile opened = new RandomAccessFile(path.toFile(), "rw");
        try {
            if (opened.length() > committedLength) {
                opened.setLength(committedLength);
                opened.getChannel().force(true);
            }
        } catch (IOException exception) {
            opened.close();
            throw exception;
        }
        randomAccessFile = opened;
    }

    private void writeHeader() throws IOException {
        byte[] workerIdBytes = workerId.getBytes(StandardCharsets.UTF_8);
        randomAccessFile.writeInt(Constants.STORE_MAGIC);
        randomAccessFile.writeShort(Constants.FORMAT_VERSION);
        randomAccessFile.writeShort(workerIdBytes.length);
        randomAccessFile.write(workerIdBytes);
    }

    /**
     * 将行编码为列式帧：键列、词项列、计数列，末尾附 CRC32；空行集返回 null。
     */
    static ByteBuffer encodeFrame(StoreTable table, List<StoreRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return null;
        }
        FrameInfo frameInfo = new FrameInfo(table, 0L, rows.size(), table.keyWidth(), table.tokenWidth());
        long frameBytes = frameInfo.totalBytes();
        if (frameBytes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("帧过大: rows=" + rows.size());
        }
        ByteBuffer buffer = ByteBuffer.allocate((int) frameBytes);
        buffer.putInt(Constants.FRAME_MAGIC);
        buffer.put(table.code());
        buffer.putInt(rows.size());
        buffer.put((byte) table.keyWidth());
        buffer.put((byte) table.tokenWidth());
        for (StoreRow row : rows) {
            StorageFileUtil.putFixedWidth(buffer, row.key(), table.keyWidth());
        }
        for (StoreRow row : rows) {
            StorageFileUtil.putFixedWidth(buffer, row.token(), table.tokenWidth());
        }
        for (StoreRow row : rows) {
            if (row.count() < 0) {
                throw new IllegalArgumentException("count 不能为负数: " + row);
            }
            buffer.putLong(row.count());
        }
        int dataLength = buffer.position();
        buffer.putInt((int) StorageFileUtil.crc32(buffer.array(), 0, dataLength));
        buffer.flip();
        return buffer;
    }

    /**
     * 编码批提交记录：magic、批序号（从 1 开始连续递增）与 CRC32。
     */
    static ByteBuffer encodeCommit(long sequence) {
        ByteBuffer buffer = ByteBuffer.allocate(FrameInfo.COMMIT_BYTES);
        buffer.putInt(Constants.COMMIT_MAGIC);
        buffer.putLong(sequence);
        buffer.putInt((int) StorageFileUtil.crc32(buffer.array(), 0, buffer.position()));
        buffer.flip();
        return buffer;
    }

    /**
     * 截回追加前长度；新建文件回滚后删除。回滚失败时停用写入器。
     */
    private void rollback(long committedLength, StoreAppendException failure) {
        if (randomAccessFile == null || committedLength < 0L) {
            return;
        }
        try {
            truncate(randomAccessFile, committedLength);
            if (committedLength == 0L) {
                randomAccessFile.close();
                randomAccessFile = null;
                Files.deleteIfExists(path);
            }
        } catch (IOException rollbackException) {
            broken = true;
            failure.addSuppressed(rollbackException);
            logger.error("回滚存储文件失败，尾部可能残留未提交帧: file={}, length={}", path, committedLength, rollbackException);
        }
    }

    private static int sizeOf(List<StoreRow> rows) {
        return rows == null ? 0 : rows.size();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("StoreWriter 已关闭");
        }
    }
}
