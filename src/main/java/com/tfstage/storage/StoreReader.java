package com.tfstage.storage;

import com.tfstage.config.Constants;

import java.io.EOFException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 存储文件读取器：打开时校验文件头并建立帧索引，按列读取帧数据。
 *
 * <p>只有后跟有效批提交记录的帧才进入索引。顺序扫描遇到截断、魔数不符或缺少提交记录的尾部时停止，
 * 之前已提交的批照常可读，尾部问题通过 {@link #uncommittedTail()} 报告。
 * 帧内容的 CRC32 在整帧读取或显式 {@link #verifyFrame} 时校验。
 */
public final class StoreReader implements AutoCloseable {
    private final RandomAccessFile randomAccessFile;
    private final String fileName;
    private final String workerId;
    private final List<FrameInfo> frames = new ArrayList<>();
    private final long fileLength;
    private long committedLength;
    private long committedBatches;
    private String uncommittedTail;
    private boolean closed;

    /**
     * 打开存储文件并建立帧索引。
     *
     * @param path 存储文件
     * @throws IOException 文件头损坏或版本不兼容时抛出
     */
    public StoreReader(Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("存储文件不能为空");
        }
        this.fileName = path.getFileName().toString();
        this.randomAccessFile = new RandomAccessFile(path.toFile(), "r");
        try {
            this.workerId = readHeader(randomAccessFile, fileName);
            this.fileLength = randomAccessFile.length();
            indexCommittedFrames(randomAccessFile.getFilePointer());
        } catch (IOException exception) {
            randomAccessFile.close();
            throw exception;
        }
    }

    /**
     * 读取并校验文件头，返回工作线程标识；读指针停在首帧起点。
     */
    static String readHeader(RandomAccessFile source, String fileName) throws IOException {
        try {
            source.seek(0L);
            int magic = source.readInt();
            if (magic != Constants.STORE_MAGIC) {
                throw new StoreFormatException("存储文件 magic 不匹配: " + fileName, 0L);
            }
            short version = source.readShort();
            if (version != Constants.FORMAT_VERSION) {
                throw new StoreFormatException("存储文件版本不支持: " + version + ", file=" + fileName, Integer.BYTES);
            }
            int workerIdLength = source.readShort();
            if (workerIdLength < 0) {
                throw new StoreFormatException("workerId 长度非法: " + workerIdLength, Integer.BYTES + Short.BYTES);
            }
            byte[] workerIdBytes = new byte[workerIdLength];
            source.readFully(workerIdBytes);
            return new String(workerIdBytes, StandardCharsets.UTF_8);
        } catch (EOFException exception) {
            throw new StoreFormatException("存储文件头截断: " + fileName, 0L);
        }
    }

    /**
     * 顺序扫描帧与提交记录；遇到第一个问题即停止，只保留已提交的帧。
     */
    private void indexCommittedFrames(long firstFrameOffset) throws IOException {
        List<FrameInfo> pending = new ArrayList<>();
        long position = firstFrameOffset;
        committedLength = firstFrameOffset;
        byte[] header = new byte[FrameInfo.HEADER_BYTES];
        while (position < fileLength) {
            if (fileLength - position < Integer.BYTES) {
                uncommittedTail = "尾部记录截断, offset=" + position;
                return;
            }
            randomAccessFile.seek(position);
            int magic = randomAccessFile.readInt();
            if (magic == Constants.COMMIT_MAGIC) {
                String problem = checkCommit(position, pending.isEmpty());
                if (problem != null) {
                    uncommittedTail = problem;
                    return;
                }
                frames.addAll(pending);
                pending.clear();
                committedBatches++;
                position += FrameInfo.COMMIT_BYTES;
                committedLength = position;
                continue;
            }
            if (magic != Constants.FRAME_MAGIC) {
                uncommittedTail = "帧 magic 不匹配, offset=" + position;
                return;
            }
            if (fileLength - position < FrameInfo.HEADER_BYTES) {
                uncommittedTail = "帧头截断, offset=" + position;
                return;
            }
            StorageFileUtil.readFully(randomAccessFile, position, header);
            ByteBuffer buffer = ByteBuffer.wrap(header, Integer.BYTES, FrameInfo.HEADER_BYTES - Integer.BYTES);
            StoreTable table = StoreTable.fromCode(buffer.get());
            int rowCount = buffer.getInt();
            int keyWidth = buffer.get();
            int tokenWidth = buffer.get();
            if (table == null || rowCount < 0 || keyWidth <= 0 || tokenWidth <= 0) {
                uncommittedTail = "帧头字段非法: rows=" + rowCount + ", widths=" + keyWidth + "/" + tokenWidth
                    + ", offset=" + position;
                return;
            }
            FrameInfo frameInfo = new FrameInfo(table, position, rowCount, keyWidth, tokenWidth);
            if (position + frameInfo.totalBytes() > fileLength) {
                uncommittedTail = "帧截断: table=" + table.key() + ", offset=" + position;
                return;
            }
            pending.add(frameInfo);
            position += frameInfo.totalBytes();
        }
        if (!pending.isEmpty()) {
            uncommittedTail = "尾部 " + pending.size() + " 个帧缺少提交记录, offset=" + pending.get(0).offset();
        }
    }

    /**
     * 校验位于 position 的提交记录，合法时返回 null。
     */
    private String checkCommit(long position, boolean noPendingFrames) throws IOException {
        if (fileLength - position < FrameInfo.COMMIT_BYTES) {
            return "提交记录截断, offset=" + position;
        }
        if (noPendingFrames) {
            return "提交记录前没有帧, offset=" + position;
        }
        byte[] record = new byte[FrameInfo.COMMIT_BYTES];
        StorageFileUtil.readFully(randomAccessFile, position, record);
        ByteBuffer buffer = ByteBuffer.wrap(record);
        buffer.getInt();
        long sequence = buffer.getLong();
        long expectedCrc32 = Integer.toUnsignedLong(buffer.getInt());
        if (StorageFileUtil.crc32(record, 0, record.length - Integer.BYTES) != expectedCrc32) {
            return "提交记录 CRC32 校验失败, offset=" + position;
        }
        if (sequence != committedBatches + 1) {
            return "提交记录序号不连续: expected=" + (committedBatches + 1) + ", actual=" + sequence + ", offset=" + position;
        }
        return null;
    }

    public String workerId() {
        return workerId;
    }

    /**
     * 全部已提交的帧，按写入顺序。
     */
    public List<FrameInfo> frames() {
        return Collections.unmodifiableList(frames);
    }

    /**
     * 已提交的批数。
     */
    public long committedBatches() {
        return committedBatches;
    }

    /**
     * 最后一个提交记录之后的文件偏移，即可安全续写的位置。
     */
    public long committedLength() {
        return committedLength;
    }

    public boolean hasUncommittedTail() {
        return uncommittedTail != null;
    }

    /**
     * 尾部未提交数据的描述；文件干净时为 null。
     */
    public String uncommittedTail() {
        return uncommittedTail;
    }

    /**
     * 尾部未提交的字节数。
     */
    public long uncommittedBytes() {
        return fileLength - committedLength;
    }

    /**
     * 指定表的帧，按写入顺序。
     */
    public List<FrameInfo> frames(StoreTable table) {
        List<FrameInfo> selected = new ArrayList<>();
        for (FrameInfo frameInfo : frames) {
            if (frameInfo.table() == table) {
                selected.add(frameInfo);
            }
        }
        return selected;
    }

    /**
     * 指定表的总行数。
     */
    public long rowCount(StoreTable table) {
        long total = 0L;
        for (FrameInfo frameInfo : frames) {
            if (frameInfo.table() == table) {
                total += frameInfo.rowCount();
            }
        }
        return total;
    }

    /**
     * 校验一个帧的 CRC32。
     *
     * @param frameInfo 帧索引
     * @throws IOException CRC 不符或读取失败时抛出
     */
    public void verifyFrame(FrameInfo frameInfo) throws IOException {
        readVerifiedFrame(frameInfo);
    }

    /**
     * 校验全部帧。
     */
    public void verifyAll() throws IOException {
        for (FrameInfo frameInfo : frames) {
            verifyFrame(frameInfo);
        }
    }

    /**
     * 读取一个帧的全部行（含 CRC 校验）。
     */
    public List<StoreRow> readRows(FrameInfo frameInfo) throws IOException {
        byte[] frameBytes = readVerifiedFrame(frameInfo);
        int rowCount = frameInfo.rowCount();
        int keyWidth = frameInfo.keyWidth();
        int tokenWidth = frameInfo.tokenWidth();
        int keyStart = FrameInfo.HEADER_BYTES;
        int tokenStart = keyStart + rowCount * keyWidth;
        ByteBuffer countBuffer = ByteBuffer.wrap(frameBytes, tokenStart + rowCount * tokenWidth, rowCount * Long.BYTES);

        List<StoreRow> rows = new ArrayList<>(rowCount);
        for (int index = 0; index < rowCount; index++) {
            String key = StorageFileUtil.getFixedWidth(frameBytes, keyStart + index * keyWidth, keyWidth);
            String token = StorageFileUtil.getFixedWidth(frameBytes, tokenStart + index * tokenWidth, tokenWidth);
            rows.add(new StoreRow(key, token, countBuffer.getLong()));
        }
        return rows;
    }

    /**
     * 读取指定表的全部行。
     */
    public List<StoreRow> readAll(StoreTable table) throws IOException {
        List<StoreRow> rows = new ArrayList<>();
        for (FrameInfo frameInfo : frames(table)) {
            rows.addAll(readRows(frameInfo));
        }
        return rows;
    }

    /**
     * 只读取帧的首键列（卷 ID 或语言），不做 CRC 校验。
     */
    public List<String> readKeys(FrameInfo frameInfo) throws IOException {
        ensureOpen();
        int keyWidth = frameInfo.keyWidth();
        byte[] column = new byte[frameInfo.rowCount() * keyWidth];
        StorageFileUtil.readFully(randomAccessFile, frameInfo.keyColumnOffset(), column);
        List<String> keys = new ArrayList<>(frameInfo.rowCount());
        for (int index = 0; index < frameInfo.rowCount(); index++) {
            keys.add(StorageFileUtil.getFixedWidth(column, index * keyWidth, keyWidth));
        }
        return keys;
    }

    /**
     * 从文件尾部向前按窗口读取指定表的首键列。
     */
    public ReverseKeyCursor reverseKeys(StoreTable table, int windowSize) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize 必须为正数: " + windowSize);
        }
        return new ReverseKeyCursor(frames(table), windowSize);
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        randomAccessFile.close();
        closed = true;
    }

    private byte[] readVerifiedFrame(FrameInfo frameInfo) throws IOException {
        ensureOpen();
        long totalBytes = frameInfo.totalBytes();
        if (totalBytes > Integer.MAX_VALUE) {
            throw new StoreFormatException("帧过大: " + fileName, frameInfo.offset());
        }
        byte[] frameBytes = new byte[(int) totalBytes];
        StorageFileUtil.readFully(randomAccessFile, frameInfo.offset(), frameBytes);
        int dataLength = frameBytes.length - Integer.BYTES;
        long expectedCrc32 = Integer.toUnsignedLong(ByteBuffer.wrap(frameBytes, dataLength, Integer.BYTES).getInt());
        long actualCrc32 = StorageFileUtil.crc32(frameBytes, 0, dataLength);
        if (actualCrc32 != expectedCrc32) {
            throw new StoreFormatException("帧 CRC32 校验失败: " + fileName + ", expected=" + expectedCrc32 + ", actual=" + actualCrc32,
                frameInfo.offset());
        }
        return frameBytes;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("StoreReader 已关闭");
        }
    }

    /**
     * 反向键游标：每次返回最多 windowSize 个键，顺序为从新到旧。
     */
    public final class ReverseKeyCursor {
        private final List<FrameInfo> remainingFrames;
        private final int windowSize;
        private final List<String> pending = new ArrayList<>();
        private int frameIndex;

        private ReverseKeyCursor(List<FrameInfo> tableFrames, int windowSize) {
            this.remainingFrames = tableFrames;
            this.frameIndex = tableFrames.size() - 1;
            this.windowSize = windowSize;
        }

        /**
         * 读取下一个窗口；到达文件起点时返回空列表。
         */
        public List<String> nextWindow() throws IOException {
            while (pending.size() < windowSize && frameIndex >= 0) {
                List<String> keys = readKeys(remainingFrames.get(frameIndex--));
                Collections.reverse(keys);
                pending.addAll(keys);
            }
            int take = Math.min(windowSize, pending.size());
            List<String> window = new ArrayList<>(pending.subList(0, take));
            pending.subList(0, take).clear();
            return window;
        }
    }
}
