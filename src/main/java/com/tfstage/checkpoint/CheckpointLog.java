package com.tfstage.checkpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 检查点日志：只追加的卷 ID 文本文件，每行一个已成功写入两张表的卷 ID。
 *
 * <p>单写者：只有调度线程在批次之间追加，因此不加锁。每次追加后强制落盘；
 * 同一 ID 至多写入一次。进程在追加中途退出留下的残行（无换行结尾）在下次打开时被截掉。
 */
public final class CheckpointLog implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CheckpointLog.class);

    private final Path path;
    private final Set<String> logged;
    private FileChannel channel;
    private boolean closed;

    /**
     * 打开检查点日志，读取已有内容；文件不存在时在首次追加时创建。
     *
     * @param path 检查点文件
     * @throws IOException 读取失败时抛出
     */
    public CheckpointLog(Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("检查点文件不能为空");
        }
        this.path = path;
        this.logged = load(path);
    }

    /**
     * 全量读取检查点文件，重建已完成集合（保持写入顺序）。
     *
     * @param path 检查点文件
     * @return 已完成卷 ID 集合；文件不存在时为空
     * @throws IOException 读取失败时抛出
     */
    public static Set<String> load(Path path) throws IOException {
        Set<String> identifiers = new LinkedHashSet<>();
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException exception) {
            return identifiers;
        }
        int completeLength = content.lastIndexOf('\n') + 1;
        try (BufferedReader reader = new BufferedReader(new StringReader(content.substring(0, completeLength)))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String identifier = line.trim();
                if (!identifier.isEmpty()) {
                    identifiers.add(identifier);
                }
            }
        }
        return identifiers;
    }

    /**
     * 当前已记录集合的只读视图。
     */
    public Set<String> doneSet() {
        return Collections.unmodifiableSet(logged);
    }

    public boolean contains(String identifier) {
        return logged.contains(identifier);
    }

    public int size() {
        return logged.size();
    }

    public Path path() {
        return path;
    }

    /**
     * 追加一组卷 ID 并落盘，已记录的 ID 被跳过。
     *
     * @param identifiers 已完成的卷 ID
     * @return 实际新写入的数量
     * @throws IOException 写入失败时抛出
     */
    public int append(Collection<String> identifiers) throws IOException {
        ensureOpen();
        StringBuilder lines = new StringBuilder();
        Set<String> fresh = new LinkedHashSet<>();
        for (String identifier : identifiers) {
            if (identifier == null || identifier.isBlank()) {
                continue;
            }
            String trimmed = identifier.trim();
            if (!logged.contains(trimmed) && fresh.add(trimmed)) {
                lines.append(trimmed).append('\n');
            }
        }
        if (fresh.isEmpty()) {
            return 0;
        }

        FileChannel target = openChannel();
        ByteBuffer buffer = ByteBuffer.wrap(lines.toString().getBytes(StandardCharsets.UTF_8));
        while (buffer.hasRemaining()) {
            target.write(buffer);
        }
        target.force(true);
        logged.addAll(fresh);
        return fresh.size();
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (channel != null) {
            channel.close();
        }
    }

    /**
     * 打开追加通道；若尾部存在未完成的残行则先截掉。
     */
    private FileChannel openChannel() throws IOException {
        if (channel != null) {
            return channel;
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        FileChannel opened = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.READ,
            StandardOpenOption.WRITE);
        try {
            long size = opened.size();
            long completeLength = completeLength(opened, size);
            if (completeLength < size) {
                logger.warn("检查点尾部存在未完成行，已截掉: file={}, bytes={}", path, size - completeLength);
                opened.truncate(completeLength);
            }
            opened.position(completeLength);
        } catch (IOException exception) {
            opened.close();
            throw exception;
        }
        channel = opened;
        return channel;
    }

    private static long completeLength(FileChannel source, long size) throws IOException {
        ByteBuffer single = ByteBuffer.allocate(1);
        for (long position = size - 1; position >= 0; position--) {
            single.clear();
            source.read(single, position);
            if (single.get(0) == '\n') {
                return position + 1;
            }
        }
        return 0L;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("CheckpointLog 已关闭");
        }
    }
}
