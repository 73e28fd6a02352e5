package com.tfstage.recovery;

import com.tfstage.config.Constants;
import com.tfstage.storage.FrameInfo;
import com.tfstage.storage.StoreReader;
import com.tfstage.storage.StoreTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 恢复扫描器：直接读取存储文件，找回已写入存储但未记入检查点的卷 ID。
 *
 * <p>从 /tf/docs 卷 ID 列尾部按固定窗口向前读取；某个窗口的 ID 全部已在检查点中时停止，
 * 更早的行必然已在更早的运行中记录。尾部存在未提交的批（缺少提交记录、截断）、CRC 不符或
 * 最后一行 ID 不符合命名空间时，放弃该文件并报告错误，不返回部分结果。离线运行，不依赖流水线状态。
 */
public class RecoveryScanner {
    private static final Logger logger = LoggerFactory.getLogger(RecoveryScanner.class);

    private final int windowSize;
    private final Pattern idPattern;

    public RecoveryScanner() {
        this(Constants.DEFAULT_SCAN_WINDOW, Pattern.compile(Constants.DEFAULT_ID_PATTERN));
    }

    public RecoveryScanner(int windowSize, Pattern idPattern) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize 必须为正数: " + windowSize);
        }
        this.windowSize = windowSize;
        this.idPattern = idPattern;
    }

    /**
     * 对账单个存储文件。
     *
     * @param storeFile 存储文件
     * @param doneSet 检查点中的已完成集合
     * @return 扫描结果；结构错误体现在 {@link ScanReport#error()}
     */
    public ScanReport reconcile(Path storeFile, Set<String> doneSet) {
        try (StoreReader reader = new StoreReader(storeFile)) {
            if (reader.hasUncommittedTail()) {
                logger.error("存储文件尾部存在未提交的数据，跳过该文件: file={}, bytes={}, {}", storeFile,
                    reader.uncommittedBytes(), reader.uncommittedTail());
                return ScanReport.failure(storeFile, "尾部存在未提交的数据: " + reader.uncommittedTail());
            }
            List<FrameInfo> docFrames = reader.frames(StoreTable.DOCS);
            if (docFrames.isEmpty()) {
                return new ScanReport(storeFile, List.of(), 0L, false, null);
            }
            FrameInfo lastFrame = docFrames.get(docFrames.size() - 1);
            reader.verifyFrame(lastFrame);

            Set<String> recovered = new LinkedHashSet<>();
            long rowsScanned = 0L;
            boolean stoppedEarly = false;
            boolean firstWindow = true;
            StoreReader.ReverseKeyCursor cursor = reader.reverseKeys(StoreTable.DOCS, windowSize);
            List<String> window;
            while (!(window = cursor.nextWindow()).isEmpty()) {
                if (firstWindow) {
                    String lastId = window.get(0);
                    if (!idPattern.matcher(lastId).matches()) {
                        return ScanReport.failure(storeFile, "最后一行卷 ID 不符合命名空间，尾部可能损坏: " + lastId);
                    }
                    firstWindow = false;
                }
                rowsScanned += window.size();
                boolean allDone = true;
                for (String volumeId : window) {
                    if (!doneSet.contains(volumeId)) {
                        allDone = false;
                        recovered.add(volumeId);
                    }
                }
                if (allDone) {
                    stoppedEarly = true;
                    break;
                }
            }
            logger.info("恢复扫描完成: file={}, rowsScanned={}, recovered={}, stoppedEarly={}", storeFile.getFileName(),
                rowsScanned, recovered.size(), stoppedEarly);
            return new ScanReport(storeFile, new ArrayList<>(recovered), rowsScanned, stoppedEarly, null);
        } catch (IOException exception) {
            logger.error("恢复扫描失败，跳过该文件: file={}", storeFile, exception);
            return ScanReport.failure(storeFile, exception.getMessage());
        }
    }

    /**
     * 扫描目录下全部存储文件，单个文件的错误不影响其他文件。
     *
     * @param storeDir 存储目录
     * @param doneSet 检查点中的已完成集合
     * @return 每个文件的扫描结果，按文件名排序
     * @throws IOException 目录无法列出时抛出
     */
    public List<ScanReport> scanAll(Path storeDir, Set<String> doneSet) throws IOException {
        List<Path> storeFiles = listStoreFiles(storeDir);
        List<ScanReport> reports = new ArrayList<>(storeFiles.size());
        for (Path storeFile : storeFiles) {
            reports.add(reconcile(storeFile, doneSet));
        }
        return reports;
    }

    /**
     * 列出目录下的存储文件，按文件名排序。
     */
    public static List<Path> listStoreFiles(Path storeDir) throws IOException {
        List<Path> storeFiles = new ArrayList<>();
        if (!Files.isDirectory(storeDir)) {
            return storeFiles;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(storeDir, "*" + Constants.STORE_FILE_SUFFIX)) {
            for (Path path : stream) {
                storeFiles.add(path);
            }
        }
        storeFiles.sort(null);
        return storeFiles;
    }

    /**
     * 合并多个文件的结果，去重并保持顺序。
     */
    public static List<String> mergeRecovered(List<ScanReport> reports) {
        Set<String> merged = new LinkedHashSet<>();
        for (ScanReport report : reports) {
            merged.addAll(report.recovered());
        }
        return new ArrayList<>(merged);
    }
}
