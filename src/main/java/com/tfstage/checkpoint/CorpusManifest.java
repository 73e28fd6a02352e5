package com.tfstage.checkpoint;

import com.tfstage.volume.VolumePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 语料清单：每行一个卷文件相对路径，启动时读取一次并转换为卷 ID。
 */
public final class CorpusManifest {
    private static final Logger logger = LoggerFactory.getLogger(CorpusManifest.class);

    private CorpusManifest() {
    }

    /**
     * 读取清单并按出现顺序返回卷 ID；空行跳过，无法解析的行记录警告后跳过。
     *
     * @param manifest 清单文件
     * @param suffix 卷文件后缀
     * @return 卷 ID 列表
     * @throws IOException 读取失败时抛出
     */
    public static List<String> readIdentifiers(Path manifest, String suffix) throws IOException {
        if (manifest == null) {
            throw new IllegalArgumentException("清单文件不能为空");
        }
        List<String> identifiers = new ArrayList<>();
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(manifest, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                try {
                    identifiers.add(VolumePaths.idFromPath(trimmed, suffix));
                } catch (IllegalArgumentException exception) {
                    logger.warn("清单行无法解析为卷 ID，已跳过: line={}, value={}", lineNumber, trimmed);
                }
            }
        } catch (IOException exception) {
            throw new IOException("读取清单失败: " + manifest.toAbsolutePath(), exception);
        }
        return identifiers;
    }
}
