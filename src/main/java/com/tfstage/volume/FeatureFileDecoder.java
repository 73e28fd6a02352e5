package com.tfstage.volume;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * 抽取特征（Extracted Features）JSON 文件解码器，支持明文 .json 与 gzip 压缩的 .json.gz。
 *
 * <p>读取 {@code id}、{@code metadata.language}（字符串或数组）以及
 * {@code features.pages[].{header,body,footer}.tokenPosCount}，三个分区在页内合并。
 */
public class FeatureFileDecoder implements VolumeDecoder {
    private static final String[] PAGE_SECTIONS = {"header", "body", "footer"};

    private final ObjectMapper objectMapper;

    public FeatureFileDecoder() {
        this(new ObjectMapper());
    }

    public FeatureFileDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public DecodedVolume decode(Path path) throws VolumeDecodeException {
        if (path == null) {
            throw new IllegalArgumentException("卷文件路径不能为空");
        }
        JsonNode root;
        try (InputStream inputStream = open(path)) {
            root = objectMapper.readTree(inputStream);
        } catch (NoSuchFileException exception) {
            throw new VolumeDecodeException("卷文件不存在", path, exception);
        } catch (IOException exception) {
            throw new VolumeDecodeException("读取卷文件失败", path, exception);
        }
        if (root == null || !root.isObject()) {
            throw new VolumeDecodeException("卷文件顶层不是 JSON 对象", path);
        }

        String id = root.path("id").asText(null);
        if (id == null || id.isBlank()) {
            throw new VolumeDecodeException("卷文件缺少 id", path);
        }
        LanguageTag language = readLanguage(root.path("metadata").path("language"), path);
        List<FeatureVolume.Page> pages = readPages(root.path("features").path("pages"), path);
        return new FeatureVolume(id, language, pages);
    }

    private InputStream open(Path path) throws IOException {
        InputStream inputStream = new BufferedInputStream(Files.newInputStream(path));
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".gz")) {
            return new GZIPInputStream(inputStream);
        }
        return inputStream;
    }

    private LanguageTag readLanguage(JsonNode languageNode, Path path) throws VolumeDecodeException {
        if (languageNode.isMissingNode() || languageNode.isNull()) {
            return LanguageTag.of(List.of());
        }
        if (languageNode.isTextual()) {
            return LanguageTag.of(languageNode.asText());
        }
        if (languageNode.isArray()) {
            List<String> codes = new ArrayList<>(languageNode.size());
            for (JsonNode codeNode : languageNode) {
                codes.add(codeNode.asText());
            }
            return LanguageTag.of(codes);
        }
        throw new VolumeDecodeException("metadata.language 类型非法: " + languageNode.getNodeType(), path);
    }

    private List<FeatureVolume.Page> readPages(JsonNode pagesNode, Path path) throws VolumeDecodeException {
        if (pagesNode.isMissingNode() || pagesNode.isNull()) {
            return List.of();
        }
        if (!pagesNode.isArray()) {
            throw new VolumeDecodeException("features.pages 不是数组", path);
        }
        List<FeatureVolume.Page> pages = new ArrayList<>(pagesNode.size());
        int ordinal = 0;
        for (JsonNode pageNode : pagesNode) {
            int seq = pageNode.path("seq").asInt(ordinal + 1);
            Map<String, Map<String, Long>> tokenPosCount = new HashMap<>();
            for (String section : PAGE_SECTIONS) {
                mergeSection(pageNode.path(section).path("tokenPosCount"), tokenPosCount, seq, path);
            }
            pages.add(new FeatureVolume.Page(seq, tokenPosCount));
            ordinal++;
        }
        return pages;
    }

    private void mergeSection(JsonNode countsNode, Map<String, Map<String, Long>> target, int seq, Path path)
            throws VolumeDecodeException {
        if (countsNode.isMissingNode() || countsNode.isNull()) {
            return;
        }
        if (!countsNode.isObject()) {
            throw new VolumeDecodeException("tokenPosCount 不是对象, seq=" + seq, path);
        }
        Iterator<Map.Entry<String, JsonNode>> tokens = countsNode.fields();
        while (tokens.hasNext()) {
            Map.Entry<String, JsonNode> tokenEntry = tokens.next();
            JsonNode posNode = tokenEntry.getValue();
            if (!posNode.isObject()) {
                throw new VolumeDecodeException("词性计数不是对象, token=" + tokenEntry.getKey() + ", seq=" + seq, path);
            }
            Map<String, Long> posCounts = target.computeIfAbsent(tokenEntry.getKey(), ignored -> new HashMap<>());
            Iterator<Map.Entry<String, JsonNode>> posEntries = posNode.fields();
            while (posEntries.hasNext()) {
                Map.Entry<String, JsonNode> posEntry = posEntries.next();
                JsonNode countNode = posEntry.getValue();
                if (!countNode.canConvertToLong() || countNode.asLong() < 0) {
                    throw new VolumeDecodeException("计数非法, token=" + tokenEntry.getKey() + ", seq=" + seq, path);
                }
                posCounts.merge(posEntry.getKey(), countNode.asLong(), Long::sum);
            }
        }
    }
}
