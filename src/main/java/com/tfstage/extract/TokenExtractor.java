package com.tfstage.extract;

import com.tfstage.config.Constants;
import com.tfstage.volume.DecodedVolume;
import com.tfstage.volume.TokenCount;
import com.tfstage.volume.TokenView;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 词频抽取器：将一个解码后的卷转换为 (语言, 卷 ID, 词项) → 计数表。
 *
 * <p>纯函数，无副作用。步骤：
 * <ol>
 *   <li>词频清单为空时返回 {@link ExtractionResult.Empty}</li>
 *   <li>按整卷、不分词性的视图折叠为每词项一个计数</li>
 *   <li>按 UTF-8 字节上限逐码点截断词项，截断后相同的词项合并计数</li>
 *   <li>多值语言标签取第一个</li>
 *   <li>为每行标注卷 ID 与语言并排序</li>
 * </ol>
 */
public class TokenExtractor {
    private final int maxTokenBytes;
    private final int maxIdBytes;

    public TokenExtractor() {
        this(Constants.TOKEN_WIDTH, Constants.VOLUME_ID_WIDTH);
    }

    public TokenExtractor(int maxTokenBytes, int maxIdBytes) {
        if (maxTokenBytes <= 0 || maxIdBytes <= 0) {
            throw new IllegalArgumentException("字节上限必须为正数: token=" + maxTokenBytes + ", id=" + maxIdBytes);
        }
        this.maxTokenBytes = maxTokenBytes;
        this.maxIdBytes = maxIdBytes;
    }

    /**
     * 抽取单卷词频。
     *
     * @param volume 解码后的卷
     * @return 抽取结果
     */
    public ExtractionResult extract(DecodedVolume volume) {
        String volumeId = volume.id();
        if (Utf8Truncator.utf8Length(volumeId) > maxIdBytes) {
            return new ExtractionResult.Failed(new ExtractError(volumeId,
                "卷 ID 超过列宽 " + maxIdBytes + " 字节"));
        }

        List<TokenCount> listing = volume.tokenCounts(TokenView.COLLAPSED);
        if (listing == null || listing.isEmpty()) {
            return new ExtractionResult.Empty(volumeId);
        }

        Map<String, Long> countsByToken = new HashMap<>(listing.size() * 2);
        for (TokenCount tokenCount : listing) {
            if (tokenCount.token() == null || tokenCount.token().isEmpty()) {
                continue;
            }
            String storedToken = Utf8Truncator.truncate(tokenCount.token(), maxTokenBytes);
            if (storedToken.isEmpty()) {
                continue;
            }
            countsByToken.merge(storedToken, tokenCount.count(), Long::sum);
        }
        if (countsByToken.isEmpty()) {
            return new ExtractionResult.Empty(volumeId);
        }

        String language = Utf8Truncator.truncate(volume.language().resolve(), Constants.LANGUAGE_WIDTH);
        List<TokenRow> rows = new ArrayList<>(countsByToken.size());
        for (Map.Entry<String, Long> entry : countsByToken.entrySet()) {
            rows.add(new TokenRow(language, volumeId, entry.getKey(), entry.getValue()));
        }
        return new ExtractionResult.Extracted(volumeId, TokenTable.of(rows));
    }
}
