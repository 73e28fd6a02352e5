package com.tfstage.volume;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 抽取特征文件解码结果：逐页保存 token → 词性 → 计数，按请求视图折叠。
 */
public record FeatureVolume(String id, LanguageTag language, List<Page> pages) implements DecodedVolume {

    public FeatureVolume {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("卷 ID 不能为空");
        }
        language = language == null ? LanguageTag.of(List.of()) : language;
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    /**
     * 单页词频，页眉、正文、页脚已合并。
     */
    public record Page(int seq, Map<String, Map<String, Long>> tokenPosCount) {
        public Page {
            tokenPosCount = tokenPosCount == null ? Map.of() : tokenPosCount;
        }
    }

    @Override
    public List<TokenCount> tokenCounts(TokenView view) {
        TokenView effectiveView = view == null ? TokenView.COLLAPSED : view;
        Map<CountKey, Long> merged = new LinkedHashMap<>();
        for (Page page : pages) {
            int pageKey = effectiveView.byPage() ? page.seq() : -1;
            for (Map.Entry<String, Map<String, Long>> tokenEntry : page.tokenPosCount().entrySet()) {
                for (Map.Entry<String, Long> posEntry : tokenEntry.getValue().entrySet()) {
                    String posKey = effectiveView.byPos() ? posEntry.getKey() : null;
                    merged.merge(new CountKey(pageKey, posKey, tokenEntry.getKey()), posEntry.getValue(), Long::sum);
                }
            }
        }
        List<TokenCount> counts = new ArrayList<>(merged.size());
        for (Map.Entry<CountKey, Long> entry : merged.entrySet()) {
            CountKey key = entry.getKey();
            counts.add(new TokenCount(key.page(), key.pos(), key.token(), entry.getValue()));
        }
        return counts;
    }

    private record CountKey(int page, String pos, String token) {
    }
}
