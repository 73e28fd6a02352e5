package com.tfstage.batch;

import com.tfstage.config.Constants;

/**
 * 语料表的非对称稀疏裁剪策略：只对主导语言丢弃批内计数低于阈值的词项，
 * 其他语言即使计数为 1 也保留。
 *
 * <p>该启发式未经真实数据验证，保持可配置。
 */
public record CorpusTrimPolicy(String language, int minCount) {

    /** 不做任何裁剪 */
    public static final CorpusTrimPolicy NONE = new CorpusTrimPolicy(null, 0);

    public CorpusTrimPolicy {
        if (minCount < 0) {
            throw new IllegalArgumentException("minCount 不能为负数: " + minCount);
        }
    }

    public static CorpusTrimPolicy defaults() {
        return new CorpusTrimPolicy(Constants.DEFAULT_TRIM_LANGUAGE, Constants.DEFAULT_TRIM_MIN_COUNT);
    }

    /**
     * 判断语料行是否保留。
     */
    public boolean keep(String rowLanguage, long batchCount) {
        if (language == null || language.isEmpty() || !language.equals(rowLanguage)) {
            return true;
        }
        return batchCount >= minCount;
    }
}
