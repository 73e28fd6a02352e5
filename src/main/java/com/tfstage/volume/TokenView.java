package com.tfstage.volume;

/**
 * 词频清单的分区视图：是否按页、是否按词性拆分。
 */
public record TokenView(boolean byPage, boolean byPos) {
    /** 整卷、不区分词性的折叠视图 */
    public static final TokenView COLLAPSED = new TokenView(false, false);
}
