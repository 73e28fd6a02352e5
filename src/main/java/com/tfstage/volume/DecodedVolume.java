package com.tfstage.volume;

import java.util.List;

/**
 * 解码后的卷，由外部解码器产出。
 */
public interface DecodedVolume {

    /**
     * 卷 ID。
     */
    String id();

    /**
     * 卷声明的语言标签。
     */
    LanguageTag language();

    /**
     * 按指定视图返回词频清单；同一词项在分区视图中可能出现多次。
     */
    List<TokenCount> tokenCounts(TokenView view);
}
