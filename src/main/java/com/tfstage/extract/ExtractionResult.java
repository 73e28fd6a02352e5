package com.tfstage.extract;

/**
 * 单卷抽取结果：成功、空卷（跳过但不算错误）或失败。
 */
public sealed interface ExtractionResult permits ExtractionResult.Extracted,
        ExtractionResult.Empty, ExtractionResult.Failed {

    String volumeId();

    record Extracted(String volumeId, TokenTable table) implements ExtractionResult {
    }

    record Empty(String volumeId) implements ExtractionResult {
    }

    record Failed(ExtractError error) implements ExtractionResult {
        @Override
        public String volumeId() {
            return error.volumeId();
        }
    }
}
