package com.tfstage.volume;

import com.tfstage.config.Constants;

import java.util.List;

/**
 * 卷的语言标签：单值或多值。
 *
 * <p>多值标签的归一化规则是取第一个语言代码，这是一项显式策略而非数据偶然；
 * 缺失或空列表归一化为 {@link Constants#UNKNOWN_LANGUAGE}。
 */
public sealed interface LanguageTag permits LanguageTag.Single, LanguageTag.Multiple {

    /**
     * 归一化为单一语言代码。
     */
    String resolve();

    record Single(String code) implements LanguageTag {
        @Override
        public String resolve() {
            return code == null || code.isBlank() ? Constants.UNKNOWN_LANGUAGE : code.trim();
        }
    }

    record Multiple(List<String> codes) implements LanguageTag {
        public Multiple {
            codes = codes == null ? List.of() : List.copyOf(codes);
        }

        @Override
        public String resolve() {
            for (String code : codes) {
                if (code != null && !code.isBlank()) {
                    return code.trim();
                }
            }
            return Constants.UNKNOWN_LANGUAGE;
        }
    }

    static LanguageTag of(String code) {
        return new Single(code);
    }

    static LanguageTag of(List<String> codes) {
        return new Multiple(codes);
    }
}
