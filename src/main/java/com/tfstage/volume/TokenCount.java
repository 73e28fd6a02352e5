package com.tfstage.volume;

/**
 * 词频清单中的一项；折叠视图下 page 为 -1、pos 为 null。
 */
public record TokenCount(int page, String pos, String token, long count) {

    public static TokenCount collapsed(String token, long count) {
        return new TokenCount(-1, null, token, count);
    }
}
