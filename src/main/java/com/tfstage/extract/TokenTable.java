package com.tfstage.extract;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 按 (语言, 卷 ID, 词项) 排序的词频表，不可变。
 */
public final class TokenTable {
    static final Comparator<TokenRow> ROW_ORDER = Comparator
        .comparing(TokenRow::language)
        .thenComparing(TokenRow::volumeId)
        .thenComparing(TokenRow::token);

    private static final TokenTable EMPTY = new TokenTable(List.of());

    private final List<TokenRow> rows;

    private TokenTable(List<TokenRow> rows) {
        this.rows = rows;
    }

    /**
     * 由任意顺序的记录构造有序表。
     */
    public static TokenTable of(List<TokenRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return EMPTY;
        }
        List<TokenRow> sorted = new ArrayList<>(rows);
        sorted.sort(ROW_ORDER);
        return new TokenTable(List.copyOf(sorted));
    }

    /**
     * 拼接多张表并保持整体有序。
     */
    public static TokenTable concat(List<TokenTable> tables) {
        List<TokenRow> merged = new ArrayList<>();
        for (TokenTable table : tables) {
            merged.addAll(table.rows);
        }
        return of(merged);
    }

    public List<TokenRow> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public long totalCount() {
        long total = 0L;
        for (TokenRow row : rows) {
            total += row.count();
        }
        return total;
    }
}
