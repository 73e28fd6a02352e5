package com.tfstage.batch;

import java.util.List;

/**
 * 一批待处理的卷 ID，保持清单中的原始顺序。
 */
public record Batch(int index, List<String> identifiers) {
    public Batch {
        if (index < 0) {
            throw new IllegalArgumentException("批序号不能为负数: " + index);
        }
        identifiers = List.copyOf(identifiers);
    }

    public int size() {
        return identifiers.size();
    }
}
