package com.tfstage.pipeline;

import com.tfstage.batch.Batch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 工作分区器：全集减去已完成集合，剩余部分按固定大小切批，保持原始顺序。
 *
 * <p>无副作用，可在运行中随时以最新的已完成集合重新调用。
 */
public final class WorkPartitioner {
    private final int batchSize;

    public WorkPartitioner(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize 必须为正数: " + batchSize);
        }
        this.batchSize = batchSize;
    }

    /**
     * 计算剩余待处理卷 ID（去重，保持顺序）。
     */
    public List<String> remainingIdentifiers(Collection<String> allIdentifiers, Set<String> doneSet) {
        Set<String> remaining = new LinkedHashSet<>();
        for (String identifier : allIdentifiers) {
            if (!doneSet.contains(identifier)) {
                remaining.add(identifier);
            }
        }
        return new ArrayList<>(remaining);
    }

    /**
     * 计算剩余工作并切分为批。
     *
     * @param allIdentifiers 清单中的全部卷 ID
     * @param doneSet 检查点中的已完成集合
     * @return 按顺序编号的批列表
     */
    public List<Batch> remainingWork(Collection<String> allIdentifiers, Set<String> doneSet) {
        List<String> remaining = remainingIdentifiers(allIdentifiers, doneSet);
        List<Batch> batches = new ArrayList<>((remaining.size() + batchSize - 1) / batchSize);
        for (int start = 0; start < remaining.size(); start += batchSize) {
            int end = Math.min(start + batchSize, remaining.size());
            batches.add(new Batch(batches.size(), remaining.subList(start, end)));
        }
        return batches;
    }

    public int batchSize() {
        return batchSize;
    }
}
