package com.tfstage.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tfstage.batch.Batch;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class WorkPartitionerTest {

    private static List<String> identifiers(int count) {
        List<String> identifiers = new ArrayList<>();
        for (int index = 0; index < count; index++) {
            identifiers.add(String.format("tst.v%04d", index));
        }
        return identifiers;
    }

    @Test
    void slicesRemainingWorkIntoFixedSizeBatches() {
        List<Batch> batches = new WorkPartitioner(25).remainingWork(identifiers(1000), Set.of());

        assertEquals(40, batches.size());
        assertEquals(25, batches.get(39).size());
        assertEquals("tst.v0975", batches.get(39).identifiers().get(0));
        assertEquals(39, batches.get(39).index());
    }

    @Test
    void doneIdentifiersAreExcludedAndOrderKept() {
        List<String> all = List.of("tst.a", "tst.b", "tst.c", "tst.d", "tst.e");

        List<Batch> batches = new WorkPartitioner(2).remainingWork(all, Set.of("tst.b", "tst.d"));

        assertEquals(List.of(List.of("tst.a", "tst.c"), List.of("tst.e")),
            batches.stream().map(Batch::identifiers).toList());
    }

    @Test
    void duplicatesInManifestAreDispatchedOnce() {
        WorkPartitioner partitioner = new WorkPartitioner(10);

        assertEquals(List.of("tst.a", "tst.b"), partitioner.remainingIdentifiers(List.of("tst.a", "tst.b", "tst.a"), Set.of()));
    }

    @Test
    void everythingDoneYieldsNoBatches() {
        List<String> all = identifiers(30);

        assertTrue(new WorkPartitioner(25).remainingWork(all, Set.copyOf(all)).isEmpty());
        assertTrue(new WorkPartitioner(25).remainingWork(List.of(), Set.of()).isEmpty());
    }

    @Test
    void rejectsNonPositiveBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> new WorkPartitioner(0));
    }
}
