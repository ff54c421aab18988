package dao.tron.anchor.service;

import dao.tron.anchor.exception.IntegrityException;
import dao.tron.anchor.model.DigestRecord;
import dao.tron.anchor.model.PutResult;
import dao.tron.anchor.support.JpaStoreTestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static dao.tron.anchor.support.TestDigests.digest;
import static dao.tron.anchor.support.TestDigests.hex;
import static org.junit.jupiter.api.Assertions.*;

class DigestStoreTest extends JpaStoreTestBase {

    @Test
    @DisplayName("Put stores a pending digest in its collection window")
    void putStoresPendingDigestInItsCollectionWindow() {
        PutResult result = digestStore.put(digest("A"));

        assertFalse(result.alreadyExists());
        assertNull(result.batchRoot());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z").getEpochSecond(), result.collectionTimestamp());
        assertTrue(digestStore.lookup(digest("A")).orElseThrow().isPending());
    }

    @Test
    @DisplayName("Duplicate put returns the existing record unchanged")
    void duplicatePutReturnsExistingRecord() {
        digestStore.put(digest("A"));
        clock.advance(Duration.ofHours(3));

        PutResult again = digestStore.put(digest("A"));

        assertTrue(again.alreadyExists());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z").getEpochSecond(), again.collectionTimestamp());
        assertEquals(1, digestStore.count());
    }

    @Test
    @DisplayName("Concurrent puts of one digest create exactly one row")
    void concurrentPutsOfSameDigestCreateOneRow() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<PutResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return digestStore.put(digest("contended"));
                }));
            }
            start.countDown();

            List<PutResult> results = new ArrayList<>();
            for (Future<PutResult> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }

            assertEquals(1, digestStore.count());
            assertEquals(1, results.stream().filter(r -> !r.alreadyExists()).count());
            assertTrue(results.stream().allMatch(r -> r.digest().equals(hex("contended"))));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Put rejects digests that are not 32 bytes")
    void putRejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> digestStore.put(new byte[20]));
        assertEquals(0, digestStore.count());
    }

    @Test
    @DisplayName("Pending query honours the cutoff and insertion order")
    void pendingSinceHonoursCutoffAndOrder() {
        digestStore.put(digest("A"));
        clock.advance(Duration.ofSeconds(1));
        digestStore.put(digest("B"));
        clock.advance(Duration.ofSeconds(1));
        digestStore.put(digest("C"));

        List<DigestRecord> pending = digestStore.pendingSince(T0.plusSeconds(1));

        assertEquals(List.of(hex("A"), hex("B")), pending.stream().map(DigestRecord::getDigest).toList());
    }

    @Test
    @DisplayName("Assigning an already batched digest is rejected")
    void assignBatchRejectsDigestsNoLongerPending() {
        digestStore.put(digest("A"));
        digestStore.put(digest("B"));
        List<String> first = List.of(hex("A"));
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        tx.executeWithoutResult(s -> {
            String root = anchorStore.createBatch(first).getMerkle();
            digestStore.assignBatch(root, first);
        });

        List<String> both = List.of(hex("A"), hex("B"));
        assertThrows(IntegrityException.class, () -> tx.executeWithoutResult(s -> {
            String root = anchorStore.createBatch(both).getMerkle();
            digestStore.assignBatch(root, both);
        }));

        assertTrue(digestStore.lookup(digest("B")).orElseThrow().isPending());
        assertEquals(1, anchorStore.count());
    }

    @Test
    @DisplayName("Collection timestamp is submission time truncated to the flush period")
    void collectionTimestampTruncatesToPeriod() {
        props.getFlush().setPeriod(Duration.ofMinutes(15));

        assertEquals(Instant.parse("2024-05-01T10:15:00Z").getEpochSecond(),
                digestStore.collectionTimestamp(Instant.parse("2024-05-01T10:29:59Z")));
    }
}
