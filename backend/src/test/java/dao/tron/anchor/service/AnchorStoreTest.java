package dao.tron.anchor.service;

import dao.tron.anchor.exception.BatchNotFoundException;
import dao.tron.anchor.exception.ConflictingConfirmationException;
import dao.tron.anchor.exception.DuplicateRootException;
import dao.tron.anchor.exception.IntegrityException;
import dao.tron.anchor.model.AnchorBatch;
import dao.tron.anchor.model.BatchStatus;
import dao.tron.anchor.support.JpaStoreTestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static dao.tron.anchor.support.TestDigests.hex;
import static org.junit.jupiter.api.Assertions.*;

class AnchorStoreTest extends JpaStoreTestBase {

    private final List<String> members = List.of(hex("A"), hex("B"), hex("C"));

    @Test
    @DisplayName("New batch stores root, members and flush time as UNSUBMITTED")
    void createBatchStoresRootMembersAndFlushTime() {
        AnchorBatch batch = anchorStore.createBatch(members);

        AnchorBatch stored = anchorStore.getBatch(batch.getMerkle());
        assertEquals(merkleTreeService.computeRootHex(members), stored.getMerkle());
        assertEquals(members, stored.getHashes());
        assertEquals(BatchStatus.UNSUBMITTED, stored.getStatus());
        assertEquals(T0.getEpochSecond(), stored.getFlushTimestamp());
    }

    @Test
    @DisplayName("Second batch with the same root is rejected")
    void duplicateRootIsRejected() {
        anchorStore.createBatch(members);

        assertThrows(DuplicateRootException.class, () -> anchorStore.createBatch(members));
        assertEquals(1, anchorStore.count());
    }

    @Test
    @DisplayName("Batch moves from UNSUBMITTED to SUBMITTED to CONFIRMED")
    void batchMovesThroughSubmissionAndConfirmation() {
        String root = anchorStore.createBatch(members).getMerkle();

        anchorStore.markSubmitted(root, "tx1");
        anchorStore.markConfirmed(root, 100L, 1714561230L);

        AnchorBatch stored = anchorStore.getBatch(root);
        assertEquals(BatchStatus.CONFIRMED, stored.getStatus());
        assertEquals("tx1", stored.getTxHash());
        assertEquals(Long.valueOf(100L), stored.getBlockHeight());
        assertEquals(Long.valueOf(1714561230L), stored.getChainTimestamp());
        assertEquals(T0, stored.getSubmittedAt());
    }

    @Test
    @DisplayName("Same confirmation twice is a no-op, a different one is rejected")
    void repeatedConfirmationIsIdempotentButConflictsAreRejected() {
        String root = anchorStore.createBatch(members).getMerkle();
        anchorStore.markSubmitted(root, "tx1");
        anchorStore.markConfirmed(root, 100L, 1714561230L);

        assertDoesNotThrow(() -> anchorStore.markConfirmed(root, 100L, 1714561230L));
        assertThrows(ConflictingConfirmationException.class, () -> anchorStore.markConfirmed(root, 101L, 1714561230L));
        assertEquals(Long.valueOf(100L), anchorStore.getBatch(root).getBlockHeight());
    }

    @Test
    @DisplayName("Skipping or reversing a status is rejected")
    void illegalTransitionsAreRejected() {
        String root = anchorStore.createBatch(members).getMerkle();

        assertThrows(IntegrityException.class, () -> anchorStore.markConfirmed(root, 1L, 1L));
        assertThrows(IntegrityException.class, () -> anchorStore.markRetry(root));
        assertEquals(BatchStatus.UNSUBMITTED, anchorStore.getBatch(root).getStatus());
    }

    @Test
    @DisplayName("FAILED batch can only be reset for resubmission")
    void failedBatchCanOnlyReturnToUnsubmitted() {
        String root = anchorStore.createBatch(members).getMerkle();
        anchorStore.markFailed(root, "out of energy");
        anchorStore.markFailed(root, "still out of energy");

        assertEquals("still out of energy", anchorStore.getBatch(root).getFailureReason());
        assertThrows(IntegrityException.class, () -> anchorStore.markConfirmed(root, 1L, 1L));

        anchorStore.markRetry(root);
        assertEquals(BatchStatus.UNSUBMITTED, anchorStore.getBatch(root).getStatus());
        assertEquals(List.of(), anchorStore.unconfirmed());
    }

    @Test
    @DisplayName("Last anchor is the newest batch with a transaction")
    void lastAnchorIsLatestBatchThatReachedTheLedger() {
        String first = anchorStore.createBatch(List.of(hex("A"))).getMerkle();
        anchorStore.markSubmitted(first, "tx1");
        clock.advance(Duration.ofHours(1));
        anchorStore.createBatch(List.of(hex("B")));

        assertEquals(first, anchorStore.lastAnchor().orElseThrow().getMerkle());
    }

    @Test
    @DisplayName("Unknown root raises not-found")
    void unknownRootIsNotFound() {
        assertThrows(BatchNotFoundException.class, () -> anchorStore.getBatch(hex("missing")));
        assertTrue(anchorStore.findBatch(hex("missing")).isEmpty());
    }
}
