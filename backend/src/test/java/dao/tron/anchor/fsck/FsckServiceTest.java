package dao.tron.anchor.fsck;

import dao.tron.anchor.model.AnchorBatch;
import dao.tron.anchor.model.BatchStatus;
import dao.tron.anchor.model.LedgerConfirmation;
import dao.tron.anchor.support.JpaStoreTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static dao.tron.anchor.support.TestDigests.digest;
import static dao.tron.anchor.support.TestDigests.hex;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

class FsckServiceTest extends JpaStoreTestBase {

    private FsckService fsckService;

    @BeforeEach
    void setUpFsck() {
        fsckService = new FsckService(anchorStore, digestStore, merkleTreeService, confirmationTracker,
                ledgerClient, flushEngine, props, clock);
        when(ledgerClient.submit(any())).thenReturn("tx1");
        when(ledgerClient.query(anyString())).thenReturn(LedgerConfirmation.unconfirmed());
    }

    @Test
    @DisplayName("Consistent store produces a clean report")
    void consistentStoreIsClean() {
        digestStore.put(digest("A"));
        digestStore.put(digest("B"));
        flushEngine.flush();

        FsckReport report = fsckService.fsck(FsckOptions.defaults());

        assertTrue(report.isClean(), report.getFindings().toString());
        assertEquals(1, report.getBatchesChecked());
        assertEquals(2, report.getDigestsChecked());
    }

    @Test
    @DisplayName("Batch whose members no longer hash to its root is reported corrupt")
    void tamperedMembersAreReportedCorrupt() {
        digestStore.put(digest("A"));
        digestStore.put(digest("B"));
        String root = flushEngine.flush().batchRoot();
        AnchorBatch batch = anchorRepository.findById(root).orElseThrow();
        List<String> reversed = new ArrayList<>(batch.getHashes());
        Collections.reverse(reversed);
        batch.setHashes(reversed);
        anchorRepository.save(batch);

        FsckReport report = fsckService.fsck(new FsckOptions(true, false));

        assertFalse(report.isClean());
        assertEquals(1, report.findings(FindingType.CORRUPT_BATCH).size());
        assertEquals(root, report.findings(FindingType.CORRUPT_BATCH).get(0).subject());
        assertTrue(report.findings(FindingType.MEMBERSHIP_MISMATCH).isEmpty());
    }

    @Test
    @DisplayName("Digest pointing at a batch that does not list it is a membership mismatch")
    void strayDigestIsAMembershipMismatch() {
        digestStore.put(digest("A"));
        String root = flushEngine.flush().batchRoot();
        digestStore.importRecord(hex("stray"), root, clock.instant(), 0L);

        FsckReport report = fsckService.fsck(FsckOptions.defaults());

        assertEquals(1, report.findings(FindingType.MEMBERSHIP_MISMATCH).size());
        assertTrue(report.findings(FindingType.CORRUPT_BATCH).isEmpty());
    }

    @Test
    @DisplayName("Digest pending past its window is reported stuck")
    void longPendingDigestIsStuck() {
        flushEngine.flush();
        digestStore.put(digest("late"));
        clock.advance(Duration.ofHours(25));

        FsckReport report = fsckService.fsck(FsckOptions.defaults());

        assertEquals(List.of(hex("late")),
                report.findings(FindingType.STUCK_DIGEST).stream().map(FsckReport.Finding::subject).toList());
    }

    @Test
    @DisplayName("Digest in the current window is not stuck")
    void recentPendingDigestIsNotStuck() {
        digestStore.put(digest("fresh"));
        clock.advance(Duration.ofHours(2));

        assertTrue(fsckService.fsck(FsckOptions.defaults()).isClean());
    }

    @Test
    @DisplayName("SUBMITTED batch is advanced when the ledger confirms it")
    void submittedBatchIsAdvancedWhenLedgerConfirms() {
        digestStore.put(digest("A"));
        String root = flushEngine.flush().batchRoot();
        when(ledgerClient.query("tx1")).thenReturn(LedgerConfirmation.confirmed(77L, 1714561400L));

        FsckReport report = fsckService.fsck(FsckOptions.defaults());

        assertTrue(report.isClean());
        assertEquals(1, report.findings(FindingType.CONFIRMATION_ADVANCED).size());
        assertEquals(BatchStatus.CONFIRMED, anchorStore.getBatch(root).getStatus());
    }

    @Test
    @DisplayName("Overdue submission is reported but stays SUBMITTED")
    void overdueSubmissionIsReportedButLeftSubmitted() {
        digestStore.put(digest("A"));
        String root = flushEngine.flush().batchRoot();
        clock.advance(Duration.ofHours(25));

        FsckReport report = fsckService.fsck(FsckOptions.defaults());

        assertFalse(report.isClean());
        assertEquals(List.of(root), report.findings(FindingType.OVERDUE_CONFIRMATION).stream()
                .map(FsckReport.Finding::subject).toList());
        AnchorBatch batch = anchorStore.getBatch(root);
        assertEquals(BatchStatus.SUBMITTED, batch.getStatus());
        assertEquals("tx1", batch.getTxHash());
        assertNull(batch.getFailureReason());
    }

    @Test
    @DisplayName("CONFIRMED batches are re-checked only with --verify-confirmed")
    void confirmedBatchIsRecheckedOnlyOnRequest() {
        digestStore.put(digest("A"));
        when(ledgerClient.query("tx1")).thenReturn(LedgerConfirmation.confirmed(77L, 1714561400L));
        flushEngine.flush();
        when(ledgerClient.query("tx1")).thenReturn(LedgerConfirmation.confirmed(78L, 1714561403L));

        assertTrue(fsckService.fsck(FsckOptions.defaults()).isClean());

        FsckReport deep = fsckService.fsck(new FsckOptions(false, true));
        assertEquals(1, deep.findings(FindingType.CONFIRMATION_MISMATCH).size());
    }
}
