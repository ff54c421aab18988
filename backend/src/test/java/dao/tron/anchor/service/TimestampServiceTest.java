package dao.tron.anchor.service;

import dao.tron.anchor.exception.CollectionsDisabledException;
import dao.tron.anchor.model.BatchStatus;
import dao.tron.anchor.model.CollectionResult;
import dao.tron.anchor.model.LedgerConfirmation;
import dao.tron.anchor.model.LookupResult;
import dao.tron.anchor.model.PutResult;
import dao.tron.anchor.support.JpaStoreTestBase;
import dao.tron.anchor.util.HexUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static dao.tron.anchor.support.TestDigests.digest;
import static dao.tron.anchor.support.TestDigests.hex;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class TimestampServiceTest extends JpaStoreTestBase {

    private TimestampService timestampService;

    @BeforeEach
    void setUpService() {
        timestampService = new TimestampService(digestStore, anchorStore, merkleTreeService, props);
    }

    @Test
    @DisplayName("Lookup of an unknown digest reports not found")
    void lookupOfUnknownDigest() {
        LookupResult result = timestampService.lookup(digest("nobody"));

        assertFalse(result.found());
        assertEquals(hex("nobody"), result.digest());
    }

    @Test
    @DisplayName("Lookup of a pending digest has no batch or proof")
    void lookupOfPendingDigest() {
        timestampService.put(digest("A"));

        LookupResult result = timestampService.lookup(digest("A"));

        assertTrue(result.found());
        assertNull(result.batchRoot());
        assertNull(result.proof());
    }

    @Test
    @DisplayName("Lookup of an anchored digest returns a proof that verifies against the root")
    void lookupOfAnchoredDigestCarriesVerifiableProof() {
        timestampService.put(List.of(digest("A"), digest("B"), digest("C")));
        when(ledgerClient.submit(any())).thenReturn("tx1");
        when(ledgerClient.query("tx1")).thenReturn(LedgerConfirmation.confirmed(100L, 1714561300L));
        flushEngine.flush();

        LookupResult result = timestampService.lookup(digest("C"));

        assertEquals(BatchStatus.CONFIRMED, result.status());
        assertEquals(Long.valueOf(100L), result.blockHeight());
        assertEquals(2, result.proof().leafIndex());
        assertTrue(MerkleTreeService.verify(digest("C"), result.proof(), HexUtil.digestBytes(result.batchRoot())));
        assertEquals(result.batchRoot(), timestampService.lastAnchor().orElseThrow().getMerkle());
    }

    @Test
    @DisplayName("Batch put flags digests that already existed")
    void batchPutReportsDuplicates() {
        timestampService.put(digest("A"));

        List<PutResult> results = timestampService.put(List.of(digest("A"), digest("B")));

        assertTrue(results.get(0).alreadyExists());
        assertFalse(results.get(1).alreadyExists());
    }

    @Test
    @DisplayName("Collection queries are refused unless enabled")
    void collectionQueriesAreDisabledByDefault() {
        assertThrows(CollectionsDisabledException.class, () -> timestampService.getTimestamps(List.of(0L)));
    }

    @Test
    @DisplayName("Collection queries group digests by collection window")
    void collectionQueriesGroupDigestsByWindow() {
        props.setEnableCollections(true);
        long firstWindow = Instant.parse("2024-05-01T10:00:00Z").getEpochSecond();
        long secondWindow = Instant.parse("2024-05-01T11:00:00Z").getEpochSecond();
        timestampService.put(digest("A"));
        timestampService.put(digest("B"));
        clock.advance(Duration.ofHours(1));
        timestampService.put(digest("C"));

        List<CollectionResult> results = timestampService.getTimestamps(List.of(secondWindow, firstWindow, 42L));

        assertEquals(3, results.size());
        assertEquals(List.of(hex("C")), results.get(0).digests());
        assertEquals(List.of(hex("A"), hex("B")), results.get(1).digests());
        assertEquals(firstWindow, results.get(1).collectionTimestamp());
        assertTrue(results.get(2).digests().isEmpty());
    }
}
