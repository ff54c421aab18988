package dao.tron.anchor.fsck;

import dao.tron.anchor.config.AnchorProperties;
import dao.tron.anchor.model.AnchorBatch;
import dao.tron.anchor.model.DigestRecord;
import dao.tron.anchor.model.LedgerConfirmation;
import dao.tron.anchor.service.AnchorStore;
import dao.tron.anchor.service.ConfirmationTracker;
import dao.tron.anchor.service.DigestStore;
import dao.tron.anchor.service.FlushEngine;
import dao.tron.anchor.service.LedgerClient;
import dao.tron.anchor.service.MerkleTreeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Walks every batch and pending digest looking for divergence between local state
 * and what can be recomputed or asked of the ledger.
 *
 * Only confirmation progress is written back; every other finding is reported.
 * An overdue submission is left for the flush cycle to resubmit.
 * Runs under the flush lock so it never races a flush cycle.
 */
@Slf4j
@Service
public class FsckService {

    private final AnchorStore anchorStore;
    private final DigestStore digestStore;
    private final MerkleTreeService merkleTreeService;
    private final ConfirmationTracker confirmationTracker;
    private final LedgerClient ledgerClient;
    private final FlushEngine flushEngine;
    private final AnchorProperties props;
    private final Clock clock;

    public FsckService(AnchorStore anchorStore,
                       DigestStore digestStore,
                       MerkleTreeService merkleTreeService,
                       ConfirmationTracker confirmationTracker,
                       LedgerClient ledgerClient,
                       FlushEngine flushEngine,
                       AnchorProperties props,
                       Clock clock) {
        this.anchorStore = anchorStore;
        this.digestStore = digestStore;
        this.merkleTreeService = merkleTreeService;
        this.confirmationTracker = confirmationTracker;
        this.ledgerClient = ledgerClient;
        this.flushEngine = flushEngine;
        this.props = props;
        this.clock = clock;
    }

    public FsckReport fsck(FsckOptions options) {
        FsckReport report = flushEngine.runExclusive(() -> check(options));
        if (report.isClean()) {
            log.info("fsck clean: {}", report);
        } else {
            log.warn("fsck found anomalies: {}", report);
        }
        return report;
    }

    private FsckReport check(FsckOptions options) {
        FsckReport report = new FsckReport();
        for (AnchorBatch batch : anchorStore.all()) {
            report.batchChecked(batch.memberCount());
            verifyRoot(batch, report, options);
            verifyMembership(batch, report, options);
            switch (batch.getStatus()) {
                case SUBMITTED -> advance(batch, report, options);
                case CONFIRMED -> {
                    if (options.verifyConfirmed()) {
                        verifyConfirmation(batch, report, options);
                    }
                }
                default -> {
                    // UNSUBMITTED and FAILED are picked up by the next flush tick
                }
            }
        }
        findStuckDigests(report, options);
        return report;
    }

    private void verifyRoot(AnchorBatch batch, FsckReport report, FsckOptions options) {
        String recomputed;
        try {
            recomputed = merkleTreeService.computeRootHex(batch.getHashes());
        } catch (IllegalArgumentException e) {
            note(report, options, FindingType.CORRUPT_BATCH, batch.getMerkle(), "unreadable members: " + e.getMessage());
            return;
        }
        if (!recomputed.equals(batch.getMerkle())) {
            note(report, options, FindingType.CORRUPT_BATCH, batch.getMerkle(), "members hash to " + recomputed);
        }
    }

    private void verifyMembership(AnchorBatch batch, FsckReport report, FsckOptions options) {
        Set<String> listed = new HashSet<>(batch.getHashes());
        Set<String> pointing = new HashSet<>();
        for (DigestRecord record : digestStore.membersOf(batch.getMerkle())) {
            pointing.add(record.getDigest());
            if (!listed.contains(record.getDigest())) {
                note(report, options, FindingType.MEMBERSHIP_MISMATCH, batch.getMerkle(),
                        "digest " + record.getDigest() + " points at the batch but is not listed");
            }
        }
        for (String member : batch.getHashes()) {
            if (!pointing.contains(member)) {
                note(report, options, FindingType.MEMBERSHIP_MISMATCH, batch.getMerkle(),
                        "listed digest " + member + " is missing or assigned elsewhere");
            }
        }
    }

    private void advance(AnchorBatch batch, FsckReport report, FsckOptions options) {
        switch (confirmationTracker.poll(batch, false)) {
            case CONFIRMED -> note(report, options, FindingType.CONFIRMATION_ADVANCED, batch.getMerkle(),
                    "tx " + batch.getTxHash() + " confirmed");
            case OVERDUE -> note(report, options, FindingType.OVERDUE_CONFIRMATION, batch.getMerkle(),
                    "tx " + batch.getTxHash() + " unconfirmed since " + batch.getSubmittedAt());
            case UNREACHABLE -> note(report, options, FindingType.LEDGER_UNREACHABLE, batch.getMerkle(),
                    "tx " + batch.getTxHash() + " could not be queried");
            default -> {
                // still pending
            }
        }
    }

    private void verifyConfirmation(AnchorBatch batch, FsckReport report, FsckOptions options) {
        LedgerConfirmation confirmation;
        try {
            confirmation = ledgerClient.query(batch.getTxHash());
        } catch (RuntimeException e) {
            note(report, options, FindingType.LEDGER_UNREACHABLE, batch.getMerkle(),
                    "tx " + batch.getTxHash() + ": " + e.getMessage());
            return;
        }
        if (!confirmation.confirmed()
                || !Objects.equals(batch.getBlockHeight(), confirmation.height())
                || !Objects.equals(batch.getChainTimestamp(), confirmation.timestamp())) {
            note(report, options, FindingType.CONFIRMATION_MISMATCH, batch.getMerkle(),
                    "stored height=" + batch.getBlockHeight() + " time=" + batch.getChainTimestamp()
                            + ", ledger " + confirmation);
        }
    }

    private void findStuckDigests(FsckReport report, FsckOptions options) {
        Duration stuckAfter = props.getFlush().getPeriod().multipliedBy(props.getFsck().getStuckDigestPeriods());
        Instant cutoff = clock.instant().minus(stuckAfter);
        List<DigestRecord> stuck = digestStore.pendingSince(cutoff);
        for (DigestRecord record : stuck) {
            note(report, options, FindingType.STUCK_DIGEST, record.getDigest(),
                    "pending since " + record.getSubmittedAt());
        }
    }

    private void note(FsckReport report, FsckOptions options, FindingType type, String subject, String detail) {
        report.add(type, subject, detail);
        if (options.verbose()) {
            log.info("fsck {} {}: {}", type, subject, detail);
        }
    }
}
