package dao.tron.anchor.service;

import dao.tron.anchor.config.AnchorProperties;
import dao.tron.anchor.model.AnchorBatch;
import dao.tron.anchor.model.BatchStatus;
import dao.tron.anchor.model.LedgerConfirmation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Advances a SUBMITTED batch from what the ledger reports. Shared by the flush
 * cycle and fsck so both apply the same rules.
 */
@Slf4j
@Component
public class ConfirmationTracker {

    public enum Outcome {
        CONFIRMED,
        PENDING,
        TIMED_OUT,
        OVERDUE,
        UNREACHABLE
    }

    private final AnchorStore anchorStore;
    private final LedgerClient ledgerClient;
    private final AnchorProperties props;
    private final Clock clock;

    public ConfirmationTracker(AnchorStore anchorStore,
                               LedgerClient ledgerClient,
                               AnchorProperties props,
                               Clock clock) {
        this.anchorStore = anchorStore;
        this.ledgerClient = ledgerClient;
        this.props = props;
        this.clock = clock;
    }

    public Outcome poll(AnchorBatch batch) {
        return poll(batch, true);
    }

    /**
     * Query the ledger for a SUBMITTED batch and record a confirmation.
     *
     * @param applyTimeout when true an overdue batch is marked FAILED for resubmission;
     *                     when false it is left SUBMITTED and reported as {@link Outcome#OVERDUE}
     */
    public Outcome poll(AnchorBatch batch, boolean applyTimeout) {
        if (batch.getStatus() != BatchStatus.SUBMITTED) {
            throw new IllegalArgumentException("Batch " + batch.getMerkle() + " is " + batch.getStatus() + ", not SUBMITTED");
        }

        LedgerConfirmation confirmation = null;
        try {
            confirmation = ledgerClient.query(batch.getTxHash());
        } catch (RuntimeException e) {
            log.warn("Ledger query for batch {} (tx={}) failed: {}", batch.getMerkle(), batch.getTxHash(), e.getMessage());
        }

        if (confirmation != null && confirmation.confirmed()) {
            anchorStore.markConfirmed(batch.getMerkle(), confirmation.height(), confirmation.timestamp());
            log.info("Batch {} confirmed: tx={}, height={}, time={}",
                    batch.getMerkle(), batch.getTxHash(), confirmation.height(), confirmation.timestamp());
            return Outcome.CONFIRMED;
        }

        if (overdue(batch)) {
            if (!applyTimeout) {
                return Outcome.OVERDUE;
            }
            log.warn("Batch {} unconfirmed since {}, marking failed for resubmission", batch.getMerkle(), batch.getSubmittedAt());
            anchorStore.markFailed(batch.getMerkle(), "confirmation timeout for tx " + batch.getTxHash());
            return Outcome.TIMED_OUT;
        }
        return confirmation == null ? Outcome.UNREACHABLE : Outcome.PENDING;
    }

    private boolean overdue(AnchorBatch batch) {
        Instant submittedAt = batch.getSubmittedAt();
        if (submittedAt == null) {
            return false;
        }
        Duration waited = Duration.between(submittedAt, clock.instant());
        return waited.compareTo(props.getRetry().getResubmitAfter()) >= 0;
    }
}
