package dao.tron.anchor.service;

import dao.tron.anchor.model.AnchorBatch;
import dao.tron.anchor.model.BatchStatus;
import dao.tron.anchor.model.DigestRecord;
import dao.tron.anchor.util.HexUtil;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single writer that closes pending digests into batches and anchors them.
 *
 * One cycle per scheduler tick, under an exclusive lock:
 * 1. snapshot pending digests; an empty window creates nothing;
 * 2. create the batch and assign its members in one transaction;
 * 3. put FAILED batches back to UNSUBMITTED, then submit every UNSUBMITTED batch;
 * 4. poll the ledger for every SUBMITTED batch.
 *
 * A tick arriving while a cycle runs is dropped, not queued.
 */
@Slf4j
@Service
public class FlushEngine {

    private final DigestStore digestStore;
    private final AnchorStore anchorStore;
    private final LedgerClient ledgerClient;
    private final ConfirmationTracker confirmationTracker;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    private final ReentrantLock flushLock = new ReentrantLock();
    private final AtomicReference<FlushState> state = new AtomicReference<>(FlushState.IDLE);
    private volatile boolean closing;

    public FlushEngine(DigestStore digestStore,
                       AnchorStore anchorStore,
                       LedgerClient ledgerClient,
                       ConfirmationTracker confirmationTracker,
                       PlatformTransactionManager transactionManager,
                       Clock clock) {
        this.digestStore = digestStore;
        this.anchorStore = anchorStore;
        this.ledgerClient = ledgerClient;
        this.confirmationTracker = confirmationTracker;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public FlushResult flush() {
        if (closing) {
            log.info("Flush tick ignored, engine is shutting down");
            return FlushResult.skipped();
        }
        if (!flushLock.tryLock()) {
            log.info("Flush already in progress, dropping tick");
            return FlushResult.skipped();
        }
        try {
            return runCycle();
        } finally {
            state.set(FlushState.IDLE);
            flushLock.unlock();
        }
    }

    /**
     * Run work that must not interleave with a flush cycle, waiting for the lock.
     */
    public <T> T runExclusive(Supplier<T> work) {
        flushLock.lock();
        try {
            return work.get();
        } finally {
            flushLock.unlock();
        }
    }

    public FlushState getState() {
        return state.get();
    }

    /**
     * Wait for an in-flight cycle before the storage handles are closed.
     */
    @PreDestroy
    public void drain() {
        closing = true;
        flushLock.lock();
        try {
            log.info("Flush engine drained");
        } finally {
            flushLock.unlock();
        }
    }

    private FlushResult runCycle() {
        Instant now = clock.instant();

        AnchorBatch created = null;
        try {
            created = transactionTemplate.execute(status -> closePending(now));
        } catch (RuntimeException e) {
            log.error("Closing pending digests failed, no batch created this tick: {}", e.getMessage(), e);
        }
        if (created != null) {
            log.info("Flushed {} digest(s) into batch {}", created.memberCount(), created.getMerkle());
        }

        state.set(FlushState.SUBMITTING);
        for (AnchorBatch failed : anchorStore.byStatus(EnumSet.of(BatchStatus.FAILED))) {
            log.info("Retrying failed batch {} (reason: {})", failed.getMerkle(), failed.getFailureReason());
            anchorStore.markRetry(failed.getMerkle());
        }
        int submitted = 0;
        int failures = 0;
        for (AnchorBatch batch : anchorStore.byStatus(EnumSet.of(BatchStatus.UNSUBMITTED))) {
            if (submit(batch)) {
                submitted++;
            } else {
                failures++;
            }
        }

        state.set(FlushState.AWAITING_CONFIRMATION);
        int confirmed = 0;
        for (AnchorBatch batch : anchorStore.byStatus(EnumSet.of(BatchStatus.SUBMITTED))) {
            if (confirmationTracker.poll(batch) == ConfirmationTracker.Outcome.CONFIRMED) {
                confirmed++;
            }
        }

        return new FlushResult(true,
                created == null ? null : created.getMerkle(),
                created == null ? 0 : created.memberCount(),
                submitted, failures, confirmed);
    }

    private AnchorBatch closePending(Instant cutoff) {
        state.set(FlushState.COLLECTING);
        List<DigestRecord> pending = digestStore.pendingSince(cutoff);
        if (pending.isEmpty()) {
            log.debug("No pending digests, nothing to flush");
            return null;
        }

        state.set(FlushState.BUILDING);
        List<String> members = pending.stream().map(DigestRecord::getDigest).toList();
        AnchorBatch batch = anchorStore.createBatch(members);
        digestStore.assignBatch(batch.getMerkle(), members);
        return batch;
    }

    private boolean submit(AnchorBatch batch) {
        String txHash;
        try {
            txHash = ledgerClient.submit(HexUtil.digestBytes(batch.getMerkle()));
        } catch (RuntimeException e) {
            log.warn("Ledger submission of batch {} failed, retrying next tick: {}", batch.getMerkle(), e.getMessage());
            anchorStore.markFailed(batch.getMerkle(), e.getMessage());
            return false;
        }
        anchorStore.markSubmitted(batch.getMerkle(), txHash);
        log.info("Batch {} submitted: tx={}", batch.getMerkle(), txHash);
        return true;
    }
}
