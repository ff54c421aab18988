package dao.tron.anchor.service;

import dao.tron.anchor.exception.BatchNotFoundException;
import dao.tron.anchor.exception.ConflictingConfirmationException;
import dao.tron.anchor.exception.DuplicateRootException;
import dao.tron.anchor.exception.IntegrityException;
import dao.tron.anchor.model.AnchorBatch;
import dao.tron.anchor.model.BatchStatus;
import dao.tron.anchor.repository.AnchorRepository;
import dao.tron.anchor.repository.StorageErrors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable record of batches keyed by Merkle root, and the only place batch state
 * changes. Every transition is checked against {@link BatchStatus#canTransitionTo}.
 */
@Slf4j
@Service
public class AnchorStore {

    private static final int MAX_REASON_LENGTH = 512;

    private final AnchorRepository anchorRepository;
    private final MerkleTreeService merkleTreeService;
    private final Clock clock;

    public AnchorStore(AnchorRepository anchorRepository, MerkleTreeService merkleTreeService, Clock clock) {
        this.anchorRepository = anchorRepository;
        this.merkleTreeService = merkleTreeService;
        this.clock = clock;
    }

    /**
     * Compute the root over the members and persist the batch as UNSUBMITTED.
     */
    public AnchorBatch createBatch(List<String> members) {
        String root = merkleTreeService.computeRootHex(members);
        return StorageErrors.guard("createBatch " + root, () -> {
            if (anchorRepository.existsById(root)) {
                log.error("Duplicate Merkle root {} for a new batch of {} digests, rejecting", root, members.size());
                throw new DuplicateRootException("Merkle root already stored: " + root);
            }
            AnchorBatch batch = AnchorBatch.builder()
                    .merkle(root)
                    .hashes(new ArrayList<>(members))
                    .status(BatchStatus.UNSUBMITTED)
                    .flushTimestamp(clock.instant().getEpochSecond())
                    .build();
            return anchorRepository.save(batch);
        });
    }

    public AnchorBatch markSubmitted(String root, String txHash) {
        AnchorBatch batch = getBatch(root);
        transition(batch, BatchStatus.SUBMITTED);
        batch.setTxHash(txHash);
        batch.setSubmittedAt(clock.instant());
        batch.setFailureReason(null);
        return save(batch);
    }

    /**
     * SUBMITTED -> CONFIRMED. Confirming again with identical values is a no-op.
     */
    public AnchorBatch markConfirmed(String root, long height, long chainTimestamp) {
        AnchorBatch batch = getBatch(root);
        if (batch.getStatus() == BatchStatus.CONFIRMED) {
            if (Objects.equals(batch.getBlockHeight(), height) && Objects.equals(batch.getChainTimestamp(), chainTimestamp)) {
                return batch;
            }
            log.error("Batch {} already confirmed at height={} time={}, ledger now reports height={} time={}",
                    root, batch.getBlockHeight(), batch.getChainTimestamp(), height, chainTimestamp);
            throw new ConflictingConfirmationException("Conflicting confirmation for batch " + root);
        }
        transition(batch, BatchStatus.CONFIRMED);
        batch.setBlockHeight(height);
        batch.setChainTimestamp(chainTimestamp);
        return save(batch);
    }

    /**
     * UNSUBMITTED or SUBMITTED -> FAILED. On an already failed batch only the reason changes.
     */
    public AnchorBatch markFailed(String root, String reason) {
        AnchorBatch batch = getBatch(root);
        if (batch.getStatus() != BatchStatus.FAILED) {
            transition(batch, BatchStatus.FAILED);
        }
        batch.setFailureReason(truncate(reason));
        return save(batch);
    }

    /**
     * FAILED -> UNSUBMITTED, so the next submission pass picks the batch up again.
     */
    public AnchorBatch markRetry(String root) {
        AnchorBatch batch = getBatch(root);
        transition(batch, BatchStatus.UNSUBMITTED);
        return save(batch);
    }

    /**
     * Batches in SUBMITTED or FAILED state, oldest first.
     */
    public List<AnchorBatch> unconfirmed() {
        return byStatus(EnumSet.of(BatchStatus.SUBMITTED, BatchStatus.FAILED));
    }

    public List<AnchorBatch> byStatus(EnumSet<BatchStatus> statuses) {
        return StorageErrors.guard("batches by status " + statuses,
                () -> anchorRepository.findByStatusInOrderByFlushTimestampAsc(statuses));
    }

    public AnchorBatch getBatch(String root) {
        return findBatch(root).orElseThrow(() -> new BatchNotFoundException("Batch not found for root: " + root));
    }

    public Optional<AnchorBatch> findBatch(String root) {
        return StorageErrors.guard("getBatch " + root, () -> anchorRepository.findById(root));
    }

    /**
     * Most recently flushed batch that reached the ledger.
     */
    public Optional<AnchorBatch> lastAnchor() {
        return StorageErrors.guard("lastAnchor", () -> anchorRepository.findFirstByStatusInOrderByFlushTimestampDesc(
                EnumSet.of(BatchStatus.SUBMITTED, BatchStatus.CONFIRMED)));
    }

    public List<AnchorBatch> all() {
        return StorageErrors.guard("all batches", anchorRepository::findAllByOrderByFlushTimestampAsc);
    }

    public long count() {
        return StorageErrors.guard("count batches", anchorRepository::count);
    }

    /**
     * Insert a batch exactly as dumped. Used by restore only.
     */
    public AnchorBatch importBatch(AnchorBatch batch) {
        return StorageErrors.guard("import batch " + batch.getMerkle(), () -> {
            if (anchorRepository.existsById(batch.getMerkle())) {
                throw new DuplicateRootException("Merkle root already stored: " + batch.getMerkle());
            }
            return anchorRepository.save(batch);
        });
    }

    private void transition(AnchorBatch batch, BatchStatus next) {
        if (!batch.getStatus().canTransitionTo(next)) {
            throw new IntegrityException("Batch " + batch.getMerkle() + ": illegal transition "
                    + batch.getStatus() + " -> " + next);
        }
        log.debug("Batch {}: {} -> {}", batch.getMerkle(), batch.getStatus(), next);
        batch.setStatus(next);
    }

    private AnchorBatch save(AnchorBatch batch) {
        return StorageErrors.guard("save batch " + batch.getMerkle(), () -> anchorRepository.save(batch));
    }

    private static String truncate(String reason) {
        if (reason == null) return null;
        return reason.length() <= MAX_REASON_LENGTH ? reason : reason.substring(0, MAX_REASON_LENGTH);
    }
}
