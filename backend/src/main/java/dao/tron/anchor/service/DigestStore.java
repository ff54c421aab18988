package dao.tron.anchor.service;

import dao.tron.anchor.config.AnchorProperties;
import dao.tron.anchor.exception.IntegrityException;
import dao.tron.anchor.exception.StorageUnavailableException;
import dao.tron.anchor.model.DigestRecord;
import dao.tron.anchor.model.PutResult;
import dao.tron.anchor.repository.DigestRepository;
import dao.tron.anchor.repository.StorageErrors;
import dao.tron.anchor.util.HexUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of submitted digests and their batch assignment.
 *
 * {@link #put} never waits on the flush lock; it only competes with other writers
 * on the unique digest column.
 */
@Slf4j
@Service
public class DigestStore {

    private static final int ASSIGN_CHUNK = 1000;
    private static final int MAX_PUT_ATTEMPTS = 3;

    private final DigestRepository digestRepository;
    private final AnchorProperties props;
    private final Clock clock;

    public DigestStore(DigestRepository digestRepository, AnchorProperties props, Clock clock) {
        this.digestRepository = digestRepository;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Store a digest unless it is already known. A known digest, pending or batched,
     * is returned as is with {@code alreadyExists} set.
     */
    public PutResult put(byte[] digest) {
        String hex = HexUtil.digestHex(digest);
        DataIntegrityViolationException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_PUT_ATTEMPTS; attempt++) {
            Optional<DigestRecord> existing = StorageErrors.guard("lookup " + hex, () -> digestRepository.findByDigest(hex));
            if (existing.isPresent()) {
                return PutResult.existing(existing.get());
            }

            Instant now = clock.instant();
            DigestRecord record = DigestRecord.builder()
                    .digest(hex)
                    .submittedAt(now)
                    .collectionTimestamp(collectionTimestamp(now))
                    .build();
            try {
                return PutResult.created(digestRepository.saveAndFlush(record));
            } catch (DataIntegrityViolationException e) {
                // a concurrent put of the same digest won the insert; read its row on the next pass
                log.debug("Concurrent insert of digest {} (attempt {})", hex, attempt);
                lastConflict = e;
            } catch (DataAccessException | TransactionException e) {
                throw new StorageUnavailableException("put " + hex + " failed: " + e.getMessage(), e);
            }
        }
        throw new IntegrityException("Insert of digest " + hex + " rejected " + MAX_PUT_ATTEMPTS + " times", lastConflict);
    }

    /**
     * Unassigned digests submitted at or before the cutoff, in submission order.
     */
    public List<DigestRecord> pendingSince(Instant cutoff) {
        return StorageErrors.guard("pendingSince", () -> digestRepository.findPendingSince(cutoff));
    }

    /**
     * Mark every given digest as member of the batch. Must run inside the caller's
     * transaction: if any digest was not pending the whole assignment is rejected
     * and the caller rolls back.
     */
    public void assignBatch(String anchorMerkle, List<String> digests) {
        int assigned = StorageErrors.guard("assignBatch " + anchorMerkle, () -> {
            int total = 0;
            for (int from = 0; from < digests.size(); from += ASSIGN_CHUNK) {
                List<String> chunk = digests.subList(from, Math.min(from + ASSIGN_CHUNK, digests.size()));
                total += digestRepository.assignAnchor(anchorMerkle, chunk);
            }
            return total;
        });
        if (assigned != digests.size()) {
            throw new IntegrityException("Batch " + anchorMerkle + ": assigned " + assigned
                    + " of " + digests.size() + " digests, some were no longer pending");
        }
    }

    public Optional<DigestRecord> lookup(byte[] digest) {
        String hex = HexUtil.digestHex(digest);
        return StorageErrors.guard("lookup " + hex, () -> digestRepository.findByDigest(hex));
    }

    public List<DigestRecord> membersOf(String anchorMerkle) {
        return StorageErrors.guard("membersOf " + anchorMerkle,
                () -> digestRepository.findByAnchorMerkleOrderBySeqAsc(anchorMerkle));
    }

    public List<DigestRecord> inCollections(Collection<Long> collectionTimestamps) {
        return StorageErrors.guard("inCollections",
                () -> digestRepository.findByCollectionTimestampInOrderBySeqAsc(collectionTimestamps));
    }

    public List<DigestRecord> all() {
        return StorageErrors.guard("all digests", digestRepository::findAllByOrderBySeqAsc);
    }

    public long count() {
        return StorageErrors.guard("count digests", digestRepository::count);
    }

    /**
     * Insert a digest exactly as dumped. Used by restore only.
     */
    public DigestRecord importRecord(String hex, String anchorMerkle, Instant submittedAt, long collectionTimestamp) {
        DigestRecord record = DigestRecord.builder()
                .digest(hex)
                .anchorMerkle(anchorMerkle)
                .submittedAt(submittedAt)
                .collectionTimestamp(collectionTimestamp)
                .build();
        return StorageErrors.guard("import digest " + hex, () -> digestRepository.save(record));
    }

    /**
     * Start of the collection window the instant falls in, unix seconds.
     */
    public long collectionTimestamp(Instant instant) {
        long period = props.getFlush().getPeriod().getSeconds();
        long epoch = instant.getEpochSecond();
        return epoch - Math.floorMod(epoch, period);
    }
}
