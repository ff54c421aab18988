package dao.tron.anchor.repository;

import dao.tron.anchor.model.DigestRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface DigestRepository extends JpaRepository<DigestRecord, Long> {

    Optional<DigestRecord> findByDigest(String digest);

    List<DigestRecord> findByAnchorMerkleOrderBySeqAsc(String anchorMerkle);

    List<DigestRecord> findByCollectionTimestampInOrderBySeqAsc(Collection<Long> collectionTimestamps);

    List<DigestRecord> findAllByOrderBySeqAsc();

    @Query("SELECT d FROM DigestRecord d WHERE d.anchorMerkle IS NULL AND d.submittedAt <= :cutoff ORDER BY d.seq")
    List<DigestRecord> findPendingSince(Instant cutoff);

    /**
     * Points still-pending digests at a batch. Returns the number of rows updated,
     * which is less than {@code digests.size()} if any of them was already assigned.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE DigestRecord d SET d.anchorMerkle = :anchorMerkle " +
            "WHERE d.digest IN :digests AND d.anchorMerkle IS NULL")
    int assignAnchor(String anchorMerkle, Collection<String> digests);
}
