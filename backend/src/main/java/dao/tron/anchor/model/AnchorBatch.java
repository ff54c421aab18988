package dao.tron.anchor.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.Length;

import java.time.Instant;
import java.util.List;

/**
 * One flushed batch: its Merkle root, ordered members and ledger state.
 */
@Entity
@Table(name = "anchors", indexes = {
        @Index(name = "idx_chain_timestamp", columnList = "chain_timestamp"),
        @Index(name = "idx_flush_timestamp", columnList = "flush_timestamp"),
        @Index(name = "idx_anchor_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnchorBatch {

    /** Merkle root, hex. */
    @Id
    @Column(name = "merkle", length = 64, updatable = false, nullable = false)
    private String merkle;

    /** Member digests in submission order, hex. */
    @Convert(converter = DigestListConverter.class)
    @Column(name = "hashes", nullable = false, length = Length.LONG32)
    private List<String> hashes;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16, nullable = false)
    private BatchStatus status;

    @Column(name = "tx_hash", length = 128)
    private String txHash;

    @Column(name = "block_height")
    private Long blockHeight;

    /** Unix seconds of the confirming block. */
    @Column(name = "chain_timestamp")
    private Long chainTimestamp;

    /** Unix seconds at which the scheduler cut the batch. */
    @Column(name = "flush_timestamp", nullable = false)
    private long flushTimestamp;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Column(name = "failure_reason", length = 512)
    private String failureReason;

    public int memberCount() {
        return hashes == null ? 0 : hashes.size();
    }
}
