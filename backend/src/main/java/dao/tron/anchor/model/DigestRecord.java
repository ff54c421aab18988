package dao.tron.anchor.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A submitted digest. {@code anchorMerkle} stays null until a flush puts the
 * digest into a batch.
 */
@Entity
@Table(name = "records", indexes = {
        @Index(name = "fki_records_anchors_fkey", columnList = "anchor_merkle"),
        @Index(name = "idx_collection_timestamp", columnList = "collection_timestamp")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DigestRecord {

    /** Submission order. */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "seq", updatable = false, nullable = false)
    private Long seq;

    @Column(name = "digest", length = 64, nullable = false, unique = true, updatable = false)
    private String digest;

    @Column(name = "anchor_merkle", length = 64)
    private String anchorMerkle;

    // read-only side of the records -> anchors foreign key
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "anchor_merkle", referencedColumnName = "merkle",
            insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "records_anchors_fkey"))
    private AnchorBatch anchor;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private Instant submittedAt;

    /** Unix seconds: submission time truncated to the flush period. */
    @Column(name = "collection_timestamp", nullable = false, updatable = false)
    private long collectionTimestamp;

    public boolean isPending() {
        return anchorMerkle == null;
    }
}
