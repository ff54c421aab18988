package dao.tron.anchor.admin;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import dao.tron.anchor.model.AnchorBatch;
import dao.tron.anchor.model.BatchStatus;
import dao.tron.anchor.model.DigestRecord;

import java.time.Instant;
import java.util.List;

/**
 * One line of a JSON dump: either a batch ({@code kind = "batch"}) or a digest
 * ({@code kind = "digest"}). Times are unix seconds except {@code submittedAt}, an ISO-8601 instant.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DumpEntry(
        String kind,
        String merkle,
        List<String> hashes,
        BatchStatus status,
        String txHash,
        Long blockHeight,
        Long chainTimestamp,
        Long flushTimestamp,
        @JsonFormat(shape = JsonFormat.Shape.STRING) Instant submittedAt,
        String failureReason,
        String digest,
        Long collectionTimestamp
) {
    public static final String KIND_BATCH = "batch";
    public static final String KIND_DIGEST = "digest";

    public static DumpEntry of(AnchorBatch batch) {
        return new DumpEntry(KIND_BATCH, batch.getMerkle(), batch.getHashes(), batch.getStatus(),
                batch.getTxHash(), batch.getBlockHeight(), batch.getChainTimestamp(), batch.getFlushTimestamp(),
                batch.getSubmittedAt(),
                batch.getFailureReason(), null, null);
    }

    public static DumpEntry of(DigestRecord record) {
        return new DumpEntry(KIND_DIGEST, record.getAnchorMerkle(), null, null, null, null, null, null,
                record.getSubmittedAt(), null, record.getDigest(), record.getCollectionTimestamp());
    }
}
