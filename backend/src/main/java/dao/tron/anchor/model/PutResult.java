package dao.tron.anchor.model;

/**
 * Outcome of storing one digest. {@code batchRoot} is null while the digest is pending.
 */
public record PutResult(
        String digest,
        boolean alreadyExists,
        String batchRoot,
        long collectionTimestamp
) {
    public static PutResult created(DigestRecord record) {
        return new PutResult(record.getDigest(), false, record.getAnchorMerkle(), record.getCollectionTimestamp());
    }

    public static PutResult existing(DigestRecord record) {
        return new PutResult(record.getDigest(), true, record.getAnchorMerkle(), record.getCollectionTimestamp());
    }
}
