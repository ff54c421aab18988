package dao.tron.anchor.model;

/**
 * Status of a digest as seen by a client: pending, or the batch it was anchored in
 * together with a freshly built inclusion proof.
 */
public record LookupResult(
        String digest,
        boolean found,
        long collectionTimestamp,
        String batchRoot,
        BatchStatus status,
        String txHash,
        Long blockHeight,
        Long chainTimestamp,
        InclusionProof proof
) {
    public static LookupResult notFound(String digest) {
        return new LookupResult(digest, false, 0L, null, null, null, null, null, null);
    }

    public static LookupResult pending(DigestRecord record) {
        return new LookupResult(record.getDigest(), true, record.getCollectionTimestamp(),
                null, null, null, null, null, null);
    }

    public static LookupResult anchored(DigestRecord record, AnchorBatch batch, InclusionProof proof) {
        return new LookupResult(record.getDigest(), true, record.getCollectionTimestamp(),
                batch.getMerkle(), batch.getStatus(), batch.getTxHash(),
                batch.getBlockHeight(), batch.getChainTimestamp(), proof);
    }
}
