package dao.tron.anchor.model;

import java.util.List;

/**
 * Digests received during one collection window.
 *
 * @param collectionTimestamp window start, unix seconds
 * @param digests             digests in submission order
 * @param batchRoots          batch each digest ended up in (null while pending), same order
 */
public record CollectionResult(long collectionTimestamp, List<String> digests, List<String> batchRoots) {}
