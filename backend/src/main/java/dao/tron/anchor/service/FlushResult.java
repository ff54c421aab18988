package dao.tron.anchor.service;

/**
 * Summary of one flush tick.
 *
 * @param ran        false when the tick was dropped because another flush held the lock
 * @param batchRoot  root of the batch created by this tick, null for an empty window
 * @param members    digests in that batch
 * @param submitted  batches handed to the ledger this tick (new and retried)
 * @param failed     submissions that failed this tick
 * @param confirmed  batches that reached CONFIRMED this tick
 */
public record FlushResult(
        boolean ran,
        String batchRoot,
        int members,
        int submitted,
        int failed,
        int confirmed
) {
    public static FlushResult skipped() {
        return new FlushResult(false, null, 0, 0, 0, 0);
    }
}
