package dao.tron.anchor.fsck;

/**
 * @param verbose         log every finding as it is found
 * @param verifyConfirmed re-query the ledger for CONFIRMED batches too
 */
public record FsckOptions(boolean verbose, boolean verifyConfirmed) {

    public static FsckOptions defaults() {
        return new FsckOptions(false, false);
    }
}
