package dao.tron.anchor.service;

import dao.tron.anchor.model.LedgerConfirmation;

/**
 * What the engine needs from the ledger. Any exception is treated as transient.
 */
public interface LedgerClient {

    /**
     * Broadcast a commitment to the 32-byte root. Returns the transaction id.
     */
    String submit(byte[] root);

    LedgerConfirmation query(String txHash);
}
