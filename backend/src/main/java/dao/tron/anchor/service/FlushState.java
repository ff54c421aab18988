package dao.tron.anchor.service;

/**
 * Phase of the flush cycle currently running, IDLE between cycles.
 */
public enum FlushState {
    IDLE,
    COLLECTING,
    BUILDING,
    SUBMITTING,
    AWAITING_CONFIRMATION
}
