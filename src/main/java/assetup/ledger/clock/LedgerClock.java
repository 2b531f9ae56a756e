package assetup.ledger.clock;

/**
 * Ledger time in seconds. Never goes backwards between calls.
 */
public interface LedgerClock {

    long currentTimestamp();
}
