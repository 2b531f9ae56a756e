package assetup.ledger.exception;

/**
 * Exception thrown when a ledger operation is rejected. Any ledger call that
 * raises it is aborted and leaves no state behind.
 */
public class LedgerException extends RuntimeException {

    private final LedgerError error;

    public LedgerException(LedgerError error, String message) {
        super(message);
        this.error = error;
    }

    public LedgerError getError() {
        return error;
    }

    public ErrorKind getKind() {
        return error.getKind();
    }
}
