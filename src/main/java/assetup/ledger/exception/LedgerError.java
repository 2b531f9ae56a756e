package assetup.ledger.exception;

/**
 * Error codes surfaced by ledger operations. Numeric codes are stable and
 * appear in API error bodies.
 */
public enum LedgerError {
    UNAUTHORIZED(8, ErrorKind.UNAUTHORIZED),
    ASSET_ALREADY_TOKENIZED(10, ErrorKind.ALREADY_EXISTS),
    ASSET_NOT_TOKENIZED(11, ErrorKind.NOT_FOUND),
    INVALID_TOKEN_SUPPLY(12, ErrorKind.INVALID_INPUT),
    INVALID_TOKEN_DECIMALS(13, ErrorKind.INVALID_INPUT),
    INSUFFICIENT_BALANCE(14, ErrorKind.STATE_CONFLICT),
    TOKENS_ARE_LOCKED(16, ErrorKind.STATE_CONFLICT),
    TRANSFER_RESTRICTION_FAILED(17, ErrorKind.RESTRICTION_VIOLATION),
    ACCREDITED_INVESTOR_REQUIRED(19, ErrorKind.RESTRICTION_VIOLATION),
    INSUFFICIENT_VOTING_POWER(21, ErrorKind.STATE_CONFLICT),
    ALREADY_VOTED(22, ErrorKind.ALREADY_EXISTS),
    PROPOSAL_NOT_FOUND(23, ErrorKind.NOT_FOUND),
    NO_DIVIDENDS_TO_CLAIM(26, ErrorKind.STATE_CONFLICT),
    INVALID_DIVIDEND_AMOUNT(27, ErrorKind.INVALID_INPUT),
    DETOKENIZATION_NOT_APPROVED(28, ErrorKind.STATE_CONFLICT),
    DETOKENIZATION_ALREADY_PROPOSED(29, ErrorKind.ALREADY_EXISTS),
    INVALID_VALUATION(30, ErrorKind.INVALID_INPUT),
    MATH_OVERFLOW(32, ErrorKind.ARITHMETIC_FAULT),
    MATH_UNDERFLOW(33, ErrorKind.ARITHMETIC_FAULT),
    INVALID_TIMESTAMPS(46, ErrorKind.INVALID_INPUT),
    REVENUE_SHARING_DISABLED(47, ErrorKind.STATE_CONFLICT);

    private final int code;
    private final ErrorKind kind;

    LedgerError(int code, ErrorKind kind) {
        this.code = code;
        this.kind = kind;
    }

    public int getCode() {
        return code;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
