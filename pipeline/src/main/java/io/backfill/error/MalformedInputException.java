package io.backfill.error;

/**
 * The input ended inside a record: bytes followed the last separator but no terminator ever arrived.
 */
public class MalformedInputException extends Exception {
    private final long ordinal;
    private final int danglingChars;

    public MalformedInputException(long ordinal, int danglingChars) {
        super("Left over data: record " + ordinal + " has " + danglingChars + " chars but no terminator");
        this.ordinal = ordinal;
        this.danglingChars = danglingChars;
    }

    /** Ordinal the unterminated record would have had. */
    public long ordinal() { return ordinal; }
    public int danglingChars() { return danglingChars; }
}
