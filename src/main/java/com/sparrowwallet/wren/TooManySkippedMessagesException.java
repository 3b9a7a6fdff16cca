package com.sparrowwallet.wren;

/**
 * A message counter is too far ahead of the receiving chain. The message is rejected without deriving or storing any
 * skipped keys.
 */
public class TooManySkippedMessagesException extends ProtocolException {
    private final long skipped;

    public TooManySkippedMessagesException(long skipped, int limit) {
        super("Too many skipped messages: " + skipped + " exceeds limit of " + limit);
        this.skipped = skipped;
    }

    public long getSkipped() {
        return skipped;
    }
}
