package com.sparrowwallet.wren.ratchet;

import javax.security.auth.Destroyable;
import java.util.Arrays;

/**
 * Message keys derived ahead of time for a message that has not arrived yet, with the time they were stored.
 */
public final class SkippedKey implements Destroyable {
    private final MessageKeys messageKeys;
    private final long timestamp;

    SkippedKey(MessageKeys messageKeys, long timestamp) {
        this.messageKeys = messageKeys;
        this.timestamp = timestamp;
    }

    public MessageKeys getMessageKeys() {
        return messageKeys;
    }

    /**
     * @return storage time in milliseconds since the epoch
     */
    public long getTimestamp() {
        return timestamp;
    }

    SkippedKey copy() {
        return new SkippedKey(new MessageKeys(Arrays.copyOf(messageKeys.getCipherKey(), MessageKeys.CIPHER_KEY_LENGTH),
                Arrays.copyOf(messageKeys.getMacKey(), MessageKeys.MAC_KEY_LENGTH),
                Arrays.copyOf(messageKeys.getIv(), MessageKeys.IV_LENGTH)), timestamp);
    }

    @Override
    public void destroy() {
        messageKeys.destroy();
    }
}
