package com.sparrowwallet.wren.ratchet;

import com.sparrowwallet.wren.InvalidKeyMaterialException;
import com.sparrowwallet.wren.MalformedMessageException;
import com.sparrowwallet.wren.crypto.Curve25519;
import com.sparrowwallet.wren.crypto.DhPublicKey;
import com.sparrowwallet.wren.util.ByteStreamParser;

import java.nio.ByteBuffer;

/**
 * Ratchet message header: sender ratchet key (32) || previous chain length (4) || message counter (4), big-endian.
 * Counters are unsigned 32-bit values.
 */
public record MessageHeader(DhPublicKey ratchetKey, int previousCounter, int messageCounter) {
    public static final int LENGTH = Curve25519.KEY_LENGTH + 4 + 4;

    public byte[] serialize() {
        return ByteBuffer.allocate(LENGTH).put(ratchetKey.getBytes()).putInt(previousCounter).putInt(messageCounter).array();
    }

    public static MessageHeader deserialize(byte[] data) throws MalformedMessageException {
        ByteStreamParser parser = new ByteStreamParser(data, "MessageHeader");
        DhPublicKey ratchetKey;
        try {
            ratchetKey = DhPublicKey.fromBytes(parser.readBytes(Curve25519.KEY_LENGTH));
        } catch(InvalidKeyMaterialException e) {
            throw new MalformedMessageException("Invalid ratchet key in message header", e);
        }
        int previousCounter = parser.readInt();
        int messageCounter = parser.readInt();
        parser.assertEmpty();

        return new MessageHeader(ratchetKey, previousCounter, messageCounter);
    }

    @Override
    public String toString() {
        return "MessageHeader{ratchetKey=" + ratchetKey + ", previousCounter=" + Integer.toUnsignedString(previousCounter) +
                ", messageCounter=" + Integer.toUnsignedString(messageCounter) + "}";
    }
}
