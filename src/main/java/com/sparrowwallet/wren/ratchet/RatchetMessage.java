package com.sparrowwallet.wren.ratchet;

import com.sparrowwallet.wren.MalformedMessageException;
import com.sparrowwallet.wren.crypto.AesGcmCipher;
import com.sparrowwallet.wren.util.ByteStreamParser;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * An established-session message: header length (4) || header || AES-GCM ciphertext with appended tag.
 */
public final class RatchetMessage {
    private final MessageHeader header;
    private final byte[] ciphertext;

    public RatchetMessage(MessageHeader header, byte[] ciphertext) {
        this.header = header;
        this.ciphertext = Arrays.copyOf(ciphertext, ciphertext.length);
    }

    public MessageHeader getHeader() {
        return header;
    }

    public byte[] getCiphertext() {
        return Arrays.copyOf(ciphertext, ciphertext.length);
    }

    public byte[] serialize() {
        byte[] headerBytes = header.serialize();
        return ByteBuffer.allocate(4 + headerBytes.length + ciphertext.length)
                .putInt(headerBytes.length)
                .put(headerBytes)
                .put(ciphertext)
                .array();
    }

    public static RatchetMessage deserialize(byte[] data) throws MalformedMessageException {
        ByteStreamParser parser = new ByteStreamParser(data, "RatchetMessage");
        long headerLength = parser.readUint32();
        if(headerLength != MessageHeader.LENGTH) {
            throw new MalformedMessageException("Invalid message header length " + headerLength);
        }

        MessageHeader header = MessageHeader.deserialize(parser.readBytes(MessageHeader.LENGTH));
        byte[] ciphertext = parser.readRemaining();
        if(ciphertext.length < AesGcmCipher.TAG_LENGTH) {
            throw new MalformedMessageException("Ciphertext too short to contain an authentication tag");
        }

        return new RatchetMessage(header, ciphertext);
    }

    @Override
    public String toString() {
        return "RatchetMessage{header=" + header + ", ciphertext=" + ciphertext.length + " bytes}";
    }
}
