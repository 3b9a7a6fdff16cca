package com.sparrowwallet.wren.util;

import com.sparrowwallet.wren.MalformedMessageException;

import java.nio.ByteBuffer;

/**
 * Sequential big-endian reader over a wire or persisted structure. Any attempt to read past the end of the input is
 * reported as a {@link MalformedMessageException}, so parsers never see a partially filled field.
 */
public class ByteStreamParser {
    private final byte[] input;
    private final String structure;
    private int position;

    public ByteStreamParser(byte[] input, String structure) {
        this.input = input;
        this.structure = structure;
    }

    public void assertEmpty() throws MalformedMessageException {
        if(available() > 0) {
            throw new MalformedMessageException(structure + " has " + available() + " unexpected trailing bytes");
        }
    }

    public int available() {
        return input.length - position;
    }

    public byte[] readBytes(int n) throws MalformedMessageException {
        if(n < 0 || n > available()) {
            throw new MalformedMessageException(structure + " truncated: needed " + n + " bytes, " + available() + " available");
        }

        byte[] result = new byte[n];
        System.arraycopy(input, position, result, 0, n);
        position += n;
        return result;
    }

    public byte[] readRemaining() {
        byte[] result = new byte[available()];
        System.arraycopy(input, position, result, 0, result.length);
        position = input.length;
        return result;
    }

    public int readUint8() throws MalformedMessageException {
        return readBytes(1)[0] & 0xFF;
    }

    public boolean readFlag() throws MalformedMessageException {
        int flag = readUint8();
        return switch(flag) {
            case 0 -> false;
            case 1 -> true;
            default -> throw new MalformedMessageException(structure + " has invalid flag byte " + flag);
        };
    }

    public int readInt() throws MalformedMessageException {
        return ByteBuffer.wrap(readBytes(4)).getInt();
    }

    public long readUint32() throws MalformedMessageException {
        return readInt() & 0xFFFFFFFFL;
    }

    public long readLong() throws MalformedMessageException {
        return ByteBuffer.wrap(readBytes(8)).getLong();
    }
}
