package com.sparrowwallet.wren;

/**
 * Tags the envelope a ciphertext travels in, telling the receiver whether to call
 * {@link ProtocolEngine#decryptInitial(ProtocolAddress, byte[])} or {@link ProtocolEngine#decrypt(ProtocolAddress, byte[])}.
 */
public enum MessageType {
    INITIAL(3), ESTABLISHED(2);

    private final int wireValue;

    MessageType(int wireValue) {
        this.wireValue = wireValue;
    }

    public int getWireValue() {
        return wireValue;
    }

    public static MessageType fromWireValue(int wireValue) throws MalformedMessageException {
        for(MessageType type : values()) {
            if(type.wireValue == wireValue) {
                return type;
            }
        }

        throw new MalformedMessageException("Unknown message type " + wireValue);
    }
}
