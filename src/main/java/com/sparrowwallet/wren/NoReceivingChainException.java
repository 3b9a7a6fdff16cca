package com.sparrowwallet.wren;

public class NoReceivingChainException extends ProtocolException {
    public NoReceivingChainException() {
        super("No receiving chain key available");
    }

    public NoReceivingChainException(String message) {
        super(message);
    }
}
