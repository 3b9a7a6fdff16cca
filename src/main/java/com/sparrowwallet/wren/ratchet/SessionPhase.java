package com.sparrowwallet.wren.ratchet;

public enum SessionPhase {
    /** Initiator after X3DH: can send, has not yet received a reply. */
    INITIATOR_ESTABLISHED,
    /** Responder after X3DH: must receive the initiator's first message before it can send. */
    RESPONDER_PENDING,
    /** Both sending and receiving chains exist. */
    BIDIRECTIONAL
}
