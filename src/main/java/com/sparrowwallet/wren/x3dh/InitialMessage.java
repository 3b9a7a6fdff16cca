package com.sparrowwallet.wren.x3dh;

import com.sparrowwallet.wren.InvalidKeyMaterialException;
import com.sparrowwallet.wren.MalformedMessageException;
import com.sparrowwallet.wren.crypto.Curve25519;
import com.sparrowwallet.wren.crypto.DhPublicKey;
import com.sparrowwallet.wren.crypto.IdentityPublicKey;
import com.sparrowwallet.wren.ratchet.RatchetMessage;
import com.sparrowwallet.wren.util.ByteStreamParser;

import javax.annotation.Nullable;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.OptionalInt;

/**
 * The first message of a session. It carries what the responder needs to repeat the X3DH calculation along with the
 * first ratchet message.
 * <p>
 * Wire format, big-endian: version (1) || identity key (32) || ephemeral key (32) || has pre-key flag (1) ||
 * [pre-key id (4)] || signed pre-key id (4) || message length (4) || ratchet message.
 */
public final class InitialMessage {
    public static final int VERSION = 3;

    private final IdentityPublicKey identityKey;
    private final DhPublicKey ephemeralKey;
    private final Integer preKeyId;
    private final int signedPreKeyId;
    private final RatchetMessage message;

    public InitialMessage(IdentityPublicKey identityKey, DhPublicKey ephemeralKey, @Nullable Integer preKeyId, int signedPreKeyId, RatchetMessage message) {
        this.identityKey = identityKey;
        this.ephemeralKey = ephemeralKey;
        this.preKeyId = preKeyId;
        this.signedPreKeyId = signedPreKeyId;
        this.message = message;
    }

    public IdentityPublicKey getIdentityKey() {
        return identityKey;
    }

    public DhPublicKey getEphemeralKey() {
        return ephemeralKey;
    }

    public OptionalInt getPreKeyId() {
        return preKeyId == null ? OptionalInt.empty() : OptionalInt.of(preKeyId);
    }

    public int getSignedPreKeyId() {
        return signedPreKeyId;
    }

    public RatchetMessage getMessage() {
        return message;
    }

    public byte[] serialize() {
        byte[] messageBytes = message.serialize();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        baos.write(VERSION);
        baos.writeBytes(identityKey.serialize());
        baos.writeBytes(ephemeralKey.getBytes());
        baos.write(preKeyId == null ? 0 : 1);
        if(preKeyId != null) {
            baos.writeBytes(ByteBuffer.allocate(4).putInt(preKeyId).array());
        }
        baos.writeBytes(ByteBuffer.allocate(8).putInt(signedPreKeyId).putInt(messageBytes.length).array());
        baos.writeBytes(messageBytes);
        return baos.toByteArray();
    }

    public static InitialMessage deserialize(byte[] data) throws MalformedMessageException {
        ByteStreamParser parser = new ByteStreamParser(data, "InitialMessage");
        int version = parser.readUint8();
        if(version != VERSION) {
            throw new MalformedMessageException("Unsupported initial message version " + version);
        }

        try {
            IdentityPublicKey identityKey = IdentityPublicKey.fromBytes(parser.readBytes(Curve25519.KEY_LENGTH));
            DhPublicKey ephemeralKey = DhPublicKey.fromBytes(parser.readBytes(Curve25519.KEY_LENGTH));
            Integer preKeyId = parser.readFlag() ? parser.readInt() : null;
            int signedPreKeyId = parser.readInt();
            long messageLength = parser.readUint32();
            if(messageLength != parser.available()) {
                throw new MalformedMessageException("Initial message declares " + messageLength + " message bytes, " + parser.available() + " present");
            }
            RatchetMessage message = RatchetMessage.deserialize(parser.readRemaining());

            return new InitialMessage(identityKey, ephemeralKey, preKeyId, signedPreKeyId, message);
        } catch(InvalidKeyMaterialException e) {
            throw new MalformedMessageException("Initial message contains an invalid key", e);
        }
    }

    @Override
    public String toString() {
        return "InitialMessage{identityKey=" + identityKey + ", ephemeralKey=" + ephemeralKey + ", preKeyId=" + preKeyId +
                ", signedPreKeyId=" + signedPreKeyId + ", message=" + message + "}";
    }
}
