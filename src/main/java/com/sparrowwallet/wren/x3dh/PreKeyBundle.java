package com.sparrowwallet.wren.x3dh;

import com.sparrowwallet.wren.InvalidKeyMaterialException;
import com.sparrowwallet.wren.MalformedMessageException;
import com.sparrowwallet.wren.VerificationFailureException;
import com.sparrowwallet.wren.crypto.Curve25519;
import com.sparrowwallet.wren.crypto.DhPublicKey;
import com.sparrowwallet.wren.crypto.Ed25519;
import com.sparrowwallet.wren.crypto.IdentityPublicKey;
import com.sparrowwallet.wren.util.ByteStreamParser;

import javax.annotation.Nullable;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * The public material a peer publishes so that others can start a session with it without it being online.
 * <p>
 * Wire format, big-endian: registration id (4) || device id (4) || has pre-key flag (1) || [pre-key id (4) ||
 * pre-key (32)] || signed pre-key id (4) || signed pre-key (32) || signature (64) || identity key (32).
 */
public final class PreKeyBundle {
    private final int registrationId;
    private final int deviceId;
    private final PublicPreKey preKey;
    private final SignedPublicPreKey signedPreKey;
    private final IdentityPublicKey identityKey;

    public PreKeyBundle(int registrationId, int deviceId, @Nullable PublicPreKey preKey, SignedPublicPreKey signedPreKey, IdentityPublicKey identityKey) {
        this.registrationId = registrationId;
        this.deviceId = deviceId;
        this.preKey = preKey;
        this.signedPreKey = signedPreKey;
        this.identityKey = identityKey;
    }

    public int getRegistrationId() {
        return registrationId;
    }

    public int getDeviceId() {
        return deviceId;
    }

    public Optional<PublicPreKey> getPreKey() {
        return Optional.ofNullable(preKey);
    }

    public SignedPublicPreKey getSignedPreKey() {
        return signedPreKey;
    }

    public IdentityPublicKey getIdentityKey() {
        return identityKey;
    }

    /**
     * Checks the signed pre-key signature against the bundle's identity key.
     */
    public void verify() throws VerificationFailureException {
        if(!identityKey.verify(signedPreKey.publicKey().getBytes(), signedPreKey.signature())) {
            throw new VerificationFailureException("Invalid signed pre-key signature in bundle for registration " + registrationId);
        }
    }

    public byte[] serialize() {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        baos.writeBytes(ByteBuffer.allocate(9).putInt(registrationId).putInt(deviceId).put((byte)(preKey == null ? 0 : 1)).array());
        if(preKey != null) {
            baos.writeBytes(ByteBuffer.allocate(4).putInt(preKey.id()).array());
            baos.writeBytes(preKey.publicKey().getBytes());
        }
        baos.writeBytes(ByteBuffer.allocate(4).putInt(signedPreKey.id()).array());
        baos.writeBytes(signedPreKey.publicKey().getBytes());
        baos.writeBytes(signedPreKey.signature());
        baos.writeBytes(identityKey.serialize());
        return baos.toByteArray();
    }

    /**
     * Parses a bundle. The signature is not checked here; call {@link #verify()}.
     */
    public static PreKeyBundle deserialize(byte[] data) throws MalformedMessageException {
        ByteStreamParser parser = new ByteStreamParser(data, "PreKeyBundle");
        try {
            int registrationId = parser.readInt();
            int deviceId = parser.readInt();
            PublicPreKey preKey = null;
            if(parser.readFlag()) {
                int preKeyId = parser.readInt();
                preKey = new PublicPreKey(preKeyId, DhPublicKey.fromBytes(parser.readBytes(Curve25519.KEY_LENGTH)));
            }
            int signedPreKeyId = parser.readInt();
            DhPublicKey signedPreKeyPublic = DhPublicKey.fromBytes(parser.readBytes(Curve25519.KEY_LENGTH));
            byte[] signature = parser.readBytes(Ed25519.SIGNATURE_LENGTH);
            IdentityPublicKey identityKey = IdentityPublicKey.fromBytes(parser.readBytes(Curve25519.KEY_LENGTH));
            parser.assertEmpty();

            return new PreKeyBundle(registrationId, deviceId, preKey, new SignedPublicPreKey(signedPreKeyId, signedPreKeyPublic, signature), identityKey);
        } catch(InvalidKeyMaterialException e) {
            throw new MalformedMessageException("PreKeyBundle contains an invalid key", e);
        }
    }

    @Override
    public String toString() {
        return "PreKeyBundle{registrationId=" + registrationId + ", deviceId=" + deviceId + ", preKey=" + preKey +
                ", signedPreKey=" + signedPreKey + ", identityKey=" + identityKey + "}";
    }
}
