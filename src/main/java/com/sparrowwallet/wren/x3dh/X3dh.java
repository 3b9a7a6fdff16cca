package com.sparrowwallet.wren.x3dh;

import com.sparrowwallet.wren.InvalidKeyMaterialException;
import com.sparrowwallet.wren.VerificationFailureException;
import com.sparrowwallet.wren.crypto.DhKeyPair;
import com.sparrowwallet.wren.crypto.DhPublicKey;
import com.sparrowwallet.wren.crypto.Hkdf;
import com.sparrowwallet.wren.crypto.IdentityKeyPair;
import com.sparrowwallet.wren.crypto.IdentityPublicKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Extended Triple Diffie-Hellman key agreement.
 *
 * @see <a href="https://signal.org/docs/specifications/x3dh/">The X3DH Key Agreement Protocol</a>
 */
public class X3dh {
    private static final Logger log = LoggerFactory.getLogger(X3dh.class);

    public static final int SHARED_SECRET_LENGTH = 32;

    private static final byte[] INFO = "X3DH".getBytes(StandardCharsets.UTF_8);
    private static final byte[] SALT = new byte[32];
    private static final int DISCONTINUITY_LENGTH = 32;

    private X3dh() {
    }

    /**
     * Computes the initiator's shared secret from a peer's bundle, using a fresh ephemeral key.
     *
     * @throws VerificationFailureException if the bundle signature does not verify
     */
    public static X3dhResult initiate(IdentityKeyPair ourIdentity, PreKeyBundle theirBundle) throws VerificationFailureException, InvalidKeyMaterialException {
        DhKeyPair ephemeral = DhKeyPair.generate();
        try {
            return initiate(ourIdentity, theirBundle, ephemeral);
        } finally {
            ephemeral.destroy();
        }
    }

    static X3dhResult initiate(IdentityKeyPair ourIdentity, PreKeyBundle theirBundle, DhKeyPair ephemeral) throws VerificationFailureException, InvalidKeyMaterialException {
        theirBundle.verify();

        DhPublicKey signedPreKey = theirBundle.getSignedPreKey().publicKey();
        PublicPreKey oneTimePreKey = theirBundle.getPreKey().orElse(null);
        if(oneTimePreKey == null) {
            log.warn("Bundle for registration " + theirBundle.getRegistrationId() + " has no one-time pre-key, continuing with signed pre-key only");
        }

        byte[] dh1 = ourIdentity.calculateAgreement(signedPreKey);
        byte[] dh2 = ephemeral.calculateAgreement(theirBundle.getIdentityKey().toDhPublicKey());
        byte[] dh3 = ephemeral.calculateAgreement(signedPreKey);
        byte[] dh4 = oneTimePreKey == null ? null : ephemeral.calculateAgreement(oneTimePreKey.publicKey());

        byte[] sharedSecret = deriveSharedSecret(dh1, dh2, dh3, dh4);
        return new X3dhResult(sharedSecret, ephemeral.getPublicKey(), oneTimePreKey == null ? null : oneTimePreKey.id(), theirBundle.getSignedPreKey().id());
    }

    /**
     * Computes the responder's shared secret from its own pre-keys and the initiator's identity and ephemeral keys.
     */
    public static byte[] respond(IdentityKeyPair ourIdentity, SignedPreKey ourSignedPreKey, @Nullable PreKey ourOneTimePreKey,
                                 IdentityPublicKey theirIdentity, DhPublicKey theirEphemeral) throws InvalidKeyMaterialException {
        byte[] dh1 = ourSignedPreKey.getKeyPair().calculateAgreement(theirIdentity.toDhPublicKey());
        byte[] dh2 = ourIdentity.calculateAgreement(theirEphemeral);
        byte[] dh3 = ourSignedPreKey.getKeyPair().calculateAgreement(theirEphemeral);
        byte[] dh4 = ourOneTimePreKey == null ? null : ourOneTimePreKey.getKeyPair().calculateAgreement(theirEphemeral);

        return deriveSharedSecret(dh1, dh2, dh3, dh4);
    }

    private static byte[] deriveSharedSecret(byte[] dh1, byte[] dh2, byte[] dh3, @Nullable byte[] dh4) {
        ByteArrayOutputStream input = new ByteArrayOutputStream();
        byte[] discontinuity = new byte[DISCONTINUITY_LENGTH];
        Arrays.fill(discontinuity, (byte)0xFF);
        input.writeBytes(discontinuity);
        input.writeBytes(dh1);
        input.writeBytes(dh2);
        input.writeBytes(dh3);
        if(dh4 != null) {
            input.writeBytes(dh4);
        }

        byte[] keyMaterial = input.toByteArray();
        try {
            return Hkdf.deriveSecrets(keyMaterial, SALT, INFO, SHARED_SECRET_LENGTH);
        } finally {
            Arrays.fill(keyMaterial, (byte)0);
            Arrays.fill(dh1, (byte)0);
            Arrays.fill(dh2, (byte)0);
            Arrays.fill(dh3, (byte)0);
            if(dh4 != null) {
                Arrays.fill(dh4, (byte)0);
            }
        }
    }
}
