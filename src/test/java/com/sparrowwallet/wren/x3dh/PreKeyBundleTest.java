package com.sparrowwallet.wren.x3dh;

import com.sparrowwallet.wren.MalformedMessageException;
import com.sparrowwallet.wren.VerificationFailureException;
import com.sparrowwallet.wren.crypto.IdentityKeyPair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class PreKeyBundleTest {
    private IdentityKeyPair identity;
    private SignedPreKey signedPreKey;
    private PreKeyBundle bundle;

    @BeforeEach
    public void setUp() throws Exception {
        identity = IdentityKeyPair.generate();
        signedPreKey = SignedPreKey.generate(5, identity);
        bundle = new PreKeyBundle(4321, 2, PreKey.generate(9).getPublicPreKey(), signedPreKey.getSignedPublicPreKey(), identity.getPublicKey());
    }

    @Test
    public void testSerializedBundleVerifies() throws Exception {
        byte[] serialized = bundle.serialize();
        assertEquals(4 + 4 + 1 + 4 + 32 + 4 + 32 + 64 + 32, serialized.length);

        PreKeyBundle parsed = PreKeyBundle.deserialize(serialized);
        parsed.verify();
        assertEquals(4321, parsed.getRegistrationId());
        assertEquals(2, parsed.getDeviceId());
        assertEquals(9, parsed.getPreKey().orElseThrow().id());
        assertEquals(signedPreKey.getSignedPublicPreKey(), parsed.getSignedPreKey());
        assertEquals(identity.getPublicKey(), parsed.getIdentityKey());
    }

    @Test
    public void testBundleWithoutPreKey() throws Exception {
        PreKeyBundle withoutPreKey = new PreKeyBundle(4321, 2, null, signedPreKey.getSignedPublicPreKey(), identity.getPublicKey());
        PreKeyBundle parsed = PreKeyBundle.deserialize(withoutPreKey.serialize());

        assertTrue(parsed.getPreKey().isEmpty());
        parsed.verify();
    }

    @Test
    public void testBitFlipInSignedPreKeyFailsVerification() throws Exception {
        byte[] serialized = bundle.serialize();
        int signedPreKeyOffset = 4 + 4 + 1 + 4 + 32 + 4;

        for(int offset : new int[] {signedPreKeyOffset, signedPreKeyOffset + 31, signedPreKeyOffset + 32, signedPreKeyOffset + 95}) {
            byte[] flipped = Arrays.copyOf(serialized, serialized.length);
            flipped[offset] ^= 0x04;
            PreKeyBundle parsed;
            try {
                parsed = PreKeyBundle.deserialize(flipped);
            } catch(MalformedMessageException e) {
                continue;
            }
            assertThrows(VerificationFailureException.class, parsed::verify);
        }
    }

    @Test
    public void testMalformedBundlesRejected() {
        byte[] serialized = bundle.serialize();

        assertThrows(MalformedMessageException.class, () -> PreKeyBundle.deserialize(Arrays.copyOf(serialized, serialized.length - 1)));
        assertThrows(MalformedMessageException.class, () -> PreKeyBundle.deserialize(Arrays.copyOf(serialized, serialized.length + 3)));
        assertThrows(MalformedMessageException.class, () -> PreKeyBundle.deserialize(new byte[0]));

        byte[] badFlag = Arrays.copyOf(serialized, serialized.length);
        badFlag[8] = 2;
        assertThrows(MalformedMessageException.class, () -> PreKeyBundle.deserialize(badFlag));
    }

    @Test
    public void testPreKeyRecordsRoundTrip() throws Exception {
        PreKey preKey = PreKey.generate(77);
        PreKey restored = PreKey.deserialize(preKey.serialize());
        assertEquals(77, restored.getId());
        assertEquals(preKey.getKeyPair().getPublicKey(), restored.getKeyPair().getPublicKey());

        SignedPreKey restoredSigned = SignedPreKey.deserialize(signedPreKey.serialize());
        assertEquals(signedPreKey.getSignedPublicPreKey(), restoredSigned.getSignedPublicPreKey());
        assertEquals(signedPreKey.getTimestamp(), restoredSigned.getTimestamp());

        byte[] corrupt = preKey.serialize();
        corrupt[40] ^= 0x01;
        assertThrows(Exception.class, () -> PreKey.deserialize(corrupt));
    }
}
