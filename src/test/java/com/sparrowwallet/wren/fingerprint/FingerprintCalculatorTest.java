package com.sparrowwallet.wren.fingerprint;

import com.sparrowwallet.wren.crypto.IdentityKeyPair;
import com.sparrowwallet.wren.crypto.IdentityPublicKey;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FingerprintCalculatorTest {
    private final IdentityPublicKey alice = IdentityKeyPair.generate().getPublicKey();
    private final IdentityPublicKey bob = IdentityKeyPair.generate().getPublicKey();

    @Test
    public void testSymmetric() {
        String aliceView = FingerprintCalculator.calculate(alice, "alice", bob, "bob");
        String bobView = FingerprintCalculator.calculate(bob, "bob", alice, "alice");
        assertEquals(aliceView, bobView);
    }

    @Test
    public void testFormat() {
        String fingerprint = FingerprintCalculator.calculate(alice, "alice", bob, "bob");
        String[] groups = fingerprint.split(" ");
        assertEquals(FingerprintCalculator.GROUPS, groups.length);
        for(String group : groups) {
            assertTrue(group.matches("\\d{5}"), group);
        }
    }

    @Test
    public void testDeterministic() {
        assertEquals(FingerprintCalculator.calculate(alice, "alice", bob, "bob"), FingerprintCalculator.calculate(alice, "alice", bob, "bob"));
    }

    @Test
    public void testDifferentKeysDifferentNumbers() {
        IdentityPublicKey mallory = IdentityKeyPair.generate().getPublicKey();
        assertNotEquals(FingerprintCalculator.calculate(alice, "alice", bob, "bob"), FingerprintCalculator.calculate(alice, "alice", mallory, "bob"));
    }

    @Test
    public void testEqualLabelsStillSymmetric() {
        assertEquals(FingerprintCalculator.calculate(alice, "same", bob, "same"), FingerprintCalculator.calculate(bob, "same", alice, "same"));
    }
}
