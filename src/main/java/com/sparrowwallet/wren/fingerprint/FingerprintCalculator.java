package com.sparrowwallet.wren.fingerprint;

import com.sparrowwallet.wren.crypto.IdentityPublicKey;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * Computes the safety number two users compare to check that they hold each other's real identity keys. Both sides
 * compute the same value regardless of which is local.
 */
public class FingerprintCalculator {
    public static final int ITERATIONS = 5199;
    public static final int GROUPS = 12;

    private static final int BYTES_PER_GROUP = 5;
    private static final long GROUP_MODULUS = 100000;

    private FingerprintCalculator() {
    }

    /**
     * @return twelve space separated groups of five digits
     */
    public static String calculate(IdentityPublicKey localIdentity, String localLabel, IdentityPublicKey remoteIdentity, String remoteLabel) {
        byte[] localLabelBytes = localLabel.getBytes(StandardCharsets.UTF_8);
        byte[] remoteLabelBytes = remoteLabel.getBytes(StandardCharsets.UTF_8);
        byte[] localKey = localIdentity.serialize();
        byte[] remoteKey = remoteIdentity.serialize();

        int order = Arrays.compareUnsigned(localLabelBytes, remoteLabelBytes);
        if(order == 0) {
            order = Arrays.compareUnsigned(localKey, remoteKey);
        }

        boolean localFirst = order <= 0;
        byte[] firstLabel = localFirst ? localLabelBytes : remoteLabelBytes;
        byte[] firstKey = localFirst ? localKey : remoteKey;
        byte[] secondLabel = localFirst ? remoteLabelBytes : localLabelBytes;
        byte[] secondKey = localFirst ? remoteKey : localKey;

        MessageDigest digest = getDigest();
        digest.update(firstLabel);
        digest.update(firstKey);
        digest.update(secondLabel);
        digest.update(secondKey);
        byte[] hash = digest.digest();

        for(int i = 0; i < ITERATIONS; i++) {
            digest.update(hash);
            digest.update(firstKey);
            digest.update(secondKey);
            hash = digest.digest();
        }

        return format(hash);
    }

    private static String format(byte[] hash) {
        StringBuilder builder = new StringBuilder();
        for(int i = 0; i < GROUPS; i++) {
            if(i > 0) {
                builder.append(' ');
            }

            long chunk = new BigInteger(1, Arrays.copyOfRange(hash, i * BYTES_PER_GROUP, (i + 1) * BYTES_PER_GROUP)).longValueExact();
            builder.append(String.format("%05d", chunk % GROUP_MODULUS));
        }

        return builder.toString();
    }

    private static MessageDigest getDigest() {
        try {
            return MessageDigest.getInstance("SHA-512");
        } catch(NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-512 is required on every Java platform", e);
        }
    }
}
