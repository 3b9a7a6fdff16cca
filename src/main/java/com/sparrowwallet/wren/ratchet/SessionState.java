package com.sparrowwallet.wren.ratchet;

import com.sparrowwallet.wren.*;
import com.sparrowwallet.wren.crypto.AesGcmCipher;
import com.sparrowwallet.wren.crypto.Curve25519;
import com.sparrowwallet.wren.crypto.DhKeyPair;
import com.sparrowwallet.wren.crypto.DhPublicKey;
import com.sparrowwallet.wren.util.ByteStreamParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.crypto.AEADBadTagException;
import javax.security.auth.Destroyable;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.util.*;

/**
 * Double ratchet state for a session with one peer device.
 * <p>
 * Every transition runs on a working copy of the state and is committed only when it completes, so a failed
 * {@link #encrypt(byte[])} or {@link #decrypt(RatchetMessage)} leaves the session exactly as it was. Key material
 * replaced by a committed transition is zeroed.
 *
 * @see <a href="https://signal.org/docs/specifications/doubleratchet/">The Double Ratchet Algorithm</a>
 */
public final class SessionState implements Destroyable {
    private static final Logger log = LoggerFactory.getLogger(SessionState.class);

    public static final int MAX_SKIP = 1000;
    public static final int MAX_SKIPPED_KEYS = 2000;
    public static final Duration DEFAULT_SKIPPED_KEY_MAX_AGE = Duration.ofDays(7);

    private static final int SERIALIZATION_VERSION = 1;

    private DhKeyPair dhSelf;
    private DhPublicKey dhRemote;
    private RootKey rootKey;
    private ChainKey sendingChainKey;
    private ChainKey receivingChainKey;
    private int sendingCounter;
    private int receivingCounter;
    private int previousCounter;
    private LinkedHashMap<SkippedKeyId, SkippedKey> skippedKeys;

    private transient Duration skippedKeyMaxAge = DEFAULT_SKIPPED_KEY_MAX_AGE;
    private transient Clock clock = Clock.systemUTC();

    private SessionState(DhKeyPair dhSelf, @Nullable DhPublicKey dhRemote, RootKey rootKey) {
        this.dhSelf = dhSelf;
        this.dhRemote = dhRemote;
        this.rootKey = rootKey;
        this.skippedKeys = new LinkedHashMap<>();
    }

    /**
     * Creates the initiator's state. One DH ratchet step against the responder's signed pre-key produces the first
     * sending chain, so the initiator can send immediately.
     *
     * @param sharedSecret the 32-byte X3DH output
     * @param ourRatchetKey the initiator's first ratchet key pair, owned by the session from here on
     * @param theirRatchetKey the responder's signed pre-key
     */
    public static SessionState initializeAlice(byte[] sharedSecret, DhKeyPair ourRatchetKey, DhPublicKey theirRatchetKey) throws InvalidKeyMaterialException {
        RootKey initialRoot = new RootKey(Arrays.copyOf(sharedSecret, RootKey.LENGTH));
        try {
            RootKey.Step step = initialRoot.createChain(ourRatchetKey, theirRatchetKey);
            SessionState state = new SessionState(ourRatchetKey, theirRatchetKey, step.rootKey());
            state.sendingChainKey = step.chainKey();
            return state;
        } finally {
            initialRoot.destroy();
        }
    }

    /**
     * Creates the responder's state. There are no chains until the initiator's first message arrives and triggers a DH
     * ratchet step.
     *
     * @param sharedSecret the 32-byte X3DH output
     * @param ourRatchetKey the responder's signed pre-key pair; the initiator's first ratchet step agrees against it
     */
    public static SessionState initializeBob(byte[] sharedSecret, DhKeyPair ourRatchetKey) {
        return new SessionState(ourRatchetKey, null, new RootKey(Arrays.copyOf(sharedSecret, RootKey.LENGTH)));
    }

    public RatchetMessage encrypt(byte[] plaintext) throws NoSendingChainException, InvalidKeyMaterialException {
        if(sendingChainKey == null) {
            throw new NoSendingChainException();
        }

        SessionState working = copy();
        RatchetMessage message;
        try {
            message = working.encryptInPlace(plaintext);
        } catch(NoSendingChainException | InvalidKeyMaterialException | RuntimeException e) {
            working.destroy();
            throw e;
        }

        commit(working);
        return message;
    }

    /**
     * Decrypts a message, performing a DH ratchet step when the sender's ratchet key is new and storing keys for any
     * messages skipped on the way.
     *
     * @throws DecryptionFailureException if authentication fails, or the message was already received or its key discarded
     * @throws TooManySkippedMessagesException if the message is more than {@link #MAX_SKIP} messages ahead
     * @throws NoReceivingChainException if the message names the current remote key but no receiving chain exists
     */
    public byte[] decrypt(RatchetMessage message) throws DecryptionFailureException, TooManySkippedMessagesException, NoReceivingChainException, InvalidKeyMaterialException {
        SessionState working = copy();
        byte[] plaintext;
        try {
            working.cleanupSkippedKeys(skippedKeyMaxAge);
            plaintext = working.decryptInPlace(message);
        } catch(DecryptionFailureException | TooManySkippedMessagesException | NoReceivingChainException | InvalidKeyMaterialException | RuntimeException e) {
            working.destroy();
            throw e;
        }

        commit(working);
        return plaintext;
    }

    private RatchetMessage encryptInPlace(byte[] plaintext) throws NoSendingChainException, InvalidKeyMaterialException {
        if(sendingChainKey == null) {
            throw new NoSendingChainException();
        }

        MessageHeader header = new MessageHeader(dhSelf.getPublicKey(), previousCounter, sendingCounter);
        MessageKeys messageKeys = sendingChainKey.getMessageKeys();
        try {
            byte[] ciphertext = AesGcmCipher.encrypt(messageKeys.getCipherKey(), messageKeys.getNonce(), header.serialize(), plaintext);
            advanceSendingChain();
            sendingCounter++;

            if(log.isDebugEnabled()) {
                log.debug("Encrypted message " + Integer.toUnsignedString(header.messageCounter()) + " on chain " + header.ratchetKey());
            }

            return new RatchetMessage(header, ciphertext);
        } finally {
            messageKeys.destroy();
        }
    }

    private byte[] decryptInPlace(RatchetMessage message) throws DecryptionFailureException, TooManySkippedMessagesException, NoReceivingChainException, InvalidKeyMaterialException {
        MessageHeader header = message.getHeader();

        SkippedKey skippedKey = skippedKeys.remove(new SkippedKeyId(header.ratchetKey(), header.messageCounter()));
        if(skippedKey != null) {
            try {
                if(log.isDebugEnabled()) {
                    log.debug("Using skipped key for message " + Integer.toUnsignedString(header.messageCounter()) + " on chain " + header.ratchetKey());
                }
                return decryptWithKeys(skippedKey.getMessageKeys(), message);
            } finally {
                skippedKey.destroy();
            }
        }

        if(!header.ratchetKey().equals(dhRemote)) {
            if(receivingChainKey != null) {
                skipMessageKeys(header.previousCounter());
            }
            dhRatchet(header.ratchetKey());
        } else if(receivingChainKey == null) {
            throw new NoReceivingChainException("No receiving chain for ratchet key " + header.ratchetKey());
        }

        if(Integer.compareUnsigned(header.messageCounter(), receivingCounter) < 0) {
            throw new DecryptionFailureException("Message " + Integer.toUnsignedString(header.messageCounter()) + " was already received or its key has been discarded");
        }

        skipMessageKeys(header.messageCounter());

        MessageKeys messageKeys = receivingChainKey.getMessageKeys();
        try {
            byte[] plaintext = decryptWithKeys(messageKeys, message);
            advanceReceivingChain();
            receivingCounter = header.messageCounter() + 1;
            return plaintext;
        } finally {
            messageKeys.destroy();
        }
    }

    private byte[] decryptWithKeys(MessageKeys messageKeys, RatchetMessage message) throws DecryptionFailureException, InvalidKeyMaterialException {
        try {
            return AesGcmCipher.decrypt(messageKeys.getCipherKey(), messageKeys.getNonce(), message.getHeader().serialize(), message.getCiphertext());
        } catch(AEADBadTagException e) {
            throw new DecryptionFailureException("Message authentication failed", e);
        }
    }

    /**
     * Derives and stores message keys on the current receiving chain up to, but not including, the given counter.
     */
    private void skipMessageKeys(int until) throws TooManySkippedMessagesException {
        if(receivingChainKey == null) {
            return;
        }

        long gap = Integer.toUnsignedLong(until) - Integer.toUnsignedLong(receivingCounter);
        if(gap > MAX_SKIP) {
            throw new TooManySkippedMessagesException(gap, MAX_SKIP);
        }

        long now = clock.millis();
        while(Integer.compareUnsigned(receivingCounter, until) < 0) {
            skippedKeys.put(new SkippedKeyId(dhRemote, receivingCounter), new SkippedKey(receivingChainKey.getMessageKeys(), now));
            advanceReceivingChain();
            receivingCounter++;
        }

        evictExcessSkippedKeys();
    }

    private void evictExcessSkippedKeys() {
        Iterator<SkippedKey> iterator = skippedKeys.values().iterator();
        int excess = skippedKeys.size() - MAX_SKIPPED_KEYS;
        while(excess > 0 && iterator.hasNext()) {
            iterator.next().destroy();
            iterator.remove();
            excess--;
        }
    }

    private void dhRatchet(DhPublicKey theirRatchetKey) throws InvalidKeyMaterialException {
        previousCounter = sendingCounter;
        sendingCounter = 0;
        receivingCounter = 0;
        dhRemote = theirRatchetKey;

        RootKey.Step receivingStep = rootKey.createChain(dhSelf, dhRemote);
        replaceRootKey(receivingStep.rootKey());
        replaceReceivingChain(receivingStep.chainKey());

        DhKeyPair newRatchetKey = DhKeyPair.generate();
        RootKey.Step sendingStep = rootKey.createChain(newRatchetKey, dhRemote);
        replaceRootKey(sendingStep.rootKey());
        replaceSendingChain(sendingStep.chainKey());

        dhSelf.destroy();
        dhSelf = newRatchetKey;

        if(log.isDebugEnabled()) {
            log.debug("Performed DH ratchet step to remote key " + theirRatchetKey);
        }
    }

    private void advanceSendingChain() {
        replaceSendingChain(sendingChainKey.getNextChainKey());
    }

    private void advanceReceivingChain() {
        replaceReceivingChain(receivingChainKey.getNextChainKey());
    }

    private void replaceRootKey(RootKey next) {
        rootKey.destroy();
        rootKey = next;
    }

    private void replaceSendingChain(ChainKey next) {
        if(sendingChainKey != null) {
            sendingChainKey.destroy();
        }
        sendingChainKey = next;
    }

    private void replaceReceivingChain(ChainKey next) {
        if(receivingChainKey != null) {
            receivingChainKey.destroy();
        }
        receivingChainKey = next;
    }

    /**
     * Discards skipped message keys stored longer ago than the given age.
     *
     * @return the number of keys discarded
     */
    public int cleanupSkippedKeys(Duration maxAge) {
        long cutoff = clock.millis() - maxAge.toMillis();
        int removed = 0;
        for(Iterator<SkippedKey> iter = skippedKeys.values().iterator(); iter.hasNext(); ) {
            SkippedKey skippedKey = iter.next();
            if(skippedKey.getTimestamp() < cutoff) {
                skippedKey.destroy();
                iter.remove();
                removed++;
            }
        }

        if(removed > 0) {
            log.info("Discarded " + removed + " expired skipped message keys");
        }

        return removed;
    }

    /**
     * Sets how long skipped keys are kept and the clock used to timestamp and expire them. Neither is persisted.
     */
    public void setSkippedKeyPolicy(Duration maxAge, Clock clock) {
        this.skippedKeyMaxAge = Objects.requireNonNull(maxAge);
        this.clock = Objects.requireNonNull(clock);
    }

    private void commit(SessionState working) {
        SessionState replaced = new SessionState(dhSelf, dhRemote, rootKey);
        replaced.sendingChainKey = sendingChainKey;
        replaced.receivingChainKey = receivingChainKey;
        replaced.skippedKeys = skippedKeys;

        dhSelf = working.dhSelf;
        dhRemote = working.dhRemote;
        rootKey = working.rootKey;
        sendingChainKey = working.sendingChainKey;
        receivingChainKey = working.receivingChainKey;
        sendingCounter = working.sendingCounter;
        receivingCounter = working.receivingCounter;
        previousCounter = working.previousCounter;
        skippedKeys = working.skippedKeys;

        replaced.destroy();
    }

    /**
     * Returns a deep copy sharing no key material with this state.
     */
    public SessionState copy() {
        SessionState copy = new SessionState(dhSelf.copy(), dhRemote, rootKey.copy());
        copy.sendingChainKey = sendingChainKey == null ? null : sendingChainKey.copy();
        copy.receivingChainKey = receivingChainKey == null ? null : receivingChainKey.copy();
        copy.sendingCounter = sendingCounter;
        copy.receivingCounter = receivingCounter;
        copy.previousCounter = previousCounter;
        for(Map.Entry<SkippedKeyId, SkippedKey> entry : skippedKeys.entrySet()) {
            copy.skippedKeys.put(entry.getKey(), entry.getValue().copy());
        }
        copy.skippedKeyMaxAge = skippedKeyMaxAge;
        copy.clock = clock;
        return copy;
    }

    public SessionPhase getPhase() {
        if(sendingChainKey == null) {
            return SessionPhase.RESPONDER_PENDING;
        }

        return receivingChainKey == null ? SessionPhase.INITIATOR_ESTABLISHED : SessionPhase.BIDIRECTIONAL;
    }

    public DhPublicKey getOurRatchetKey() {
        return dhSelf.getPublicKey();
    }

    public Optional<DhPublicKey> getRemoteRatchetKey() {
        return Optional.ofNullable(dhRemote);
    }

    public boolean hasSendingChain() {
        return sendingChainKey != null;
    }

    public boolean hasReceivingChain() {
        return receivingChainKey != null;
    }

    public long getSendingCounter() {
        return Integer.toUnsignedLong(sendingCounter);
    }

    public long getReceivingCounter() {
        return Integer.toUnsignedLong(receivingCounter);
    }

    public long getPreviousCounter() {
        return Integer.toUnsignedLong(previousCounter);
    }

    public int getSkippedKeyCount() {
        return skippedKeys.size();
    }

    public boolean hasSkippedKey(DhPublicKey ratchetKey, int counter) {
        return skippedKeys.containsKey(new SkippedKeyId(ratchetKey, counter));
    }

    /**
     * Encodes the complete state, including private keys and the skipped key table. The result is secret.
     */
    public byte[] serialize() {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        baos.write(SERIALIZATION_VERSION);

        byte[] privateKey = dhSelf.getPrivateKeyBytes();
        baos.writeBytes(privateKey);
        Arrays.fill(privateKey, (byte)0);
        baos.writeBytes(dhSelf.getPublicKey().getBytes());
        writeOptional(baos, dhRemote == null ? null : dhRemote.getBytes());
        baos.writeBytes(rootKey.getKey());
        writeOptional(baos, sendingChainKey == null ? null : sendingChainKey.getKey());
        writeOptional(baos, receivingChainKey == null ? null : receivingChainKey.getKey());
        baos.writeBytes(ByteBuffer.allocate(16).putInt(sendingCounter).putInt(receivingCounter).putInt(previousCounter).putInt(skippedKeys.size()).array());

        for(Map.Entry<SkippedKeyId, SkippedKey> entry : skippedKeys.entrySet()) {
            MessageKeys messageKeys = entry.getValue().getMessageKeys();
            baos.writeBytes(entry.getKey().ratchetKey().getBytes());
            baos.writeBytes(ByteBuffer.allocate(4).putInt(entry.getKey().counter()).array());
            baos.writeBytes(messageKeys.getCipherKey());
            baos.writeBytes(messageKeys.getMacKey());
            baos.writeBytes(messageKeys.getIv());
            baos.writeBytes(ByteBuffer.allocate(8).putLong(entry.getValue().getTimestamp()).array());
        }

        return baos.toByteArray();
    }

    public static SessionState deserialize(byte[] data) throws MalformedMessageException, InvalidKeyMaterialException {
        ByteStreamParser parser = new ByteStreamParser(data, "SessionState");
        int version = parser.readUint8();
        if(version != SERIALIZATION_VERSION) {
            throw new MalformedMessageException("Unsupported session state version " + version);
        }

        byte[] privateKey = parser.readBytes(Curve25519.KEY_LENGTH);
        DhKeyPair dhSelf;
        try {
            dhSelf = DhKeyPair.fromPrivateKey(privateKey);
        } finally {
            Arrays.fill(privateKey, (byte)0);
        }
        if(!dhSelf.getPublicKey().equals(DhPublicKey.fromBytes(parser.readBytes(Curve25519.KEY_LENGTH)))) {
            dhSelf.destroy();
            throw new InvalidKeyMaterialException("Session ratchet public key does not match private key");
        }

        byte[] remote = readOptional(parser, Curve25519.KEY_LENGTH);
        SessionState state = new SessionState(dhSelf, remote == null ? null : DhPublicKey.fromBytes(remote), new RootKey(parser.readBytes(RootKey.LENGTH)));
        byte[] sending = readOptional(parser, ChainKey.LENGTH);
        state.sendingChainKey = sending == null ? null : new ChainKey(sending);
        byte[] receiving = readOptional(parser, ChainKey.LENGTH);
        state.receivingChainKey = receiving == null ? null : new ChainKey(receiving);
        state.sendingCounter = parser.readInt();
        state.receivingCounter = parser.readInt();
        state.previousCounter = parser.readInt();

        long skippedCount = parser.readUint32();
        if(skippedCount > MAX_SKIPPED_KEYS) {
            throw new MalformedMessageException("Session state has " + skippedCount + " skipped keys, limit is " + MAX_SKIPPED_KEYS);
        }
        for(long i = 0; i < skippedCount; i++) {
            DhPublicKey ratchetKey = DhPublicKey.fromBytes(parser.readBytes(Curve25519.KEY_LENGTH));
            int counter = parser.readInt();
            MessageKeys messageKeys = new MessageKeys(parser.readBytes(MessageKeys.CIPHER_KEY_LENGTH), parser.readBytes(MessageKeys.MAC_KEY_LENGTH), parser.readBytes(MessageKeys.IV_LENGTH));
            long timestamp = parser.readLong();
            state.skippedKeys.put(new SkippedKeyId(ratchetKey, counter), new SkippedKey(messageKeys, timestamp));
        }
        parser.assertEmpty();

        return state;
    }

    private static void writeOptional(ByteArrayOutputStream baos, @Nullable byte[] value) {
        if(value == null) {
            baos.write(0);
        } else {
            baos.write(1);
            baos.writeBytes(value);
        }
    }

    @Nullable
    private static byte[] readOptional(ByteStreamParser parser, int length) throws MalformedMessageException {
        return parser.readFlag() ? parser.readBytes(length) : null;
    }

    @Override
    public void destroy() {
        dhSelf.destroy();
        rootKey.destroy();
        if(sendingChainKey != null) {
            sendingChainKey.destroy();
        }
        if(receivingChainKey != null) {
            receivingChainKey.destroy();
        }
        skippedKeys.values().forEach(SkippedKey::destroy);
        skippedKeys.clear();
    }

    @Override
    public boolean isDestroyed() {
        return dhSelf.isDestroyed();
    }

    @Override
    public String toString() {
        return "SessionState{phase=" + getPhase() + ", ourRatchetKey=" + dhSelf.getPublicKey() + ", remoteRatchetKey=" + dhRemote +
                ", sendingCounter=" + getSendingCounter() + ", receivingCounter=" + getReceivingCounter() + ", skippedKeys=" + skippedKeys.size() + "}";
    }

    private record SkippedKeyId(DhPublicKey ratchetKey, int counter) {
    }
}
