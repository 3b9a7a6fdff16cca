package com.sparrowwallet.wren;

import com.sparrowwallet.wren.crypto.DhKeyPair;
import com.sparrowwallet.wren.crypto.IdentityKeyPair;
import com.sparrowwallet.wren.crypto.IdentityPublicKey;
import com.sparrowwallet.wren.fingerprint.FingerprintCalculator;
import com.sparrowwallet.wren.ratchet.RatchetMessage;
import com.sparrowwallet.wren.ratchet.SessionPhase;
import com.sparrowwallet.wren.ratchet.SessionState;
import com.sparrowwallet.wren.store.LocalIdentity;
import com.sparrowwallet.wren.store.ProtocolStore;
import com.sparrowwallet.wren.x3dh.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The main interface to the library. Manages this device's identity and pre-keys, establishes sessions with peers
 * through X3DH and encrypts and decrypts messages with each session's double ratchet.
 * <p>
 * Every mutation is written to the {@link ProtocolStore} before it becomes visible in memory, so an operation that
 * fails, including on a store error, leaves the engine as it was. Operations on different peers run concurrently;
 * operations on the same peer are serialized.
 */
public class ProtocolEngine implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(ProtocolEngine.class);

    public static final int MAX_PRE_KEY_ID = 0xFFFFFF;
    public static final int REGISTRATION_ID_MASK = 0x3FFF;

    private static final SecureRandom random = new SecureRandom();

    private final ProtocolStore store;
    private final EngineConfig config;
    private final Clock clock;
    private final IdentityKeyPair identityKeyPair;
    private final int registrationId;

    private final ConcurrentNavigableMap<Integer, PreKey> preKeys = new ConcurrentSkipListMap<>();
    private final Object preKeyLock = new Object();
    private int nextPreKeyId = 1;
    private volatile SignedPreKey signedPreKey;

    private final ConcurrentHashMap<ProtocolAddress, SessionEntry> sessions = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, IdentityPublicKey> trustedIdentities = new ConcurrentHashMap<>();
    private final Object trustLock = new Object();

    ProtocolEngine(ProtocolStore store, EngineConfig config, Clock clock, IdentityKeyPair identityKeyPair, int registrationId) {
        this.store = store;
        this.config = config;
        this.clock = clock;
        this.identityKeyPair = identityKeyPair;
        this.registrationId = registrationId;
    }

    /**
     * Creates an engine with a freshly generated identity and registration id, persisting both.
     */
    public static ProtocolEngine create(ProtocolStore store) throws StoreException {
        return create(store, EngineConfig.DEFAULT);
    }

    public static ProtocolEngine create(ProtocolStore store, EngineConfig config) throws StoreException {
        return create(store, config, Clock.systemUTC());
    }

    static ProtocolEngine create(ProtocolStore store, EngineConfig config, Clock clock) throws StoreException {
        IdentityKeyPair identityKeyPair = IdentityKeyPair.generate();
        int registrationId = random.nextInt(REGISTRATION_ID_MASK) + 1;
        store.storeLocalIdentity(LocalIdentity.of(identityKeyPair, registrationId));

        log.info("Generated new identity " + identityKeyPair.getPublicKey() + " with registration id " + registrationId);

        return new ProtocolEngine(store, config, clock, identityKeyPair, registrationId);
    }

    /**
     * Restores an engine from a store holding a previously created identity, together with its pre-keys, signed
     * pre-key, sessions and trusted identities.
     *
     * @throws StoreException if the store has no identity or holds corrupt state
     */
    public static ProtocolEngine load(ProtocolStore store) throws StoreException {
        return load(store, EngineConfig.DEFAULT);
    }

    public static ProtocolEngine load(ProtocolStore store, EngineConfig config) throws StoreException {
        return load(store, config, Clock.systemUTC());
    }

    static ProtocolEngine load(ProtocolStore store, EngineConfig config, Clock clock) throws StoreException {
        LocalIdentity localIdentity = store.getLocalIdentity().orElseThrow(() -> new StoreException("No local identity in store"));

        IdentityKeyPair identityKeyPair;
        try {
            identityKeyPair = localIdentity.toIdentityKeyPair();
        } catch(InvalidKeyMaterialException e) {
            throw new StoreException("Stored identity key is invalid", e);
        }

        ProtocolEngine engine = new ProtocolEngine(store, config, clock, identityKeyPair, localIdentity.registrationId());

        for(PreKey preKey : store.loadPreKeys()) {
            engine.preKeys.put(preKey.getId(), preKey);
        }
        if(!engine.preKeys.isEmpty()) {
            engine.nextPreKeyId = nextPreKeyId(engine.preKeys.lastKey());
        }

        engine.signedPreKey = store.loadSignedPreKey().orElse(null);

        for(Map.Entry<String, byte[]> entry : store.loadSessions().entrySet()) {
            ProtocolAddress address;
            SessionState state;
            try {
                address = ProtocolAddress.parse(entry.getKey());
                state = SessionState.deserialize(entry.getValue());
            } catch(IllegalArgumentException | MalformedMessageException | InvalidKeyMaterialException e) {
                throw new StoreException("Stored session for " + entry.getKey() + " is corrupt", e);
            }
            state.setSkippedKeyPolicy(config.skippedKeyMaxAge(), clock);
            engine.sessions.put(address, new SessionEntry(state));
        }

        engine.trustedIdentities.putAll(store.loadTrustedIdentities());

        log.info("Loaded identity " + identityKeyPair.getPublicKey() + " with " + engine.preKeys.size() + " pre-keys, " +
                engine.sessions.size() + " sessions and " + engine.trustedIdentities.size() + " trusted identities");

        return engine;
    }

    /**
     * Loads the engine from the store if it holds an identity, otherwise creates a new one.
     */
    public static ProtocolEngine open(ProtocolStore store, EngineConfig config) throws StoreException {
        if(store.getLocalIdentity().isPresent()) {
            return load(store, config);
        }

        return create(store, config);
    }

    public IdentityPublicKey getIdentityPublicKey() {
        return identityKeyPair.getPublicKey();
    }

    public int getRegistrationId() {
        return registrationId;
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * Generates and persists a batch of one-time pre-keys. Ids run from 1 to {@link #MAX_PRE_KEY_ID} and wrap back to 1,
     * skipping ids still held by unconsumed keys.
     *
     * @return the public halves, for publishing
     */
    public List<PublicPreKey> generatePreKeys(int count) throws StoreException {
        if(count < 0) {
            throw new IllegalArgumentException("Pre-key count cannot be negative");
        }

        synchronized(preKeyLock) {
            if(preKeys.size() + count > MAX_PRE_KEY_ID) {
                throw new IllegalStateException("Cannot hold more than " + MAX_PRE_KEY_ID + " pre-keys");
            }

            int startId = nextPreKeyId;
            List<PublicPreKey> generated = new ArrayList<>(count);
            for(int i = 0; i < count; i++) {
                while(preKeys.containsKey(nextPreKeyId)) {
                    nextPreKeyId = nextPreKeyId(nextPreKeyId);
                }

                PreKey preKey = PreKey.generate(nextPreKeyId);
                store.storePreKey(preKey);
                preKeys.put(preKey.getId(), preKey);
                generated.add(preKey.getPublicPreKey());
                nextPreKeyId = nextPreKeyId(nextPreKeyId);
            }

            log.info("Generated " + count + " pre-keys starting at " + startId);
            return generated;
        }
    }

    private static int nextPreKeyId(int id) {
        return id >= MAX_PRE_KEY_ID ? 1 : id + 1;
    }

    /**
     * Generates a signed pre-key and makes it the active one, replacing any previous signed pre-key.
     */
    public SignedPublicPreKey generateSignedPreKey(int id) throws StoreException {
        SignedPreKey generated;
        try {
            generated = SignedPreKey.generate(id, identityKeyPair);
        } catch(InvalidKeyMaterialException e) {
            throw new IllegalStateException("Identity key cannot sign", e);
        }

        store.storeSignedPreKey(generated);
        signedPreKey = generated;

        log.info("Generated signed pre-key " + id);
        return generated.getSignedPublicPreKey();
    }

    public Optional<SignedPublicPreKey> getSignedPreKey() {
        SignedPreKey current = signedPreKey;
        return current == null ? Optional.empty() : Optional.of(current.getSignedPublicPreKey());
    }

    public int getPreKeyCount() {
        return preKeys.size();
    }

    /**
     * Generates a batch of pre-keys if fewer than the configured low-water mark remain.
     *
     * @return the newly generated keys, or an empty list if none were needed
     */
    public List<PublicPreKey> refillPreKeysIfNeeded() throws StoreException {
        if(preKeys.size() < config.preKeyLowWaterMark()) {
            return generatePreKeys(config.preKeyBatchSize());
        }

        return Collections.emptyList();
    }

    /**
     * Assembles this device's bundle from the active signed pre-key and, when one is available, the one-time pre-key
     * with the lowest id. The one-time pre-key is not removed until an initial message uses it.
     */
    public PreKeyBundle createPreKeyBundle(int deviceId) throws NoSignedPreKeyException {
        SignedPreKey current = signedPreKey;
        if(current == null) {
            throw new NoSignedPreKeyException();
        }

        Map.Entry<Integer, PreKey> first = preKeys.firstEntry();
        PublicPreKey preKey = first == null ? null : first.getValue().getPublicPreKey();
        if(preKey == null) {
            log.warn("No one-time pre-keys available, bundle contains signed pre-key only");
        }

        return new PreKeyBundle(registrationId, deviceId, preKey, current.getSignedPublicPreKey(), identityKeyPair.getPublicKey());
    }

    /**
     * Establishes a session with a peer from its bundle. The peer's identity is trusted on first use; a bundle whose
     * identity differs from an already trusted one is rejected.
     */
    public void processPreKeyBundle(ProtocolAddress address, PreKeyBundle bundle) throws ProtocolException {
        SessionState state = initiateSession(address, bundle).state();
        boolean newlyTrusted = false;
        try {
            newlyTrusted = trustOnFirstUse(address.getName(), bundle.getIdentityKey());
            installSession(address, state);
        } catch(StoreException | RuntimeException e) {
            state.destroy();
            if(newlyTrusted) {
                revokeFirstUseTrust(address.getName(), bundle.getIdentityKey(), e);
            }
            throw e;
        }

        log.info("Established session with " + address);
    }

    /**
     * Establishes a session with a peer from its bundle and encrypts the first message. The result carries the X3DH
     * parameters so that the peer can establish its side with {@link #decryptInitial(ProtocolAddress, byte[])}.
     */
    public byte[] encryptInitial(ProtocolAddress address, PreKeyBundle bundle, byte[] plaintext) throws ProtocolException {
        InitiatedSession initiated = initiateSession(address, bundle);
        SessionState state = initiated.state();

        RatchetMessage message;
        boolean newlyTrusted = false;
        try {
            message = state.encrypt(plaintext);
            newlyTrusted = trustOnFirstUse(address.getName(), bundle.getIdentityKey());
            installSession(address, state);
        } catch(ProtocolException | RuntimeException e) {
            state.destroy();
            if(newlyTrusted) {
                revokeFirstUseTrust(address.getName(), bundle.getIdentityKey(), e);
            }
            throw e;
        }

        X3dhResult result = initiated.result();
        InitialMessage initialMessage = new InitialMessage(identityKeyPair.getPublicKey(), result.ephemeralPublicKey(), result.usedPreKeyId(), result.signedPreKeyId(), message);

        log.info("Created initial message for " + address + (result.usedPreKeyId() == null ? " without one-time pre-key" : " using pre-key " + result.usedPreKeyId()));

        return initialMessage.serialize();
    }

    private InitiatedSession initiateSession(ProtocolAddress address, PreKeyBundle bundle) throws ProtocolException {
        bundle.verify();
        checkIdentity(address.getName(), bundle.getIdentityKey());

        X3dhResult result = X3dh.initiate(identityKeyPair, bundle);
        try {
            SessionState state = SessionState.initializeAlice(result.sharedSecret(), DhKeyPair.generate(), bundle.getSignedPreKey().publicKey());
            state.setSkippedKeyPolicy(config.skippedKeyMaxAge(), clock);
            return new InitiatedSession(result, state);
        } finally {
            Arrays.fill(result.sharedSecret(), (byte)0);
        }
    }

    /**
     * Encrypts a message on an established session.
     *
     * @return a serialized ratchet message
     * @throws UnknownSessionException if there is no session with the address
     */
    public byte[] encrypt(ProtocolAddress address, byte[] plaintext) throws ProtocolException {
        SessionEntry entry = sessions.get(address);
        if(entry == null) {
            throw new UnknownSessionException(address);
        }

        entry.lock.lock();
        try {
            if(entry.state == null) {
                throw new UnknownSessionException(address);
            }

            SessionState working = entry.state.copy();
            try {
                RatchetMessage message = working.encrypt(plaintext);
                store.storeSession(address.toString(), working.serialize());
                commit(entry, working);

                if(log.isDebugEnabled()) {
                    log.debug("Encrypted message " + Integer.toUnsignedString(message.getHeader().messageCounter()) + " for " + address);
                }

                return message.serialize();
            } catch(ProtocolException | RuntimeException e) {
                working.destroy();
                throw e;
            }
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Decrypts a ratchet message on an established session.
     *
     * @throws UnknownSessionException if there is no session with the address
     * @throws MalformedMessageException if the ciphertext cannot be parsed
     * @throws DecryptionFailureException if the message fails authentication or was already received
     */
    public byte[] decrypt(ProtocolAddress address, byte[] ciphertext) throws ProtocolException {
        RatchetMessage message = RatchetMessage.deserialize(ciphertext);

        SessionEntry entry = sessions.get(address);
        if(entry == null) {
            throw new UnknownSessionException(address);
        }

        entry.lock.lock();
        try {
            if(entry.state == null) {
                throw new UnknownSessionException(address);
            }

            SessionState working = entry.state.copy();
            try {
                byte[] plaintext = working.decrypt(message);
                store.storeSession(address.toString(), working.serialize());
                commit(entry, working);

                if(log.isDebugEnabled()) {
                    log.debug("Decrypted message " + Integer.toUnsignedString(message.getHeader().messageCounter()) + " from " + address);
                }

                return plaintext;
            } catch(ProtocolException | RuntimeException e) {
                working.destroy();
                if(e instanceof ProtocolException) {
                    log.warn("Rejected message from " + address + ": " + e.getMessage());
                }
                throw e;
            }
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Establishes the responder side of a session from an initial message and decrypts its payload. The one-time
     * pre-key it names is consumed; a second message naming the same pre-key fails with {@link UnknownPreKeyException}.
     *
     * @throws UnknownSignedPreKeyException if the message does not name the active signed pre-key
     * @throws UnknownPreKeyException if the named one-time pre-key does not exist or was already used
     * @throws IdentityMismatchException if the sender's identity differs from the one trusted for its name
     */
    public byte[] decryptInitial(ProtocolAddress address, byte[] ciphertext) throws ProtocolException {
        InitialMessage initialMessage = InitialMessage.deserialize(ciphertext);

        SignedPreKey currentSignedPreKey = signedPreKey;
        if(currentSignedPreKey == null || currentSignedPreKey.getId() != initialMessage.getSignedPreKeyId()) {
            log.warn("Initial message from " + address + " names unknown signed pre-key " + initialMessage.getSignedPreKeyId());
            throw new UnknownSignedPreKeyException(initialMessage.getSignedPreKeyId());
        }

        checkIdentity(address.getName(), initialMessage.getIdentityKey());

        PreKey preKey = null;
        if(initialMessage.getPreKeyId().isPresent()) {
            int preKeyId = initialMessage.getPreKeyId().getAsInt();
            preKey = preKeys.remove(preKeyId);
            if(preKey == null) {
                log.warn("Initial message from " + address + " names unknown or used pre-key " + preKeyId);
                throw new UnknownPreKeyException(preKeyId);
            }
        }

        boolean preKeyRemovedFromStore = false;
        boolean newlyTrusted = false;
        SessionState state = null;
        try {
            byte[] sharedSecret = X3dh.respond(identityKeyPair, currentSignedPreKey, preKey, initialMessage.getIdentityKey(), initialMessage.getEphemeralKey());
            try {
                state = SessionState.initializeBob(sharedSecret, currentSignedPreKey.getKeyPair().copy());
            } finally {
                Arrays.fill(sharedSecret, (byte)0);
            }
            state.setSkippedKeyPolicy(config.skippedKeyMaxAge(), clock);

            byte[] plaintext = state.decrypt(initialMessage.getMessage());

            if(preKey != null) {
                store.removePreKey(preKey.getId());
                preKeyRemovedFromStore = true;
            }
            newlyTrusted = trustOnFirstUse(address.getName(), initialMessage.getIdentityKey());
            installSession(address, state);

            if(preKey != null) {
                preKey.destroy();
            }

            log.info("Processed initial message from " + address + ", session established");
            return plaintext;
        } catch(ProtocolException | RuntimeException e) {
            boolean installed = state != null && isInstalled(address, state);
            if(state != null && !installed) {
                state.destroy();
            }
            if(preKey != null && !preKey.isDestroyed() && !installed) {
                restorePreKey(preKey, preKeyRemovedFromStore, e);
            }
            if(newlyTrusted && !installed) {
                revokeFirstUseTrust(address.getName(), initialMessage.getIdentityKey(), e);
            }
            if(e instanceof ProtocolException) {
                log.warn("Rejected initial message from " + address + ": " + e.getMessage());
            }
            throw e;
        }
    }

    private void restorePreKey(PreKey preKey, boolean removedFromStore, Exception cause) {
        if(removedFromStore) {
            try {
                store.storePreKey(preKey);
            } catch(StoreException e) {
                log.error("Could not restore pre-key " + preKey.getId() + " to store", e);
                cause.addSuppressed(e);
            }
        }
        preKeys.put(preKey.getId(), preKey);
    }

    private boolean isInstalled(ProtocolAddress address, SessionState state) {
        SessionEntry entry = sessions.get(address);
        return entry != null && entry.state == state;
    }

    /**
     * Persists a new session for the address, replacing any existing one.
     */
    private void installSession(ProtocolAddress address, SessionState state) throws StoreException {
        byte[] serialized = state.serialize();
        while(true) {
            SessionEntry entry = sessions.computeIfAbsent(address, key -> new SessionEntry(null));
            entry.lock.lock();
            try {
                if(entry.deleted) {
                    continue;
                }

                try {
                    store.storeSession(address.toString(), serialized);
                } catch(StoreException e) {
                    if(entry.state == null) {
                        entry.deleted = true;
                        sessions.remove(address, entry);
                    }
                    throw e;
                }

                if(entry.state != null) {
                    log.info("Replacing existing session with " + address);
                }
                commit(entry, state);
                return;
            } finally {
                entry.lock.unlock();
            }
        }
    }

    private static void commit(SessionEntry entry, SessionState state) {
        SessionState replaced = entry.state;
        entry.state = state;
        if(replaced != null) {
            replaced.destroy();
        }
    }

    public boolean hasSession(ProtocolAddress address) {
        SessionEntry entry = sessions.get(address);
        return entry != null && entry.state != null;
    }

    public Optional<SessionPhase> getSessionPhase(ProtocolAddress address) {
        SessionEntry entry = sessions.get(address);
        if(entry == null) {
            return Optional.empty();
        }

        entry.lock.lock();
        try {
            return entry.state == null ? Optional.empty() : Optional.of(entry.state.getPhase());
        } finally {
            entry.lock.unlock();
        }
    }

    public Set<ProtocolAddress> getSessionAddresses() {
        Set<ProtocolAddress> addresses = new TreeSet<>();
        sessions.forEach((address, entry) -> {
            if(entry.state != null) {
                addresses.add(address);
            }
        });
        return addresses;
    }

    /**
     * Serializes the session with the address. The result contains private key material.
     */
    public Optional<byte[]> exportSession(ProtocolAddress address) {
        SessionEntry entry = sessions.get(address);
        if(entry == null) {
            return Optional.empty();
        }

        entry.lock.lock();
        try {
            return entry.state == null ? Optional.empty() : Optional.of(entry.state.serialize());
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Installs a session previously serialized by {@link #exportSession(ProtocolAddress)}, replacing any existing session
     * with the address.
     *
     * @throws MalformedMessageException if the data is not a serialized session
     */
    public void importSession(ProtocolAddress address, byte[] serialized) throws ProtocolException {
        SessionState state = SessionState.deserialize(serialized);
        state.setSkippedKeyPolicy(config.skippedKeyMaxAge(), clock);
        try {
            installSession(address, state);
        } catch(StoreException | RuntimeException e) {
            state.destroy();
            throw e;
        }

        log.info("Imported session with " + address);
    }

    /**
     * Removes the session with the address from memory and the store.
     *
     * @return true if a session existed
     */
    public boolean deleteSession(ProtocolAddress address) throws StoreException {
        SessionEntry entry = sessions.get(address);
        if(entry == null) {
            return false;
        }

        entry.lock.lock();
        try {
            if(entry.deleted || entry.state == null) {
                return false;
            }

            store.deleteSession(address.toString());
            entry.deleted = true;
            sessions.remove(address, entry);
            entry.state.destroy();
            entry.state = null;

            log.info("Deleted session with " + address);
            return true;
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Trusts the identity key for the name, replacing any previously trusted key. Use this after the user has verified
     * a changed identity, for example by comparing safety numbers.
     */
    public void trustIdentity(String name, IdentityPublicKey identityKey) throws StoreException {
        synchronized(trustLock) {
            store.storeTrustedIdentity(name, identityKey);
            IdentityPublicKey previous = trustedIdentities.put(name, identityKey);
            if(previous != null && !previous.equals(identityKey)) {
                log.warn("Replaced trusted identity for " + name);
            }
        }
    }

    public boolean isTrustedIdentity(String name, IdentityPublicKey identityKey) {
        return identityKey.equals(trustedIdentities.get(name));
    }

    public Optional<IdentityPublicKey> getTrustedIdentity(String name) {
        return Optional.ofNullable(trustedIdentities.get(name));
    }

    private void checkIdentity(String name, IdentityPublicKey presented) throws IdentityMismatchException {
        IdentityPublicKey trusted = trustedIdentities.get(name);
        if(trusted != null && !trusted.equals(presented)) {
            log.warn("Identity key for " + name + " changed to " + presented);
            throw new IdentityMismatchException(name, presented);
        }
    }

    /**
     * Trusts the identity key if nothing is trusted for the name yet. Must run before the session is installed.
     *
     * @return true if the key was newly trusted and must be revoked should the session not be installed
     */
    private boolean trustOnFirstUse(String name, IdentityPublicKey identityKey) throws StoreException {
        synchronized(trustLock) {
            if(trustedIdentities.containsKey(name)) {
                return false;
            }

            store.storeTrustedIdentity(name, identityKey);
            trustedIdentities.put(name, identityKey);
            return true;
        }
    }

    private void revokeFirstUseTrust(String name, IdentityPublicKey identityKey, Exception cause) {
        synchronized(trustLock) {
            if(!identityKey.equals(trustedIdentities.get(name))) {
                return;
            }

            try {
                store.removeTrustedIdentity(name);
                trustedIdentities.remove(name);
            } catch(StoreException e) {
                log.error("Could not revoke trusted identity for " + name, e);
                cause.addSuppressed(e);
            }
        }
    }

    /**
     * Computes the safety number between this device's identity and the trusted identity of a peer.
     *
     * @param localLabel the label identifying this user, as the peer knows it
     * @param remoteName the peer's name, which must have a trusted identity
     * @throws UntrustedIdentityException if no identity is trusted for the peer
     */
    public String getSafetyNumber(String localLabel, String remoteName) throws UntrustedIdentityException {
        IdentityPublicKey remoteIdentity = trustedIdentities.get(remoteName);
        if(remoteIdentity == null) {
            throw new UntrustedIdentityException(remoteName);
        }

        return FingerprintCalculator.calculate(identityKeyPair.getPublicKey(), localLabel, remoteIdentity, remoteName);
    }

    /**
     * Zeroes all private key material held in memory. The engine cannot be used afterwards; the store is unaffected.
     */
    @Override
    public void close() {
        for(SessionEntry entry : sessions.values()) {
            entry.lock.lock();
            try {
                if(entry.state != null) {
                    entry.state.destroy();
                    entry.state = null;
                }
                entry.deleted = true;
            } finally {
                entry.lock.unlock();
            }
        }
        sessions.clear();

        synchronized(preKeyLock) {
            preKeys.values().forEach(PreKey::destroy);
            preKeys.clear();
        }

        SignedPreKey current = signedPreKey;
        if(current != null) {
            current.destroy();
        }
        identityKeyPair.destroy();
    }

    private static final class SessionEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile SessionState state;
        private volatile boolean deleted;

        private SessionEntry(SessionState state) {
            this.state = state;
        }
    }

    private record InitiatedSession(X3dhResult result, SessionState state) {
    }
}
