package com.sparrowwallet.wren.store;

import com.sparrowwallet.wren.InvalidKeyMaterialException;
import com.sparrowwallet.wren.MalformedMessageException;
import com.sparrowwallet.wren.StoreException;
import com.sparrowwallet.wren.crypto.IdentityPublicKey;
import com.sparrowwallet.wren.x3dh.PreKey;
import com.sparrowwallet.wren.x3dh.SignedPreKey;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * A store that keeps everything in memory, holding keys in serialized form so that callers never share key objects
 * with it.
 */
public class InMemoryProtocolStore implements ProtocolStore {
    private volatile LocalIdentity localIdentity;
    private final Map<Integer, byte[]> preKeys = new ConcurrentSkipListMap<>();
    private volatile byte[] signedPreKey;
    private final Map<String, byte[]> sessions = new ConcurrentHashMap<>();
    private final Map<String, IdentityPublicKey> trustedIdentities = new ConcurrentHashMap<>();

    @Override
    public Optional<LocalIdentity> getLocalIdentity() {
        return Optional.ofNullable(localIdentity);
    }

    @Override
    public void storeLocalIdentity(LocalIdentity localIdentity) {
        this.localIdentity = localIdentity;
    }

    @Override
    public Collection<PreKey> loadPreKeys() throws StoreException {
        List<PreKey> loaded = new ArrayList<>();
        for(byte[] serialized : preKeys.values()) {
            loaded.add(deserializePreKey(serialized));
        }
        return loaded;
    }

    @Override
    public Optional<PreKey> loadPreKey(int preKeyId) throws StoreException {
        byte[] serialized = preKeys.get(preKeyId);
        return serialized == null ? Optional.empty() : Optional.of(deserializePreKey(serialized));
    }

    @Override
    public void storePreKey(PreKey preKey) {
        preKeys.put(preKey.getId(), preKey.serialize());
    }

    @Override
    public void removePreKey(int preKeyId) {
        byte[] removed = preKeys.remove(preKeyId);
        if(removed != null) {
            Arrays.fill(removed, (byte)0);
        }
    }

    @Override
    public Optional<SignedPreKey> loadSignedPreKey() throws StoreException {
        byte[] serialized = signedPreKey;
        if(serialized == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(SignedPreKey.deserialize(serialized));
        } catch(MalformedMessageException | InvalidKeyMaterialException e) {
            throw new StoreException("Stored signed pre-key is corrupt", e);
        }
    }

    @Override
    public void storeSignedPreKey(SignedPreKey signedPreKey) {
        this.signedPreKey = signedPreKey.serialize();
    }

    @Override
    public Map<String, byte[]> loadSessions() {
        Map<String, byte[]> copy = new HashMap<>();
        sessions.forEach((address, state) -> copy.put(address, Arrays.copyOf(state, state.length)));
        return copy;
    }

    @Override
    public Optional<byte[]> loadSession(String address) {
        byte[] state = sessions.get(address);
        return state == null ? Optional.empty() : Optional.of(Arrays.copyOf(state, state.length));
    }

    @Override
    public void storeSession(String address, byte[] sessionState) throws StoreException {
        sessions.put(address, Arrays.copyOf(sessionState, sessionState.length));
    }

    @Override
    public void deleteSession(String address) {
        sessions.remove(address);
    }

    @Override
    public Map<String, IdentityPublicKey> loadTrustedIdentities() {
        return new HashMap<>(trustedIdentities);
    }

    @Override
    public void storeTrustedIdentity(String name, IdentityPublicKey identityKey) throws StoreException {
        trustedIdentities.put(name, identityKey);
    }

    @Override
    public void removeTrustedIdentity(String name) throws StoreException {
        trustedIdentities.remove(name);
    }

    private static PreKey deserializePreKey(byte[] serialized) throws StoreException {
        try {
            return PreKey.deserialize(serialized);
        } catch(MalformedMessageException | InvalidKeyMaterialException e) {
            throw new StoreException("Stored pre-key is corrupt", e);
        }
    }
}
