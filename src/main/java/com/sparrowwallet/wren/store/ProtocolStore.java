package com.sparrowwallet.wren.store;

import com.sparrowwallet.wren.StoreException;
import com.sparrowwallet.wren.crypto.IdentityPublicKey;
import com.sparrowwallet.wren.x3dh.PreKey;
import com.sparrowwallet.wren.x3dh.SignedPreKey;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent key and session storage. Every write must be durable when the method returns; the engine only commits
 * in-memory state after a write succeeds.
 */
public interface ProtocolStore {
    Optional<LocalIdentity> getLocalIdentity() throws StoreException;
    void storeLocalIdentity(LocalIdentity localIdentity) throws StoreException;

    Collection<PreKey> loadPreKeys() throws StoreException;
    Optional<PreKey> loadPreKey(int preKeyId) throws StoreException;
    void storePreKey(PreKey preKey) throws StoreException;
    void removePreKey(int preKeyId) throws StoreException;

    Optional<SignedPreKey> loadSignedPreKey() throws StoreException;
    void storeSignedPreKey(SignedPreKey signedPreKey) throws StoreException;

    /**
     * @return serialized session state keyed by address string form
     */
    Map<String, byte[]> loadSessions() throws StoreException;
    Optional<byte[]> loadSession(String address) throws StoreException;
    void storeSession(String address, byte[] sessionState) throws StoreException;
    void deleteSession(String address) throws StoreException;

    Map<String, IdentityPublicKey> loadTrustedIdentities() throws StoreException;
    void storeTrustedIdentity(String name, IdentityPublicKey identityKey) throws StoreException;
    void removeTrustedIdentity(String name) throws StoreException;
}
