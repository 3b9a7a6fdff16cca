package com.sparrowwallet.wren.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparrowwallet.wren.InvalidKeyMaterialException;
import com.sparrowwallet.wren.MalformedMessageException;
import com.sparrowwallet.wren.StoreException;
import com.sparrowwallet.wren.crypto.IdentityPublicKey;
import com.sparrowwallet.wren.x3dh.PreKey;
import com.sparrowwallet.wren.x3dh.SignedPreKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;

/**
 * Stores all protocol state in a single JSON file, with keys and session blobs encoded as Base64. Every write replaces
 * the file through a temporary file in the same directory.
 * <p>
 * The file holds private keys in the clear and should be protected by filesystem permissions.
 */
public class JsonFileProtocolStore implements ProtocolStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileProtocolStore.class);

    private final ObjectMapper mapper = new ObjectMapper();

    protected final File storeFile;

    public JsonFileProtocolStore(File storeFile) {
        this.storeFile = storeFile;
    }

    @Override
    public synchronized Optional<LocalIdentity> getLocalIdentity() throws StoreException {
        StoreFile contents = read();
        if(contents.identity == null) {
            return Optional.empty();
        }

        return Optional.of(new LocalIdentity(decode(contents.identity.publicKey), decode(contents.identity.privateKey), contents.identity.registrationId));
    }

    @Override
    public synchronized void storeLocalIdentity(LocalIdentity localIdentity) throws StoreException {
        StoreFile contents = read();
        contents.identity = new StoredIdentity();
        contents.identity.publicKey = encode(localIdentity.publicKey());
        contents.identity.privateKey = encode(localIdentity.privateKey());
        contents.identity.registrationId = localIdentity.registrationId();
        write(contents);
    }

    @Override
    public synchronized Collection<PreKey> loadPreKeys() throws StoreException {
        List<PreKey> preKeys = new ArrayList<>();
        for(String encoded : read().preKeys.values()) {
            preKeys.add(deserializePreKey(decode(encoded)));
        }
        return preKeys;
    }

    @Override
    public synchronized Optional<PreKey> loadPreKey(int preKeyId) throws StoreException {
        String encoded = read().preKeys.get(Integer.toString(preKeyId));
        return encoded == null ? Optional.empty() : Optional.of(deserializePreKey(decode(encoded)));
    }

    @Override
    public synchronized void storePreKey(PreKey preKey) throws StoreException {
        StoreFile contents = read();
        contents.preKeys.put(Integer.toString(preKey.getId()), encode(preKey.serialize()));
        write(contents);
    }

    @Override
    public synchronized void removePreKey(int preKeyId) throws StoreException {
        StoreFile contents = read();
        if(contents.preKeys.remove(Integer.toString(preKeyId)) != null) {
            write(contents);
        }
    }

    @Override
    public synchronized Optional<SignedPreKey> loadSignedPreKey() throws StoreException {
        StoreFile contents = read();
        if(contents.signedPreKey == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(SignedPreKey.deserialize(decode(contents.signedPreKey)));
        } catch(MalformedMessageException | InvalidKeyMaterialException e) {
            throw new StoreException("Stored signed pre-key in " + storeFile.getAbsolutePath() + " is corrupt", e);
        }
    }

    @Override
    public synchronized void storeSignedPreKey(SignedPreKey signedPreKey) throws StoreException {
        StoreFile contents = read();
        contents.signedPreKey = encode(signedPreKey.serialize());
        write(contents);
    }

    @Override
    public synchronized Map<String, byte[]> loadSessions() throws StoreException {
        Map<String, byte[]> sessions = new HashMap<>();
        for(Map.Entry<String, String> entry : read().sessions.entrySet()) {
            sessions.put(entry.getKey(), decode(entry.getValue()));
        }
        return sessions;
    }

    @Override
    public synchronized Optional<byte[]> loadSession(String address) throws StoreException {
        String encoded = read().sessions.get(address);
        return encoded == null ? Optional.empty() : Optional.of(decode(encoded));
    }

    @Override
    public synchronized void storeSession(String address, byte[] sessionState) throws StoreException {
        StoreFile contents = read();
        contents.sessions.put(address, encode(sessionState));
        write(contents);
    }

    @Override
    public synchronized void deleteSession(String address) throws StoreException {
        StoreFile contents = read();
        if(contents.sessions.remove(address) != null) {
            write(contents);
        }
    }

    @Override
    public synchronized Map<String, IdentityPublicKey> loadTrustedIdentities() throws StoreException {
        Map<String, IdentityPublicKey> identities = new HashMap<>();
        for(Map.Entry<String, String> entry : read().trustedIdentities.entrySet()) {
            try {
                identities.put(entry.getKey(), IdentityPublicKey.fromBytes(decode(entry.getValue())));
            } catch(InvalidKeyMaterialException e) {
                throw new StoreException("Stored identity key for " + entry.getKey() + " is invalid", e);
            }
        }
        return identities;
    }

    @Override
    public synchronized void storeTrustedIdentity(String name, IdentityPublicKey identityKey) throws StoreException {
        StoreFile contents = read();
        contents.trustedIdentities.put(name, encode(identityKey.serialize()));
        write(contents);
    }

    @Override
    public synchronized void removeTrustedIdentity(String name) throws StoreException {
        StoreFile contents = read();
        if(contents.trustedIdentities.remove(name) != null) {
            write(contents);
        }
    }

    private StoreFile read() throws StoreException {
        if(!storeFile.exists()) {
            return new StoreFile();
        }

        try {
            return mapper.readValue(storeFile, StoreFile.class);
        } catch(IOException e) {
            log.error("Could not read " + storeFile.getAbsolutePath(), e);
            throw new StoreException("Could not read " + storeFile.getAbsolutePath(), e);
        }
    }

    private void write(StoreFile contents) throws StoreException {
        Path target = storeFile.toPath().toAbsolutePath();
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            mapper.writeValue(temp.toFile(), contents);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch(AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch(IOException e) {
            log.error("Could not write " + storeFile.getAbsolutePath(), e);
            if(temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch(IOException deleteException) {
                    e.addSuppressed(deleteException);
                }
            }
            throw new StoreException("Could not write " + storeFile.getAbsolutePath(), e);
        }
    }

    private PreKey deserializePreKey(byte[] serialized) throws StoreException {
        try {
            return PreKey.deserialize(serialized);
        } catch(MalformedMessageException | InvalidKeyMaterialException e) {
            throw new StoreException("Stored pre-key in " + storeFile.getAbsolutePath() + " is corrupt", e);
        }
    }

    private byte[] decode(String base64) throws StoreException {
        try {
            return Base64.getDecoder().decode(base64);
        } catch(IllegalArgumentException e) {
            log.error("Invalid Base64 in " + storeFile.getAbsolutePath(), e);
            throw new StoreException("Invalid Base64 in " + storeFile.getAbsolutePath(), e);
        }
    }

    private static String encode(byte[] data) {
        return Base64.getEncoder().encodeToString(data);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreFile {
        public StoredIdentity identity;
        public Map<String, String> preKeys = new TreeMap<>();
        public String signedPreKey;
        public Map<String, String> sessions = new TreeMap<>();
        public Map<String, String> trustedIdentities = new TreeMap<>();
    }

    public static class StoredIdentity {
        @JsonProperty("public")
        public String publicKey;
        @JsonProperty("private")
        public String privateKey;
        public int registrationId;
    }
}
