package com.sparrowwallet.wren;

import com.sparrowwallet.wren.crypto.IdentityKeyPair;
import com.sparrowwallet.wren.crypto.IdentityPublicKey;
import com.sparrowwallet.wren.ratchet.MessageHeader;
import com.sparrowwallet.wren.ratchet.RatchetMessage;
import com.sparrowwallet.wren.ratchet.SessionPhase;
import com.sparrowwallet.wren.store.InMemoryProtocolStore;
import com.sparrowwallet.wren.x3dh.InitialMessage;
import com.sparrowwallet.wren.x3dh.PreKeyBundle;
import com.sparrowwallet.wren.x3dh.PublicPreKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

public class ProtocolEngineTest {
    private static final ProtocolAddress ALICE = new ProtocolAddress("alice", 1);
    private static final ProtocolAddress BOB = new ProtocolAddress("bob", 1);

    private FailingStore aliceStore;
    private FailingStore bobStore;
    private ProtocolEngine alice;
    private ProtocolEngine bob;

    @BeforeEach
    public void setUp() throws Exception {
        aliceStore = new FailingStore();
        bobStore = new FailingStore();
        alice = ProtocolEngine.create(aliceStore);
        bob = ProtocolEngine.create(bobStore);

        bob.generatePreKeys(5);
        bob.generateSignedPreKey(1);
    }

    @AfterEach
    public void tearDown() {
        alice.close();
        bob.close();
    }

    @Test
    public void testAliceAndBobConversation() throws Exception {
        PreKeyBundle bundle = bob.createPreKeyBundle(1);
        byte[] initial = alice.encryptInitial(BOB, bundle, bytes("Hello Bob!"));

        assertEquals("Hello Bob!", string(bob.decryptInitial(ALICE, initial)));
        assertEquals(SessionPhase.BIDIRECTIONAL, bob.getSessionPhase(ALICE).orElseThrow());
        assertEquals(SessionPhase.INITIATOR_ESTABLISHED, alice.getSessionPhase(BOB).orElseThrow());

        byte[] reply = bob.encrypt(ALICE, bytes("Hi Alice! How are you?"));
        assertEquals("Hi Alice! How are you?", string(alice.decrypt(BOB, reply)));

        byte[] answer = alice.encrypt(BOB, bytes("I'm fine, thanks!"));
        assertEquals("I'm fine, thanks!", string(bob.decrypt(ALICE, answer)));

        assertTrue(alice.isTrustedIdentity("bob", bob.getIdentityPublicKey()));
        assertTrue(bob.isTrustedIdentity("alice", alice.getIdentityPublicKey()));
    }

    @Test
    public void testOneTimePreKeyConsumedOnce() throws Exception {
        PreKeyBundle bundle = bob.createPreKeyBundle(1);
        int preKeyId = bundle.getPreKey().orElseThrow().id();
        byte[] initial = alice.encryptInitial(BOB, bundle, bytes("first"));

        bob.decryptInitial(ALICE, initial);
        assertEquals(4, bob.getPreKeyCount());
        assertTrue(bobStore.loadPreKey(preKeyId).isEmpty());

        UnknownPreKeyException e = assertThrows(UnknownPreKeyException.class, () -> bob.decryptInitial(ALICE, initial));
        assertEquals(preKeyId, e.getPreKeyId());
    }

    @Test
    public void testFailedInitialDecryptRestoresPreKey() throws Exception {
        PreKeyBundle bundle = bob.createPreKeyBundle(1);
        byte[] initial = alice.encryptInitial(BOB, bundle, bytes("first"));
        initial[initial.length - 1] ^= 0x01;

        assertThrows(DecryptionFailureException.class, () -> bob.decryptInitial(ALICE, initial));
        assertEquals(5, bob.getPreKeyCount());
        assertFalse(bob.hasSession(ALICE));
        assertFalse(bob.getTrustedIdentity("alice").isPresent());
    }

    @Test
    public void testBundleWithoutOneTimePreKey() throws Exception {
        ProtocolEngine carol = ProtocolEngine.create(new InMemoryProtocolStore());
        carol.generateSignedPreKey(3);
        PreKeyBundle bundle = carol.createPreKeyBundle(2);
        assertTrue(bundle.getPreKey().isEmpty());

        ProtocolAddress carolAddress = new ProtocolAddress("carol", 2);
        byte[] initial = alice.encryptInitial(carolAddress, bundle, bytes("no pre-key"));
        assertTrue(InitialMessage.deserialize(initial).getPreKeyId().isEmpty());
        assertEquals("no pre-key", string(carol.decryptInitial(ALICE, initial)));
    }

    @Test
    public void testUnknownSignedPreKey() throws Exception {
        PreKeyBundle bundle = bob.createPreKeyBundle(1);
        byte[] initial = alice.encryptInitial(BOB, bundle, bytes("stale"));
        bob.generateSignedPreKey(2);

        UnknownSignedPreKeyException e = assertThrows(UnknownSignedPreKeyException.class, () -> bob.decryptInitial(ALICE, initial));
        assertNotNull(e.getMessage());
        assertEquals(5, bob.getPreKeyCount());
    }

    @Test
    public void testNoSignedPreKey() throws Exception {
        ProtocolEngine carol = ProtocolEngine.create(new InMemoryProtocolStore());
        assertThrows(NoSignedPreKeyException.class, () -> carol.createPreKeyBundle(1));
    }

    @Test
    public void testProcessPreKeyBundleEstablishesSession() throws Exception {
        assertFalse(alice.hasSession(BOB));
        alice.processPreKeyBundle(BOB, bob.createPreKeyBundle(1));

        assertTrue(alice.hasSession(BOB));
        assertEquals(Set.of(BOB), alice.getSessionAddresses());
        RatchetMessage message = RatchetMessage.deserialize(alice.encrypt(BOB, bytes("after bundle")));
        assertEquals(0, message.getHeader().messageCounter());
        assertTrue(alice.isTrustedIdentity("bob", bob.getIdentityPublicKey()));
    }

    @Test
    public void testIdentityMismatchRejected() throws Exception {
        alice.processPreKeyBundle(BOB, bob.createPreKeyBundle(1));

        ProtocolEngine impostor = ProtocolEngine.create(new InMemoryProtocolStore());
        impostor.generateSignedPreKey(1);
        PreKeyBundle forged = impostor.createPreKeyBundle(1);

        IdentityMismatchException e = assertThrows(IdentityMismatchException.class, () -> alice.processPreKeyBundle(BOB, forged));
        assertEquals("bob", e.getName());
        assertEquals(impostor.getIdentityPublicKey(), e.getPresentedKey());
        assertThrows(IdentityMismatchException.class, () -> alice.encryptInitial(BOB, forged, bytes("x")));

        alice.trustIdentity("bob", impostor.getIdentityPublicKey());
        alice.processPreKeyBundle(BOB, forged);
        assertTrue(alice.isTrustedIdentity("bob", impostor.getIdentityPublicKey()));
    }

    @Test
    public void testInitialMessageFromChangedIdentityRejected() throws Exception {
        bob.trustIdentity("alice", IdentityKeyPair.generate().getPublicKey());
        byte[] initial = alice.encryptInitial(BOB, bob.createPreKeyBundle(1), bytes("hello"));

        assertThrows(IdentityMismatchException.class, () -> bob.decryptInitial(ALICE, initial));
        assertEquals(5, bob.getPreKeyCount());
    }

    @Test
    public void testTamperedBundleRejected() throws Exception {
        byte[] serialized = bob.createPreKeyBundle(1).serialize();
        serialized[serialized.length - 40] ^= 0x01;
        PreKeyBundle tampered = PreKeyBundle.deserialize(serialized);

        assertThrows(VerificationFailureException.class, () -> alice.processPreKeyBundle(BOB, tampered));
        assertFalse(alice.hasSession(BOB));
    }

    @Test
    public void testEncryptWithoutSession() {
        assertThrows(UnknownSessionException.class, () -> alice.encrypt(BOB, bytes("nobody")));
        assertThrows(UnknownSessionException.class, () -> alice.decrypt(BOB, new RatchetMessage(
                new MessageHeader(bob.createPreKeyBundle(1).getSignedPreKey().publicKey(), 0, 0), new byte[20]).serialize()));
        assertThrows(MalformedMessageException.class, () -> alice.decrypt(BOB, new byte[3]));
    }

    @Test
    public void testDeleteSession() throws Exception {
        alice.processPreKeyBundle(BOB, bob.createPreKeyBundle(1));
        assertTrue(alice.deleteSession(BOB));
        assertFalse(alice.hasSession(BOB));
        assertTrue(aliceStore.loadSession(BOB.toString()).isEmpty());
        assertFalse(alice.deleteSession(BOB));
        assertThrows(UnknownSessionException.class, () -> alice.encrypt(BOB, bytes("gone")));
    }

    @Test
    public void testSafetyNumbersMatch() throws Exception {
        bob.decryptInitial(ALICE, alice.encryptInitial(BOB, bob.createPreKeyBundle(1), bytes("hi")));

        String aliceView = alice.getSafetyNumber("alice", "bob");
        String bobView = bob.getSafetyNumber("bob", "alice");
        assertEquals(aliceView, bobView);
        assertTrue(aliceView.matches("(\\d{5} ){11}\\d{5}"));

        assertThrows(UntrustedIdentityException.class, () -> alice.getSafetyNumber("alice", "carol"));
    }

    @Test
    public void testRefillPreKeys() throws Exception {
        assertEquals(EngineConfig.DEFAULT_PRE_KEY_BATCH_SIZE, bob.refillPreKeysIfNeeded().size());
        assertEquals(105, bob.getPreKeyCount());
        assertTrue(bob.refillPreKeysIfNeeded().isEmpty());

        ProtocolEngine small = ProtocolEngine.create(new InMemoryProtocolStore(), new EngineConfig(3, 2, EngineConfig.DEFAULT_SKIPPED_KEY_MAX_AGE));
        assertEquals(3, small.refillPreKeysIfNeeded().size());
        assertTrue(small.refillPreKeysIfNeeded().isEmpty());
    }

    @Test
    public void testPreKeyIdsAreSequentialAndNonZero() throws Exception {
        List<PublicPreKey> more = bob.generatePreKeys(3);
        assertEquals(List.of(6, 7, 8), more.stream().map(PublicPreKey::id).toList());
        assertEquals(1, bob.createPreKeyBundle(1).getPreKey().orElseThrow().id());
    }

    @Test
    public void testStoreFailureLeavesSessionUnchanged() throws Exception {
        alice.processPreKeyBundle(BOB, bob.createPreKeyBundle(1));

        aliceStore.failSessionWrites = true;
        assertThrows(StoreException.class, () -> alice.encrypt(BOB, bytes("lost")));
        aliceStore.failSessionWrites = false;

        RatchetMessage message = RatchetMessage.deserialize(alice.encrypt(BOB, bytes("kept")));
        assertEquals(0, message.getHeader().messageCounter());
    }

    @Test
    public void testStoreFailureDuringEstablishment() throws Exception {
        aliceStore.failSessionWrites = true;
        assertThrows(StoreException.class, () -> alice.processPreKeyBundle(BOB, bob.createPreKeyBundle(1)));
        assertFalse(alice.hasSession(BOB));
        assertTrue(alice.getSessionAddresses().isEmpty());
        assertFalse(alice.getTrustedIdentity("bob").isPresent());
        assertTrue(aliceStore.loadTrustedIdentities().isEmpty());
    }

    @Test
    public void testTrustWriteFailureDuringEstablishment() throws Exception {
        PreKeyBundle bundle = bob.createPreKeyBundle(1);

        aliceStore.failTrustWrites = true;
        assertThrows(StoreException.class, () -> alice.processPreKeyBundle(BOB, bundle));
        assertThrows(StoreException.class, () -> alice.encryptInitial(BOB, bundle, bytes("lost")));
        assertFalse(alice.hasSession(BOB));
        assertTrue(aliceStore.loadSession(BOB.toString()).isEmpty());
        aliceStore.failTrustWrites = false;

        byte[] initial = alice.encryptInitial(BOB, bundle, bytes("Hello Bob!"));
        assertEquals("Hello Bob!", string(bob.decryptInitial(ALICE, initial)));
    }

    @Test
    public void testTrustWriteFailureDuringInitialDecrypt() throws Exception {
        PreKeyBundle bundle = bob.createPreKeyBundle(1);
        int preKeyId = bundle.getPreKey().orElseThrow().id();
        byte[] initial = alice.encryptInitial(BOB, bundle, bytes("Hello Bob!"));

        bobStore.failTrustWrites = true;
        assertThrows(StoreException.class, () -> bob.decryptInitial(ALICE, initial));
        assertFalse(bob.hasSession(ALICE));
        assertEquals(5, bob.getPreKeyCount());
        assertTrue(bobStore.loadPreKey(preKeyId).isPresent());
        assertFalse(bob.getTrustedIdentity("alice").isPresent());
        bobStore.failTrustWrites = false;

        assertEquals("Hello Bob!", string(bob.decryptInitial(ALICE, initial)));
        assertTrue(bob.isTrustedIdentity("alice", alice.getIdentityPublicKey()));
        assertEquals(4, bob.getPreKeyCount());
    }

    @Test
    public void testSessionWriteFailureDuringInitialDecryptRevokesTrust() throws Exception {
        byte[] initial = alice.encryptInitial(BOB, bob.createPreKeyBundle(1), bytes("Hello Bob!"));

        bobStore.failSessionWrites = true;
        assertThrows(StoreException.class, () -> bob.decryptInitial(ALICE, initial));
        assertFalse(bob.hasSession(ALICE));
        assertFalse(bob.getTrustedIdentity("alice").isPresent());
        assertTrue(bobStore.loadTrustedIdentities().isEmpty());
        assertEquals(5, bob.getPreKeyCount());
        bobStore.failSessionWrites = false;

        assertEquals("Hello Bob!", string(bob.decryptInitial(ALICE, initial)));
    }

    @Test
    public void testExportAndImportSession() throws Exception {
        bob.decryptInitial(ALICE, alice.encryptInitial(BOB, bob.createPreKeyBundle(1), bytes("hello")));

        byte[] exported = alice.exportSession(BOB).orElseThrow();
        assertTrue(alice.deleteSession(BOB));
        assertFalse(alice.hasSession(BOB));

        alice.importSession(BOB, exported);
        assertTrue(alice.hasSession(BOB));
        assertTrue(aliceStore.loadSession(BOB.toString()).isPresent());
        assertEquals("restored", string(bob.decrypt(ALICE, alice.encrypt(BOB, bytes("restored")))));

        ProtocolAddress carol = new ProtocolAddress("carol", 1);
        assertTrue(alice.exportSession(carol).isEmpty());
        assertThrows(MalformedMessageException.class, () -> alice.importSession(carol, new byte[] {1, 2, 3}));
        assertFalse(alice.hasSession(carol));
    }

    @Test
    public void testReloadFromStore() throws Exception {
        bob.decryptInitial(ALICE, alice.encryptInitial(BOB, bob.createPreKeyBundle(1), bytes("before reload")));
        bob.decrypt(ALICE, alice.encrypt(BOB, bytes("second")));

        ProtocolEngine reloaded = ProtocolEngine.load(bobStore);
        assertEquals(bob.getIdentityPublicKey(), reloaded.getIdentityPublicKey());
        assertEquals(bob.getRegistrationId(), reloaded.getRegistrationId());
        assertEquals(4, reloaded.getPreKeyCount());
        assertTrue(reloaded.hasSession(ALICE));
        assertEquals(bob.getSignedPreKey(), reloaded.getSignedPreKey());

        assertEquals("after reload", string(reloaded.decrypt(ALICE, alice.encrypt(BOB, bytes("after reload")))));
        assertEquals("reply", string(alice.decrypt(BOB, reloaded.encrypt(ALICE, bytes("reply")))));
        assertEquals(6, reloaded.generatePreKeys(1).get(0).id());
    }

    @Test
    public void testLoadWithoutIdentity() {
        assertThrows(StoreException.class, () -> ProtocolEngine.load(new InMemoryProtocolStore()));
    }

    @Test
    public void testOpenCreatesThenLoads() throws Exception {
        InMemoryProtocolStore store = new InMemoryProtocolStore();
        ProtocolEngine created = ProtocolEngine.open(store, EngineConfig.DEFAULT);
        ProtocolEngine opened = ProtocolEngine.open(store, EngineConfig.DEFAULT);
        assertEquals(created.getIdentityPublicKey(), opened.getIdentityPublicKey());
        assertTrue(created.getRegistrationId() > 0 && created.getRegistrationId() <= ProtocolEngine.REGISTRATION_ID_MASK);
    }

    @Test
    public void testConcurrentEncryptionToOnePeer() throws Exception {
        bob.decryptInitial(ALICE, alice.encryptInitial(BOB, bob.createPreKeyBundle(1), bytes("start")));

        int threads = 8;
        int perThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<List<byte[]>>> futures = new ArrayList<>();
        for(int t = 0; t < threads; t++) {
            int thread = t;
            futures.add(executor.submit(() -> {
                List<byte[]> sent = new ArrayList<>();
                for(int i = 0; i < perThread; i++) {
                    sent.add(alice.encrypt(BOB, bytes(thread + ":" + i)));
                }
                return sent;
            }));
        }

        List<byte[]> ciphertexts = new ArrayList<>();
        for(Future<List<byte[]>> future : futures) {
            ciphertexts.addAll(future.get(60, TimeUnit.SECONDS));
        }
        executor.shutdown();

        Set<Integer> counters = new HashSet<>();
        Set<String> plaintexts = new HashSet<>();
        for(byte[] ciphertext : ciphertexts) {
            counters.add(RatchetMessage.deserialize(ciphertext).getHeader().messageCounter());
            plaintexts.add(string(bob.decrypt(ALICE, ciphertext)));
        }

        assertEquals(threads * perThread, counters.size());
        assertEquals(threads * perThread, plaintexts.size());
    }

    @Test
    public void testConcurrentSessionsWithManyPeers() throws Exception {
        int peers = 6;
        List<ProtocolEngine> engines = new ArrayList<>();
        for(int i = 0; i < peers; i++) {
            ProtocolEngine peer = ProtocolEngine.create(new InMemoryProtocolStore());
            peer.generatePreKeys(1);
            peer.generateSignedPreKey(1);
            engines.add(peer);
        }

        ExecutorService executor = Executors.newFixedThreadPool(peers);
        List<Future<String>> results = new ArrayList<>();
        for(int i = 0; i < peers; i++) {
            ProtocolEngine peer = engines.get(i);
            ProtocolAddress address = new ProtocolAddress("peer" + i, 1);
            results.add(executor.submit(() -> {
                byte[] initial = alice.encryptInitial(address, peer.createPreKeyBundle(1), bytes("hello " + address));
                String first = string(peer.decryptInitial(ALICE, initial));
                for(int m = 0; m < 10; m++) {
                    peer.decrypt(ALICE, alice.encrypt(address, bytes("m" + m)));
                    alice.decrypt(address, peer.encrypt(ALICE, bytes("r" + m)));
                }
                return first;
            }));
        }

        for(int i = 0; i < peers; i++) {
            assertEquals("hello peer" + i + ".1", results.get(i).get(60, TimeUnit.SECONDS));
        }
        executor.shutdown();
        assertEquals(peers, alice.getSessionAddresses().size());
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static String string(byte[] data) {
        return new String(data, StandardCharsets.UTF_8);
    }

    private static class FailingStore extends InMemoryProtocolStore {
        private volatile boolean failSessionWrites;
        private volatile boolean failTrustWrites;

        @Override
        public void storeSession(String address, byte[] sessionState) throws StoreException {
            if(failSessionWrites) {
                throw new StoreException("Simulated write failure");
            }
            super.storeSession(address, sessionState);
        }

        @Override
        public void storeTrustedIdentity(String name, IdentityPublicKey identityKey) throws StoreException {
            if(failTrustWrites) {
                throw new StoreException("Simulated trust write failure");
            }
            super.storeTrustedIdentity(name, identityKey);
        }
    }
}
