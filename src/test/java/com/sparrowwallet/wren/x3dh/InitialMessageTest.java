package com.sparrowwallet.wren.x3dh;

import com.sparrowwallet.wren.MalformedMessageException;
import com.sparrowwallet.wren.crypto.DhKeyPair;
import com.sparrowwallet.wren.crypto.IdentityKeyPair;
import com.sparrowwallet.wren.ratchet.MessageHeader;
import com.sparrowwallet.wren.ratchet.RatchetMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class InitialMessageTest {
    private InitialMessage initialMessage;

    @BeforeEach
    public void setUp() {
        IdentityKeyPair identity = IdentityKeyPair.generate();
        DhKeyPair ephemeral = DhKeyPair.generate();
        RatchetMessage ratchetMessage = new RatchetMessage(new MessageHeader(DhKeyPair.generate().getPublicKey(), 0, 0), new byte[26]);
        initialMessage = new InitialMessage(identity.getPublicKey(), ephemeral.getPublicKey(), 12, 3, ratchetMessage);
    }

    @Test
    public void testParseSerializedMessage() throws Exception {
        byte[] serialized = initialMessage.serialize();
        assertEquals(InitialMessage.VERSION, serialized[0]);

        InitialMessage parsed = InitialMessage.deserialize(serialized);
        assertEquals(initialMessage.getIdentityKey(), parsed.getIdentityKey());
        assertEquals(initialMessage.getEphemeralKey(), parsed.getEphemeralKey());
        assertEquals(12, parsed.getPreKeyId().getAsInt());
        assertEquals(3, parsed.getSignedPreKeyId());
        assertEquals(initialMessage.getMessage().getHeader(), parsed.getMessage().getHeader());
        assertArrayEquals(initialMessage.getMessage().getCiphertext(), parsed.getMessage().getCiphertext());
    }

    @Test
    public void testMessageWithoutPreKey() throws Exception {
        InitialMessage withoutPreKey = new InitialMessage(initialMessage.getIdentityKey(), initialMessage.getEphemeralKey(), null, 3, initialMessage.getMessage());
        InitialMessage parsed = InitialMessage.deserialize(withoutPreKey.serialize());
        assertTrue(parsed.getPreKeyId().isEmpty());
    }

    @Test
    public void testMalformedMessagesRejected() {
        byte[] serialized = initialMessage.serialize();

        byte[] wrongVersion = Arrays.copyOf(serialized, serialized.length);
        wrongVersion[0] = 2;
        assertThrows(MalformedMessageException.class, () -> InitialMessage.deserialize(wrongVersion));

        assertThrows(MalformedMessageException.class, () -> InitialMessage.deserialize(Arrays.copyOf(serialized, serialized.length - 1)));
        assertThrows(MalformedMessageException.class, () -> InitialMessage.deserialize(Arrays.copyOf(serialized, 40)));
        assertThrows(MalformedMessageException.class, () -> InitialMessage.deserialize(new byte[0]));

        byte[] shortCiphertext = new InitialMessage(initialMessage.getIdentityKey(), initialMessage.getEphemeralKey(), null, 3,
                new RatchetMessage(initialMessage.getMessage().getHeader(), new byte[5])).serialize();
        assertThrows(MalformedMessageException.class, () -> InitialMessage.deserialize(shortCiphertext));
    }
}
