package com.sparrowwallet.wren.content;

import com.sparrowwallet.wren.MalformedMessageException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class MessageContentCodecTest {
    private final MessageContentCodec codec = new MessageContentCodec();

    @Test
    public void testTextMessage() throws Exception {
        PlaintextMessage message = new PlaintextMessage("m1", 1700000000000L, new MessageContent.Text("Hello Bob!"));
        byte[] encoded = codec.encode(message);

        String json = new String(encoded, StandardCharsets.UTF_8);
        assertTrue(json.contains("\"type\":\"TEXT\""), json);
        assertFalse(json.contains("quote"), json);

        PlaintextMessage decoded = codec.decode(encoded);
        assertEquals(message, decoded);
        assertEquals(ContentType.TEXT, decoded.content().contentType());
    }

    @Test
    public void testAttachmentAndQuote() throws Exception {
        Attachment attachment = new Attachment("a1", "image/png", "cat.png", 2048, new byte[] {1, 2}, new byte[] {3, 4}, 2, 1700000000000L, 640, 480, null);
        QuoteReference quote = new QuoteReference("m1", "alice", "Hello Bob!");
        PlaintextMessage message = new PlaintextMessage("m2", 1700000001000L, new MessageContent.Image(attachment, "a cat"), quote, 1700086400000L);

        PlaintextMessage decoded = codec.decode(codec.encode(message));
        MessageContent.Image image = assertInstanceOf(MessageContent.Image.class, decoded.content());
        assertEquals("a cat", image.caption());
        assertEquals("image/png", image.attachment().contentType());
        assertArrayEquals(new byte[] {3, 4}, image.attachment().key());
        assertEquals(quote, decoded.quote());
        assertTrue(decoded.isExpired(1700086400000L));
        assertFalse(decoded.isExpired(1700000002000L));
    }

    @Test
    public void testOtherVariants() throws Exception {
        List<MessageContent> contents = List.of(
                new MessageContent.Sticker("pack", 12),
                new MessageContent.Location(51.5, -0.12, "London"),
                new MessageContent.Contact(new ContactInfo("Carol", List.of("+123"), List.of())),
                new MessageContent.Voice(new Attachment("v1", "audio/ogg", null, 100, new byte[0], new byte[0], 0, 0, null, null, null), 3000));

        for(MessageContent content : contents) {
            PlaintextMessage decoded = codec.decode(codec.encode(new PlaintextMessage("id", 1, content)));
            assertEquals(content.contentType(), decoded.content().contentType());
        }
    }

    @Test
    public void testQuoteResolvesLazily() {
        PlaintextMessage original = new PlaintextMessage("m1", 1, new MessageContent.Text("original"));
        MessageLookup lookup = id -> Optional.ofNullable(Map.of("m1", original).get(id));

        assertEquals(Optional.of(original), new QuoteReference("m1", "alice", "orig").resolve(lookup));
        assertTrue(new QuoteReference("gone", "alice", "deleted").resolve(lookup).isEmpty());
    }

    @Test
    public void testMalformedContentRejected() {
        assertThrows(MalformedMessageException.class, () -> codec.decode("not json".getBytes(StandardCharsets.UTF_8)));
        assertThrows(MalformedMessageException.class, () -> codec.decode("{\"id\":\"m\",\"timestamp\":1,\"content\":{\"type\":\"HOLOGRAM\"}}".getBytes(StandardCharsets.UTF_8)));
        assertThrows(MalformedMessageException.class, () -> codec.decode("{\"timestamp\":1}".getBytes(StandardCharsets.UTF_8)));
    }
}
