package com.sparrowwallet.wren.content;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparrowwallet.wren.MalformedMessageException;

import java.io.IOException;

/**
 * Converts {@link PlaintextMessage}s to and from the UTF-8 JSON bytes passed to the engine for encryption.
 */
public class MessageContentCodec {
    private final ObjectMapper mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

    public byte[] encode(PlaintextMessage message) {
        try {
            return mapper.writeValueAsBytes(message);
        } catch(JsonProcessingException e) {
            throw new IllegalStateException("Could not encode message " + message.id(), e);
        }
    }

    public PlaintextMessage decode(byte[] plaintext) throws MalformedMessageException {
        PlaintextMessage message;
        try {
            message = mapper.readValue(plaintext, PlaintextMessage.class);
        } catch(IOException e) {
            throw new MalformedMessageException("Could not decode message content", e);
        }

        if(message == null || message.id() == null || message.content() == null) {
            throw new MalformedMessageException("Message content is missing required fields");
        }

        return message;
    }
}
