package com.sparrowwallet.wren.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Optional;

/**
 * Points at the message being replied to by id. The snippet is a short preview shown when the quoted message is no
 * longer available locally.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuoteReference(String messageId, String senderLabel, String snippet) {
    public Optional<PlaintextMessage> resolve(MessageLookup lookup) {
        return lookup.findMessage(messageId);
    }
}
