package com.sparrowwallet.wren.content;

import java.util.Optional;

/**
 * Resolves message ids to messages, typically backed by the application's message history.
 */
@FunctionalInterface
public interface MessageLookup {
    Optional<PlaintextMessage> findMessage(String messageId);
}
