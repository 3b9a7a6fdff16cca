package com.sparrowwallet.wren.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import javax.annotation.Nullable;

/**
 * What a sender encrypts: a message id, a send timestamp in milliseconds, the typed content, an optional quote and an
 * optional expiry time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlaintextMessage(String id, long timestamp, MessageContent content, @Nullable QuoteReference quote, @Nullable Long expiresAt) {
    public PlaintextMessage(String id, long timestamp, MessageContent content) {
        this(id, timestamp, content, null, null);
    }

    public boolean isExpired(long now) {
        return expiresAt != null && now >= expiresAt;
    }
}
