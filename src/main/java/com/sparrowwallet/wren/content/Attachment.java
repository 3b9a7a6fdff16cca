package com.sparrowwallet.wren.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import javax.annotation.Nullable;

/**
 * A reference to encrypted attachment data stored elsewhere. The key and digest let the receiver fetch, verify and
 * decrypt it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Attachment(String id, String contentType, @Nullable String fileName, long size, byte[] digest, byte[] key, int cdnNumber,
                         long uploadTimestamp, @Nullable Integer width, @Nullable Integer height, @Nullable byte[] thumbnail) {
}
