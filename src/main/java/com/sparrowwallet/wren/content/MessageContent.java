package com.sparrowwallet.wren.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import javax.annotation.Nullable;

/**
 * The typed body of a plaintext message. Each variant is encoded as a JSON object whose {@code type} property is the
 * variant's {@link ContentType} name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MessageContent.Text.class, name = "TEXT"),
        @JsonSubTypes.Type(value = MessageContent.Image.class, name = "IMAGE"),
        @JsonSubTypes.Type(value = MessageContent.Video.class, name = "VIDEO"),
        @JsonSubTypes.Type(value = MessageContent.Audio.class, name = "AUDIO"),
        @JsonSubTypes.Type(value = MessageContent.File.class, name = "FILE"),
        @JsonSubTypes.Type(value = MessageContent.Voice.class, name = "VOICE"),
        @JsonSubTypes.Type(value = MessageContent.Sticker.class, name = "STICKER"),
        @JsonSubTypes.Type(value = MessageContent.Contact.class, name = "CONTACT"),
        @JsonSubTypes.Type(value = MessageContent.Location.class, name = "LOCATION")
})
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public interface MessageContent {
    ContentType contentType();

    record Text(String body) implements MessageContent {
        public ContentType contentType() {
            return ContentType.TEXT;
        }
    }

    record Image(Attachment attachment, @Nullable String caption) implements MessageContent {
        public ContentType contentType() {
            return ContentType.IMAGE;
        }
    }

    record Video(Attachment attachment, @Nullable String caption) implements MessageContent {
        public ContentType contentType() {
            return ContentType.VIDEO;
        }
    }

    record Audio(Attachment attachment) implements MessageContent {
        public ContentType contentType() {
            return ContentType.AUDIO;
        }
    }

    record File(Attachment attachment) implements MessageContent {
        public ContentType contentType() {
            return ContentType.FILE;
        }
    }

    record Voice(Attachment attachment, long durationMs) implements MessageContent {
        public ContentType contentType() {
            return ContentType.VOICE;
        }
    }

    record Sticker(String packId, long stickerId) implements MessageContent {
        public ContentType contentType() {
            return ContentType.STICKER;
        }
    }

    record Contact(ContactInfo contact) implements MessageContent {
        public ContentType contentType() {
            return ContentType.CONTACT;
        }
    }

    record Location(double latitude, double longitude, @Nullable String name) implements MessageContent {
        public ContentType contentType() {
            return ContentType.LOCATION;
        }
    }
}
