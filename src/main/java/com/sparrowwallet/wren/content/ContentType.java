package com.sparrowwallet.wren.content;

/**
 * Discriminant of {@link MessageContent}, written as the {@code type} property of the encoded content.
 */
public enum ContentType {
    TEXT, IMAGE, VIDEO, AUDIO, FILE, VOICE, STICKER, CONTACT, LOCATION
}
