package com.sparrowwallet.wren.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ContactInfo(String name, List<String> phoneNumbers, List<String> emails) {
    public ContactInfo {
        phoneNumbers = phoneNumbers == null ? List.of() : List.copyOf(phoneNumbers);
        emails = emails == null ? List.of() : List.copyOf(emails);
    }
}
