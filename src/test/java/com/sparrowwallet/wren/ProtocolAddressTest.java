package com.sparrowwallet.wren;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

public class ProtocolAddressTest {
    @Test
    public void testStringForm() {
        ProtocolAddress address = new ProtocolAddress("alice", 3);
        assertEquals("alice.3", address.toString());
        assertEquals(address, ProtocolAddress.parse("alice.3"));
    }

    @Test
    public void testParseNameWithDots() {
        ProtocolAddress address = ProtocolAddress.parse("alice.example.com.12");
        assertEquals("alice.example.com", address.getName());
        assertEquals(12, address.getDeviceId());
    }

    @Test
    public void testInvalidAddresses() {
        assertThrows(IllegalArgumentException.class, () -> ProtocolAddress.parse("alice"));
        assertThrows(IllegalArgumentException.class, () -> ProtocolAddress.parse("alice."));
        assertThrows(IllegalArgumentException.class, () -> ProtocolAddress.parse(".1"));
        assertThrows(IllegalArgumentException.class, () -> ProtocolAddress.parse("alice.one"));
        assertThrows(IllegalArgumentException.class, () -> new ProtocolAddress("", 1));
    }

    @Test
    public void testOrderingByStringForm() {
        TreeSet<ProtocolAddress> addresses = new TreeSet<>(List.of(new ProtocolAddress("bob", 1), new ProtocolAddress("alice", 2), new ProtocolAddress("alice", 10)));
        assertEquals(List.of("alice.10", "alice.2", "bob.1"), addresses.stream().map(ProtocolAddress::toString).toList());
    }
}
