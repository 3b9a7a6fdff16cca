package com.sparrowwallet.wren;

import java.util.Objects;

/**
 * Identifies one device of a peer. The string form is {@code name.deviceId}, and addresses are ordered by it.
 */
public final class ProtocolAddress implements Comparable<ProtocolAddress> {
    private final String name;
    private final int deviceId;

    public ProtocolAddress(String name, int deviceId) {
        if(name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Address name cannot be empty");
        }

        this.name = name;
        this.deviceId = deviceId;
    }

    /**
     * Parses the string form, splitting at the last '.' so that names may themselves contain dots.
     */
    public static ProtocolAddress parse(String address) {
        int index = address == null ? -1 : address.lastIndexOf('.');
        if(index <= 0 || index == address.length() - 1) {
            throw new IllegalArgumentException("Invalid protocol address: " + address);
        }

        try {
            return new ProtocolAddress(address.substring(0, index), Integer.parseInt(address.substring(index + 1)));
        } catch(NumberFormatException e) {
            throw new IllegalArgumentException("Invalid device id in protocol address: " + address, e);
        }
    }

    public String getName() {
        return name;
    }

    public int getDeviceId() {
        return deviceId;
    }

    @Override
    public int compareTo(ProtocolAddress other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(o == null || getClass() != o.getClass()) {
            return false;
        }

        ProtocolAddress that = (ProtocolAddress)o;
        return deviceId == that.deviceId && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, deviceId);
    }

    @Override
    public String toString() {
        return name + "." + deviceId;
    }
}
