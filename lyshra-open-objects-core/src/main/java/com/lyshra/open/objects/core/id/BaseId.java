package com.lyshra.open.objects.core.id;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Base type for the opaque, fixed-size binary identifiers used across the cluster.
 *
 * An identifier is an immutable byte array of a length fixed by the concrete type.
 * The nil identifier has every byte set to {@code 0xFF} and stands for "no id",
 * e.g. the spilled node of an object that was never spilled.
 *
 * Thread Safety: This class is immutable and thread-safe.
 */
public abstract class BaseId {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private final byte[] id;

    protected BaseId(byte[] id, int expectedSize) {
        Objects.requireNonNull(id, "id must not be null");
        if (id.length != expectedSize) {
            throw new IllegalArgumentException(String.format(
                    "%s must be %d bytes long, got %d", getClass().getSimpleName(), expectedSize, id.length));
        }
        this.id = id.clone();
    }

    protected static byte[] nilBytes(int size) {
        byte[] bytes = new byte[size];
        Arrays.fill(bytes, (byte) 0xFF);
        return bytes;
    }

    protected static byte[] randomBytes(int size) {
        byte[] bytes = new byte[size];
        do {
            RANDOM.nextBytes(bytes);
        } while (isAllNil(bytes));
        return bytes;
    }

    protected static byte[] hexBytes(String hex) {
        Objects.requireNonNull(hex, "hex must not be null");
        return HEX.parseHex(hex);
    }

    private static boolean isAllNil(byte[] bytes) {
        for (byte b : bytes) {
            if (b != (byte) 0xFF) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns a copy of the raw identifier bytes.
     */
    public byte[] toBinary() {
        return id.clone();
    }

    /**
     * Returns the lowercase hex form of the identifier.
     */
    public String toHex() {
        return HEX.formatHex(id);
    }

    /**
     * Checks if this is the nil identifier.
     */
    public boolean isNil() {
        return isAllNil(id);
    }

    public int size() {
        return id.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(id, ((BaseId) o).id);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(id);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
