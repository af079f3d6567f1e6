package com.fdb.types;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A borrowed view of Latin-1 encoded text inside a store's backing buffer.
 * <p>
 * No bytes are copied when a view is created. The view must not be retained beyond the lifetime
 * of the store that owns the buffer; call {@link #decode()} to obtain an owned {@link String}.
 * Equality and hashing are defined on byte content.
 */
public final class Latin1Str {

    // Bounds checking control
    private static final boolean BOUNDS_CHECK = Boolean.parseBoolean(
            System.getProperty("fdb.text.bounds.check", "false"));

    private static final Latin1Str EMPTY = new Latin1Str(new byte[0], 0, 0);

    private final byte[] array;
    private final int offset;
    private final int length;
    private String cachedString;

    private Latin1Str(byte[] array, int offset, int length) {
        this.array = array;
        this.offset = offset;
        this.length = length;
    }

    /**
     * Wrap a slice of a backing buffer. The array is shared, not copied, and must not be modified afterwards.
     */
    public static Latin1Str wrap(byte[] array, int offset, int length) {
        Objects.requireNonNull(array, "Array cannot be null");
        if (BOUNDS_CHECK && (offset < 0 || length < 0 || offset + length > array.length)) {
            throw new IllegalArgumentException("Invalid offset/length: " + offset + "/" + length
                    + " for buffer of " + array.length + " bytes");
        }
        return new Latin1Str(array, offset, length);
    }

    /**
     * Encode an owned string. Characters outside Latin-1 are replaced with {@code '?'}.
     */
    public static Latin1Str of(String value) {
        Objects.requireNonNull(value, "String cannot be null");
        if (value.isEmpty()) return EMPTY;
        var bytes = value.getBytes(StandardCharsets.ISO_8859_1);
        return new Latin1Str(bytes, 0, bytes.length);
    }

    public int length() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    public byte byteAt(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + length);
        }
        return array[offset + index];
    }

    /**
     * Copy the bytes of this view.
     */
    public byte[] toByteArray() {
        return Arrays.copyOfRange(array, offset, offset + length);
    }

    /**
     * Decode into an owned string. The result is cached on the view.
     */
    public String decode() {
        String result = cachedString;
        if (result == null) {
            result = new String(array, offset, length, StandardCharsets.ISO_8859_1);
            cachedString = result;
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Latin1Str)) return false;
        var that = (Latin1Str) obj;
        return Arrays.equals(array, offset, offset + length, that.array, that.offset, that.offset + that.length);
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = offset; i < offset + length; i++) {
            result = 31 * result + array[i];
        }
        return result;
    }

    @Override
    public String toString() {
        return decode();
    }
}
