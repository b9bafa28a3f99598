package org.introspect.runtime;

import org.introspect.ExpressionEvaluationException;

import java.io.ByteArrayOutputStream;

/**
 * A run-time pointer value: an address, optionally backed by readable storage so
 * character pointers can be dereferenced for display.
 */
public final class Pointer {

    public static final Pointer NULL = new Pointer(0L, null, 0);

    private final long address;
    private final byte[] storage;
    private final int offset;

    private Pointer(long address, byte[] storage, int offset) {
        this.address = address;
        this.storage = storage;
        this.offset = offset;
    }

    public static Pointer ofAddress(long address) {
        return address == 0L ? NULL : new Pointer(address, null, 0);
    }

    /**
     * A pointer to the first byte of {@code storage}, which lives at {@code address}.
     */
    public static Pointer to(long address, byte[] storage) {
        if (address == 0L) {
            throw new IllegalArgumentException("Storage cannot live at address 0");
        }
        return new Pointer(address, storage, 0);
    }

    public long getAddress() {
        return address;
    }

    public boolean isNull() {
        return address == 0L;
    }

    public boolean isReadable() {
        return storage != null && offset >= 0 && offset <= storage.length;
    }

    public Pointer plus(long bytes) {
        if (storage == null) {
            return ofAddress(address + bytes);
        }
        return new Pointer(address + bytes, storage, Math.toIntExact(offset + bytes));
    }

    /**
     * Reads bytes up to (not including) the first NUL or the end of the backing storage.
     */
    public byte[] readCString() {
        if (!isReadable()) {
            throw new ExpressionEvaluationException(
                    "Pointer 0x" + Long.toHexString(address) + " has no readable storage");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = offset; i < storage.length && storage[i] != 0; i++) {
            out.write(storage[i]);
        }
        return out.toByteArray();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Pointer && ((Pointer) o).address == address;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(address);
    }

    @Override
    public String toString() {
        return isNull() ? "NULL" : "0x" + Long.toHexString(address);
    }
}
