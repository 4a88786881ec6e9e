package com.parallel.dnamatch.engine;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Immutable run of DNA symbols ({@code A}, {@code C}, {@code G}, {@code T}).
 * Instances are shared read-only between every worker of a search.
 */
public final class Sequence {

    public static final String ALPHABET = "ACGT";

    private final byte[] symbols;

    private Sequence(byte[] symbols) {
        this.symbols = symbols;
    }

    public static Sequence of(String symbols) {
        return ofBytes(symbols.getBytes(StandardCharsets.US_ASCII));
    }

    /**
     * Copies the given symbols; every byte must belong to {@link #ALPHABET}.
     */
    public static Sequence ofBytes(byte[] symbols) {
        for (int i = 0; i < symbols.length; i++) {
            if (ALPHABET.indexOf(symbols[i]) < 0) {
                throw new IllegalArgumentException("Invalid symbol '" + (char) symbols[i] + "' at index " + i);
            }
        }
        return new Sequence(symbols.clone());
    }

    public int length() {
        return symbols.length;
    }

    public boolean isEmpty() {
        return symbols.length == 0;
    }

    public byte symbolAt(int index) {
        return symbols[index];
    }

    public byte[] toByteArray() {
        return symbols.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Sequence other && Arrays.equals(symbols, other.symbols);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(symbols);
    }

    @Override
    public String toString() {
        return new String(symbols, StandardCharsets.US_ASCII);
    }
}
