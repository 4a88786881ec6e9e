package com.parallel.dnamatch;

import com.parallel.dnamatch.engine.Sequence;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads DNA files keeping only {@code A C G T}; lower-case bases are upper-cased and anything else
 * (line breaks, headers, ambiguous bases) is dropped.
 */
public final class SequenceLoader {

    public static final int MAX_SEQUENCE_SIZE = 1_048_576;
    public static final int MAX_SUBSEQUENCE_SIZE = 10_240;

    private static final int READ_CHUNK_SIZE = 64 * 1024;

    private SequenceLoader() {
    }

    public static Sequence loadSequence(Path path) throws IOException {
        return load(path, MAX_SEQUENCE_SIZE);
    }

    public static Sequence loadSubsequence(Path path) throws IOException {
        return load(path, MAX_SUBSEQUENCE_SIZE);
    }

    public static Sequence load(Path path, int maxSymbols) throws IOException {
        ByteArrayOutputStream kept = new ByteArrayOutputStream();
        byte[] chunk = new byte[READ_CHUNK_SIZE];
        try (InputStream in = Files.newInputStream(path)) {
            int n;
            while ((n = in.read(chunk)) != -1) {
                for (int i = 0; i < n; i++) {
                    int base = Character.toUpperCase(chunk[i]);
                    if (Sequence.ALPHABET.indexOf(base) < 0) {
                        continue;
                    }
                    if (kept.size() >= maxSymbols) {
                        throw new IOException("File '" + path + "' too big after filtering (max " + maxSymbols + ")");
                    }
                    kept.write(base);
                }
            }
        }
        return Sequence.ofBytes(kept.toByteArray());
    }
}
