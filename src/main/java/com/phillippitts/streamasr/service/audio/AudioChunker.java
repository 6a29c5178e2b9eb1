package com.phillippitts.streamasr.service.audio;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Splits a byte buffer into ordered chunks of at most {@code chunkSize} bytes.
 *
 * <p>Every chunk but the last holds exactly {@code chunkSize} bytes. The last chunk holds the
 * remainder, between 0 and {@code chunkSize} bytes, and is the only one flagged final. An empty
 * buffer yields a single empty final chunk.
 */
public final class AudioChunker {

    private AudioChunker() {}

    /**
     * Lazily splits {@code data}. The returned iterator walks the buffer once and cannot be reset.
     *
     * @param data      bytes to split
     * @param chunkSize maximum chunk size in bytes (positive)
     * @return iterator over the chunks
     * @throws IllegalArgumentException if {@code chunkSize <= 0}
     */
    public static Iterator<Chunk> split(byte[] data, int chunkSize) {
        Objects.requireNonNull(data, "data");
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got: " + chunkSize);
        }
        return new ChunkIterator(data, chunkSize);
    }

    private static final class ChunkIterator implements Iterator<Chunk> {
        private final byte[] data;
        private final int chunkSize;
        private int offset;
        private boolean finished;

        private ChunkIterator(byte[] data, int chunkSize) {
            this.data = data;
            this.chunkSize = chunkSize;
        }

        @Override
        public boolean hasNext() {
            return !finished;
        }

        @Override
        public Chunk next() {
            if (finished) {
                throw new NoSuchElementException("all chunks consumed");
            }
            // long arithmetic: offset + chunkSize may exceed Integer.MAX_VALUE
            if ((long) offset + chunkSize < data.length) {
                Chunk chunk = new Chunk(Arrays.copyOfRange(data, offset, offset + chunkSize), false);
                offset += chunkSize;
                return chunk;
            }
            finished = true;
            return new Chunk(Arrays.copyOfRange(data, offset, data.length), true);
        }
    }
}
