package com.questrail.busanomaly.core;

import java.util.BitSet;
import java.util.Collection;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Word
 * -----------------------------------------------------------------------------
 * A fixed-width, immutable bit vector representing one decoded bus message
 * payload.
 *
 * <h2>Bit Order</h2>
 * Bit {@code 0} is the left-most character of the binary-string form the
 * payload was decoded from. Field offsets ({@code startBit}) address bits in
 * this same order.
 *
 * <h2>Internal Representation</h2>
 * A {@link BitSet} holds the set bits and an explicit {@code width} holds the
 * word length, since a {@code BitSet} alone cannot express trailing zeros.
 *
 * <h2>Mutability</h2>
 * Instances never change. Every "modifying" operation returns a new
 * {@code Word}; anomaly generators rely on this to leave the source tensor
 * untouched.
 */
public final class Word
{
    private final BitSet bits;
    private final int width;

    private Word(BitSet bits, int width) {
        this.bits = bits;
        this.width = width;
    }

    /**
     * Creates a word from its binary-string form, e.g. {@code "01001101"}.
     *
     * @throws IllegalArgumentException if the string contains anything other
     *         than {@code '0'} and {@code '1'}
     */
    public static Word fromBinaryString(String binary) {
        Objects.requireNonNull(binary, "binary");
        BitSet bits = new BitSet(binary.length());
        for (int i = 0; i < binary.length(); i++) {
            char c = binary.charAt(i);
            if (c == '1') {
                bits.set(i);
            } else if (c != '0') {
                throw new IllegalArgumentException(
                        "Not a binary digit at position " + i + ": '" + c + "'");
            }
        }
        return new Word(bits, binary.length());
    }

    /**
     * Creates an all-zero word of the given width.
     */
    public static Word zeros(int width) {
        requireWidth(width);
        return new Word(new BitSet(width), width);
    }

    /**
     * Creates an all-one word of the given width.
     */
    public static Word ones(int width) {
        requireWidth(width);
        BitSet bits = new BitSet(width);
        bits.set(0, width);
        return new Word(bits, width);
    }

    public int width() {
        return width;
    }

    public boolean bit(int index) {
        checkIndex(index);
        return bits.get(index);
    }

    /**
     * Returns a copy of this word with the bits starting at {@code start}
     * replaced by the first {@code count} bits of {@code source}.
     */
    public Word withBits(int start, int count, BitSet source) {
        Objects.requireNonNull(source, "source");
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative");
        }
        if (count == 0) {
            return this;
        }
        checkIndex(start);
        checkIndex(start + count - 1);

        BitSet copy = (BitSet) bits.clone();
        for (int i = 0; i < count; i++) {
            copy.set(start + i, source.get(i));
        }
        return new Word(copy, width);
    }

    /**
     * Returns {@code count} bits starting at {@code start}, re-based so that
     * bit {@code start} is bit 0 of the result.
     */
    public BitSet slice(int start, int count) {
        if (count == 0) {
            return new BitSet();
        }
        checkIndex(start);
        checkIndex(start + count - 1);
        return bits.get(start, start + count);
    }

    /**
     * Returns a narrower word with the given bit positions deleted.
     * Duplicate positions are deleted once.
     */
    public Word withoutBits(Collection<Integer> positions) {
        Objects.requireNonNull(positions, "positions");
        TreeSet<Integer> drop = new TreeSet<>(positions);
        for (Integer p : drop) {
            checkIndex(p);
        }

        BitSet out = new BitSet(width - drop.size());
        int target = 0;
        for (int i = 0; i < width; i++) {
            if (drop.contains(i)) {
                continue;
            }
            if (bits.get(i)) {
                out.set(target);
            }
            target++;
        }
        return new Word(out, target);
    }

    public String toBinaryString() {
        return IntStream.range(0, width)
                .mapToObj(i -> bits.get(i) ? "1" : "0")
                .collect(Collectors.joining());
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= width) {
            throw new IndexOutOfBoundsException("bit=" + index + ", width=" + width);
        }
    }

    private static void requireWidth(int width) {
        if (width < 0) {
            throw new IllegalArgumentException("width must be non-negative");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Word)) {
            return false;
        }
        Word other = (Word) o;
        return width == other.width && bits.equals(other.bits);
    }

    @Override
    public int hashCode() {
        return 31 * bits.hashCode() + width;
    }

    @Override
    public String toString() {
        return toBinaryString();
    }
}
