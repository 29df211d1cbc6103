package com.questrail.busanomaly.field;

import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Per-bit constancy mask over words of a fixed width. A set bit means the
 * position never differed from the reference word during the scan.
 */
public final class ConstantBitMask
{
    private final BitSet constant;
    private final int width;

    ConstantBitMask(BitSet constant, int width) {
        this.constant = Objects.requireNonNull(constant, "constant");
        this.width = width;
    }

    public int width() {
        return width;
    }

    public boolean isConstant(int bit) {
        if (bit < 0 || bit >= width) {
            throw new IndexOutOfBoundsException("bit=" + bit + ", width=" + width);
        }
        return constant.get(bit);
    }

    public int constantCount() {
        return constant.cardinality();
    }

    public List<Integer> constantIndices() {
        return constant.stream().boxed().collect(Collectors.toList());
    }

    /**
     * Returns the mask as a boolean array of length {@link #width()}.
     */
    public boolean[] toArray() {
        boolean[] out = new boolean[width];
        for (int i = 0; i < width; i++) {
            out[i] = constant.get(i);
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConstantBitMask)) {
            return false;
        }
        ConstantBitMask other = (ConstantBitMask) o;
        return width == other.width && constant.equals(other.constant);
    }

    @Override
    public int hashCode() {
        return 31 * constant.hashCode() + width;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(width);
        for (int i = 0; i < width; i++) {
            sb.append(constant.get(i) ? 'C' : '.');
        }
        return sb.toString();
    }
}
