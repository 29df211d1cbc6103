package com.questrail.busanomaly.field;

import java.util.Objects;

/**
 * Field
 * -----------------------------------------------------------------------------
 * One bit-range within a {@link com.questrail.busanomaly.core.Word}.
 *
 * <h2>Length Convention</h2>
 * A field spans {@code [startBit, startBit + length]} <b>inclusive</b>, so a
 * field of length {@code L} covers {@code L + 1} bits. Every consumer in this
 * library uses this convention; {@link #bitCount()} and {@link #endBit()} are
 * the only places that spell it out.
 *
 * <h2>Category</h2>
 * {@code category} is the variability class used to target anomalies. It may
 * be {@code null} for fields that were never classified by variability
 * (typically {@link FieldType#CONST} fields).
 *
 * @param startBit   first bit of the field (0-based)
 * @param length     field length; the field covers {@code length + 1} bits
 * @param type       value-kind classification
 * @param category   variability class, or {@code null}
 * @param valueCount number of distinct values observed; informational only
 */
public record Field(int startBit, int length, FieldType type, FieldVariability category, int valueCount)
{
    public Field {
        Objects.requireNonNull(type, "type");
        if (startBit < 0) {
            throw new IllegalArgumentException("startBit must be non-negative");
        }
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
        if (valueCount < 0) {
            throw new IllegalArgumentException("valueCount must be non-negative");
        }
    }

    public static Field constant(int startBit, int length) {
        return new Field(startBit, length, FieldType.CONST, null, 1);
    }

    public boolean isConstant() {
        return type == FieldType.CONST;
    }

    /**
     * Last bit covered by this field (inclusive).
     */
    public int endBit() {
        return startBit + length;
    }

    /**
     * Number of bits covered by this field, {@code length + 1}.
     */
    public int bitCount() {
        return length + 1;
    }
}
