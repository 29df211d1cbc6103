package com.questrail.busanomaly.field;

import com.questrail.busanomaly.api.TrafficRecord;
import com.questrail.busanomaly.core.Tensor;
import com.questrail.busanomaly.core.TensorShape;
import com.questrail.busanomaly.core.TensorShapeException;
import com.questrail.busanomaly.core.Word;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * FieldAnalysis
 * -----------------------------------------------------------------------------
 * Bit-level analysis of words against a field list: constant-bit detection,
 * removal of constant columns and extraction of field values.
 *
 * <h2>Constancy</h2>
 * Constancy is established against a single reference word. A position stays
 * constant only while every scanned word agrees with the reference there; one
 * disagreement clears it for the rest of the scan. Scanning more words can
 * therefore only shrink the constant set.
 */
public final class FieldAnalysis
{
    private FieldAnalysis() {}

    /**
     * Builds the constant-bit mask of a sample.
     *
     * @param reference  word every sample word is compared against
     * @param sample     words to scan; {@code null} entries are skipped
     * @param wordLength width of the mask
     * @return mask with a set bit for every position that never differed
     * @throws TensorShapeException if a sample word is wider than the mask or
     *         the reference
     */
    public static ConstantBitMask findConstantBits(Word reference, List<Word> sample, int wordLength) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(sample, "sample");
        if (wordLength < 0) {
            throw new IllegalArgumentException("wordLength must be non-negative");
        }

        BitSet constant = new BitSet(wordLength);
        constant.set(0, wordLength);

        for (Word word : sample) {
            if (word == null) {
                continue;
            }
            if (word.width() > wordLength || word.width() > reference.width()) {
                throw new TensorShapeException(
                        "Sample word has " + word.width() + " bits; mask width is " + wordLength
                                + " and reference width is " + reference.width());
            }
            for (int bit = word.width() - 1; bit >= 0; bit--) {
                if (reference.bit(bit) != word.bit(bit)) {
                    constant.clear(bit);
                }
            }
        }
        return new ConstantBitMask(constant, wordLength);
    }

    /**
     * Expands every {@link FieldType#CONST} field into its inclusive bit range.
     * <p>
     * Indices are returned in field-list order. Overlapping constant fields
     * produce duplicate indices; {@link #removeConstantBits} tolerates them.
     */
    public static List<Integer> constantBitIndices(List<Field> fields) {
        Objects.requireNonNull(fields, "fields");
        List<Integer> indices = new ArrayList<>();
        for (Field field : fields) {
            if (field.isConstant()) {
                for (int bit = field.startBit(); bit <= field.endBit(); bit++) {
                    indices.add(bit);
                }
            }
        }
        return indices;
    }

    /**
     * Deletes every constant bit column from the tensor. The result has shape
     * {@code (N, P, W - d)} where {@code d} is the number of distinct constant
     * indices.
     *
     * @throws TensorShapeException if a constant field reaches past the word
     */
    public static Tensor removeConstantBits(Tensor tensor, List<Field> fields) {
        Objects.requireNonNull(tensor, "tensor");
        Set<Integer> drop = new LinkedHashSet<>(constantBitIndices(fields));

        for (Integer bit : drop) {
            if (bit >= tensor.bitsPerWord()) {
                throw new TensorShapeException(
                        "Constant bit " + bit + " lies outside a " + tensor.bitsPerWord() + "-bit word");
            }
        }

        List<Word> reduced = new ArrayList<>(tensor.shape().totalWords());
        for (Word word : tensor.flatten()) {
            reduced.add(word.withoutBits(drop));
        }

        TensorShape in = tensor.shape();
        return Tensor.reshape(reduced,
                new TensorShape(in.sequences(), in.wordsPerSequence(), in.bitsPerWord() - drop.size()));
    }

    /**
     * Returns the unsigned integer value of every non-constant field of a
     * record, in field-list order.
     *
     * @throws TensorShapeException if a field reaches past the payload
     */
    public static List<Long> fieldValues(List<Field> fields, TrafficRecord record) {
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(record, "record");

        String bits = record.payloadBits();
        List<Long> values = new ArrayList<>();
        for (Field field : fields) {
            if (field.isConstant()) {
                continue;
            }
            if (field.endBit() >= bits.length()) {
                throw new TensorShapeException(
                        "Field [" + field.startBit() + ".." + field.endBit() + "] lies outside a "
                                + bits.length() + "-bit payload");
            }
            String slice = bits.substring(field.startBit(), field.endBit() + 1);
            values.add(Long.parseUnsignedLong(slice, 2));
        }
        return values;
    }

    /**
     * Turns every maximal run of constant bits in the mask into a
     * {@link FieldType#CONST} field.
     */
    public static List<Field> constantFields(ConstantBitMask mask) {
        Objects.requireNonNull(mask, "mask");
        List<Field> fields = new ArrayList<>();

        int bit = 0;
        while (bit < mask.width()) {
            if (!mask.isConstant(bit)) {
                bit++;
                continue;
            }
            int start = bit;
            while (bit + 1 < mask.width() && mask.isConstant(bit + 1)) {
                bit++;
            }
            // inclusive convention: a run of k bits has length k - 1
            fields.add(Field.constant(start, bit - start));
            bit++;
        }
        return fields;
    }
}
