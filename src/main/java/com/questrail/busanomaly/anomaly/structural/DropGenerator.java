package com.questrail.busanomaly.anomaly.structural;

import com.questrail.busanomaly.api.LabeledTensor;
import com.questrail.busanomaly.core.Tensor;
import com.questrail.busanomaly.core.TensorShape;
import com.questrail.busanomaly.core.TensorShapeException;
import com.questrail.busanomaly.core.Word;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Removes a block of words around the middle of every sequence.
 * <p>
 * With {@code mid = P / 2} and {@code half = length / 2}, positions
 * {@code [mid - half, mid + half)} are removed from each sequence. For an even
 * {@code length} that is exactly {@code length} words; an odd {@code length}
 * removes {@code length - 1}.
 * <p>
 * The output has shape {@code (N, P - 2 * half, W)}.
 */
public final class DropGenerator implements StructuralAnomalyGenerator
{
    public static final String LABEL = "drop";
    public static final int DEFAULT_LENGTH = 10;

    private final int length;

    public DropGenerator() {
        this(DEFAULT_LENGTH);
    }

    public DropGenerator(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
        this.length = length;
    }

    public int length() {
        return length;
    }

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public LabeledTensor generate(Tensor sequences) {
        Objects.requireNonNull(sequences, "sequences");

        int p = sequences.wordsPerSequence();
        if (length >= p) {
            throw new TensorShapeException(
                    "Cannot drop " + length + " words from sequences of " + p + " words");
        }

        int mid = p / 2;
        int half = length / 2;
        int from = mid - half;
        int to = mid + half;

        List<Word> out = new ArrayList<>();
        for (int i = 0; i < sequences.sequenceCount(); i++) {
            for (int j = 0; j < p; j++) {
                if (j < from || j >= to) {
                    out.add(sequences.word(i, j));
                }
            }
        }

        TensorShape in = sequences.shape();
        TensorShape shape = new TensorShape(in.sequences(), p - (to - from), in.bitsPerWord());
        return new LabeledTensor(Tensor.reshape(out, shape), LABEL);
    }
}
