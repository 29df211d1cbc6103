package com.questrail.busanomaly.anomaly.structural;

import com.questrail.busanomaly.api.LabeledTensor;
import com.questrail.busanomaly.core.Tensor;
import com.questrail.busanomaly.core.Word;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Interleaves the first and second half of the traffic word by word.
 * <p>
 * All words are flattened in sequence order and split into halves
 * {@code x} and {@code y}; the result is {@code x1, y1, x2, y2, ...} cut back
 * into the original shape.
 * <p>
 * With an odd word count the middle word belongs to neither half. It is kept
 * and placed last, so the output keeps the input shape.
 */
public final class InterleaveGenerator implements StructuralAnomalyGenerator
{
    public static final String LABEL = "interleave";

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public LabeledTensor generate(Tensor sequences) {
        Objects.requireNonNull(sequences, "sequences");

        List<Word> flat = sequences.flatten();
        int total = flat.size();
        int half = total / 2;

        List<Word> interleaved = new ArrayList<>(total);
        for (int i = 0; i < half; i++) {
            interleaved.add(flat.get(i));
            interleaved.add(flat.get(total - half + i));
        }
        if (total % 2 != 0) {
            interleaved.add(flat.get(half));
        }

        return new LabeledTensor(Tensor.reshape(interleaved, sequences.shape()), LABEL);
    }
}
