package com.questrail.busanomaly.anomaly.structural;

import com.questrail.busanomaly.api.LabeledTensor;
import com.questrail.busanomaly.core.Tensor;
import com.questrail.busanomaly.core.Word;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reverses the order of words.
 * <p>
 * The flattened word stream is reversed, cut back into {@code (N, P)}, and
 * then the sequence order is reversed as well. The two reversals compose:
 * sequence {@code i} of the output holds the words of input sequence
 * {@code i} in reverse order.
 */
public final class ReverseGenerator implements StructuralAnomalyGenerator
{
    public static final String LABEL = "reverse";

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public LabeledTensor generate(Tensor sequences) {
        Objects.requireNonNull(sequences, "sequences");

        List<Word> flat = sequences.flatten();
        Collections.reverse(flat);
        Tensor reversedWords = Tensor.reshape(flat, sequences.shape());

        List<Word> out = new ArrayList<>(flat.size());
        for (int i = reversedWords.sequenceCount() - 1; i >= 0; i--) {
            out.addAll(reversedWords.sequence(i));
        }
        return new LabeledTensor(Tensor.reshape(out, sequences.shape()), LABEL);
    }
}
