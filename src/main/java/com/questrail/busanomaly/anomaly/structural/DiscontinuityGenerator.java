package com.questrail.busanomaly.anomaly.structural;

import com.questrail.busanomaly.anomaly.DonorRotation;
import com.questrail.busanomaly.api.LabeledTensor;
import com.questrail.busanomaly.core.Tensor;
import com.questrail.busanomaly.core.Word;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splices the second half of every sequence from another sequence.
 * <p>
 * Each sequence keeps its first {@code P / 2} words. The remaining words are
 * copied from a donor sequence; the donor of sequence {@code i} is
 * {@code (N / 2 - 1 + i) mod N}. The result is still valid traffic, with a
 * sudden change of context halfway through.
 */
public final class DiscontinuityGenerator implements StructuralAnomalyGenerator
{
    public static final String LABEL = "discontinuity";

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public LabeledTensor generate(Tensor sequences) {
        Objects.requireNonNull(sequences, "sequences");

        int n = sequences.sequenceCount();
        int p = sequences.wordsPerSequence();
        int mid = p / 2;
        int[] donors = DonorRotation.sequence(n / 2 - 1, Math.max(n, 1), n);

        List<Word> out = new ArrayList<>(sequences.shape().totalWords());
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < p; j++) {
                out.add(j < mid ? sequences.word(i, j) : sequences.word(donors[i], j));
            }
        }
        return new LabeledTensor(Tensor.reshape(out, sequences.shape()), LABEL);
    }
}
