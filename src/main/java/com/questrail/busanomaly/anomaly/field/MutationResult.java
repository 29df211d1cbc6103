package com.questrail.busanomaly.anomaly.field;

import com.questrail.busanomaly.core.Word;

import java.util.Objects;

/**
 * A mutated word and the label of the mutation that produced it.
 */
public record MutationResult(Word word, String label)
{
    public MutationResult {
        Objects.requireNonNull(word, "word");
        Objects.requireNonNull(label, "label");
    }
}
