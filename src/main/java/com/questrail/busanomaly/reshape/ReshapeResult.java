package com.questrail.busanomaly.reshape;

import com.questrail.busanomaly.core.Tensor;

import java.util.Objects;

/**
 * Outcome of cutting traffic into sequences.
 *
 * @param tensor         the complete sequences
 * @param discardedWords trailing words that did not fill a whole sequence
 */
public record ReshapeResult(Tensor tensor, int discardedWords)
{
    public ReshapeResult {
        Objects.requireNonNull(tensor, "tensor");
        if (discardedWords < 0) {
            throw new IllegalArgumentException("discardedWords must be non-negative");
        }
    }
}
