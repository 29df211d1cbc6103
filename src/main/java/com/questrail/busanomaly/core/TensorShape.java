package com.questrail.busanomaly.core;

/**
 * Shape of a {@link Tensor}: {@code (sequences, wordsPerSequence, bitsPerWord)},
 * written {@code (N, P, W)} throughout this library.
 */
public record TensorShape(int sequences, int wordsPerSequence, int bitsPerWord)
{
    public TensorShape {
        if (sequences < 0) {
            throw new IllegalArgumentException("sequences must be non-negative");
        }
        if (wordsPerSequence < 0) {
            throw new IllegalArgumentException("wordsPerSequence must be non-negative");
        }
        if (bitsPerWord < 0) {
            throw new IllegalArgumentException("bitsPerWord must be non-negative");
        }
    }

    /**
     * Total number of words, {@code N * P}.
     */
    public int totalWords() {
        return sequences * wordsPerSequence;
    }

    @Override
    public String toString() {
        return "(" + sequences + ", " + wordsPerSequence + ", " + bitsPerWord + ")";
    }
}
