package com.questrail.busanomaly.core;

/**
 * Indicates that a tensor, word or transform parameter violates a shape
 * precondition and the requested transform cannot proceed.
 *
 * Typical causes:
 * <ul>
 *   <li>Words of differing widths in one sequence stream</li>
 *   <li>A drop length that is not smaller than the sequence length</li>
 *   <li>An anomaly run that cannot fit after the first third of a sequence</li>
 *   <li>A field whose bit range lies outside the word</li>
 * </ul>
 *
 * These are input-contract failures; retrying with the same inputs will fail
 * the same way.
 */
public final class TensorShapeException extends RuntimeException
{
    public TensorShapeException(String message) {
        super(message);
    }

    public TensorShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
