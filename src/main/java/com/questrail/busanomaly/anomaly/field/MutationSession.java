package com.questrail.busanomaly.anomaly.field;

import java.util.BitSet;
import java.util.Objects;
import java.util.Random;

/**
 * State shared by the mutations of one field-anomaly run.
 * <p>
 * A session owns the random source and the constant drawn by
 * {@link FieldMutation#RANDOM_CONSTANT}. The constant is drawn on first use
 * and then reused for every word of the run. Each run starts a new session,
 * so a constant never carries over to another run.
 */
public final class MutationSession
{
    private final Random random;
    private BitSet constant;

    public MutationSession(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Returns the run's constant, drawing {@code bits} random bits on the
     * first call. Later calls return the same bits regardless of the argument.
     */
    BitSet constant(int bits) {
        if (constant == null) {
            constant = randomBits(bits);
        }
        return constant;
    }

    /**
     * Returns whether the run's constant has been drawn yet.
     */
    public boolean hasConstant() {
        return constant != null;
    }

    /**
     * Draws {@code bits} independent random bits.
     */
    BitSet randomBits(int bits) {
        BitSet out = new BitSet(bits);
        for (int i = 0; i < bits; i++) {
            if (random.nextBoolean()) {
                out.set(i);
            }
        }
        return out;
    }
}
