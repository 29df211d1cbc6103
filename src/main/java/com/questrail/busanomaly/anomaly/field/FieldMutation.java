package com.questrail.busanomaly.anomaly.field;

import com.questrail.busanomaly.core.Word;
import com.questrail.busanomaly.field.Field;

import java.util.BitSet;
import java.util.Objects;
import java.util.Optional;

/**
 * FieldMutation
 * -----------------------------------------------------------------------------
 * The closed set of ways a field anomaly rewrites a field.
 *
 * <h2>Bits Written</h2>
 * Fields cover {@code length + 1} bits. Each mutation writes:
 * <ul>
 *   <li>{@link #MAX}, {@link #MIN}, {@link #RANDOM_VALUE}, {@link #REPLAY}:
 *       all {@code length + 1} bits</li>
 *   <li>{@link #RANDOM_CONSTANT}: draws {@code length + 2} bits once per run
 *       and writes the first {@code length}; the last field bit keeps its
 *       value</li>
 * </ul>
 * The counts differ per mutation and are kept that way, since they set the
 * magnitude of the generated anomaly.
 */
public enum FieldMutation
{
    /** Every field bit set to 1. */
    MAX("max_value"),

    /** Every field bit set to 0. */
    MIN("min_value"),

    /** One random value per run, written to every affected word. */
    RANDOM_CONSTANT("constant_value"),

    /** A fresh random value for every affected word. */
    RANDOM_VALUE("random_value"),

    /** Field bits copied from the same position of a donor sequence. */
    REPLAY("replay_field");

    private final String label;

    FieldMutation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Returns true if this mutation reads a donor word.
     */
    public boolean requiresDonor() {
        return this == REPLAY;
    }

    /**
     * Binds this mutation to a run's session.
     */
    public WordMutator bind(MutationSession session) {
        Objects.requireNonNull(session, "session");
        return (field, word, donor) -> {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(word, "word");
            Objects.requireNonNull(donor, "donor");
            return new MutationResult(apply(session, field, word, donor), label);
        };
    }

    private Word apply(MutationSession session, Field field, Word word, Optional<Word> donor) {
        int start = field.startBit();
        int bits = field.bitCount();

        return switch (this) {
            case MAX -> {
                BitSet ones = new BitSet(bits);
                ones.set(0, bits);
                yield word.withBits(start, bits, ones);
            }
            case MIN -> word.withBits(start, bits, new BitSet(bits));
            case RANDOM_CONSTANT -> word.withBits(start, field.length(), session.constant(field.length() + 2));
            case RANDOM_VALUE -> word.withBits(start, bits, session.randomBits(field.length() + 2));
            case REPLAY -> {
                Word replayed = donor.orElseThrow(() ->
                        new IllegalArgumentException("Replay requires a donor word"));
                yield word.withBits(start, bits, replayed.slice(start, bits));
            }
        };
    }
}
