package com.questrail.busanomaly.anomaly.field;

import com.questrail.busanomaly.core.Word;
import com.questrail.busanomaly.field.Field;

import java.util.Optional;

/**
 * Rewrites the bits of one field in one word.
 * <p>
 * Implementations return a new word; bits outside the field are left exactly
 * as they were. Only mutations that replay data from another sequence use the
 * donor word.
 */
@FunctionalInterface
public interface WordMutator
{
    /**
     * @param field target field
     * @param word  word to mutate
     * @param donor word at the same position of the donor sequence, if the
     *              mutation needs one
     * @return the mutated word and the mutation label
     */
    MutationResult mutate(Field field, Word word, Optional<Word> donor);
}
