package com.questrail.busanomaly.anomaly.field;

import com.questrail.busanomaly.core.Word;
import com.questrail.busanomaly.field.Field;
import com.questrail.busanomaly.field.FieldType;
import com.questrail.busanomaly.field.FieldVariability;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FieldMutationTest {

    // covers bits 2..4
    private static final Field FIELD = new Field(2, 2, FieldType.SENSOR, FieldVariability.HIGH_VAR, 8);

    private static MutationResult apply(FieldMutation mutation, MutationSession session, Word word) {
        return mutation.bind(session).mutate(FIELD, word, Optional.empty());
    }

    @Test
    void labelsMatchMutationNames() {
        assertEquals("max_value", FieldMutation.MAX.label());
        assertEquals("min_value", FieldMutation.MIN.label());
        assertEquals("constant_value", FieldMutation.RANDOM_CONSTANT.label());
        assertEquals("random_value", FieldMutation.RANDOM_VALUE.label());
        assertEquals("replay_field", FieldMutation.REPLAY.label());
    }

    @Test
    void maxSetsEveryFieldBit() {
        MutationResult result = apply(FieldMutation.MAX, new MutationSession(new Random(1)), Word.zeros(8));
        assertEquals("00111000", result.word().toBinaryString());
        assertEquals("max_value", result.label());
    }

    @Test
    void minClearsEveryFieldBit() {
        MutationResult result = apply(FieldMutation.MIN, new MutationSession(new Random(1)), Word.ones(8));
        assertEquals("11000111", result.word().toBinaryString());
    }

    @Test
    void randomConstantIsReusedWithinSessionAndSkipsLastFieldBit() {
        MutationSession session = new MutationSession(new Random(5));
        assertFalse(session.hasConstant());

        Word fromZeros = apply(FieldMutation.RANDOM_CONSTANT, session, Word.zeros(8)).word();
        Word fromOnes = apply(FieldMutation.RANDOM_CONSTANT, session, Word.ones(8)).word();

        assertTrue(session.hasConstant());
        assertEquals(fromZeros.bit(2), fromOnes.bit(2));
        assertEquals(fromZeros.bit(3), fromOnes.bit(3));
        assertFalse(fromZeros.bit(4));
        assertTrue(fromOnes.bit(4));
        assertEquals("00", fromZeros.toBinaryString().substring(0, 2));
        assertEquals("111", fromOnes.toBinaryString().substring(5));
    }

    @Test
    void randomValueRewritesOnlyTheField() {
        MutationSession session = new MutationSession(new Random(9));
        Set<String> fieldValues = new HashSet<>();

        for (int i = 0; i < 64; i++) {
            Word out = apply(FieldMutation.RANDOM_VALUE, session, Word.ones(8)).word();
            String bits = out.toBinaryString();
            assertEquals("11", bits.substring(0, 2));
            assertEquals("111", bits.substring(5));
            fieldValues.add(bits.substring(2, 5));
        }
        assertTrue(fieldValues.size() > 1);
        assertFalse(session.hasConstant());
    }

    @Test
    void replayCopiesDonorFieldBits() {
        Word donor = Word.fromBinaryString("10101010");
        MutationResult result = FieldMutation.REPLAY.bind(new MutationSession(new Random(1)))
                .mutate(FIELD, Word.zeros(8), Optional.of(donor));

        assertEquals("00101000", result.word().toBinaryString());
        assertEquals("replay_field", result.label());
    }

    @Test
    void replayWithoutDonorIsRejected() {
        WordMutator replay = FieldMutation.REPLAY.bind(new MutationSession(new Random(1)));
        assertThrows(IllegalArgumentException.class,
                () -> replay.mutate(FIELD, Word.zeros(8), Optional.empty()));
    }

    @Test
    void onlyReplayRequiresDonor() {
        for (FieldMutation m : FieldMutation.values()) {
            assertEquals(m == FieldMutation.REPLAY, m.requiresDonor(), m.name());
        }
    }

    @Test
    void sourceWordIsNeverModified() {
        Word source = Word.fromBinaryString("01010101");
        for (FieldMutation m : FieldMutation.values()) {
            m.bind(new MutationSession(new Random(2))).mutate(FIELD, source, Optional.of(Word.ones(8)));
            assertEquals("01010101", source.toBinaryString(), m.name());
        }
    }
}
