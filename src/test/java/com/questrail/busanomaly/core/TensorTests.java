package com.questrail.busanomaly.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TensorTests {

    @Test
    void flattenIsSequenceMajor() {
        Tensor tensor = TensorFixtures.tagged(3, 4, 8);

        List<Word> flat = tensor.flatten();
        for (int k = 0; k < flat.size(); k++) {
            assertEquals(k, TensorFixtures.tag(flat.get(k)));
        }
        assertEquals(6, TensorFixtures.tag(tensor.word(1, 2)));
    }

    @Test
    void reshapeRejectsWrongWordCount() {
        List<Word> words = List.of(Word.zeros(8), Word.zeros(8), Word.zeros(8));
        assertThrows(TensorShapeException.class, () -> Tensor.reshape(words, new TensorShape(2, 2, 8)));
    }

    @Test
    void reshapeRejectsRaggedWidths() {
        List<Word> words = List.of(Word.zeros(8), Word.zeros(7));
        assertThrows(TensorShapeException.class, () -> Tensor.reshape(words, new TensorShape(1, 2, 8)));
    }

    @Test
    void ofRejectsRaggedSequences() {
        List<List<Word>> sequences = List.of(
                List.of(Word.zeros(4), Word.zeros(4)),
                List.of(Word.zeros(4)));
        assertThrows(TensorShapeException.class, () -> Tensor.of(sequences));
    }

    @Test
    void flattenReturnsIndependentCopy() {
        Tensor tensor = TensorFixtures.tagged(2, 2, 4);
        List<Word> flat = tensor.flatten();
        flat.set(0, Word.ones(4));

        assertEquals(0, TensorFixtures.tag(tensor.word(0, 0)));
        assertThrows(UnsupportedOperationException.class, () -> tensor.sequence(0).set(0, Word.ones(4)));
    }

    @Test
    void shapeReportsDimensions() {
        Tensor tensor = TensorFixtures.tagged(4, 10, 8);
        assertEquals(new TensorShape(4, 10, 8), tensor.shape());
        assertEquals(40, tensor.shape().totalWords());
    }
}
