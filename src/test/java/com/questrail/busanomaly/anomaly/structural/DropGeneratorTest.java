package com.questrail.busanomaly.anomaly.structural;

import com.questrail.busanomaly.api.LabeledTensor;
import com.questrail.busanomaly.core.Tensor;
import com.questrail.busanomaly.core.TensorFixtures;
import com.questrail.busanomaly.core.TensorShape;
import com.questrail.busanomaly.core.TensorShapeException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DropGeneratorTest {

    private static List<Integer> positions(Tensor out, int sequence, int p) {
        return out.sequence(sequence).stream()
                .map(w -> TensorFixtures.tag(w) - sequence * p)
                .collect(Collectors.toList());
    }

    @Test
    void removesBlockAroundMidpoint() {
        Tensor input = TensorFixtures.tagged(3, 10, 8);

        LabeledTensor result = new DropGenerator(4).generate(input);

        assertEquals("drop", result.label());
        assertEquals(new TensorShape(3, 6, 8), result.tensor().shape());
        for (int i = 0; i < 3; i++) {
            assertEquals(List.of(0, 1, 2, 7, 8, 9), positions(result.tensor(), i, 10));
        }
    }

    @Test
    void oddLengthRemovesOneWordLess() {
        Tensor input = TensorFixtures.tagged(2, 10, 8);

        Tensor out = new DropGenerator(5).generate(input).tensor();

        assertEquals(new TensorShape(2, 6, 8), out.shape());
        assertEquals(List.of(0, 1, 2, 7, 8, 9), positions(out, 1, 10));
    }

    @Test
    void defaultLengthIsTen() {
        Tensor input = TensorFixtures.tagged(2, 30, 8);
        Tensor out = new DropGenerator().generate(input).tensor();
        assertEquals(new TensorShape(2, 20, 8), out.shape());
        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 20, 21, 22, 23, 24, 25, 26, 27, 28, 29),
                positions(out, 0, 30));
    }

    @Test
    void zeroLengthKeepsEverything() {
        Tensor input = TensorFixtures.tagged(2, 10, 8);
        assertEquals(input, new DropGenerator(0).generate(input).tensor());
    }

    @Test
    void lengthNotSmallerThanSequenceIsFatal() {
        Tensor input = TensorFixtures.tagged(2, 10, 8);
        assertThrows(TensorShapeException.class, () -> new DropGenerator(10).generate(input));
        assertThrows(TensorShapeException.class, () -> new DropGenerator(12).generate(input));
        assertThrows(IllegalArgumentException.class, () -> new DropGenerator(-1));
    }
}
