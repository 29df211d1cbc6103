package com.questrail.busanomaly;

import com.questrail.busanomaly.api.BusMessage;
import com.questrail.busanomaly.api.LabeledTensor;
import com.questrail.busanomaly.config.AnomalyGenerationConfig;
import com.questrail.busanomaly.core.Tensor;
import com.questrail.busanomaly.core.TensorFixtures;
import com.questrail.busanomaly.core.TensorShape;
import com.questrail.busanomaly.field.Field;
import com.questrail.busanomaly.field.FieldCatalog;
import com.questrail.busanomaly.field.FieldType;
import com.questrail.busanomaly.field.FieldVariability;
import com.questrail.busanomaly.observability.AnomalyGeneratedEvent;
import com.questrail.busanomaly.observability.FieldAnomalyOnsetEvent;
import com.questrail.busanomaly.observability.RecordingAnomalyObservabilitySink;
import com.questrail.busanomaly.observability.TargetFieldUnavailableEvent;
import com.questrail.busanomaly.reshape.ReshapeResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs a whole anomaly session over synthetic two-identifier traffic.
 */
class AnomalyGeneratorTest {

    private static final String TARGET = "0DE";
    private static final String OTHER = "1A0";

    private static final List<Field> FIELDS = List.of(
            Field.constant(0, 3),
            new Field(4, 7, FieldType.SENSOR, FieldVariability.HIGH_VAR, 180),
            new Field(12, 3, FieldType.MULTI_VALUE, FieldVariability.LOW_VAR, 4));

    private RecordingAnomalyObservabilitySink sink;
    private AnomalyGenerator generator;
    private List<BusMessage> traffic;

    @BeforeEach
    void setUp() {
        sink = new RecordingAnomalyObservabilitySink();
        AnomalyGenerationConfig config = AnomalyGenerationConfig.builder()
                .withSamplingPeriod(Duration.ofMillis(10))
                .withSequenceDuration(Duration.ofMillis(300))
                .withAnomalyDuration(Duration.ofMillis(50))
                .withDropLength(4)
                .withVerbose(true)
                .withSeed(7L)
                .build();
        generator = new AnomalyGenerator(config, sink);

        Random random = new Random(21);
        traffic = new ArrayList<>();
        for (int k = 0; k < 130; k++) {
            String payload = "1010" + TensorFixtures.word(random.nextInt(1 << 12), 12).toBinaryString();
            traffic.add(new BusMessage(k * 0.01, TARGET, payload));
            traffic.add(new BusMessage(k * 0.01 + 0.005, OTHER, "11110000"));
        }
    }

    @Test
    void sequencesAreBuiltFromTargetIdentifierOnly() {
        ReshapeResult result = generator.sequencesFor(traffic, TARGET);

        assertEquals(new TensorShape(4, 30, 16), result.tensor().shape());
        assertEquals(10, result.discardedWords());
        assertEquals(traffic.get(0).payloadBits(), result.tensor().word(0, 0).toBinaryString());
        assertEquals(traffic.get(2).payloadBits(), result.tensor().word(0, 1).toBinaryString());
    }

    @Test
    void structuralAnomaliesComeInFixedOrder() {
        Tensor sequences = generator.sequencesFor(traffic, TARGET).tensor();

        List<LabeledTensor> anomalies = generator.structuralAnomalies(sequences);

        assertEquals(List.of("interleave", "discontinuity", "reverse", "drop"),
                anomalies.stream().map(LabeledTensor::label).collect(Collectors.toList()));
        assertEquals(sequences.shape(), anomalies.get(0).tensor().shape());
        assertEquals(sequences.shape(), anomalies.get(1).tensor().shape());
        assertEquals(sequences.shape(), anomalies.get(2).tensor().shape());
        assertEquals(new TensorShape(4, 26, 16), anomalies.get(3).tensor().shape());
        assertEquals(4, sink.eventsOfType(AnomalyGeneratedEvent.class).size());
    }

    @Test
    void fieldAnomaliesTargetConfiguredCategory() {
        Tensor sequences = generator.sequencesFor(traffic, TARGET).tensor();

        List<LabeledTensor> anomalies = generator.fieldAnomalies(sequences, FIELDS).orElseThrow();

        assertEquals(List.of("max_value", "min_value", "constant_value", "random_value", "replay_field"),
                anomalies.stream().map(LabeledTensor::label).collect(Collectors.toList()));

        List<FieldAnomalyOnsetEvent> onsets = sink.eventsOfType(FieldAnomalyOnsetEvent.class);
        assertEquals(5, onsets.size());
        for (FieldAnomalyOnsetEvent onset : onsets) {
            assertEquals(4, onset.fieldStartBit());
            assertEquals(7, onset.fieldLength());
            assertEquals(5, onset.anomalyWordCount());
        }

        // the constant prefix and the low-variability field are never touched
        for (LabeledTensor anomaly : anomalies) {
            for (int i = 0; i < sequences.sequenceCount(); i++) {
                for (int j = 0; j < sequences.wordsPerSequence(); j++) {
                    String before = sequences.word(i, j).toBinaryString();
                    String after = anomaly.tensor().word(i, j).toBinaryString();
                    assertEquals(before.substring(0, 4), after.substring(0, 4));
                    assertEquals(before.substring(12), after.substring(12));
                }
            }
        }
    }

    @Test
    void missingCategoryYieldsNoFieldAnomalies() {
        Tensor sequences = generator.sequencesFor(traffic, TARGET).tensor();
        List<Field> noHighVar = List.of(FIELDS.get(0), FIELDS.get(2));

        Optional<List<LabeledTensor>> anomalies = generator.fieldAnomalies(sequences, noHighVar);

        assertTrue(anomalies.isEmpty());
        assertTrue(sink.hasEventOfType(TargetFieldUnavailableEvent.class));
        assertFalse(sink.hasEventOfType(FieldAnomalyOnsetEvent.class));
    }

    @Test
    void fieldsCanBeResolvedFromClassificationSource() {
        Tensor sequences = generator.sequencesFor(traffic, TARGET).tensor();
        FieldCatalog catalog = FieldCatalog.builder()
                .add(TARGET, FIELDS)
                .add(OTHER, List.of(Field.constant(0, 7)))
                .build();

        assertEquals(5, generator.fieldAnomalies(sequences, catalog, TARGET).orElseThrow().size());
        assertTrue(generator.fieldAnomalies(sequences, catalog, OTHER).isEmpty());
    }

    @Test
    void seededSessionsAreReproducible() {
        Tensor sequences = generator.sequencesFor(traffic, TARGET).tensor();
        AnomalyGenerator twin = new AnomalyGenerator(generator.config());

        List<LabeledTensor> a = generator.fieldAnomalies(sequences, FIELDS).orElseThrow();
        List<LabeledTensor> b = twin.fieldAnomalies(sequences, FIELDS).orElseThrow();

        assertEquals(a, b);
    }
}
