package com.questrail.busanomaly;

import com.questrail.busanomaly.anomaly.field.FieldAnomalyEngine;
import com.questrail.busanomaly.anomaly.field.FieldMutation;
import com.questrail.busanomaly.anomaly.structural.DiscontinuityGenerator;
import com.questrail.busanomaly.anomaly.structural.DropGenerator;
import com.questrail.busanomaly.anomaly.structural.InterleaveGenerator;
import com.questrail.busanomaly.anomaly.structural.ReverseGenerator;
import com.questrail.busanomaly.anomaly.structural.StructuralAnomalyGenerator;
import com.questrail.busanomaly.api.FieldClassificationSource;
import com.questrail.busanomaly.api.LabeledTensor;
import com.questrail.busanomaly.api.TrafficRecord;
import com.questrail.busanomaly.config.AnomalyGenerationConfig;
import com.questrail.busanomaly.core.Tensor;
import com.questrail.busanomaly.field.Field;
import com.questrail.busanomaly.field.FieldSelector;
import com.questrail.busanomaly.observability.AnomalyGeneratedEvent;
import com.questrail.busanomaly.observability.AnomalyObservabilitySink;
import com.questrail.busanomaly.observability.NullAnomalyObservabilitySink;
import com.questrail.busanomaly.reshape.ReshapeResult;
import com.questrail.busanomaly.reshape.SequenceReshaper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * AnomalyGenerator
 * ============================================================================
 * Entry point for producing a full set of anomalous test sequences for one
 * message identifier.
 *
 * <h2>Flow</h2>
 * <pre>
 *   traffic records
 *        → sequencesFor(...)          (filter by identifier, cut into sequences)
 *            → structuralAnomalies()  (interleave, discontinuity, reverse, drop)
 *            → fieldAnomalies()       (max, min, constant, random, replay)
 * </pre>
 *
 * <h2>Randomness</h2>
 * One random source, created from {@link AnomalyGenerationConfig#newRandom()},
 * drives field selection, onset selection and random field values. A seeded
 * configuration therefore reproduces the same anomalies.
 *
 * <h2>What this class does NOT do</h2>
 * <ul>
 *   <li>Load traffic or field classifications from storage</li>
 *   <li>Decode payload bytes into bit strings</li>
 *   <li>Detect anomalies</li>
 * </ul>
 */
public final class AnomalyGenerator
{
    private final AnomalyGenerationConfig config;
    private final AnomalyObservabilitySink sink;
    private final SequenceReshaper reshaper;
    private final FieldSelector selector;
    private final FieldAnomalyEngine engine;
    private final List<StructuralAnomalyGenerator> structural;

    public AnomalyGenerator(AnomalyGenerationConfig config) {
        this(config, NullAnomalyObservabilitySink.INSTANCE);
    }

    public AnomalyGenerator(AnomalyGenerationConfig config, AnomalyObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");

        Random random = config.newRandom();
        this.reshaper = new SequenceReshaper(sink);
        this.selector = new FieldSelector(random, sink);
        this.engine = new FieldAnomalyEngine(random, sink);
        this.structural = List.of(
                new InterleaveGenerator(),
                new DiscontinuityGenerator(),
                new ReverseGenerator(),
                new DropGenerator(config.dropLength()));
    }

    public AnomalyGenerationConfig config() {
        return config;
    }

    /**
     * Keeps the records of one identifier, in arrival order, and cuts them
     * into sequences.
     */
    public ReshapeResult sequencesFor(List<? extends TrafficRecord> traffic, String identifier) {
        Objects.requireNonNull(traffic, "traffic");
        Objects.requireNonNull(identifier, "identifier");

        List<TrafficRecord> selected = traffic.stream()
                .filter(r -> identifier.equals(r.identifier()))
                .collect(Collectors.<TrafficRecord>toList());

        return reshaper.createTestSequences(selected, config.samplingPeriod(), config.sequenceDuration());
    }

    /**
     * Produces one tensor per structural anomaly, in the order interleave,
     * discontinuity, reverse, drop.
     */
    public List<LabeledTensor> structuralAnomalies(Tensor sequences) {
        Objects.requireNonNull(sequences, "sequences");
        List<LabeledTensor> out = new ArrayList<>(structural.size());
        for (StructuralAnomalyGenerator generator : structural) {
            out.add(report(sequences, generator.generate(sequences)));
        }
        return out;
    }

    /**
     * Picks a field of the configured category and produces one tensor per
     * {@link FieldMutation}, all targeting that field.
     *
     * @return the anomalous tensors, or empty if no field of the configured
     *         category exists
     */
    public Optional<List<LabeledTensor>> fieldAnomalies(Tensor sequences, List<Field> fields) {
        Objects.requireNonNull(sequences, "sequences");
        Optional<Field> target = selector.targetField(fields, config.targetCategory());
        if (target.isEmpty()) {
            return Optional.empty();
        }

        List<LabeledTensor> out = new ArrayList<>(FieldMutation.values().length);
        for (FieldMutation mutation : FieldMutation.values()) {
            LabeledTensor result = engine.createFieldAnomaly(
                    sequences, target.get(), config.anomalyWordCount(), mutation, config.verbose());
            out.add(report(sequences, result));
        }
        return Optional.of(out);
    }

    /**
     * Convenience overload resolving the identifier's fields from a
     * classification source.
     */
    public Optional<List<LabeledTensor>> fieldAnomalies(Tensor sequences,
                                                        FieldClassificationSource classifications,
                                                        String identifier) {
        Objects.requireNonNull(classifications, "classifications");
        return fieldAnomalies(sequences, classifications.fieldsFor(identifier));
    }

    private LabeledTensor report(Tensor input, LabeledTensor output) {
        sink.onAnomalyGenerated(new AnomalyGeneratedEvent(
                Instant.now(), output.label(), input.shape(), output.tensor().shape()));
        return output;
    }
}
