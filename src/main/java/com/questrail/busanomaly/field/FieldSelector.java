package com.questrail.busanomaly.field;

import com.questrail.busanomaly.observability.AnomalyObservabilitySink;
import com.questrail.busanomaly.observability.TargetFieldUnavailableEvent;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Picks the field an anomaly will target.
 * <p>
 * Not every identifier has a field in every variability category. That case
 * is an ordinary outcome and is reported as {@link Optional#empty()}.
 */
public final class FieldSelector
{
    private final Random random;
    private final AnomalyObservabilitySink sink;

    public FieldSelector(Random random, AnomalyObservabilitySink sink) {
        this.random = Objects.requireNonNull(random, "random");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Returns a field of the requested category, chosen uniformly at random
     * among the matches.
     *
     * @return the chosen field, or empty if no field has that category
     */
    public Optional<Field> targetField(List<Field> fields, FieldVariability category) {
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(category, "category");

        List<Field> matches = fields.stream()
                .filter(f -> f.category() == category)
                .collect(Collectors.toList());

        if (matches.isEmpty()) {
            sink.onTargetFieldUnavailable(
                    new TargetFieldUnavailableEvent(Instant.now(), category, fields.size()));
            return Optional.empty();
        }
        return Optional.of(matches.get(random.nextInt(matches.size())));
    }
}
