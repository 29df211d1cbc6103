package com.questrail.busanomaly.api;

import com.questrail.busanomaly.core.Tensor;

import java.util.Objects;

/**
 * An anomalous tensor together with the label of the anomaly that produced it,
 * e.g. {@code "interleave"} or {@code "max_value"}.
 */
public record LabeledTensor(Tensor tensor, String label)
{
    public LabeledTensor {
        Objects.requireNonNull(tensor, "tensor");
        Objects.requireNonNull(label, "label");
    }
}
