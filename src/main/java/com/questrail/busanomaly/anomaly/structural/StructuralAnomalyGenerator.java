package com.questrail.busanomaly.anomaly.structural;

import com.questrail.busanomaly.api.LabeledTensor;
import com.questrail.busanomaly.core.Tensor;

/**
 * StructuralAnomalyGenerator
 * -----------------------------------------------------------------------------
 * A whole-tensor transform that corrupts temporal or ordering properties of
 * the traffic while leaving individual word contents intact.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>The input tensor is never modified; a new tensor is returned</li>
 *   <li>The result is labeled with {@link #label()}</li>
 *   <li>Output shape equals input shape unless an implementation documents
 *       otherwise</li>
 * </ul>
 */
public interface StructuralAnomalyGenerator
{
    /**
     * Returns the label attached to every tensor this generator produces.
     */
    String label();

    /**
     * Produces the anomalous variant of {@code sequences}.
     *
     * @throws com.questrail.busanomaly.core.TensorShapeException if the tensor
     *         does not satisfy this generator's shape preconditions
     */
    LabeledTensor generate(Tensor sequences);
}
