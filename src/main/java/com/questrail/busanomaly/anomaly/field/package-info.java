/**
 * Field-level anomalies
 * =============================================================================
 *
 * <p>This package rewrites a single field over a contiguous run of words while
 * leaving every other bit of the tensor untouched.</p>
 *
 * <pre>
 *   Tensor + Field + run length + FieldMutation
 *        → FieldAnomalyEngine      (onset, run, donor rotation)
 *            → WordMutator         (one word, one field)
 *                → LabeledTensor
 * </pre>
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>{@link com.questrail.busanomaly.anomaly.field.FieldMutation} is a closed
 *       set; every mutation goes through the same
 *       {@link com.questrail.busanomaly.anomaly.field.WordMutator} contract.</li>
 *   <li>State that must persist across words of one run lives in a
 *       {@link com.questrail.busanomaly.anomaly.field.MutationSession} and
 *       nowhere else.</li>
 * </ul>
 */
package com.questrail.busanomaly.anomaly.field;
