package com.questrail.busanomaly.anomaly;

/**
 * DonorRotation
 * -----------------------------------------------------------------------------
 * Index arithmetic for transforms that borrow data from other sequences
 * (discontinuity, field replay).
 *
 * <p>A rotation starts at a given sequence index and advances by one for every
 * step, wrapping to 0 after the last sequence. The donor for step {@code k} is
 * a pure function of {@code (start, sequences, k)}, so the whole rotation can
 * be precomputed and steps may be processed in any order.</p>
 *
 * <p>A negative start counts from the end, so a start of {@code -1} over a
 * single sequence selects sequence 0.</p>
 */
public final class DonorRotation
{
    private DonorRotation() {}

    /**
     * Returns the donor sequence index for step {@code step}.
     *
     * @param start     donor index of step 0
     * @param sequences number of sequences (must be positive)
     * @param step      0-based step number
     */
    public static int donorAt(int start, int sequences, long step) {
        if (sequences <= 0) {
            throw new IllegalArgumentException("sequences must be positive");
        }
        if (step < 0) {
            throw new IllegalArgumentException("step must be non-negative");
        }
        return (int) Math.floorMod(start + step, (long) sequences);
    }

    /**
     * Precomputes the donor index of every step in {@code [0, count)}.
     */
    public static int[] sequence(int start, int sequences, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative");
        }
        int[] donors = new int[count];
        for (int k = 0; k < count; k++) {
            donors[k] = donorAt(start, sequences, k);
        }
        return donors;
    }
}
