package com.questrail.busanomaly.api;

/**
 * TrafficRecord
 * -----------------------------------------------------------------------------
 * One decoded bus message as handed over by the traffic-loading collaborator.
 *
 * <h2>What this library expects</h2>
 * <ul>
 *   <li>{@link #payloadBits()} is the payload already rendered as a fixed-width
 *       binary string (one {@code '0'}/{@code '1'} character per bit)</li>
 *   <li>{@link #identifier()} is the message identifier the record belongs to</li>
 *   <li>Records are supplied in arrival order; this library never re-sorts them</li>
 * </ul>
 *
 * Reading captures from storage and decoding payload bytes into bit strings
 * happen outside this library.
 */
public interface TrafficRecord
{
    /**
     * Returns the message identifier, e.g. {@code "0DE"}.
     */
    String identifier();

    /**
     * Returns the payload as a binary string, most significant bit of the first
     * payload byte first.
     */
    String payloadBits();
}
