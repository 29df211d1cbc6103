package com.questrail.busanomaly.api;

import com.questrail.busanomaly.field.Field;

import java.util.List;
import java.util.Set;

/**
 * Source of precomputed field classifications, keyed by message identifier.
 * <p>
 * How the classifications are produced and persisted is up to the
 * implementation; this library only reads them.
 */
public interface FieldClassificationSource
{
    /**
     * Returns the fields of the given message identifier.
     *
     * @throws IllegalArgumentException if the identifier is unknown
     */
    List<Field> fieldsFor(String identifier);

    /**
     * Returns every identifier this source can classify.
     */
    Set<String> identifiers();

    /**
     * Returns true if this source knows the given identifier.
     */
    default boolean contains(String identifier) {
        return identifiers().contains(identifier);
    }
}
