package com.questrail.busanomaly.field;

import com.questrail.busanomaly.api.FieldClassificationSource;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory {@link FieldClassificationSource}.
 * Maps message identifiers to their field lists.
 */
public final class FieldCatalog implements FieldClassificationSource
{
    private final Map<String, List<Field>> fields;

    private FieldCatalog(Map<String, List<Field>> fields) {
        this.fields = Collections.unmodifiableMap(new HashMap<>(fields));
    }

    @Override
    public List<Field> fieldsFor(String identifier) {
        Objects.requireNonNull(identifier, "identifier");
        List<Field> list = fields.get(identifier);
        if (list == null) {
            throw new IllegalArgumentException("Unknown identifier: " + identifier);
        }
        return list;
    }

    @Override
    public Set<String> identifiers() {
        return fields.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, List<Field>> fields = new HashMap<>();

        public Builder add(String identifier, List<Field> identifierFields) {
            Objects.requireNonNull(identifier, "identifier");
            Objects.requireNonNull(identifierFields, "identifierFields");
            fields.put(identifier, List.copyOf(identifierFields));
            return this;
        }

        public FieldCatalog build() {
            if (fields.isEmpty()) {
                throw new IllegalStateException("At least one identifier required");
            }
            return new FieldCatalog(fields);
        }
    }
}
