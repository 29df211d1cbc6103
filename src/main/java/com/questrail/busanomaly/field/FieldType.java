package com.questrail.busanomaly.field;

/**
 * Classification of a field by the kind of values it carries.
 */
public enum FieldType
{
    /**
     * Every bit of the field holds the same value in all observed words.
     */
    CONST("CONST"),

    /**
     * The field takes one of a small set of discrete values (flags, counters,
     * mode selectors).
     */
    MULTI_VALUE("MULTI-VALUE"),

    /**
     * The field carries a physical reading that varies more or less
     * continuously.
     */
    SENSOR("SENSOR");

    private final String label;

    FieldType(String label) {
        this.label = label;
    }

    /**
     * Returns the name used by field-classification files, e.g.
     * {@code "MULTI-VALUE"}.
     */
    public String label() {
        return label;
    }

    /**
     * Resolves a classification-file name back to a type.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static FieldType fromLabel(String label) {
        for (FieldType t : values()) {
            if (t.label.equals(label)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown field type: " + label);
    }
}
