package com.questrail.busanomaly.field;

/**
 * Variability category of a field: how often its value changes across
 * traffic. Field anomalies are targeted by category.
 */
public enum FieldVariability
{
    HIGH_VAR,
    MID_VAR,
    LOW_VAR
}
