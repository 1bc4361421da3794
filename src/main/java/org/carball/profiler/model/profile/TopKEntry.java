package org.carball.profiler.model.profile;

/**
 * One frequent value of a column; {@code rate} is relative to the column's non-null count.
 */
public record TopKEntry(String value, long count, double rate) {
}
