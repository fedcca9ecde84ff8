package com.flowsmith.core.grounding;

import java.util.List;

/**
 * What a sample of one column looks like.
 *
 * @param exists       whether the field is present in the source at all
 * @param sampleSize   number of sampled rows, nulls included
 * @param sampleValues non-null sampled values, in row order
 * @param patterns     corroborating patterns: all_emails, all_dates, all_numeric, iso_date_format
 */
public record ColumnSample(
    String fieldName,
    boolean exists,
    int sampleSize,
    List<Object> sampleValues,
    DataType dataType,
    int nullCount,
    int uniqueCount,
    List<String> patterns
) {

    public ColumnSample {
        sampleValues = sampleValues == null ? List.of() : List.copyOf(sampleValues);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    public static ColumnSample missing(String fieldName) {
        return new ColumnSample(fieldName, false, 0, List.of(), DataType.UNKNOWN, 0, 0, List.of());
    }

    public boolean isUsable() {
        return exists && sampleSize > 0;
    }

    public boolean isNullable() {
        return nullCount > 0;
    }
}
