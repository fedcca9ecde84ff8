package com.flowsmith.core.grounding;

import com.flowsmith.core.model.DataSourceMetadata;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Infers types and patterns from sampled rows and checks field assumptions
 * against them.
 * <p>
 * Each non-null value classifies as email, date, boolean, number or string,
 * in that order of precedence. A column is the shared type when unanimous;
 * a mixed column that contains emails is email, one that contains dates is
 * date, anything else is mixed.
 */
@Component
public class DataSampler {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("M/d/yyyy", Locale.ROOT),
            DateTimeFormatter.ofPattern("yyyy/M/d", Locale.ROOT),
            DateTimeFormatter.ofPattern("d MMM yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH));

    private static final double TYPE_MISMATCH_FACTOR = 0.5;
    private static final double REQUIRED_WITH_NULLS_FACTOR = 0.7;

    /**
     * Samples up to {@code sampleSize} rows of one column.
     */
    public ColumnSample sample(DataSourceMetadata metadata, String fieldName, int sampleSize) {
        if (!metadata.effectiveHeaders().contains(fieldName)) {
            return ColumnSample.missing(fieldName);
        }
        List<Object> values = new ArrayList<>();
        for (Map<String, Object> row : metadata.sampleRows()) {
            if (values.size() >= sampleSize) {
                break;
            }
            values.add(row == null ? null : row.get(fieldName));
        }
        return analyze(fieldName, values);
    }

    ColumnSample analyze(String fieldName, List<Object> values) {
        List<Object> nonNull = new ArrayList<>();
        for (Object value : values) {
            if (value != null && !(value instanceof String s && s.isEmpty())) {
                nonNull.add(value);
            }
        }
        Set<String> unique = new HashSet<>();
        nonNull.forEach(v -> unique.add(String.valueOf(v)));
        return new ColumnSample(fieldName, true, values.size(), nonNull, inferType(nonNull),
                values.size() - nonNull.size(), unique.size(), detectPatterns(nonNull));
    }

    DataType inferType(List<Object> values) {
        if (values.isEmpty()) {
            return DataType.UNKNOWN;
        }
        Set<DataType> types = EnumSet.noneOf(DataType.class);
        for (Object value : values) {
            types.add(classify(value));
        }
        if (types.size() == 1) {
            return types.iterator().next();
        }
        if (types.contains(DataType.EMAIL)) {
            return DataType.EMAIL;
        }
        if (types.contains(DataType.DATE)) {
            return DataType.DATE;
        }
        return DataType.MIXED;
    }

    static DataType classify(Object value) {
        if (isEmail(value)) {
            return DataType.EMAIL;
        }
        if (isDate(value)) {
            return DataType.DATE;
        }
        if (value instanceof Boolean) {
            return DataType.BOOLEAN;
        }
        if (isNumeric(value)) {
            return DataType.NUMBER;
        }
        if (value instanceof String) {
            return DataType.STRING;
        }
        return DataType.UNKNOWN;
    }

    static boolean isEmail(Object value) {
        return value instanceof String s && EMAIL.matcher(s.trim()).matches();
    }

    static boolean isNumeric(Object value) {
        if (value instanceof Number) {
            return true;
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                Double.parseDouble(s.trim());
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return false;
    }

    static boolean isDate(Object value) {
        if (value instanceof java.time.temporal.TemporalAccessor || value instanceof java.util.Date) {
            return true;
        }
        if (!(value instanceof String s) || s.isBlank()) {
            return false;
        }
        String text = s.trim();
        if (tryParse(() -> LocalDate.parse(text)) || tryParse(() -> LocalDateTime.parse(text))
                || tryParse(() -> OffsetDateTime.parse(text)) || tryParse(() -> ZonedDateTime.parse(text))
                || tryParse(() -> ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME))) {
            return true;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            if (tryParse(() -> LocalDate.parse(text, format))) {
                return true;
            }
        }
        return false;
    }

    private static boolean tryParse(Runnable parse) {
        try {
            parse.run();
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    List<String> detectPatterns(List<Object> values) {
        List<String> patterns = new ArrayList<>();
        if (values.isEmpty()) {
            return patterns;
        }
        if (values.stream().allMatch(DataSampler::isEmail)) {
            patterns.add("all_emails");
        }
        if (values.stream().allMatch(DataSampler::isDate)) {
            patterns.add("all_dates");
        }
        if (values.stream().allMatch(DataSampler::isNumeric)) {
            patterns.add("all_numeric");
        }
        if (values.get(0) instanceof String first && ISO_DATE.matcher(first).matches()) {
            patterns.add("iso_date_format");
        }
        return patterns;
    }

    /**
     * Email and date columns read fine as strings, and a number stored as
     * text is still usable; anything else is a genuine mismatch.
     */
    public static boolean isCompatible(DataType expected, DataType actual) {
        if (expected == actual) {
            return true;
        }
        return switch (expected) {
            case EMAIL, DATE, NUMBER -> actual == DataType.STRING;
            case STRING -> actual == DataType.EMAIL || actual == DataType.DATE;
            default -> false;
        };
    }

    /**
     * Checks a matched field's sampled data against the expected type and nullability.
     *
     * @param expectedType null when the assumption states no type
     * @param required     whether nulls count against the field
     */
    public FieldValidation validateFieldAssumption(DataSourceMetadata metadata, String actualFieldName,
                                                   DataType expectedType, boolean required, int sampleSize) {
        ColumnSample sample = sample(metadata, actualFieldName, sampleSize);
        if (!sample.exists()) {
            return FieldValidation.failed(0, "Field \"" + actualFieldName + "\" does not exist in data source");
        }
        if (!sample.isUsable()) {
            return FieldValidation.failed(0, "No sample data available");
        }

        double confidence = 1.0;
        boolean typeMatches = true;
        List<String> errors = new ArrayList<>();
        if (expectedType != null && expectedType != DataType.UNKNOWN) {
            typeMatches = isCompatible(expectedType, sample.dataType());
            if (!typeMatches) {
                confidence *= TYPE_MISMATCH_FACTOR;
                errors.add("Type mismatch: expected " + expectedType.value() + ", got " + sample.dataType().value());
            }
        }
        if (required && sample.isNullable()) {
            confidence *= REQUIRED_WITH_NULLS_FACTOR;
            errors.add("Required field has " + sample.nullCount() + " null values");
        }

        boolean validated = typeMatches && (!required || sample.nullCount() == 0);
        String details = "Field \"" + actualFieldName + "\" contains " + sample.dataType().value() + " data. "
                + (sample.nullCount() > 0 ? sample.nullCount() + " null values found." : "No null values.");
        return new FieldValidation(validated, confidence, sample.sampleSize(),
                sample.sampleSize() - sample.nullCount(), sample.dataType(), details, errors);
    }

    /**
     * Checks that at least {@code minMatchRate} of the sampled non-null values match {@code pattern}.
     */
    public PatternValidation validateFieldPattern(DataSourceMetadata metadata, String fieldName, Pattern pattern,
                                                  double minMatchRate, int sampleSize) {
        ColumnSample sample = sample(metadata, fieldName, sampleSize);
        if (!sample.isUsable() || sample.sampleValues().isEmpty()) {
            return new PatternValidation(false, 0.0, 0, 0);
        }
        int matching = 0;
        for (Object value : sample.sampleValues()) {
            if (pattern.matcher(String.valueOf(value)).find()) {
                matching++;
            }
        }
        int size = sample.sampleValues().size();
        double rate = (double) matching / size;
        return new PatternValidation(rate >= minMatchRate, rate, size, matching);
    }

    public FieldStatistics fieldStatistics(DataSourceMetadata metadata, String fieldName, int sampleSize) {
        ColumnSample sample = sample(metadata, fieldName, sampleSize);
        Double min = null;
        Double max = null;
        Double avg = null;
        if (sample.dataType() == DataType.NUMBER) {
            List<Double> numbers = new ArrayList<>();
            for (Object value : sample.sampleValues()) {
                if (isNumeric(value)) {
                    numbers.add(value instanceof Number n ? n.doubleValue() : Double.parseDouble(String.valueOf(value).trim()));
                }
            }
            if (!numbers.isEmpty()) {
                min = numbers.stream().mapToDouble(Double::doubleValue).min().orElse(0);
                max = numbers.stream().mapToDouble(Double::doubleValue).max().orElse(0);
                avg = numbers.stream().mapToDouble(Double::doubleValue).average().orElse(0);
            }
        }
        int totalRows = metadata.rowCount() != null ? metadata.rowCount() : sample.sampleValues().size();
        return new FieldStatistics(fieldName, sample.dataType(), totalRows, sample.nullCount(), sample.uniqueCount(),
                sample.sampleValues().subList(0, Math.min(5, sample.sampleValues().size())), min, max, avg);
    }

    public record FieldValidation(
        boolean validated,
        double confidence,
        int sampleSize,
        int matchingCount,
        DataType observedType,
        String details,
        List<String> errors
    ) {
        public FieldValidation {
            errors = errors == null ? List.of() : List.copyOf(errors);
        }

        static FieldValidation failed(int sampleSize, String reason) {
            return new FieldValidation(false, 0.0, sampleSize, 0, DataType.UNKNOWN, reason, List.of(reason));
        }
    }

    public record PatternValidation(boolean valid, double matchRate, int sampleSize, int matchingCount) {}

    public record FieldStatistics(
        String fieldName,
        DataType dataType,
        int totalRows,
        int nullCount,
        int uniqueCount,
        List<Object> sampleValues,
        Double minValue,
        Double maxValue,
        Double averageValue
    ) {}
}
