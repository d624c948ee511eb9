package com.semaphore.migrator.migration.transform.service;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.semaphore.migrator.migration.schema.model.ColumnDefinition;
import com.semaphore.migrator.migration.schema.model.ColumnType;
import com.semaphore.migrator.migration.transform.model.CoercionResult;
import com.semaphore.migrator.migration.transform.model.SqlLiteral;

/**
 * Coerces loosely typed document values to the type category of their column.
 *
 * A value is never truncated or dropped: when it does not fit the declared category it is emitted
 * as escaped text and the result is flagged as a fallback.
 */
public class ValueCoercer {

    private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");
    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);
    private static final Pattern DECIMAL_PATTERN = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    public CoercionResult coerce(ColumnDefinition column, JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return CoercionResult.coerced(SqlLiteral.nullValue());
        }
        ColumnType type = column.getType() == null ? ColumnType.NUMERIC : column.getType();
        return switch (type) {
            case INTEGER -> toInteger(column, value);
            case REAL -> toReal(column, value);
            case TEXT -> CoercionResult.coerced(SqlLiteral.ofText(textOf(value)));
            case BLOB -> toBlob(column, value);
            case NUMERIC -> toNumeric(column, value);
        };
    }

    private CoercionResult toInteger(ColumnDefinition column, JsonNode value) {
        if (value.isBoolean()) {
            return CoercionResult.coerced(SqlLiteral.ofInteger(value.booleanValue() ? 1 : 0));
        }
        if (value.isNumber()) {
            if (!hasExactDecimal(value)) {
                return fallback(column, value, "number out of range");
            }
            return integerOrFallback(column, value, value.decimalValue());
        }
        if (value.isTextual()) {
            String text = value.textValue();
            Integer bool = parseBoolean(text);
            if (bool != null) {
                return CoercionResult.coerced(SqlLiteral.ofInteger(bool));
            }
            if (INTEGER_PATTERN.matcher(text).matches() || DECIMAL_PATTERN.matcher(text).matches()) {
                BigDecimal decimal = parseDecimal(text);
                if (decimal != null) {
                    return integerOrFallback(column, value, decimal);
                }
            }
            return fallback(column, value, "not an integer");
        }
        return fallback(column, value, "structured value");
    }

    private CoercionResult integerOrFallback(ColumnDefinition column, JsonNode value, BigDecimal decimal) {
        if (!isIntegral(decimal)) {
            return fallback(column, value, "non-integral number");
        }
        Long exact = toExactLong(decimal);
        if (exact == null) {
            return fallback(column, value, "outside the 64-bit integer range");
        }
        return CoercionResult.coerced(SqlLiteral.ofInteger(exact));
    }

    private CoercionResult toReal(ColumnDefinition column, JsonNode value) {
        BigDecimal decimal = null;
        if (value.isNumber() && hasExactDecimal(value)) {
            decimal = value.decimalValue();
        } else if (value.isTextual() && DECIMAL_PATTERN.matcher(value.textValue()).matches()) {
            decimal = parseDecimal(value.textValue());
        }
        if (decimal != null && isFiniteDouble(decimal)) {
            return CoercionResult.coerced(SqlLiteral.ofReal(decimal));
        }
        if (value.isNumber() || decimal != null) {
            return fallback(column, value, "number out of range");
        }
        return fallback(column, value, value.isContainerNode() ? "structured value" : "not a number");
    }

    private CoercionResult toNumeric(ColumnDefinition column, JsonNode value) {
        if (value.isBoolean()) {
            return CoercionResult.coerced(SqlLiteral.ofInteger(value.booleanValue() ? 1 : 0));
        }
        if (value.isNumber()) {
            return numberLiteral(column, value);
        }
        if (value.isContainerNode()) {
            return fallback(column, value, "structured value");
        }
        // SQLite applies NUMERIC affinity itself; strings such as timestamps are stored as text
        return CoercionResult.coerced(SqlLiteral.ofText(value.asText()));
    }

    private CoercionResult toBlob(ColumnDefinition column, JsonNode value) {
        if (value.isContainerNode()) {
            return CoercionResult.coerced(SqlLiteral.ofBlob(value.toString().getBytes(StandardCharsets.UTF_8)));
        }
        if (value.isBoolean()) {
            return CoercionResult.coerced(SqlLiteral.ofInteger(value.booleanValue() ? 1 : 0));
        }
        if (value.isNumber()) {
            return numberLiteral(column, value);
        }
        return CoercionResult.coerced(SqlLiteral.ofText(value.asText()));
    }

    private static CoercionResult numberLiteral(ColumnDefinition column, JsonNode value) {
        if (value.isIntegralNumber()) {
            return CoercionResult.coerced(SqlLiteral.ofInteger(value.bigIntegerValue()));
        }
        if (!hasExactDecimal(value) || !isFiniteDouble(value.decimalValue())) {
            return fallback(column, value, "number out of range");
        }
        return CoercionResult.coerced(SqlLiteral.ofReal(value.decimalValue()));
    }

    private static CoercionResult fallback(ColumnDefinition column, JsonNode value, String reason) {
        return CoercionResult.fallback(SqlLiteral.ofText(textOf(value)),
                String.format("column %s (%s): %s, emitted as text", column.getName(), column.getType(), reason));
    }

    /**
     * Scalars as their plain text, objects and arrays as compact JSON.
     */
    static String textOf(JsonNode value) {
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isContainerNode()) {
            return value.toString();
        }
        return value.asText();
    }

    /**
     * False for floating-point nodes holding an infinity or NaN, whose {@code decimalValue()} throws.
     */
    static boolean hasExactDecimal(JsonNode value) {
        return !value.isFloatingPointNumber() || value.isBigDecimal() || Double.isFinite(value.doubleValue());
    }

    private static boolean isFiniteDouble(BigDecimal decimal) {
        return Double.isFinite(decimal.doubleValue());
    }

    private static BigDecimal parseDecimal(String text) {
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            // exponent beyond the int range
            return null;
        }
    }

    /**
     * The exact long value, or {@code null} when the number does not fit. Checks the digit count
     * first so huge exponents are never expanded.
     */
    private static Long toExactLong(BigDecimal decimal) {
        if (decimal.signum() == 0) {
            return 0L;
        }
        BigDecimal stripped = decimal.stripTrailingZeros();
        if (stripped.scale() > 0 || (long) stripped.precision() - stripped.scale() > 19) {
            return null;
        }
        if (stripped.compareTo(LONG_MIN) < 0 || stripped.compareTo(LONG_MAX) > 0) {
            return null;
        }
        return stripped.longValueExact();
    }

    private static boolean isIntegral(BigDecimal decimal) {
        return decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0;
    }

    private static Integer parseBoolean(String text) {
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "true" -> 1;
            case "false" -> 0;
            default -> null;
        };
    }
}
