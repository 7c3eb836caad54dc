package ai.docindexer.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts raw record values into the representation of a declared field type. Conversion is
 * lossless or it fails with an {@link IllegalArgumentException} describing the mismatch; there is
 * no partial conversion.
 */
public final class FieldValueConverter {
  private static final BigInteger INT32_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
  private static final BigInteger INT32_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
  private static final BigInteger INT64_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger INT64_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  // date, date-time, or date-time with offset
  private static final DateTimeFormatter ISO_DATE_TIME_OPTIONAL_OFFSET =
      new DateTimeFormatterBuilder()
          .parseCaseInsensitive()
          .append(DateTimeFormatter.ISO_LOCAL_DATE)
          .optionalStart()
          .appendLiteral('T')
          .append(DateTimeFormatter.ISO_LOCAL_TIME)
          .optionalStart()
          .appendOffsetId()
          .optionalEnd()
          .optionalEnd()
          .toFormatter();

  private FieldValueConverter() {}

  public static Object convert(FieldSchema field, Object value) {
    if (value == null) {
      throw new IllegalArgumentException("value is null");
    }
    switch (field.getType()) {
      case STRING:
        return toStringValue(value);
      case INT32:
        return toIntegral(value, INT32_MIN, INT32_MAX, FieldType.INT32).intValueExact();
      case INT64:
        return toIntegral(value, INT64_MIN, INT64_MAX, FieldType.INT64).longValueExact();
      case DOUBLE:
        return toDouble(value);
      case BOOLEAN:
        return toBoolean(value);
      case DATETIME:
        return normalizeDateTime(value);
      case STRING_COLLECTION:
        return toStringCollection(value);
      case FLOAT_VECTOR:
        return toVector(value, field.getDimensions());
      default:
        throw new IllegalStateException("Unhandled field type " + field.getType());
    }
  }

  private static String toStringValue(Object value) {
    if (value instanceof String) {
      return (String) value;
    }
    throw mismatch(FieldType.STRING, value);
  }

  private static BigInteger toIntegral(
      Object value, BigInteger min, BigInteger max, FieldType type) {
    BigDecimal decimal;
    if (value instanceof Integer
        || value instanceof Long
        || value instanceof Short
        || value instanceof Byte) {
      decimal = BigDecimal.valueOf(((Number) value).longValue());
    } else if (value instanceof BigInteger) {
      decimal = new BigDecimal((BigInteger) value);
    } else if (value instanceof BigDecimal) {
      decimal = (BigDecimal) value;
    } else if (value instanceof Double || value instanceof Float) {
      double asDouble = ((Number) value).doubleValue();
      if (!Double.isFinite(asDouble)) {
        throw mismatch(type, value);
      }
      decimal = BigDecimal.valueOf(asDouble);
    } else if (value instanceof String) {
      try {
        decimal = new BigDecimal(((String) value).trim());
      } catch (NumberFormatException e) {
        throw mismatch(type, value);
      }
    } else {
      throw mismatch(type, value);
    }

    BigInteger integral;
    try {
      integral = decimal.toBigIntegerExact();
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException(
          String.format("value %s has a fractional part, expected %s", value, type.getEdmName()));
    }
    if (integral.compareTo(min) < 0 || integral.compareTo(max) > 0) {
      throw new IllegalArgumentException(
          String.format("value %s is out of range for %s", value, type.getEdmName()));
    }
    return integral;
  }

  private static double toDouble(Object value) {
    double result;
    if (value instanceof Number) {
      result = ((Number) value).doubleValue();
    } else if (value instanceof String) {
      try {
        result = Double.parseDouble(((String) value).trim());
      } catch (NumberFormatException e) {
        throw mismatch(FieldType.DOUBLE, value);
      }
    } else {
      throw mismatch(FieldType.DOUBLE, value);
    }
    if (!Double.isFinite(result)) {
      throw new IllegalArgumentException(String.format("value %s is not finite", value));
    }
    return result;
  }

  private static boolean toBoolean(Object value) {
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof String) {
      String text = ((String) value).trim();
      if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
        return Boolean.parseBoolean(text);
      }
    }
    throw mismatch(FieldType.BOOLEAN, value);
  }

  /**
   * Normalizes an ISO-8601 date or date-time to an offset date-time in UTC. Values without an
   * offset are taken as UTC.
   */
  public static String normalizeDateTime(Object value) {
    if (!(value instanceof String)) {
      throw mismatch(FieldType.DATETIME, value);
    }
    String text = ((String) value).trim();
    OffsetDateTime dateTime;
    try {
      TemporalAccessor parsed =
          ISO_DATE_TIME_OPTIONAL_OFFSET.parseBest(
              text, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
      if (parsed instanceof OffsetDateTime) {
        dateTime = (OffsetDateTime) parsed;
      } else if (parsed instanceof LocalDateTime) {
        dateTime = ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
      } else {
        dateTime = ((LocalDate) parsed).atStartOfDay().atOffset(ZoneOffset.UTC);
      }
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException(
          String.format("value '%s' is not an ISO-8601 date-time", text));
    }
    return dateTime
        .withOffsetSameInstant(ZoneOffset.UTC)
        .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
  }

  private static List<String> toStringCollection(Object value) {
    if (!(value instanceof List)) {
      throw mismatch(FieldType.STRING_COLLECTION, value);
    }
    List<?> elements = (List<?>) value;
    List<String> result = new ArrayList<>(elements.size());
    for (int i = 0; i < elements.size(); i++) {
      Object element = elements.get(i);
      if (!(element instanceof String)) {
        throw new IllegalArgumentException(
            String.format("element %d is %s, expected a string", i, describe(element)));
      }
      result.add((String) element);
    }
    return result;
  }

  private static List<Float> toVector(Object value, Integer dimensions) {
    if (!(value instanceof List)) {
      throw mismatch(FieldType.FLOAT_VECTOR, value);
    }
    List<?> elements = (List<?>) value;
    if (dimensions == null || elements.size() != dimensions) {
      throw new IllegalArgumentException(
          String.format("vector has %d dimensions, expected %s", elements.size(), dimensions));
    }
    List<Float> result = new ArrayList<>(elements.size());
    for (int i = 0; i < elements.size(); i++) {
      Object element = elements.get(i);
      if (!(element instanceof Number)) {
        throw new IllegalArgumentException(
            String.format("vector element %d is %s, expected a number", i, describe(element)));
      }
      double component = ((Number) element).doubleValue();
      if (!Double.isFinite(component) || Math.abs(component) > Float.MAX_VALUE) {
        throw new IllegalArgumentException(
            String.format("vector element %d is not a finite float: %s", i, element));
      }
      result.add((float) component);
    }
    return result;
  }

  private static IllegalArgumentException mismatch(FieldType expected, Object value) {
    return new IllegalArgumentException(
        String.format("expected %s but got %s", expected.getEdmName(), describe(value)));
  }

  private static String describe(Object value) {
    if (value == null) {
      return "null";
    }
    String text = String.valueOf(value);
    if (text.length() > 40) {
      text = text.substring(0, 40) + "...";
    }
    return value.getClass().getSimpleName() + " '" + text + "'";
  }
}
