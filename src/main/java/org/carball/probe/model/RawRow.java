package org.carball.probe.model;

import org.carball.probe.exception.RowBindException;

import java.sql.Timestamp;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * One tabular result row, keyed by column label (case-insensitive).
 *
 * <p>The {@code get*} accessors return null for absent or SQL NULL columns; the {@code require*}
 * accessors throw {@link RowBindException} instead. A value of the wrong type is always a bind error.
 */
public final class RawRow {

    private static final HexFormat HEX = HexFormat.of();

    private final Map<String, Object> values;

    public RawRow(Map<String, ?> values) {
        TreeMap<String, Object> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(values);
        this.values = Collections.unmodifiableMap(copy);
    }

    public static RawRow of(Map<String, ?> values) {
        return new RawRow(values);
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Object get(String column) {
        return values.get(column);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public String getString(String column) {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof byte[] bytes) {
            return toHex(bytes);
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant().toString();
        }
        return value.toString();
    }

    public String requireString(String column) {
        return required(column, getString(column));
    }

    public Long getLong(String column) {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw new RowBindException("Column " + column + " is not an integer: " + text, e);
            }
        }
        throw typeMismatch(column, "integer", value);
    }

    public long requireLong(String column) {
        return required(column, getLong(column));
    }

    public Integer getInt(String column) {
        Long value = getLong(column);
        if (value == null) {
            return null;
        }
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new RowBindException("Column " + column + " is out of int range: " + value);
        }
        return value.intValue();
    }

    public Double getDouble(String column) {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new RowBindException("Column " + column + " is not numeric: " + text, e);
            }
        }
        throw typeMismatch(column, "numeric", value);
    }

    public double requireDouble(String column) {
        return required(column, getDouble(column));
    }

    public Boolean getBoolean(String column) {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.equals("1") || trimmed.equalsIgnoreCase("true")) return true;
            if (trimmed.equals("0") || trimmed.equalsIgnoreCase("false")) return false;
        }
        throw typeMismatch(column, "boolean", value);
    }

    public boolean requireBoolean(String column) {
        return required(column, getBoolean(column));
    }

    /**
     * Binary columns such as query hashes and plan handles, rendered as {@code 0x}-prefixed hex.
     */
    public String getHex(String column) {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof byte[] bytes) {
            return toHex(bytes);
        }
        if (value instanceof String text) {
            return text;
        }
        throw typeMismatch(column, "binary", value);
    }

    static String toHex(byte[] bytes) {
        return "0x" + HEX.formatHex(bytes);
    }

    private static <T> T required(String column, T value) {
        if (value == null) {
            throw new RowBindException("Column " + column + " is missing or null");
        }
        return value;
    }

    private static RowBindException typeMismatch(String column, String expected, Object actual) {
        return new RowBindException(String.format("Column %s expected %s but was %s",
                column, expected, actual.getClass().getSimpleName()));
    }

    @Override
    public String toString() {
        return "RawRow" + values;
    }
}
