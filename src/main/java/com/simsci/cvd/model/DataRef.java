package com.simsci.cvd.model;

import com.simsci.cvd.api.ConfigurationException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reference to the source of a quantity: either a named table key or a literal
 * value (a rate, a proportion, or a duration in days).
 *
 * <p>
 * Exactly one of {@code tableKey} and {@code literal} is set.
 */
public record DataRef(String tableKey, Double literal) {
    private static final Pattern LITERAL = Pattern.compile(
            "^\\s*([-+]?[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?)\\s*(days?|d)?\\s*$");

    public DataRef {
        if ((tableKey == null) == (literal == null))
            throw new ConfigurationException("DataRef needs exactly one of tableKey/literal");
    }

    public static DataRef table(String key) {
        return new DataRef(key, null);
    }

    public static DataRef literal(double value) {
        return new DataRef(null, value);
    }

    /**
     * Parses a configuration value. Numbers and strings such as {@code "28 days"}
     * become literals; any other string is a table key.
     */
    public static DataRef parse(Object value) {
        if (value == null)
            return null;
        if (value instanceof Number n)
            return literal(n.doubleValue());
        String s = value.toString();
        Matcher m = LITERAL.matcher(s);
        if (m.matches())
            return literal(Double.parseDouble(m.group(1)));
        if (s.isBlank())
            throw new ConfigurationException("Empty data reference");
        return table(s.trim());
    }

    public boolean isLiteral() {
        return literal != null;
    }

    @Override
    public String toString() {
        return isLiteral() ? String.valueOf(literal) : tableKey;
    }
}
