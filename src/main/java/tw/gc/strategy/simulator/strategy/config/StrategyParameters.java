package tw.gc.strategy.simulator.strategy.config;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat mapping of named strategy parameters shared by all subroutines.
 *
 * Raw values are resolved once at construction:
 * <ul>
 *   <li>collections and arrays contribute their first element</li>
 *   <li>numbers and numeric text become {@code Double}</li>
 *   <li>other text is kept as trimmed {@code String}</li>
 *   <li>nulls and empty collections are dropped with a warning</li>
 * </ul>
 */
@Slf4j
public final class StrategyParameters {

    private static final StrategyParameters EMPTY = new StrategyParameters(Collections.emptyMap());

    private final Map<String, Object> values;

    private StrategyParameters(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static StrategyParameters empty() {
        return EMPTY;
    }

    public static StrategyParameters of(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> resolved = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            Object coerced = coerce(value);
            if (coerced == null) {
                log.warn("[Parameters] Failed to convert {}={}, skipping", key, value);
            } else {
                resolved.put(key, coerced);
            }
        });
        log.info("[Parameters] Resolved {}", resolved);
        return new StrategyParameters(resolved);
    }

    private static Object coerce(Object value) {
        Object first = firstElement(value);
        if (first == null) {
            return null;
        }
        if (first instanceof Number number) {
            return number.doubleValue();
        }
        String text = first.toString().trim();
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return text;
        }
    }

    private static Object firstElement(Object value) {
        if (value instanceof Collection<?> collection) {
            Iterator<?> it = collection.iterator();
            return it.hasNext() ? it.next() : null;
        }
        if (value instanceof Object[] array) {
            return array.length > 0 ? array[0] : null;
        }
        return value;
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * Numeric value of {@code key}, or {@code defaultValue} when absent.
     *
     * @throws IllegalArgumentException if the value is present but not numeric
     */
    public double getDouble(String key, double defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Double d) {
            return d;
        }
        throw new IllegalArgumentException("Parameter " + key + " must be numeric: " + value);
    }

    /**
     * Text value of {@code key}, or {@code defaultValue} when absent.
     * Numeric values are rendered back to text.
     */
    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value == null ? defaultValue : value.toString();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
