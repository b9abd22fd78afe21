package com.sailfish.jobs;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * String-keyed arguments of a job.
 *
 * <p>Arguments cross the storage boundary as JSON, so only JSON-compatible values are
 * accepted: strings, numbers, booleans, {@code null}, lists and nested string-keyed maps.
 * Anything else is rejected when it is put into the map rather than when the job is stored.
 */
public final class JobArgs {

    private final Map<String, Object> values;

    private JobArgs(Map<String, Object> values) {
        this.values = values;
    }

    public static JobArgs empty() {
        return new JobArgs(new LinkedHashMap<>());
    }

    public static JobArgs of(Map<String, ?> values) {
        JobArgs args = empty();
        if (values != null) {
            values.forEach(args::set);
        }
        return args;
    }

    public static JobArgs of(String key, Object value) {
        return empty().set(key, value);
    }

    /**
     * Parses command-line style arguments: {@code key=value} pairs become entries, a bare
     * token is stored under {@code arg}.
     */
    public static JobArgs parse(List<String> tokens) {
        JobArgs args = empty();
        for (String token : tokens) {
            int separator = token.indexOf('=');
            if (separator < 0) {
                args.set("arg", token);
            } else {
                args.set(token.substring(0, separator), token.substring(separator + 1));
            }
        }
        return args;
    }

    public JobArgs set(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("Job argument keys cannot be null");
        }
        values.put(key, normalize(key, value));
        return this;
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Object raw(String key) {
        return values.get(key);
    }

    /**
     * Returns the value as a string, or an empty string when it is absent.
     */
    public String get(String key) {
        Object value = values.get(key);
        return value == null ? "" : value.toString();
    }

    /**
     * Returns the value as a long; absent or unparsable values yield 0.
     */
    public long getLong(String key) {
        Object value = values.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return 0L;
            }
        }
        return 0L;
    }

    public boolean getBoolean(String key) {
        Object value = values.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String s = ((String) value).trim();
            return s.equalsIgnoreCase("true") || s.equals("1");
        }
        if (value instanceof Number) {
            return ((Number) value).longValue() != 0L;
        }
        return false;
    }

    @SuppressWarnings("unchecked")
    public JobArgs getArgs(String key) {
        Object value = values.get(key);
        if (value instanceof Map) {
            return of((Map<String, ?>) value);
        }
        return empty();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @SuppressWarnings("unchecked")
    private static Object normalize(String key, Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Character || value instanceof Enum) {
            return value.toString();
        }
        if (value instanceof JobArgs) {
            return new LinkedHashMap<>(((JobArgs) value).values);
        }
        if (value instanceof Map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw new IllegalArgumentException("Job argument '" + key + "' contains a non-string map key: " + entry.getKey());
                }
                String nestedKey = (String) entry.getKey();
                nested.put(nestedKey, normalize(key + "." + nestedKey, entry.getValue()));
            }
            return nested;
        }
        if (value instanceof Collection) {
            List<Object> list = new ArrayList<>();
            for (Object element : (Collection<Object>) value) {
                list.add(normalize(key + "[]", element));
            }
            return list;
        }
        throw new IllegalArgumentException("Job argument '" + key + "' has unsupported type " + value.getClass().getName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobArgs that = (JobArgs) o;
        return Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
