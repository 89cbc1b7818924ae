package com.mimecast.mailbuilder.mime.headers;

import com.mimecast.mailbuilder.textproto.HeaderKeys;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Container for multiple MIME headers.
 *
 * <p>Ordered multi-map of canonical header name to values.
 * <br>Names are canonicalized on every access so lookups are case insensitive.
 * <br>Iteration follows first insertion, which keeps rebuilt headers reproducible.
 */
public class MimeHeaders {

    /**
     * Header values by canonical name.
     */
    private final Map<String, List<String>> headers = new LinkedHashMap<>();

    /**
     * Adds a value, keeping any existing values.
     *
     * @param name  Header name.
     * @param value Header value.
     * @return Self.
     */
    public MimeHeaders add(String name, String value) {
        headers.computeIfAbsent(HeaderKeys.canonical(name), k -> new ArrayList<>()).add(value);
        return this;
    }

    /**
     * Sets a value, replacing any existing values.
     * <p>An existing header keeps its position.
     *
     * @param name  Header name.
     * @param value Header value.
     * @return Self.
     */
    public MimeHeaders set(String name, String value) {
        List<String> values = new ArrayList<>();
        values.add(value);
        headers.put(HeaderKeys.canonical(name), values);
        return this;
    }

    /**
     * Gets first value.
     *
     * @param name Header name.
     * @return Optional of String.
     */
    public Optional<String> get(String name) {
        List<String> values = headers.get(HeaderKeys.canonical(name));
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(0));
    }

    /**
     * Gets first value or empty string.
     *
     * @param name Header name.
     * @return String.
     */
    public String getValue(String name) {
        return get(name).orElse("");
    }

    /**
     * Gets all values.
     *
     * @param name Header name.
     * @return Unmodifiable list of values in encounter order.
     */
    public List<String> getAll(String name) {
        List<String> values = headers.get(HeaderKeys.canonical(name));
        return values == null ? Collections.emptyList() : Collections.unmodifiableList(values);
    }

    /**
     * Checks if header exists.
     *
     * @param name Header name.
     * @return Boolean.
     */
    public boolean contains(String name) {
        return headers.containsKey(HeaderKeys.canonical(name));
    }

    /**
     * Removes all values of a header.
     *
     * @param name Header name.
     * @return Self.
     */
    public MimeHeaders remove(String name) {
        headers.remove(HeaderKeys.canonical(name));
        return this;
    }

    /**
     * Gets canonical names in insertion order.
     *
     * @return Unmodifiable set of names.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(headers.keySet());
    }

    /**
     * Gets number of distinct header names.
     *
     * @return Size.
     */
    public int size() {
        return headers.size();
    }

    /**
     * Is empty.
     *
     * @return Boolean.
     */
    public boolean isEmpty() {
        return headers.isEmpty();
    }

    @Override
    public String toString() {
        return headers.toString();
    }
}
