package com.shlawgathon.stageforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The evolving intermediate data threaded from stage to stage.
 * Instances are immutable: stages derive a new document with {@link #with}
 * instead of changing the one they were given, so a retried stage always sees
 * the same input.
 */
@EqualsAndHashCode
public final class WorkingDocument {

    private static final WorkingDocument EMPTY = new WorkingDocument(Map.of());

    private final Map<String, Object> content;

    private WorkingDocument(Map<String, Object> content) {
        this.content = Collections.unmodifiableMap(new LinkedHashMap<>(content));
    }

    public static WorkingDocument empty() {
        return EMPTY;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static WorkingDocument of(Map<String, Object> content) {
        return content == null || content.isEmpty() ? EMPTY : new WorkingDocument(content);
    }

    /**
     * Copy of this document with {@code key} set to {@code value}.
     */
    public WorkingDocument with(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(content);
        next.put(key, value);
        return new WorkingDocument(next);
    }

    /**
     * Copy of this document with every entry of {@code values} applied.
     */
    public WorkingDocument withAll(Map<String, ?> values) {
        Map<String, Object> next = new LinkedHashMap<>(content);
        next.putAll(values);
        return new WorkingDocument(next);
    }

    /**
     * Copy of this document with only the keys of {@code defaults} that are not
     * already present added.
     */
    public WorkingDocument withDefaults(Map<String, ?> defaults) {
        Map<String, Object> next = new LinkedHashMap<>(content);
        defaults.forEach(next::putIfAbsent);
        return new WorkingDocument(next);
    }

    public boolean contains(String key) {
        return content.containsKey(key);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(content.get(key));
    }

    public Optional<String> getString(String key) {
        return get(key).map(Object::toString);
    }

    public <T> T require(String key, Class<T> type) {
        Object value = content.get(key);
        if (value == null) {
            throw new IllegalStateException("Working document has no '" + key + "' entry");
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException("Working document entry '" + key + "' is a "
                    + value.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        return type.cast(value);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return content;
    }

    public int size() {
        return content.size();
    }

    @Override
    public String toString() {
        return "WorkingDocument" + content.keySet();
    }
}
