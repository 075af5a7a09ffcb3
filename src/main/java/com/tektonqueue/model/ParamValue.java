package com.tektonqueue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A Tekton parameter value: a string, an array of strings or an object of strings.
 * Serialized as the bare JSON value, so CEL sees {@code p.value} with its natural type.
 */
public final class ParamValue {

    /**
     * Tekton parameter value types.
     */
    public enum Type {
        STRING,
        ARRAY,
        OBJECT
    }

    private final Type type;
    private final String stringVal;
    private final List<String> arrayVal;
    private final Map<String, String> objectVal;

    private ParamValue(Type type, String stringVal, List<String> arrayVal, Map<String, String> objectVal) {
        this.type = type;
        this.stringVal = stringVal;
        this.arrayVal = arrayVal;
        this.objectVal = objectVal;
    }

    public static ParamValue ofString(String value) {
        return new ParamValue(Type.STRING, Objects.requireNonNull(value), null, null);
    }

    public static ParamValue ofArray(List<String> values) {
        return new ParamValue(Type.ARRAY, null, List.copyOf(values), null);
    }

    public static ParamValue ofObject(Map<String, String> values) {
        return new ParamValue(Type.OBJECT, null, null, new LinkedHashMap<>(values));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static ParamValue fromJson(Object raw) {
        if (raw instanceof List<?> list) {
            return ofArray(list.stream().map(String::valueOf).toList());
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, String> values = new LinkedHashMap<>();
            map.forEach((k, v) -> values.put(String.valueOf(k), String.valueOf(v)));
            return ofObject(values);
        }
        return ofString(raw == null ? "" : String.valueOf(raw));
    }

    @JsonValue
    Object toJson() {
        return switch (type) {
            case STRING -> stringVal;
            case ARRAY -> arrayVal;
            case OBJECT -> objectVal;
        };
    }

    public Type getType() {
        return type;
    }

    public String getStringVal() {
        return stringVal;
    }

    public List<String> getArrayVal() {
        return arrayVal;
    }

    public Map<String, String> getObjectVal() {
        return objectVal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParamValue that)) return false;
        return type == that.type && Objects.equals(toJson(), that.toJson());
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, toJson());
    }

    @Override
    public String toString() {
        return String.valueOf(toJson());
    }
}
