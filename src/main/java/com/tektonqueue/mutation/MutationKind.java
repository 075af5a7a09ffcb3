package com.tektonqueue.mutation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Kind of metadata change a {@link MutationRequest} performs.
 * Determines both the target map and the merge semantics.
 */
public enum MutationKind {

    /**
     * Overwrites an annotation.
     */
    ANNOTATION("annotation"),

    /**
     * Overwrites a label.
     */
    LABEL("label"),

    /**
     * Adds an integer quantity to a resource-request annotation.
     */
    RESOURCE("resource");

    private final String value;

    MutationKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolve a kind from its lowercase wire name.
     *
     * @throws IllegalArgumentException if the name is not one of the known kinds
     */
    @JsonCreator
    public static MutationKind fromValue(String value) {
        for (MutationKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException(
                "invalid mutation type: \"" + value + "\", must be one of: " + validValues());
    }

    /**
     * Lowercase names of all kinds, in declaration order.
     */
    public static List<String> validValues() {
        return Arrays.stream(values()).map(MutationKind::value).toList();
    }

    @Override
    public String toString() {
        return value;
    }
}
