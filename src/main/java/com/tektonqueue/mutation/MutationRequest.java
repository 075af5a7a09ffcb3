package com.tektonqueue.mutation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tektonqueue.exception.ValidationException;

/**
 * A single label, annotation or resource-quantity change.
 *
 * @param kind  mutation kind (serialized as {@code type})
 * @param key   target metadata key, already prefixed for resource requests
 * @param value new value; a decimal integer for {@link MutationKind#RESOURCE}
 */
public record MutationRequest(
        @JsonProperty("type") MutationKind kind,
        @JsonProperty("key") String key,
        @JsonProperty("value") String value
) {

    public static MutationRequest annotation(String key, String value) {
        return new MutationRequest(MutationKind.ANNOTATION, key, value);
    }

    public static MutationRequest label(String key, String value) {
        return new MutationRequest(MutationKind.LABEL, key, value);
    }

    public static MutationRequest resource(String key, long value) {
        return new MutationRequest(MutationKind.RESOURCE, key, Long.toString(value));
    }

    /**
     * Check the structural invariant: known kind, non-empty key and value.
     *
     * @throws ValidationException if the request must not be applied
     */
    public void validate() {
        if (kind == null) {
            throw new ValidationException("invalid mutation type: " + kind);
        }
        if (key == null || key.isEmpty()) {
            throw new ValidationException("mutation key cannot be empty");
        }
        if (value == null || value.isEmpty()) {
            throw new ValidationException("mutation value cannot be empty");
        }
    }
}
