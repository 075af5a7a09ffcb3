package com.tektonqueue.cel;

import com.tektonqueue.exception.ValidationException;
import com.tektonqueue.mutation.MutationKind;
import com.tektonqueue.validation.KubernetesValidation;
import dev.cel.runtime.CelEvaluationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Implementations of the functions exposed to policy expressions.
 * <p>
 * Mutation constructors return a {@code type}/{@code key}/{@code value} map rather than a
 * {@link com.tektonqueue.mutation.MutationRequest}: CEL has no user-defined nominal types.
 */
final class MutationFunctions {

    static final String ANNOTATION = "annotation";
    static final String LABEL = "label";
    static final String PRIORITY = "priority";
    static final String RESOURCE = "resource";
    static final String REPLACE = "replace";

    /**
     * Label read by Kueue to pick a WorkloadPriorityClass.
     */
    static final String PRIORITY_CLASS_LABEL = "kueue.x-k8s.io/priority-class";

    /**
     * Prefix of annotations declaring resource requests.
     */
    static final String RESOURCE_REQUEST_PREFIX = "kueue.konflux-ci.dev/requests-";

    static final String TYPE_FIELD = "type";
    static final String KEY_FIELD = "key";
    static final String VALUE_FIELD = "value";

    private MutationFunctions() {
    }

    static Map<String, Object> annotation(String key, String value) throws CelEvaluationException {
        checkKey(ANNOTATION, key);
        try {
            KubernetesValidation.validateAnnotationValue(value);
        } catch (ValidationException e) {
            throw failure(ANNOTATION + " value validation failed: " + e.getMessage(), e);
        }
        return mutation(MutationKind.ANNOTATION, key, value);
    }

    static Map<String, Object> label(String key, String value) throws CelEvaluationException {
        checkKey(LABEL, key);
        try {
            KubernetesValidation.validateLabelValue(value);
        } catch (ValidationException e) {
            throw failure(LABEL + " value validation failed: " + e.getMessage(), e);
        }
        return mutation(MutationKind.LABEL, key, value);
    }

    static Map<String, Object> priority(String value) throws CelEvaluationException {
        try {
            KubernetesValidation.validateLabelValue(value);
        } catch (ValidationException e) {
            throw failure(PRIORITY + " value validation failed: " + e.getMessage(), e);
        }
        return mutation(MutationKind.LABEL, PRIORITY_CLASS_LABEL, value);
    }

    static Map<String, Object> resource(String key, long value) throws CelEvaluationException {
        checkKey(RESOURCE, key);
        try {
            KubernetesValidation.validateResourceValue(value);
        } catch (ValidationException e) {
            throw failure(RESOURCE + " value validation failed: " + e.getMessage(), e);
        }
        return mutation(MutationKind.RESOURCE, RESOURCE_REQUEST_PREFIX + key, Long.toString(value));
    }

    static String replace(String source, String search, String replacement) {
        return source.replace(search, replacement);
    }

    private static void checkKey(String function, String key) throws CelEvaluationException {
        if (key.isEmpty()) {
            throw failure(function + " key cannot be empty", null);
        }
        try {
            KubernetesValidation.validateKey(key, function);
        } catch (ValidationException e) {
            throw failure(function + " key validation failed: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> mutation(MutationKind kind, String key, String value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(TYPE_FIELD, kind.value());
        map.put(KEY_FIELD, key);
        map.put(VALUE_FIELD, value);
        return map;
    }

    private static CelEvaluationException failure(String message, Throwable cause) {
        return cause == null
                ? new CelEvaluationException(message)
                : new CelEvaluationException(message, cause);
    }
}
