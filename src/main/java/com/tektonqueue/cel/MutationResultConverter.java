package com.tektonqueue.cel;

import com.tektonqueue.exception.EvaluationException;
import com.tektonqueue.mutation.MutationKind;
import com.tektonqueue.mutation.MutationRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns the raw value an expression produced into mutation requests.
 * A single map yields one request, a list yields one request per element.
 */
final class MutationResultConverter {

    private MutationResultConverter() {
    }

    static List<MutationRequest> convert(Object result) {
        if (result instanceof Map<?, ?> map) {
            return List.of(convertMap(map));
        }
        if (result instanceof List<?> list) {
            List<MutationRequest> requests = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                Object item = list.get(i);
                if (!(item instanceof Map<?, ?> map)) {
                    throw new EvaluationException("failed to convert list item " + i
                            + ": expected MutationRequest-compatible map, got " + typeName(item));
                }
                try {
                    requests.add(convertMap(map));
                } catch (EvaluationException e) {
                    throw new EvaluationException("failed to convert list item " + i + ": " + e.getMessage(), e);
                }
            }
            return requests;
        }
        throw new EvaluationException("expected MutationRequest-compatible map or list, got " + typeName(result));
    }

    private static MutationRequest convertMap(Map<?, ?> map) {
        Object rawType = map.get(MutationFunctions.TYPE_FIELD);
        if (rawType == null) {
            throw new EvaluationException("missing required 'type' field");
        }
        if (!(rawType instanceof String type)) {
            throw new EvaluationException("'type' field must be a string, got " + typeName(rawType));
        }
        MutationKind kind;
        try {
            kind = MutationKind.fromValue(type);
        } catch (IllegalArgumentException e) {
            throw new EvaluationException(e.getMessage(), e);
        }

        String key = stringField(map, MutationFunctions.KEY_FIELD);
        if (key.isEmpty()) {
            throw new EvaluationException("'key' field cannot be empty");
        }
        String value = stringField(map, MutationFunctions.VALUE_FIELD);
        return new MutationRequest(kind, key, value);
    }

    private static String stringField(Map<?, ?> map, String field) {
        Object raw = map.get(field);
        if (raw == null) {
            throw new EvaluationException("missing required '" + field + "' field");
        }
        if (!(raw instanceof String value)) {
            throw new EvaluationException("'" + field + "' field must be a string, got " + typeName(raw));
        }
        return value;
    }

    static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
