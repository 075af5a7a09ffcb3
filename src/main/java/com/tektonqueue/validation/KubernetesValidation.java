package com.tektonqueue.validation;

import com.tektonqueue.exception.ValidationException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Kubernetes naming rules for metadata keys and values.
 * <p>
 * All checks are pure: they either return normally or throw a {@link ValidationException}
 * whose message names the violated constraint.
 */
public final class KubernetesValidation {

    /**
     * Maximum length of the name part of a qualified name, and of a label value.
     */
    public static final int MAX_NAME_LENGTH = 63;

    /**
     * Maximum length of a DNS-1123 subdomain prefix.
     */
    public static final int MAX_PREFIX_LENGTH = 253;

    /**
     * Maximum size of an annotation value in bytes (256 KiB).
     */
    public static final int MAX_ANNOTATION_VALUE_BYTES = 256 * 1024;

    private static final String QUALIFIED_NAME_FMT = "([A-Za-z0-9][-A-Za-z0-9_.]*)?[A-Za-z0-9]";
    private static final Pattern QUALIFIED_NAME = Pattern.compile("^" + QUALIFIED_NAME_FMT + "$");
    private static final String QUALIFIED_NAME_MSG =
            "must consist of alphanumeric characters, '-', '_' or '.', "
                    + "and must start and end with an alphanumeric character";

    private static final String LABEL_VALUE_FMT = "(" + QUALIFIED_NAME_FMT + ")?";
    private static final Pattern LABEL_VALUE = Pattern.compile("^" + LABEL_VALUE_FMT + "$");

    private static final String DNS1123_SUBDOMAIN_FMT =
            "[a-z0-9]([-a-z0-9]*[a-z0-9])?(\\.[a-z0-9]([-a-z0-9]*[a-z0-9])?)*";
    private static final Pattern DNS1123_SUBDOMAIN = Pattern.compile("^" + DNS1123_SUBDOMAIN_FMT + "$");

    private KubernetesValidation() {
    }

    /**
     * Validate a label, annotation or resource key as a Kubernetes qualified name:
     * an optional DNS subdomain prefix and '/', followed by a short name.
     *
     * @param key     the key to check
     * @param keyType "label", "annotation" or "resource", used in messages
     */
    public static void validateKey(String key, String keyType) {
        if (key == null || key.isEmpty()) {
            throw new ValidationException(keyType + " key cannot be empty");
        }
        List<String> errors = qualifiedNameErrors(key);
        if (!errors.isEmpty()) {
            throw new ValidationException(
                    keyType + " key '" + key + "' is invalid: " + String.join(", ", errors));
        }
    }

    /**
     * Validate a label value. Empty values are allowed.
     */
    public static void validateLabelValue(String value) {
        List<String> errors = new ArrayList<>();
        if (value.length() > MAX_NAME_LENGTH) {
            errors.add(maxLengthError(MAX_NAME_LENGTH));
        }
        if (!LABEL_VALUE.matcher(value).matches()) {
            errors.add("a valid label must be an empty string or " + QUALIFIED_NAME_MSG
                    + " (e.g. 'MyValue', or 'my_value', or '12345', regex used for validation is '"
                    + LABEL_VALUE_FMT + "')");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(
                    "label value '" + value + "' is invalid: " + String.join(", ", errors));
        }
    }

    /**
     * Validate an annotation value. Any UTF-8 content is allowed up to
     * {@link #MAX_ANNOTATION_VALUE_BYTES}.
     */
    public static void validateAnnotationValue(String value) {
        int size = value.getBytes(StandardCharsets.UTF_8).length;
        if (size > MAX_ANNOTATION_VALUE_BYTES) {
            throw new ValidationException("annotation value is too long: " + size
                    + " bytes, maximum allowed is " + MAX_ANNOTATION_VALUE_BYTES + " bytes");
        }
    }

    /**
     * Validate a resource quantity. Must be zero or positive.
     */
    public static void validateResourceValue(long value) {
        if (value < 0) {
            throw new ValidationException("resource value cannot be negative: " + value);
        }
    }

    private static List<String> qualifiedNameErrors(String value) {
        List<String> errors = new ArrayList<>();
        String[] parts = value.split("/", -1);
        String name;
        switch (parts.length) {
            case 1 -> name = parts[0];
            case 2 -> {
                String prefix = parts[0];
                name = parts[1];
                if (prefix.isEmpty()) {
                    errors.add("prefix part must be non-empty");
                } else {
                    for (String msg : dns1123SubdomainErrors(prefix)) {
                        errors.add("prefix part " + msg);
                    }
                }
            }
            default -> {
                errors.add("a qualified name " + QUALIFIED_NAME_MSG
                        + " with an optional DNS subdomain prefix and '/' (e.g. 'example.com/MyName')");
                return errors;
            }
        }

        if (name.isEmpty()) {
            errors.add("name part must be non-empty");
        } else if (name.length() > MAX_NAME_LENGTH) {
            errors.add("name part " + maxLengthError(MAX_NAME_LENGTH));
        }
        if (!QUALIFIED_NAME.matcher(name).matches()) {
            errors.add("name part " + QUALIFIED_NAME_MSG
                    + " (e.g. 'MyName', or 'my.name', or '123-abc', regex used for validation is '"
                    + QUALIFIED_NAME_FMT + "')");
        }
        return errors;
    }

    private static List<String> dns1123SubdomainErrors(String value) {
        List<String> errors = new ArrayList<>();
        if (value.length() > MAX_PREFIX_LENGTH) {
            errors.add(maxLengthError(MAX_PREFIX_LENGTH));
        }
        if (!DNS1123_SUBDOMAIN.matcher(value).matches()) {
            errors.add("a lowercase RFC 1123 subdomain must consist of lower case alphanumeric characters, "
                    + "'-' or '.', and must start and end with an alphanumeric character "
                    + "(e.g. 'example.com', regex used for validation is '" + DNS1123_SUBDOMAIN_FMT + "')");
        }
        return errors;
    }

    private static String maxLengthError(int length) {
        return "must be no more than " + length + " characters";
    }
}
