package com.tektonqueue.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A named Tekton parameter.
 *
 * @param name  parameter name
 * @param value parameter value
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Param(String name, ParamValue value) {

    public static Param of(String name, String value) {
        return new Param(name, ParamValue.ofString(value));
    }

    public static Param ofArray(String name, String... values) {
        return new Param(name, ParamValue.ofArray(List.of(values)));
    }
}
