package com.tektonqueue.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pipeline definition embedded in a PipelineRun.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"tasks", "finally"})
public class PipelineSpec {

    private List<PipelineTask> tasks;
    private List<PipelineTask> finallyTasks;
    private final Map<String, Object> additionalProperties = new LinkedHashMap<>();

    public PipelineSpec() {
    }

    public PipelineSpec(List<PipelineTask> tasks) {
        this.tasks = new ArrayList<>(tasks);
    }

    public List<PipelineTask> getTasks() {
        return tasks;
    }

    public void setTasks(List<PipelineTask> tasks) {
        this.tasks = tasks;
    }

    @JsonProperty("finally")
    public List<PipelineTask> getFinallyTasks() {
        return finallyTasks;
    }

    @JsonProperty("finally")
    public void setFinallyTasks(List<PipelineTask> finallyTasks) {
        this.finallyTasks = finallyTasks;
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditionalProperties() {
        return additionalProperties;
    }

    @JsonAnySetter
    public void setAdditionalProperty(String key, Object value) {
        additionalProperties.put(key, value);
    }
}
