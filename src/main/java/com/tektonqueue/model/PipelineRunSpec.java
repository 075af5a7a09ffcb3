package com.tektonqueue.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Desired state of a PipelineRun.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"pipelineRef", "pipelineSpec", "params", "status", "managedBy"})
public class PipelineRunSpec {

    /**
     * Value of {@code spec.status} that keeps a run from starting until it is admitted.
     */
    public static final String STATUS_PENDING = "PipelineRunPending";

    private PipelineRef pipelineRef;
    private PipelineSpec pipelineSpec;
    private List<Param> params;
    private String status;
    private String managedBy;
    private final Map<String, Object> additionalProperties = new LinkedHashMap<>();

    public PipelineRef getPipelineRef() {
        return pipelineRef;
    }

    public void setPipelineRef(PipelineRef pipelineRef) {
        this.pipelineRef = pipelineRef;
    }

    public PipelineSpec getPipelineSpec() {
        return pipelineSpec;
    }

    public void setPipelineSpec(PipelineSpec pipelineSpec) {
        this.pipelineSpec = pipelineSpec;
    }

    public List<Param> getParams() {
        return params;
    }

    public void setParams(List<Param> params) {
        this.params = params;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getManagedBy() {
        return managedBy;
    }

    public void setManagedBy(String managedBy) {
        this.managedBy = managedBy;
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
