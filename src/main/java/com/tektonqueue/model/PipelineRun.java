package com.tektonqueue.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tekton {@code tekton.dev/v1} PipelineRun, as seen by the admission webhook.
 * Only the fields mutations and policies care about are typed; the rest round-trips untouched.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"apiVersion", "kind", "metadata", "spec"})
public class PipelineRun {

    public static final String API_VERSION = "tekton.dev/v1";
    public static final String KIND = "PipelineRun";

    private String apiVersion = API_VERSION;
    private String kind = KIND;
    private ObjectMeta metadata = new ObjectMeta();
    private PipelineRunSpec spec = new PipelineRunSpec();
    private final Map<String, Object> additionalProperties = new LinkedHashMap<>();

    public PipelineRun() {
    }

    public PipelineRun(String namespace, String name) {
        metadata.setNamespace(namespace);
        metadata.setName(name);
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public ObjectMeta getMetadata() {
        return metadata;
    }

    public void setMetadata(ObjectMeta metadata) {
        this.metadata = metadata == null ? new ObjectMeta() : metadata;
    }

    public PipelineRunSpec getSpec() {
        return spec;
    }

    public void setSpec(PipelineRunSpec spec) {
        this.spec = spec == null ? new PipelineRunSpec() : spec;
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditionalProperties() {
        return additionalProperties;
    }

    @JsonAnySetter
    public void setAdditionalProperty(String key, Object value) {
        additionalProperties.put(key, value);
    }

    @Override
    public String toString() {
        return "PipelineRun{" + metadata.getNamespace() + "/"
                + (metadata.getName() != null ? metadata.getName() : metadata.getGenerateName()) + '}';
    }
}
