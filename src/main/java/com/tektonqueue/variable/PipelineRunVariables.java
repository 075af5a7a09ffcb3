package com.tektonqueue.variable;

import com.tektonqueue.model.PipelineRun;
import com.tektonqueue.model.PipelineRunMapper;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds the variables an expression can reference for one PipelineRun.
 * <ul>
 *   <li>{@code pipelineRun} - the whole run as nested maps</li>
 *   <li>{@code plrNamespace} - the run's namespace</li>
 *   <li>{@code pacEventType} - Pipelines-as-Code event type of a build run</li>
 *   <li>{@code pacTestEventType} - event type of an integration test run</li>
 * </ul>
 * Event types are the empty string when the label is missing.
 */
public final class PipelineRunVariables {

    public static final String PIPELINE_RUN = "pipelineRun";
    public static final String PLR_NAMESPACE = "plrNamespace";
    public static final String PAC_EVENT_TYPE = "pacEventType";
    public static final String PAC_TEST_EVENT_TYPE = "pacTestEventType";

    public static final String PAC_EVENT_TYPE_LABEL = "pipelinesascode.tekton.dev/event-type";
    public static final String PAC_TEST_EVENT_TYPE_LABEL = "pac.test.appstudio.openshift.io/event-type";

    private PipelineRunVariables() {
    }

    /**
     * Resolve all variables for the given run.
     *
     * @param pipelineRun non-null run
     * @return mutable map of variable name to value
     */
    public static Map<String, Object> resolve(PipelineRun pipelineRun) {
        Map<String, Object> vars = new HashMap<>();
        vars.put(PIPELINE_RUN, PipelineRunMapper.toMap(pipelineRun));
        vars.put(PLR_NAMESPACE, nullToEmpty(pipelineRun.getMetadata().getNamespace()));
        vars.put(PAC_EVENT_TYPE, label(pipelineRun, PAC_EVENT_TYPE_LABEL));
        vars.put(PAC_TEST_EVENT_TYPE, label(pipelineRun, PAC_TEST_EVENT_TYPE_LABEL));
        return vars;
    }

    /**
     * Value of a label, or the empty string if the run has no such label.
     */
    public static String label(PipelineRun pipelineRun, String key) {
        Map<String, String> labels = pipelineRun.getMetadata().getLabels();
        if (labels == null) {
            return "";
        }
        return nullToEmpty(labels.get(key));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
