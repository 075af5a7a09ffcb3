package com.tektonqueue.webhook;

import com.tektonqueue.config.ConfigSnapshot;
import com.tektonqueue.config.ConfigStore;
import com.tektonqueue.config.TektonQueueConfig;
import com.tektonqueue.exception.BadRequestException;
import com.tektonqueue.model.PipelineRun;
import com.tektonqueue.model.PipelineRunSpec;
import com.tektonqueue.mutation.PipelineRunMutator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admission-time defaulting for newly created PipelineRuns.
 * <p>
 * Holds the run pending, assigns it to the configured Kueue queue and then applies
 * every configured mutator. Configuration and mutators come from one snapshot, so a
 * concurrent reload never mixes two configurations within a single request.
 */
public class PipelineRunDefaulter {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunDefaulter.class);

    /**
     * Label Kueue reads to pick the LocalQueue.
     */
    public static final String QUEUE_LABEL = "kueue.x-k8s.io/queue-name";

    /**
     * Controller name that hands the run to MultiKueue.
     */
    public static final String MULTIKUEUE_MANAGED_BY = "kueue.x-k8s.io/multikueue";

    private final ConfigStore configStore;

    public PipelineRunDefaulter(ConfigStore configStore) {
        this.configStore = configStore;
    }

    /**
     * Default and mutate a run in place.
     *
     * @throws BadRequestException if the run is missing or its spec is malformed
     */
    public void apply(PipelineRun pipelineRun) {
        if (pipelineRun == null) {
            throw new BadRequestException("expected a PipelineRun object but got null");
        }
        validateSpec(pipelineRun.getSpec());

        ConfigSnapshot snapshot = configStore.snapshot();
        TektonQueueConfig config = snapshot.config();

        PipelineRunSpec spec = pipelineRun.getSpec();
        spec.setStatus(PipelineRunSpec.STATUS_PENDING);
        if (config.multiKueueOverride()) {
            spec.setManagedBy(MULTIKUEUE_MANAGED_BY);
        }
        pipelineRun.getMetadata().labels().putIfAbsent(QUEUE_LABEL, config.queueName());

        for (PipelineRunMutator mutator : snapshot.mutators()) {
            mutator.mutate(pipelineRun);
        }
        log.debug("Defaulted PipelineRun {}/{}", pipelineRun.getMetadata().getNamespace(), displayName(pipelineRun));
    }

    private static void validateSpec(PipelineRunSpec spec) {
        if (spec == null) {
            throw new BadRequestException("expected exactly one, got neither: spec.pipelineRef, spec.pipelineSpec");
        }
        boolean hasRef = spec.getPipelineRef() != null;
        boolean hasSpec = spec.getPipelineSpec() != null;
        if (hasRef && hasSpec) {
            throw new BadRequestException("expected exactly one, got both: spec.pipelineRef, spec.pipelineSpec");
        }
        if (!hasRef && !hasSpec) {
            throw new BadRequestException("expected exactly one, got neither: spec.pipelineRef, spec.pipelineSpec");
        }
    }

    private static String displayName(PipelineRun pipelineRun) {
        String name = pipelineRun.getMetadata().getName();
        return name != null ? name : pipelineRun.getMetadata().getGenerateName();
    }
}
