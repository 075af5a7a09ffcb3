package com.tektonqueue.config;

import com.tektonqueue.mutation.PipelineRunMutator;

import java.util.List;

/**
 * A parsed configuration together with the mutators compiled from it.
 * Never modified after publication.
 */
public record ConfigSnapshot(TektonQueueConfig config, List<PipelineRunMutator> mutators) {

    public ConfigSnapshot {
        mutators = List.copyOf(mutators);
    }
}
