package com.tektonqueue.mutation;

import com.tektonqueue.model.PipelineRun;

/**
 * Mutates a PipelineRun in place during admission.
 */
public interface PipelineRunMutator {

    /**
     * Apply this mutator's changes to the given PipelineRun.
     *
     * @param pipelineRun run to mutate, modified in place
     * @throws com.tektonqueue.exception.TektonQueueException if the run must be rejected
     */
    void mutate(PipelineRun pipelineRun);
}
