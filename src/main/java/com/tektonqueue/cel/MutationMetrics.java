package com.tektonqueue.cel;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Micrometer counters for expression evaluation and mutation application.
 * Exported by a Prometheus registry as {@code tekton_queue_cel_evaluations_total}
 * and {@code tekton_queue_cel_mutations_total}.
 */
public class MutationMetrics {

    static final String EVALUATIONS = "tekton_queue.cel.evaluations";
    static final String MUTATIONS = "tekton_queue.cel.mutations";

    private final MeterRegistry registry;

    public MutationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * One program evaluated against one run.
     */
    public void recordEvaluation(boolean success) {
        Counter.builder(EVALUATIONS)
                .description("CEL program evaluations")
                .tag("result", result(success))
                .register(registry)
                .increment();
    }

    /**
     * Mutation requests applied, or one failed application.
     */
    public void recordMutations(boolean success, int count) {
        Counter.builder(MUTATIONS)
                .description("Mutation requests applied to PipelineRuns")
                .tag("result", result(success))
                .register(registry)
                .increment(count);
    }

    private static String result(boolean success) {
        return success ? "success" : "failure";
    }
}
