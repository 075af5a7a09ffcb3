package com.tektonqueue.cel;

import com.tektonqueue.exception.EvaluationException;
import com.tektonqueue.exception.MutationException;
import com.tektonqueue.model.PipelineRun;
import com.tektonqueue.mutation.MutationApplier;
import com.tektonqueue.mutation.MutationRequest;
import com.tektonqueue.mutation.PipelineRunMutator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutator backed by a list of compiled expressions.
 * <p>
 * Every program is evaluated first and the resulting requests are applied in
 * expression order afterwards, so an evaluation failure leaves the run untouched.
 * Thread-safe: holds only immutable programs.
 */
public class CelMutator implements PipelineRunMutator {

    private static final Logger log = LoggerFactory.getLogger(CelMutator.class);

    private final List<CompiledProgram> programs;
    private final MutationMetrics metrics;

    public CelMutator(List<CompiledProgram> programs) {
        this(programs, new MutationMetrics(new SimpleMeterRegistry()));
    }

    public CelMutator(List<CompiledProgram> programs, MutationMetrics metrics) {
        this.programs = List.copyOf(programs);
        this.metrics = metrics;
    }

    public List<CompiledProgram> getPrograms() {
        return programs;
    }

    /**
     * @throws EvaluationException if any program fails; nothing is applied
     * @throws MutationException   if a request cannot be applied; earlier requests remain
     */
    @Override
    public void mutate(PipelineRun pipelineRun) {
        if (pipelineRun == null) {
            throw new EvaluationException("pipelineRun cannot be nil");
        }
        List<MutationRequest> requests = new ArrayList<>();
        for (CompiledProgram program : programs) {
            try {
                requests.addAll(program.evaluate(pipelineRun));
                metrics.recordEvaluation(true);
            } catch (EvaluationException e) {
                metrics.recordEvaluation(false);
                throw e;
            }
        }

        try {
            MutationApplier.apply(requests, pipelineRun);
        } catch (MutationException e) {
            metrics.recordMutations(false, 1);
            throw e;
        }
        metrics.recordMutations(true, requests.size());
        log.debug("Applied {} mutations from {} expressions", requests.size(), programs.size());
    }
}
