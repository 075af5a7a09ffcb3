package com.tektonqueue.cel;

import com.tektonqueue.exception.EvaluationException;
import com.tektonqueue.exception.ValidationException;
import com.tektonqueue.model.PipelineRun;
import com.tektonqueue.mutation.MutationRequest;
import com.tektonqueue.variable.PipelineRunVariables;
import dev.cel.common.CelAbstractSyntaxTree;
import dev.cel.runtime.CelEvaluationException;
import dev.cel.runtime.CelRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * A type-checked expression ready to be evaluated against PipelineRuns.
 * Immutable and safe to share between threads.
 */
public final class CompiledProgram {

    private static final Logger log = LoggerFactory.getLogger(CompiledProgram.class);

    private final String expression;
    private final CelAbstractSyntaxTree ast;
    private final CelRuntime.Program program;

    CompiledProgram(String expression, CelAbstractSyntaxTree ast, CelRuntime.Program program) {
        this.expression = expression;
        this.ast = ast;
        this.program = program;
    }

    public String getExpression() {
        return expression;
    }

    CelAbstractSyntaxTree getAst() {
        return ast;
    }

    /**
     * Evaluate against a run and return the validated mutation requests it produced.
     * The run itself is not modified.
     *
     * @throws EvaluationException on runtime failure, malformed result or invalid request
     */
    public List<MutationRequest> evaluate(PipelineRun pipelineRun) {
        if (pipelineRun == null) {
            throw new EvaluationException("pipelineRun cannot be nil");
        }

        Map<String, Object> vars = PipelineRunVariables.resolve(pipelineRun);
        Object result;
        try {
            result = program.eval(vars);
        } catch (CelEvaluationException e) {
            throw new EvaluationException(
                    "failed to evaluate CEL expression \"" + expression + "\": " + causeChain(e), e);
        }

        List<MutationRequest> requests;
        try {
            requests = MutationResultConverter.convert(result);
        } catch (EvaluationException e) {
            throw new EvaluationException("failed to convert result to MutationRequests for expression \""
                    + expression + "\": " + e.getMessage(), e);
        }

        for (int i = 0; i < requests.size(); i++) {
            try {
                requests.get(i).validate();
            } catch (ValidationException e) {
                throw new EvaluationException("invalid mutation at index " + i + " for expression \""
                        + expression + "\": " + e.getMessage(), e);
            }
        }

        log.debug("Expression produced {} mutations for {}/{}", requests.size(),
                pipelineRun.getMetadata().getNamespace(), pipelineRun.getMetadata().getName());
        return requests;
    }

    // The runtime wraps function failures; the innermost messages carry the useful detail.
    private static String causeChain(Throwable error) {
        StringBuilder sb = new StringBuilder(String.valueOf(error.getMessage()));
        Throwable cause = error.getCause();
        while (cause != null && cause != error) {
            String message = cause.getMessage();
            if (message != null && !sb.toString().contains(message)) {
                sb.append(": ").append(message);
            }
            error = cause;
            cause = cause.getCause();
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "CompiledProgram{" + expression + "}";
    }
}
