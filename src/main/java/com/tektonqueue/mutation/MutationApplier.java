package com.tektonqueue.mutation;

import com.tektonqueue.exception.MutationException;
import com.tektonqueue.model.ObjectMeta;
import com.tektonqueue.model.PipelineRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Applies mutation requests to a PipelineRun's metadata, in order.
 * <p>
 * Labels and annotations are overwritten. Resource requests are added to the
 * quantity already recorded under the same annotation key. The first failure
 * stops processing; requests applied before it stay applied.
 */
public final class MutationApplier {

    private static final Logger log = LoggerFactory.getLogger(MutationApplier.class);

    private MutationApplier() {
    }

    /**
     * @throws MutationException on the first request that cannot be applied
     */
    public static void apply(List<MutationRequest> requests, PipelineRun pipelineRun) {
        ObjectMeta metadata = pipelineRun.getMetadata();
        for (MutationRequest request : requests) {
            try {
                applyOne(request, metadata);
            } catch (MutationException e) {
                throw new MutationException("failed to apply mutation (type: " + request.kind()
                        + ", key: " + request.key() + "): " + e.getMessage(), e);
            }
        }
    }

    private static void applyOne(MutationRequest request, ObjectMeta metadata) {
        switch (request.kind()) {
            case LABEL -> metadata.labels().put(request.key(), request.value());
            case ANNOTATION -> metadata.annotations().put(request.key(), request.value());
            case RESOURCE -> addResource(metadata.annotations(), request.key(), request.value());
        }
    }

    private static void addResource(Map<String, String> annotations, String key, String value) {
        long amount;
        try {
            amount = Long.parseLong(value);
        } catch (NumberFormatException e) {
            // resource() only emits decimal integers
            log.error("Resource mutation for key {} carries non-integer value {}", key, value);
            throw new MutationException("failed to parse resource value \"" + value + "\" as integer", e);
        }

        String existing = annotations.get(key);
        if (existing != null) {
            long prior;
            try {
                prior = Long.parseLong(existing);
            } catch (NumberFormatException e) {
                throw new MutationException("failed to parse existing resource value \"" + existing
                        + "\" as integer for key \"" + key + "\"", e);
            }
            try {
                amount = Math.addExact(prior, amount);
            } catch (ArithmeticException e) {
                throw new MutationException("resource value overflow for key \"" + key + "\"", e);
            }
        }
        annotations.put(key, Long.toString(amount));
    }
}
