package com.tektonqueue.mutation;

import com.tektonqueue.exception.MutationException;
import com.tektonqueue.model.PipelineRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MutationApplier.
 */
class MutationApplierTest {

    private PipelineRun pipelineRun;

    @BeforeEach
    void setUp() {
        pipelineRun = new PipelineRun("default", "build-1");
    }

    @Test
    @DisplayName("Should create label and annotation maps on demand")
    void shouldCreateMaps() {
        assertNull(pipelineRun.getMetadata().getLabels());

        MutationApplier.apply(List.of(
                MutationRequest.label("team", "core"),
                MutationRequest.annotation("note", "hello world")), pipelineRun);

        assertEquals(Map.of("team", "core"), pipelineRun.getMetadata().getLabels());
        assertEquals(Map.of("note", "hello world"), pipelineRun.getMetadata().getAnnotations());
    }

    @Test
    @DisplayName("Later label and annotation mutations overwrite earlier values")
    void shouldOverwrite() {
        pipelineRun.getMetadata().labels().put("team", "old");

        MutationApplier.apply(List.of(
                MutationRequest.label("team", "first"),
                MutationRequest.label("team", "second"),
                MutationRequest.annotation("a", "1"),
                MutationRequest.annotation("a", "2")), pipelineRun);

        assertEquals("second", pipelineRun.getMetadata().getLabels().get("team"));
        assertEquals("2", pipelineRun.getMetadata().getAnnotations().get("a"));
    }

    @Test
    @DisplayName("Resource mutations add to the existing quantity")
    void shouldSumResources() {
        pipelineRun.getMetadata().annotations().put("kueue.konflux-ci.dev/requests-cpu", "1024");

        MutationApplier.apply(List.of(
                MutationRequest.resource("kueue.konflux-ci.dev/requests-cpu", 2048),
                MutationRequest.resource("kueue.konflux-ci.dev/requests-mem", 2),
                MutationRequest.resource("kueue.konflux-ci.dev/requests-mem", 4)), pipelineRun);

        assertEquals("3072", pipelineRun.getMetadata().getAnnotations().get("kueue.konflux-ci.dev/requests-cpu"));
        assertEquals("6", pipelineRun.getMetadata().getAnnotations().get("kueue.konflux-ci.dev/requests-mem"));
    }

    @Test
    @DisplayName("Should reject a non-numeric existing resource value")
    void shouldRejectNonNumericExisting() {
        pipelineRun.getMetadata().annotations().put("res", "invalid");

        MutationException e = assertThrows(MutationException.class,
                () -> MutationApplier.apply(List.of(MutationRequest.resource("res", 1)), pipelineRun));

        assertEquals("failed to apply mutation (type: resource, key: res): "
                + "failed to parse existing resource value \"invalid\" as integer for key \"res\"", e.getMessage());
        assertEquals("invalid", pipelineRun.getMetadata().getAnnotations().get("res"));
    }

    @Test
    @DisplayName("Should reject a non-numeric resource request")
    void shouldRejectNonNumericRequest() {
        MutationRequest request = new MutationRequest(MutationKind.RESOURCE, "res", "ten");

        MutationException e = assertThrows(MutationException.class,
                () -> MutationApplier.apply(List.of(request), pipelineRun));

        assertTrue(e.getMessage().endsWith("failed to parse resource value \"ten\" as integer"));
    }

    @Test
    @DisplayName("Should reject resource sums that overflow")
    void shouldRejectOverflow() {
        pipelineRun.getMetadata().annotations().put("res", Long.toString(Long.MAX_VALUE));

        MutationException e = assertThrows(MutationException.class,
                () -> MutationApplier.apply(List.of(MutationRequest.resource("res", 1)), pipelineRun));

        assertTrue(e.getMessage().endsWith("resource value overflow for key \"res\""));
    }

    @Test
    @DisplayName("Should stop at the first failure keeping earlier mutations")
    void shouldStopAtFirstFailure() {
        pipelineRun.getMetadata().annotations().put("res", "invalid");

        assertThrows(MutationException.class, () -> MutationApplier.apply(List.of(
                MutationRequest.label("before", "yes"),
                MutationRequest.resource("res", 1),
                MutationRequest.label("after", "yes")), pipelineRun));

        assertEquals("yes", pipelineRun.getMetadata().getLabels().get("before"));
        assertFalse(pipelineRun.getMetadata().getLabels().containsKey("after"));
    }

    @Test
    @DisplayName("Should leave spec and other metadata untouched")
    void shouldTouchOnlyLabelsAndAnnotations() {
        MutationApplier.apply(List.of(MutationRequest.label("x", "y")), pipelineRun);

        assertEquals("build-1", pipelineRun.getMetadata().getName());
        assertEquals("default", pipelineRun.getMetadata().getNamespace());
        assertNull(pipelineRun.getSpec().getStatus());
    }
}
