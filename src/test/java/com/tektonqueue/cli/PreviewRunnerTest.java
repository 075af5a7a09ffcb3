package com.tektonqueue.cli;

import com.tektonqueue.config.ConfigLoader;
import com.tektonqueue.config.ConfigStore;
import com.tektonqueue.model.PipelineRun;
import com.tektonqueue.model.PipelineRunMapper;
import com.tektonqueue.webhook.PipelineRunDefaulter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class PreviewRunnerTest {

    private PipelineRunDefaulter defaulter;

    @BeforeEach
    void setUp() {
        ConfigStore store = new ConfigStore();
        store.update(ConfigLoader.read("classpath:tekton-queue-test.yaml"));
        defaulter = new PipelineRunDefaulter(store);
    }

    @Test
    @DisplayName("Should print the defaulted and mutated run")
    void shouldPreviewBuildRun() {
        String yaml = new PreviewRunner("classpath:pipelinerun-build.yaml", defaulter).preview();

        PipelineRun result = PipelineRunMapper.fromYaml(yaml);
        assertEquals("PipelineRunPending", result.getSpec().getStatus());
        assertEquals("kueue.x-k8s.io/multikueue", result.getSpec().getManagedBy());
        assertEquals("test-queue", result.getMetadata().getLabels().get("kueue.x-k8s.io/queue-name"));
        assertEquals("konflux-post-merge-build", result.getMetadata().getLabels().get("kueue.x-k8s.io/priority-class"));
        assertEquals("1", result.getMetadata().getAnnotations().get("kueue.konflux-ci.dev/requests-linux-x86_64"));
        assertEquals("1", result.getMetadata().getAnnotations().get("kueue.konflux-ci.dev/requests-linux-arm64"));
        assertTrue(result.getSpec().getAdditionalProperties().containsKey("workspaces"));
    }

    @Test
    @DisplayName("Should print errors instead of failing startup")
    void shouldPrintErrors() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        new PreviewRunner("/no/such/pipelinerun.yaml", defaulter, out).run();

        assertEquals("error: Failed to read PipelineRun from: /no/such/pipelinerun.yaml",
                buffer.toString(StandardCharsets.UTF_8).trim());
    }

    @Test
    @DisplayName("Should write the preview to the given stream")
    void shouldWriteToStream() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        new PreviewRunner("classpath:pipelinerun-embedded.yaml", defaulter, out).run();

        PipelineRun result = PipelineRunMapper.fromYaml(buffer.toString(StandardCharsets.UTF_8));
        assertEquals("konflux-dependency-update",
                result.getMetadata().getLabels().get("kueue.x-k8s.io/priority-class"));
    }
}
