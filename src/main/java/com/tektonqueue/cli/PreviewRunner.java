package com.tektonqueue.cli;

import com.tektonqueue.exception.TektonQueueException;
import com.tektonqueue.model.PipelineRun;
import com.tektonqueue.model.PipelineRunMapper;
import com.tektonqueue.webhook.PipelineRunDefaulter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Runs the defaulter over one PipelineRun document at startup and prints the result,
 * so a policy can be tried out without an admission round trip.
 */
public class PreviewRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(PreviewRunner.class);

    private final String path;
    private final PipelineRunDefaulter defaulter;
    private final PrintStream out;

    public PreviewRunner(String path, PipelineRunDefaulter defaulter) {
        this(path, defaulter, System.out);
    }

    PreviewRunner(String path, PipelineRunDefaulter defaulter, PrintStream out) {
        this.path = path;
        this.defaulter = defaulter;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        try {
            out.print(preview());
        } catch (TektonQueueException | IllegalArgumentException e) {
            log.error("Preview of {} failed: {}", path, e.getMessage());
            out.println("error: " + e.getMessage());
        }
    }

    /**
     * Default the document at the configured path.
     *
     * @return the mutated PipelineRun as YAML
     * @throws IllegalArgumentException if the document cannot be read or parsed
     * @throws TektonQueueException     if defaulting rejects the run
     */
    public String preview() {
        PipelineRun pipelineRun = PipelineRunMapper.fromYaml(readDocument());
        defaulter.apply(pipelineRun);
        return PipelineRunMapper.toYaml(pipelineRun);
    }

    private String readDocument() {
        Resource resource = path.startsWith("classpath:")
                ? new ClassPathResource(path.substring("classpath:".length()))
                : new FileSystemResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read PipelineRun from: " + path, e);
        }
    }
}
