package com.tektonqueue;

import com.tektonqueue.spring.EnableTektonQueue;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point. Loads the policy file and, when
 * {@code tekton-queue.preview.pipeline-run} is set, previews one PipelineRun.
 */
@SpringBootApplication
@EnableTektonQueue
public class TektonQueueApplication {

    public static void main(String[] args) {
        SpringApplication.run(TektonQueueApplication.class, args);
    }
}
