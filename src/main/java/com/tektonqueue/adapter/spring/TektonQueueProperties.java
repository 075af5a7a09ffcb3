package com.tektonqueue.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for tekton-queue.
 */
@ConfigurationProperties(prefix = "tekton-queue")
public class TektonQueueProperties {

    /**
     * Whether tekton-queue is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the policy file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:tekton-queue.yaml";

    private final Preview preview = new Preview();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public Preview getPreview() {
        return preview;
    }

    public static class Preview {

        /**
         * PipelineRun document to default and print on startup.
         */
        private String pipelineRun;

        public String getPipelineRun() {
            return pipelineRun;
        }

        public void setPipelineRun(String pipelineRun) {
            this.pipelineRun = pipelineRun;
        }
    }
}
