package com.tektonqueue.config;

import com.tektonqueue.exception.ConfigurationException;

/**
 * Root of the policy file.
 *
 * @param queueName          Kueue LocalQueue every admitted run is assigned to
 * @param multiKueueOverride mark runs as managed by MultiKueue
 * @param cel                mutation expressions
 */
public record TektonQueueConfig(
        String queueName,
        boolean multiKueueOverride,
        CelConfig cel
) {

    public TektonQueueConfig {
        if (cel == null) {
            cel = CelConfig.empty();
        }
    }

    /**
     * @throws ConfigurationException if the configuration cannot be served
     */
    public void validate() {
        if (queueName == null || queueName.isBlank()) {
            throw new ConfigurationException("queue name is not set");
        }
    }
}
