package com.tektonqueue.config;

import com.tektonqueue.cel.CelMutator;
import com.tektonqueue.cel.CelProgramCompiler;
import com.tektonqueue.cel.CompiledProgram;
import com.tektonqueue.cel.MutationMetrics;
import com.tektonqueue.exception.ConfigurationException;
import com.tektonqueue.exception.TektonQueueException;
import com.tektonqueue.mutation.PipelineRunMutator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds the active configuration and its compiled mutators.
 * <p>
 * Readers always observe a complete snapshot. A reload is parsed, validated and
 * compiled before it is published; if any step fails the previous snapshot stays active.
 */
public class ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(ConfigStore.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final MutationMetrics metrics;
    private ConfigSnapshot current;

    public ConfigStore() {
        this(new MutationMetrics(new SimpleMeterRegistry()));
    }

    public ConfigStore(MutationMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Replace the active configuration with the given policy document.
     *
     * @param document raw YAML policy
     * @return the newly published snapshot
     * @throws TektonQueueException if the document is rejected; the previous snapshot is kept
     */
    public ConfigSnapshot update(String document) {
        ConfigSnapshot next;
        try {
            next = build(document);
        } catch (TektonQueueException e) {
            log.warn("Rejected configuration update, keeping previous configuration: {}", e.getMessage());
            throw e;
        }

        lock.writeLock().lock();
        try {
            current = next;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Loaded configuration: queue {}, {} CEL expressions, multiKueueOverride={}",
                next.config().queueName(), next.config().cel().expressions().size(),
                next.config().multiKueueOverride());
        return next;
    }

    /**
     * @throws ConfigurationException if no configuration was loaded yet
     */
    public ConfigSnapshot snapshot() {
        lock.readLock().lock();
        try {
            if (current == null) {
                throw new ConfigurationException("configuration has not been loaded");
            }
            return current;
        } finally {
            lock.readLock().unlock();
        }
    }

    public TektonQueueConfig getConfig() {
        return snapshot().config();
    }

    public List<PipelineRunMutator> getMutators() {
        return snapshot().mutators();
    }

    private ConfigSnapshot build(String document) {
        TektonQueueConfig config = ConfigLoader.parse(document);
        config.validate();

        List<String> expressions = config.cel().expressions();
        if (expressions.isEmpty()) {
            return new ConfigSnapshot(config, List.of());
        }
        List<CompiledProgram> programs = CelProgramCompiler.compile(expressions);
        return new ConfigSnapshot(config, List.of(new CelMutator(programs, metrics)));
    }
}
