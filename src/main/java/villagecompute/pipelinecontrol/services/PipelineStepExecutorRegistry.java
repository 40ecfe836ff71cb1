package villagecompute.pipelinecontrol.services;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.exceptions.PipelineConfigurationException;
import villagecompute.pipelinecontrol.jobs.PipelineStepExecutor;
import villagecompute.pipelinecontrol.jobs.PipelineStepType;

/**
 * Maps each {@link PipelineStepType} to its CDI-discovered {@link PipelineStepExecutor}.
 *
 * <p>
 * Two executors claiming the same type fail startup. A type with no executor is only an error when a run needs it.
 */
@ApplicationScoped
public class PipelineStepExecutorRegistry {

    private static final Logger LOG = Logger.getLogger(PipelineStepExecutorRegistry.class);

    private Map<PipelineStepType, PipelineStepExecutor> executors;

    @Inject
    public PipelineStepExecutorRegistry(Instance<PipelineStepExecutor> executors) {
        this.executors = buildRegistry(executors);
        LOG.infof("Registered executors for step types %s", this.executors.keySet());
    }

    private static Map<PipelineStepType, PipelineStepExecutor> buildRegistry(Instance<PipelineStepExecutor> found) {
        Map<PipelineStepType, PipelineStepExecutor> registry = new EnumMap<>(PipelineStepType.class);
        for (PipelineStepExecutor executor : found) {
            PipelineStepType type = executor.handlesType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate executors registered for PipelineStepType." + type + ": "
                        + registry.get(type).getClass().getName() + " and " + executor.getClass().getName());
            }
            registry.put(type, executor);
        }
        return registry;
    }

    /**
     * @throws PipelineConfigurationException
     *             if no executor handles {@code type}
     */
    public PipelineStepExecutor executorFor(PipelineStepType type) {
        PipelineStepExecutor executor = executors.get(type);
        if (executor == null) {
            throw new PipelineConfigurationException("No executor registered for step type " + type);
        }
        return executor;
    }

    public Set<PipelineStepType> registeredTypes() {
        return Collections.unmodifiableSet(executors.keySet());
    }
}
