package villagecompute.pipelinecontrol.jobs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import villagecompute.pipelinecontrol.exceptions.ValidationException;
import villagecompute.pipelinecontrol.services.SubscriptionTier;

/**
 * Everything an executor needs for one attempt of a run.
 *
 * @param runId
 *            run being executed
 * @param tenantId
 *            owning tenant
 * @param configId
 *            pipeline definition id
 * @param pipelineId
 *            pipeline identifier, also the lock key suffix
 * @param pipelineLoggingId
 *            execution id of this attempt
 * @param attempt
 *            1-based attempt number
 * @param tier
 *            tenant tier resolved at claim time
 * @param parameters
 *            definition parameters merged with the queue item config
 */
public record StepContext(String runId, String tenantId, String configId, String pipelineId,
        String pipelineLoggingId, int attempt, SubscriptionTier tier, Map<String, Object> parameters) {

    public StepContext {
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public String stringParameter(String name) {
        Object value = parameters.get(name);
        return value == null ? null : value.toString();
    }

    public Long longParameter(String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Parameter " + name + " is not a number: " + value, e);
        }
    }
}
