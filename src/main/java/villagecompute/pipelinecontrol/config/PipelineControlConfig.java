package villagecompute.pipelinecontrol.config;

import java.time.Duration;
import java.util.Locale;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Dependent;
import jakarta.enterprise.inject.Produces;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.exceptions.PipelineConfigurationException;
import villagecompute.pipelinecontrol.services.AdmissionGate;
import villagecompute.pipelinecontrol.services.InProcessAdmissionGate;
import villagecompute.pipelinecontrol.services.RetryPolicy;
import villagecompute.pipelinecontrol.services.StoreBackedAdmissionGate;

/**
 * Deployment-topology choices for the control plane.
 *
 * <p>
 * <b>Admission gate</b> ({@code pipelinecontrol.admission.gate}):
 * <ul>
 * <li>{@code in-process} - per-JVM counters; a tenant may run up to the ceiling on every worker process</li>
 * <li>{@code store} - one counter row per tenant shared by all workers</li>
 * </ul>
 *
 * <p>
 * <b>Retry policy</b> ({@code pipelinecontrol.retry.*}): the default applied to runs whose definition does not
 * override {@code max_retries}.
 *
 * <p>
 * Invalid values fail startup rather than surfacing on the first claimed run.
 */
@ApplicationScoped
@Startup
public class PipelineControlConfig {

    private static final Logger LOG = Logger.getLogger(PipelineControlConfig.class);

    public static final String GATE_IN_PROCESS = "in-process";

    public static final String GATE_STORE = "store";

    @ConfigProperty(
            name = "pipelinecontrol.admission.gate",
            defaultValue = GATE_IN_PROCESS)
    String admissionGate;

    @ConfigProperty(
            name = "pipelinecontrol.retry.max-retries",
            defaultValue = "3")
    int maxRetries;

    @ConfigProperty(
            name = "pipelinecontrol.retry.backoff-multiplier",
            defaultValue = "2.0")
    double backoffMultiplier;

    @ConfigProperty(
            name = "pipelinecontrol.retry.base-delay-seconds",
            defaultValue = "60")
    long baseDelaySeconds;

    @ConfigProperty(
            name = "pipelinecontrol.retry.max-delay-seconds",
            defaultValue = "3600")
    long maxDelaySeconds;

    @PostConstruct
    public void validateConfiguration() {
        String gate = normalizedGate();
        if (!GATE_IN_PROCESS.equals(gate) && !GATE_STORE.equals(gate)) {
            String errorMessage = "pipelinecontrol.admission.gate must be '" + GATE_IN_PROCESS + "' or '" + GATE_STORE
                    + "', got '" + admissionGate + "'";
            LOG.fatal(errorMessage);
            throw new PipelineConfigurationException(errorMessage);
        }
        try {
            defaultRetryPolicy();
        } catch (IllegalArgumentException e) {
            LOG.fatal("Invalid pipelinecontrol.retry configuration: " + e.getMessage());
            throw new PipelineConfigurationException("Invalid pipelinecontrol.retry configuration", e);
        }
        LOG.infof("Pipeline control configured: admission gate=%s, retries=%d, backoff=%.1fx from %ds (cap %ds)",
                gate, maxRetries, backoffMultiplier, baseDelaySeconds, maxDelaySeconds);
    }

    @Produces
    @ApplicationScoped
    public AdmissionGate admissionGate() {
        if (GATE_STORE.equals(normalizedGate())) {
            LOG.info("Using store-backed admission gate (cluster-wide limits)");
            return new StoreBackedAdmissionGate();
        }
        LOG.info("Using in-process admission gate (per-process limits)");
        return new InProcessAdmissionGate();
    }

    @Produces
    @Dependent
    public RetryPolicy defaultRetryPolicy() {
        return new RetryPolicy(maxRetries, backoffMultiplier, Duration.ofSeconds(baseDelaySeconds),
                Duration.ofSeconds(maxDelaySeconds), RetryPolicy.DEFAULT_RETRYABLE);
    }

    private String normalizedGate() {
        return admissionGate == null ? "" : admissionGate.trim().toLowerCase(Locale.ROOT);
    }
}
