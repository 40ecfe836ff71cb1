package villagecompute.pipelinecontrol.jobs;

/**
 * Contract for pipeline step implementations.
 *
 * <p>
 * Executors are {@code @ApplicationScoped} CDI beans. {@code PipelineStepExecutorRegistry} discovers them at startup
 * and the worker routes each claimed run to the executor for its definition's {@link PipelineStepType}.
 *
 * <p>
 * <b>Error Handling:</b> Thrown exceptions fail the run. The exception type decides retry eligibility:
 * {@link villagecompute.pipelinecontrol.exceptions.ValidationException} and
 * {@link villagecompute.pipelinecontrol.exceptions.PipelineConfigurationException} are terminal,
 * {@link villagecompute.pipelinecontrol.exceptions.ResourceExhaustedException} sends the run back to the queue, and
 * anything else is retried per the run's policy.
 */
public interface PipelineStepExecutor {

    /**
     * @return the step type this executor handles
     */
    PipelineStepType handlesType();

    /**
     * Executes one attempt of a run. May be called concurrently for different tenants.
     *
     * @param context
     *            identifiers, tier and parameters for this attempt
     * @return what the step processed
     * @throws Exception
     *             any failure; classified by the worker
     */
    StepResult execute(StepContext context) throws Exception;
}
