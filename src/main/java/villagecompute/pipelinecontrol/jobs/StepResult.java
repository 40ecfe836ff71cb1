package villagecompute.pipelinecontrol.jobs;

/**
 * Outcome of a successful step.
 *
 * @param unitsProcessed
 *            rows or bytes processed, executor-defined
 * @param summary
 *            short human-readable summary for logs
 */
public record StepResult(long unitsProcessed, String summary) {

    public static StepResult of(long unitsProcessed, String summary) {
        return new StepResult(unitsProcessed, summary);
    }
}
