package villagecompute.pipelinecontrol.jobs;

/**
 * Kinds of pipeline step a run can execute. Each type is handled by exactly one {@link PipelineStepExecutor} bean.
 *
 * <p>
 * Only {@link #WAREHOUSE_SQL} ships with the control plane. The provider ETL, data quality and notification modules
 * register executors for the remaining types.
 *
 * @see villagecompute.pipelinecontrol.services.PipelineStepExecutorRegistry
 */
public enum PipelineStepType {

    /**
     * Runs a parameterized SQL statement against the warehouse datasource.
     */
    WAREHOUSE_SQL("Warehouse SQL statement"),

    /**
     * Pulls raw provider usage for a billing day.
     */
    USAGE_INGESTION("Provider usage ingestion"),

    /**
     * Converts ingested usage into cost rows.
     */
    COST_CALCULATION("Usage to cost calculation"),

    /**
     * Evaluates data-quality rules over a pipeline's output tables.
     */
    DATA_QUALITY("Data quality checks"),

    /**
     * Sends alerts and digests for a finished pipeline.
     */
    NOTIFICATION("Notification delivery");

    private final String description;

    PipelineStepType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
