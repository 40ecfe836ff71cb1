package villagecompute.pipelinecontrol.jobs;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

import io.quarkus.narayana.jta.QuarkusTransaction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;

import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.exceptions.ValidationException;
import villagecompute.pipelinecontrol.services.AdmissionController;
import villagecompute.pipelinecontrol.services.OperationShape;

/**
 * Runs a pipeline's SQL statement against the datasource under admission control.
 *
 * <p>
 * <b>Parameters:</b>
 * <ul>
 * <li>{@code statement} (required): SQL text, positional {@code ?} placeholders allowed</li>
 * <li>{@code statement_parameters}: list bound to the placeholders in order</li>
 * <li>{@code timeout_seconds}: requested timeout, capped at the tier ceiling</li>
 * <li>{@code estimated_cost_units}: billed GB the statement is expected to scan; rejected above the tier cap</li>
 * <li>{@code estimated_bytes}: bytes the statement is expected to scan, for the usage ledger</li>
 * </ul>
 *
 * <p>
 * Reads report the number of rows returned, writes the number of rows affected.
 */
@ApplicationScoped
public class WarehouseSqlStepExecutor implements PipelineStepExecutor {

    private static final Logger LOG = Logger.getLogger(WarehouseSqlStepExecutor.class);

    static final String QUERY_TIMEOUT_HINT = "jakarta.persistence.query.timeout";

    @Inject
    EntityManager entityManager;

    @Inject
    AdmissionController admission;

    @Override
    public PipelineStepType handlesType() {
        return PipelineStepType.WAREHOUSE_SQL;
    }

    @Override
    public StepResult execute(StepContext context) throws Exception {
        String statement = context.stringParameter("statement");
        if (statement == null || statement.isBlank()) {
            throw new ValidationException("Invalid pipeline config: statement is required");
        }
        Long estimatedUnits = context.longParameter("estimated_cost_units");
        if (estimatedUnits != null && !admission.withinCostCeiling(context.tier(), estimatedUnits)) {
            throw new ValidationException("Invalid pipeline config: estimated " + estimatedUnits
                    + " units exceeds the cost cap of tier " + context.tier());
        }
        Long requestedTimeout = context.longParameter("timeout_seconds");
        OperationShape shape = OperationShape.classify(statement);
        int timeoutSeconds = admission.resolveTimeout(shape,
                requestedTimeout != null ? (int) Math.min(Integer.MAX_VALUE, requestedTimeout) : null,
                context.tier());
        List<?> bindings = context.parameters().get("statement_parameters") instanceof List<?> list ? list
                : List.of();

        LOG.debugf("Running %s statement for run %s with timeout %ds", shape, context.runId(), timeoutSeconds);
        long started = System.nanoTime();
        long rows = admission.runAdmitted(context.tenantId(), context.tier(),
                () -> QuarkusTransaction.requiringNew().timeout(timeoutSeconds)
                        .call(() -> runStatement(statement, bindings, timeoutSeconds)));
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        Long estimatedBytes = context.longParameter("estimated_bytes");
        BigDecimal cost = admission.estimateCost(estimatedBytes != null ? estimatedBytes : 0L);
        admission.recordUsage(context.tenantId(), context.pipelineLoggingId(), "warehouse_sql", rows, elapsed, cost);

        return StepResult.of(rows, shape + " statement processed " + rows + " rows in " + elapsed.toMillis() + "ms");
    }

    private long runStatement(String statement, List<?> bindings, int timeoutSeconds) {
        Query query = entityManager.createNativeQuery(statement);
        query.setHint(QUERY_TIMEOUT_HINT, timeoutSeconds * 1000);
        for (int i = 0; i < bindings.size(); i++) {
            query.setParameter(i + 1, bindings.get(i));
        }
        if (returnsRows(statement)) {
            return query.getResultList().size();
        }
        return query.executeUpdate();
    }

    static boolean returnsRows(String statement) {
        String head = statement.stripLeading().toUpperCase(Locale.ROOT);
        return head.startsWith("SELECT") || head.startsWith("WITH") || head.startsWith("VALUES");
    }
}
