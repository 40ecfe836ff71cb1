package villagecompute.pipelinecontrol.jobs;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Locale;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WarehouseSqlStepExecutorTest {

    private Locale previousDefault;

    @BeforeEach
    void setUp() {
        previousDefault = Locale.getDefault();
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(previousDefault);
    }

    @Test
    void testReturnsRows_QueriesAndUpdates() {
        assertTrue(WarehouseSqlStepExecutor.returnsRows("  select tenant_id from tenants"));
        assertTrue(WarehouseSqlStepExecutor.returnsRows("VALUES (1)"));
        assertFalse(WarehouseSqlStepExecutor.returnsRows("UPDATE usage_quota SET cost_units = 0"));
        assertFalse(WarehouseSqlStepExecutor.returnsRows("delete from staging"));
    }

    @Test
    void testReturnsRows_TurkishDefaultLocale_StillRecognizesWith() {
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));

        assertTrue(WarehouseSqlStepExecutor.returnsRows("with recent as (select 1) select * from recent"));
        assertTrue(WarehouseSqlStepExecutor.returnsRows("select 1"));
    }
}
