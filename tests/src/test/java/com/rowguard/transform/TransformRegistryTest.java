package com.rowguard.transform;

import com.rowguard.backend.BackendSettings;
import com.rowguard.backend.DefaultBackendSettings;
import com.rowguard.backend.NativeValidator;
import com.rowguard.config.RowguardConfig;
import com.rowguard.config.RowguardDefaults;
import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.FunctionCall;
import com.rowguard.plan.EvalPythonExec;
import com.rowguard.plan.NodeKind;
import com.rowguard.plan.PhysicalPlan;
import com.rowguard.plan.ScanExec;
import com.rowguard.test.PlanFixtures;
import com.rowguard.test.TestBase;
import com.rowguard.test.TestCategories;
import com.rowguard.types.PrimitiveType;
import com.rowguard.validation.ValidationOutcome;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("TransformRegistry Tests")
public class TransformRegistryTest extends TestBase {

    private static TransformContext context(BackendSettings backend, RowguardConfig conf) {
        return new TransformContext(backend, conf, NativeValidator.ACCEPT_ALL);
    }

    private static boolean eligible(PhysicalPlan plan, TransformContext context) {
        return TransformRegistry.defaults().lookup(plan.kind())
            .map(registration -> registration.eligible().test(plan, context))
            .orElse(false);
    }

    @ParameterizedTest(name = "{0} has no transformer")
    @EnumSource(value = NodeKind.class, names = {"RDD_SCAN", "RANGE", "AQE_SHUFFLE_READ", "QUERY_STAGE", "NATIVE_STAGE"})
    @DisplayName("Leaf sources and stage wrappers are not registered")
    void testUnregistered(NodeKind kind) {
        assertThat(TransformRegistry.defaults().isRegistered(kind)).isFalse();
    }

    @ParameterizedTest(name = "{0} has a transformer")
    @EnumSource(value = NodeKind.class, mode = EnumSource.Mode.EXCLUDE,
        names = {"RDD_SCAN", "RANGE", "AQE_SHUFFLE_READ", "QUERY_STAGE", "NATIVE_STAGE"})
    @DisplayName("Every other kind is registered")
    void testRegistered(NodeKind kind) {
        assertThat(TransformRegistry.defaults().lookup(kind)).isPresent();
    }

    @Test
    @DisplayName("Empty registry knows nothing")
    void testEmpty() {
        assertThat(TransformRegistry.empty().isRegistered(NodeKind.FILTER)).isFalse();
    }

    @Test
    @DisplayName("with and without return modified copies")
    void testCopies() {
        TransformRegistry defaults = TransformRegistry.defaults();
        TransformRegistry withoutFilter = defaults.without(NodeKind.FILTER);
        TransformRegistry withRange = defaults.with(NodeKind.RANGE,
            (plan, context) -> new TransformCandidate(plan, context) {
                @Override
                protected ValidationOutcome validateLocally() {
                    return ValidationOutcome.failed("ranges stay on the row engine");
                }
            });

        assertThat(withoutFilter.isRegistered(NodeKind.FILTER)).isFalse();
        assertThat(defaults.isRegistered(NodeKind.FILTER)).isTrue();
        assertThat(withRange.isRegistered(NodeKind.RANGE)).isTrue();
        assertThat(defaults.isRegistered(NodeKind.RANGE)).isFalse();
    }

    @Test
    @DisplayName("Scans with partition or runtime filters are not eligible")
    void testScanEligibility() {
        TransformContext context = context(DefaultBackendSettings.defaults(), RowguardConfig.defaults());
        ScanExec file = PlanFixtures.salesScan();
        ScanExec batch = PlanFixtures.salesBatchScan();

        assertThat(eligible(file, context)).isTrue();
        assertThat(eligible(file.withPartitionFilters(List.of(PlanFixtures.amountAbove100(file))), context)).isFalse();
        assertThat(eligible(batch, context)).isTrue();
        assertThat(eligible(batch.withRuntimeFilters(List.of(PlanFixtures.amountAbove100(batch))), context)).isFalse();
    }

    @Test
    @DisplayName("Arrow UDFs use the generic path only when the columnar arrow path is off")
    void testArrowEligibility() {
        ScanExec scan = PlanFixtures.salesScan();
        EvalPythonExec arrow = new EvalPythonExec(NodeKind.ARROW_EVAL_PYTHON,
            List.of(FunctionCall.of("my_udf", PrimitiveType.DOUBLE, PlanFixtures.column(scan, "amount"))),
            List.of(new AttributeReference("r", PrimitiveType.DOUBLE)),
            EvalPythonExec.EvalType.SQL_SCALAR_PANDAS_UDF, scan);
        BackendSettings arrowBackend = DefaultBackendSettings.builder().supportColumnarArrowUdf(true).build();
        RowguardConfig arrowOff = RowguardConfig.defaults().with(RowguardDefaults.ARROW_UDF, "false");

        assertThat(eligible(arrow, context(DefaultBackendSettings.defaults(), RowguardConfig.defaults()))).isTrue();
        assertThat(eligible(arrow, context(arrowBackend, RowguardConfig.defaults()))).isFalse();
        assertThat(eligible(arrow, context(arrowBackend, arrowOff))).isTrue();
    }
}
