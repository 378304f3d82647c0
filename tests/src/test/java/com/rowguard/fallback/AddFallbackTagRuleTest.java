package com.rowguard.fallback;

import com.rowguard.backend.BackendSettings;
import com.rowguard.backend.DefaultBackendSettings;
import com.rowguard.backend.NativeValidator;
import com.rowguard.config.OperatorSwitch;
import com.rowguard.config.RowguardConfig;
import com.rowguard.exception.NotSupportedException;
import com.rowguard.plan.FileFormat;
import com.rowguard.plan.FilterExec;
import com.rowguard.plan.NodeKind;
import com.rowguard.plan.PhysicalPlan;
import com.rowguard.plan.ProjectExec;
import com.rowguard.plan.RangeExec;
import com.rowguard.plan.ScanExec;
import com.rowguard.test.PlanFixtures;
import com.rowguard.test.TestBase;
import com.rowguard.test.TestCategories;
import com.rowguard.transform.TransformContext;
import com.rowguard.transform.TransformRegistry;
import com.rowguard.types.SchemaParser;
import com.rowguard.validation.FallbackInjects;
import com.rowguard.validation.ValidationOutcome;
import com.rowguard.validation.Validators;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("AddFallbackTagRule Tests")
public class AddFallbackTagRuleTest extends TestBase {

    private FallbackTagStore store;

    @Override
    protected void doSetUp() {
        store = new FallbackTagStore();
    }

    private AddFallbackTagRule rule(BackendSettings backend, RowguardConfig conf, TransformRegistry registry,
                                    NativeValidator nativeValidator, FallbackInjects injects) {
        return new AddFallbackTagRule(store, new TransformContext(backend, conf, nativeValidator), registry, injects);
    }

    private AddFallbackTagRule defaultRule() {
        return rule(DefaultBackendSettings.defaults(), RowguardConfig.defaults(), TransformRegistry.defaults(),
            NativeValidator.ACCEPT_ALL, FallbackInjects.none());
    }

    private static ScanExec textScan() {
        return ScanExec.fileSource("logs", FileFormat.TEXT, SchemaParser.parse(PlanFixtures.SALES_SCHEMA));
    }

    @Nested
    @DisplayName("Offloadable Plans")
    class OffloadablePlans {

        @Test
        @DisplayName("Supported filter over parquet scan stays untagged")
        void testFilterOverScan() {
            FilterExec filter = PlanFixtures.filterOverScan();

            PhysicalPlan result = defaultRule().apply(filter);

            assertThat(result).isSameAs(filter);
            assertThat(store.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Unregistered kinds are assumed offloadable")
        void testUnregisteredKind() {
            RangeExec range = new RangeExec(0, 10, 1);

            defaultRule().apply(range);

            assertThat(store.nonEmpty(range)).isFalse();
        }

        @Test
        @DisplayName("Empty registry tags nothing")
        void testEmptyRegistry() {
            ScanExec scan = textScan();
            PhysicalPlan plan = new FilterExec(PlanFixtures.amountAbove100(scan), scan);

            rule(DefaultBackendSettings.defaults(), RowguardConfig.defaults(), TransformRegistry.empty(),
                NativeValidator.ACCEPT_ALL, FallbackInjects.none()).apply(plan);

            assertThat(store.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Scan with partition filters is not validated")
        void testPartitionFilterSideCondition() {
            ScanExec scan = textScan();
            ScanExec pruned = scan.withPartitionFilters(List.of(PlanFixtures.amountAbove100(scan)));

            defaultRule().apply(pruned);

            assertThat(store.nonEmpty(pruned)).isFalse();
        }
    }

    @Nested
    @DisplayName("Rejected Plans")
    class RejectedPlans {

        @Test
        @DisplayName("Unsupported read format tags only the scan")
        void testUnsupportedFormat() {
            ScanExec scan = textScan();
            ProjectExec project = PlanFixtures.projectOf(scan, "id");

            defaultRule().apply(project);

            assertThat(store.getTag(scan).describe()).isEqualTo("Unsupported file format TEXT or schema for logs");
            assertThat(store.nonEmpty(project)).isFalse();
        }

        @Test
        @DisplayName("Unsupported function is reported with the node shape")
        void testUnsupportedFunction() {
            FilterExec filter = PlanFixtures.filterOverScan();
            BackendSettings backend = DefaultBackendSettings.builder().unsupportedFunction(">").build();

            rule(backend, RowguardConfig.defaults(), TransformRegistry.defaults(),
                NativeValidator.ACCEPT_ALL, FallbackInjects.none()).apply(filter);

            assertThat(store.getTag(filter).describe())
                .isEqualTo("Function > is not supported by the backend, original plan is Filter(FileSourceScan)");
            assertThat(store.nonEmpty(filter.child())).isFalse();
        }

        @Test
        @DisplayName("UnsupportedOperationException from a transformer is recorded")
        void testUnsupportedOperation() {
            FilterExec filter = PlanFixtures.filterOverScan();
            TransformRegistry registry = TransformRegistry.defaults().with(NodeKind.FILTER, (plan, context) -> {
                throw new UnsupportedOperationException("no filters today");
            });

            rule(DefaultBackendSettings.defaults(), RowguardConfig.defaults(), registry,
                NativeValidator.ACCEPT_ALL, FallbackInjects.none()).apply(filter);

            assertThat(store.getTag(filter).describe())
                .isEqualTo("no filters today, original plan is Filter(FileSourceScan)");
        }

        @Test
        @DisplayName("Other runtime exceptions propagate")
        void testOtherExceptionsPropagate() {
            FilterExec filter = PlanFixtures.filterOverScan();
            TransformRegistry registry = TransformRegistry.defaults().with(NodeKind.FILTER, (plan, context) -> {
                throw new IllegalStateException("broken transformer");
            });

            assertThatThrownBy(() -> rule(DefaultBackendSettings.defaults(), RowguardConfig.defaults(), registry,
                NativeValidator.ACCEPT_ALL, FallbackInjects.none()).apply(filter))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("broken transformer");
        }

        @Test
        @DisplayName("Native validator rejection is recorded verbatim")
        void testNativeValidator() {
            FilterExec filter = PlanFixtures.filterOverScan();
            NativeValidator rejectFilters = candidate -> candidate.original().kind() == NodeKind.FILTER
                ? ValidationOutcome.failed("native engine rejected filter")
                : ValidationOutcome.passed();

            rule(DefaultBackendSettings.defaults(), RowguardConfig.defaults(), TransformRegistry.defaults(),
                rejectFilters, FallbackInjects.none()).apply(filter);

            assertThat(store.getTag(filter).describe()).isEqualTo("native engine rejected filter");
            assertThat(store.nonEmpty(filter.child())).isFalse();
        }

        @Test
        @DisplayName("Disabled operator switch tags the operator")
        void testUserOption() {
            FilterExec filter = PlanFixtures.filterOverScan();
            RowguardConfig conf = RowguardConfig.defaults().with(OperatorSwitch.FILTER.key(), "false");

            rule(DefaultBackendSettings.defaults(), conf, TransformRegistry.defaults(),
                NativeValidator.ACCEPT_ALL, FallbackInjects.none()).apply(filter);

            assertThat(store.getTag(filter).describe())
                .isEqualTo("[FallbackByUserOptions] Validation failed on node Filter");
        }

        @Test
        @DisplayName("Injected predicate forces fallback")
        void testInjects() {
            FilterExec filter = PlanFixtures.filterOverScan();

            rule(DefaultBackendSettings.defaults(), RowguardConfig.defaults(), TransformRegistry.defaults(),
                NativeValidator.ACCEPT_ALL, FallbackInjects.of(plan -> plan.kind() == NodeKind.FILE_SOURCE_SCAN))
                .apply(filter);

            assertThat(store.nonEmpty(filter.child())).isTrue();
            assertThat(store.nonEmpty(filter)).isFalse();
        }

        @Test
        @DisplayName("Existing tag is not duplicated by the hint validator")
        void testHintNotDuplicated() {
            FilterExec filter = PlanFixtures.filterOverScan();
            store.add(filter, "tagged earlier");

            defaultRule().apply(filter);

            assertThat(store.getTag(filter)).isEqualTo(Unsupported.appendable("tagged earlier"));
        }

        @Test
        @DisplayName("NotSupportedException carries the node name")
        void testNotSupportedExceptionMessage() {
            NotSupportedException e = new NotSupportedException("Type void is not supported", "amount");

            assertThat(e.getMessage()).isEqualTo("Type void is not supported (node: amount)");
            assertThat(e.getNodeName()).isEqualTo("amount");
        }
    }

    @Nested
    @DisplayName("Dispatch After Validation")
    class DispatchAfterValidation {

        private final AtomicInteger dispatched = new AtomicInteger();

        private TransformRegistry countingFilterRegistry() {
            TransformRegistry defaults = TransformRegistry.defaults();
            return defaults.with(NodeKind.FILTER, (plan, context) -> {
                dispatched.incrementAndGet();
                return defaults.lookup(NodeKind.FILTER).orElseThrow().factory().apply(plan, context);
            });
        }

        @Test
        @DisplayName("Filter passing every validator is dispatched once")
        void testDispatchedWhenValidatorsPass() {
            FilterExec filter = PlanFixtures.filterOverScan();

            rule(DefaultBackendSettings.defaults(), RowguardConfig.defaults(), countingFilterRegistry(),
                NativeValidator.ACCEPT_ALL, FallbackInjects.none()).apply(filter);

            assertThat(dispatched.get()).isEqualTo(1);
            assertThat(store.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Disabled operator switch stops the filter before dispatch")
        void testNoDispatchWhenUserOptionFails() {
            logStep("Given a filter whose operator switch is off");
            FilterExec filter = PlanFixtures.filterOverScan();
            RowguardConfig conf = RowguardConfig.defaults().with(OperatorSwitch.FILTER.key(), "false");

            logStep("When the tagging rule runs");
            rule(DefaultBackendSettings.defaults(), conf, countingFilterRegistry(),
                NativeValidator.ACCEPT_ALL, FallbackInjects.none()).apply(filter);

            logStep("Then the filter is tagged and its transformer never built");
            assertThat(store.nonEmpty(filter)).isTrue();
            assertThat(dispatched.get()).isZero();
        }

        @Test
        @DisplayName("Injected rejection stops the filter before dispatch")
        void testNoDispatchWhenInjected() {
            FilterExec filter = PlanFixtures.filterOverScan();

            rule(DefaultBackendSettings.defaults(), RowguardConfig.defaults(), countingFilterRegistry(),
                NativeValidator.ACCEPT_ALL, FallbackInjects.of(plan -> plan.kind() == NodeKind.FILTER))
                .apply(filter);

            assertThat(store.nonEmpty(filter)).isTrue();
            assertThat(dispatched.get()).isZero();
        }

        @Test
        @DisplayName("Already tagged filter is not dispatched again")
        void testNoDispatchWhenAlreadyTagged() {
            FilterExec filter = PlanFixtures.filterOverScan();
            store.add(filter, "tagged earlier");

            rule(DefaultBackendSettings.defaults(), RowguardConfig.defaults(), countingFilterRegistry(),
                NativeValidator.ACCEPT_ALL, FallbackInjects.none()).apply(filter);

            assertThat(dispatched.get()).isZero();
        }
    }

    @Nested
    @DisplayName("Traversal")
    class Traversal {

        @Test
        @DisplayName("Children are validated before their parents")
        void testBottomUp() {
            List<String> visited = new ArrayList<>();
            ProjectExec project = PlanFixtures.projectOf(PlanFixtures.filterOverScan(), "id");
            AddFallbackTagRule recording = new AddFallbackTagRule(store,
                new TransformContext(DefaultBackendSettings.defaults(), RowguardConfig.defaults(),
                    NativeValidator.ACCEPT_ALL),
                TransformRegistry.empty(),
                Validators.builder().add(plan -> {
                    visited.add(plan.nodeName());
                    return ValidationOutcome.passed();
                }).build());

            recording.apply(project);

            assertThat(visited).containsExactly("FileSourceScan", "Filter", "Project");
        }
    }
}
