package com.rowguard.fallback;

import com.rowguard.backend.DefaultBackendSettings;
import com.rowguard.backend.NativeValidator;
import com.rowguard.config.RowguardConfig;
import com.rowguard.config.RowguardDefaults;
import com.rowguard.expression.Alias;
import com.rowguard.expression.Literal;
import com.rowguard.plan.FileFormat;
import com.rowguard.plan.FilterExec;
import com.rowguard.plan.JoinExec;
import com.rowguard.plan.NodeKind;
import com.rowguard.plan.PhysicalPlan;
import com.rowguard.plan.ProjectExec;
import com.rowguard.plan.RDDScanExec;
import com.rowguard.plan.ScanExec;
import com.rowguard.test.PlanFixtures;
import com.rowguard.test.TestBase;
import com.rowguard.test.TestCategories;
import com.rowguard.transform.TransformRegistry;
import com.rowguard.types.SchemaParser;
import com.rowguard.validation.ValidationOutcome;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("FallbackPipeline Tests")
public class FallbackPipelineTest extends TestBase {

    private static ProjectExec projectOverTextScan() {
        ScanExec scan = ScanExec.fileSource("logs", FileFormat.TEXT, SchemaParser.parse(PlanFixtures.SALES_SCHEMA));
        return PlanFixtures.projectOf(new FilterExec(PlanFixtures.amountAbove100(scan), scan), "id");
    }

    private static List<String> describeAll(FallbackResult result) {
        return result.plan().collectNodes().stream()
            .map(node -> result.tags().getTagOption(node).map(FallbackTag::describe).orElse("-"))
            .toList();
    }

    @Nested
    @DisplayName("Tagging")
    class Tagging {

        @Test
        @DisplayName("Fully supported plan has no fallback")
        void testFullySupported() {
            FilterExec filter = PlanFixtures.filterOverScan();

            FallbackResult result = FallbackPipeline.builder().build().apply(filter);

            assertThat(result.plan()).isSameAs(filter);
            assertThat(result.plan().collectNodes()).allMatch(result::isOffloadable);
            assertThat(result.report().fallbackCount()).isZero();
        }

        @Test
        @DisplayName("Only the unsupported node falls back")
        void testPartialFallback() {
            ProjectExec project = projectOverTextScan();

            FallbackResult result = FallbackPipeline.builder().build().apply(project);

            assertThat(describeAll(result)).containsExactly(
                "-", "-", "Unsupported file format TEXT or schema for logs");
        }

        @Test
        @DisplayName("ANSI mode tags every node exactly once")
        void testAnsiMode() {
            RowguardConfig conf = RowguardConfig.defaults().with(RowguardDefaults.ANSI_ENABLED, "true");

            FallbackResult result = FallbackPipeline.builder().conf(conf).build().apply(projectOverTextScan());

            assertThat(describeAll(result)).containsOnly(FallbackOnAnsiMode.REASON);
        }

        @Test
        @DisplayName("Fused chain reason is not repeated by validation")
        void testMultiCodegensThroughPipeline() {
            RowguardConfig conf = RowguardConfig.defaults()
                .with(RowguardDefaults.JOIN_OPTIMIZE_ENABLED, "true")
                .with(RowguardDefaults.JOIN_OPTIMIZATION_LEVEL, "3");

            FallbackResult result = FallbackPipeline.builder().conf(conf).build()
                .apply(PlanFixtures.projectOf(PlanFixtures.filterOverScan(), "id"));

            assertThat(describeAll(result)).containsOnly(FallbackMultiCodegens.REASON);
        }

        @Test
        @DisplayName("Custom chain-join predicate is used by the pipeline")
        void testCustomChainJoin() {
            RowguardConfig conf = RowguardConfig.defaults()
                .with(RowguardDefaults.JOIN_OPTIMIZE_ENABLED, "true")
                .with(RowguardDefaults.JOIN_OPTIMIZATION_LEVEL, "3");
            ScanExec left = PlanFixtures.salesScan();
            ScanExec right = PlanFixtures.salesScan();
            PhysicalPlan plan = PlanFixtures.projectOf(JoinExec.shuffledHashJoin(
                List.of(PlanFixtures.column(left, "id")), List.of(PlanFixtures.column(right, "id")),
                JoinExec.JoinType.INNER, JoinExec.BuildSide.LEFT, left, right), "amount");

            FallbackResult byDefault = FallbackPipeline.builder().conf(conf).build().apply(plan);
            FallbackResult noJoinChains = FallbackPipeline.builder().conf(conf).chainJoin(node -> false).build()
                .apply(plan);

            assertThat(describeAll(byDefault)).containsOnly(FallbackMultiCodegens.REASON);
            assertThat(noJoinChains.tags().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Native validator rejection reaches the result")
        void testNativeValidator() {
            NativeValidator noProjects = candidate -> candidate.original().kind() == NodeKind.PROJECT
                ? ValidationOutcome.failed("projection rejected natively")
                : ValidationOutcome.passed();

            FallbackResult result = FallbackPipeline.builder().nativeValidator(noProjects).build()
                .apply(PlanFixtures.projectOf(PlanFixtures.filterOverScan(), "id"));

            assertThat(describeAll(result)).containsExactly("projection rejected natively", "-", "-");
        }

        @Test
        @DisplayName("One-row relation rewrite is visible in the result plan")
        void testOneRowRelation() {
            ProjectExec project = new ProjectExec(List.of(new Alias(Literal.of(1), "one")),
                RDDScanExec.oneRowRelation());

            FallbackResult result = FallbackPipeline.builder().build().apply(project);

            assertThat(result.plan()).isNotSameAs(project);
            assertThat(result.plan().children().get(0).output())
                .extracting(a -> a.name())
                .containsExactly(PlanOneRowRelation.FAKE_COLUMN);
        }

        @Test
        @DisplayName("Origins are recorded when configured")
        void testRecordOrigin() {
            RowguardConfig conf = RowguardConfig.defaults().with(RowguardDefaults.RECORD_TAG_ORIGIN, "true");

            FallbackResult result = FallbackPipeline.builder().conf(conf).build().apply(projectOverTextScan());

            PhysicalPlan scan = result.plan().collectNodes().get(2);
            assertThat(result.tags().origin(scan)).isPresent();
        }
    }

    @Nested
    @DisplayName("Idempotence")
    class Idempotence {

        @Test
        @DisplayName("Running twice on the same plan gives the same tags")
        void testApplyTwice() {
            FallbackPipeline pipeline = FallbackPipeline.builder().build();
            ProjectExec project = projectOverTextScan();

            FallbackResult first = pipeline.apply(project);
            FallbackResult second = pipeline.apply(project);

            assertThat(describeAll(second)).isEqualTo(describeAll(first));
            assertThat(second.tags()).isNotSameAs(first.tags());
        }

        @Test
        @DisplayName("Revalidation clears and recomputes without duplicating reasons")
        void testRevalidate() {
            FallbackPipeline pipeline = FallbackPipeline.builder().build();
            FallbackResult first = pipeline.apply(projectOverTextScan());
            List<String> before = describeAll(first);

            FallbackResult again = pipeline.revalidate(first);

            assertThat(describeAll(again)).isEqualTo(before);
            assertThat(again.tags()).isSameAs(first.tags());
        }

        @Test
        @DisplayName("Revalidation under a new backend drops stale tags")
        void testRevalidateDropsStaleTags() {
            FallbackResult first = FallbackPipeline.builder().build().apply(projectOverTextScan());
            FallbackPipeline lenient = FallbackPipeline.builder()
                .backend(DefaultBackendSettings.builder()
                    .readFormats(FileFormat.PARQUET, FileFormat.TEXT)
                    .build())
                .build();

            FallbackResult again = lenient.revalidate(first);

            assertThat(again.tags().isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Rule failure clears the store and propagates")
        void testFailureClearsStore() {
            FallbackResult first = FallbackPipeline.builder().build().apply(projectOverTextScan());
            assertThat(first.tags().isEmpty()).isFalse();
            FallbackPipeline broken = FallbackPipeline.builder()
                .registry(TransformRegistry.defaults().with(NodeKind.FILTER, (plan, context) -> {
                    throw new IllegalStateException("transformer bug");
                }))
                .build();

            assertThatThrownBy(() -> broken.revalidate(first))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("transformer bug");
            assertThat(first.tags().isEmpty()).isTrue();
        }
    }
}
