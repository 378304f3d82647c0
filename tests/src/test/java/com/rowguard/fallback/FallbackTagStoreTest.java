package com.rowguard.fallback;

import com.rowguard.plan.FilterExec;
import com.rowguard.plan.NativeStageExec;
import com.rowguard.plan.PhysicalPlan;
import com.rowguard.plan.ProjectExec;
import com.rowguard.plan.ScanExec;
import com.rowguard.plan.UnionExec;
import com.rowguard.test.PlanFixtures;
import com.rowguard.test.TestBase;
import com.rowguard.test.TestCategories;
import com.rowguard.validation.ValidationOutcome;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("FallbackTagStore Tests")
public class FallbackTagStoreTest extends TestBase {

    private FallbackTagStore store;
    private ScanExec scan;

    @Override
    protected void doSetUp() {
        store = new FallbackTagStore();
        scan = PlanFixtures.salesScan();
    }

    @Nested
    @DisplayName("Merge Rules")
    class MergeRules {

        @Test
        @DisplayName("Untagged node takes the new tag")
        void testFirstTag() {
            store.tag(scan, Unsupported.locked("r0"));

            assertThat(store.getTag(scan)).isEqualTo(Unsupported.locked("r0"));
        }

        @Test
        @DisplayName("Two appendable reasons are concatenated")
        void testAppendableMerge() {
            store.add(scan, "r0");
            store.add(scan, "r1");

            assertThat(store.getTag(scan)).isEqualTo(Unsupported.appendable("r0; r1"));
        }

        @Test
        @DisplayName("A locked tag absorbs later reasons")
        void testLockedAbsorbs() {
            store.tag(scan, Unsupported.locked("r0"));
            store.add(scan, "r1");
            store.tag(scan, Unsupported.locked("r2"));

            assertThat(store.getTag(scan)).isEqualTo(Unsupported.locked("r0"));
        }

        @Test
        @DisplayName("Appendable then locked concatenates and locks")
        void testAppendableThenLocked() {
            store.add(scan, "r0");
            store.tag(scan, Unsupported.locked("r1"));
            store.add(scan, "r2");

            assertThat(store.getTag(scan)).isEqualTo(Unsupported.locked("r0; r1"));
        }

        @Test
        @DisplayName("Tag without reason is replaced by the next tag")
        void testExistingWithoutReason() {
            store.tag(scan, Unsupported.withoutReason());
            store.tag(scan, Unsupported.locked("r1"));

            assertThat(store.getTag(scan)).isEqualTo(Unsupported.locked("r1"));
        }

        @Test
        @DisplayName("New tag without reason keeps the existing tag")
        void testNewWithoutReason() {
            store.add(scan, "r0");
            store.tag(scan, Unsupported.withoutReason());

            assertThat(store.getTag(scan)).isEqualTo(Unsupported.appendable("r0"));
        }

        @Test
        @DisplayName("Merging with another tag kind is a programming error")
        void testIncompatibleKind() {
            FallbackTag other = () -> "other kind";
            store.add(scan, "r0");

            assertThatThrownBy(() -> store.tag(scan, other))
                .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Another tag kind on an untagged node is stored")
        void testOtherKindOnUntagged() {
            FallbackTag other = () -> "other kind";
            store.tag(scan, other);

            assertThat(store.getTag(scan)).isSameAs(other);
            assertThatThrownBy(() -> store.add(scan, "r1"))
                .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("A reason-less tag describes itself as not recorded")
        void testDescribeWithoutReason() {
            assertThat(Unsupported.withoutReason().describe()).isEqualTo("Reason not recorded");
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("getTag on an untagged node fails")
        void testGetTagUntagged() {
            assertThatThrownBy(() -> store.getTag(scan))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("FileSourceScan");
            assertThat(store.getTagOption(scan)).isEmpty();
        }

        @Test
        @DisplayName("nonEmpty and maybeOffloadable are complementary")
        void testOffloadable() {
            assertThat(store.nonEmpty(scan)).isFalse();
            assertThat(store.maybeOffloadable(scan)).isTrue();

            store.add(scan, "r0");

            assertThat(store.nonEmpty(scan)).isTrue();
            assertThat(store.maybeOffloadable(scan)).isFalse();
        }

        @Test
        @DisplayName("Structurally equal nodes carry independent tags")
        void testIdentityKeyed() {
            ScanExec twin = new ScanExec(scan.kind(), scan.tableName(), scan.format(), scan.output(),
                scan.dataFilters(), scan.partitionFilters(), scan.runtimeFilters());

            store.add(scan, "r0");

            assertThat(store.nonEmpty(twin)).isFalse();
        }

        @Test
        @DisplayName("Passed outcome leaves the node untagged")
        void testAddOutcome() {
            store.add(scan, ValidationOutcome.passed());
            assertThat(store.nonEmpty(scan)).isFalse();

            store.add(scan, ValidationOutcome.failed("bad format"));
            assertThat(store.getTag(scan).describe()).isEqualTo("bad format");
        }
    }

    @Nested
    @DisplayName("Clearing")
    class Clearing {

        @Test
        @DisplayName("untag is idempotent")
        void testUntagIdempotent() {
            store.add(scan, "r0");
            store.untag(scan);
            store.untag(scan);

            assertThat(store.nonEmpty(scan)).isFalse();
            assertThat(store.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("RemoveFallbackTagRule leaves no tag on the tree")
        void testRemoveRule() {
            FilterExec filter = new FilterExec(PlanFixtures.amountAbove100(scan), scan);
            store.add(filter, "r0");
            store.tag(scan, Unsupported.locked("r1"));

            new RemoveFallbackTagRule(store).apply(filter);

            assertThat(store.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("Recursive Tagging")
    class RecursiveTagging {

        @Test
        @DisplayName("addRecursively tags the whole subtree")
        void testAddRecursively() {
            ProjectExec project = PlanFixtures.projectOf(new FilterExec(PlanFixtures.amountAbove100(scan), scan), "id");

            store.addRecursively(project, Unsupported.appendable("whole stage"));

            assertThat(project.collectNodes()).allMatch(store::nonEmpty);
        }

        @Test
        @DisplayName("addRecursively skips subtrees committed to the native engine")
        void testSkipsNativeBoundary() {
            NativeStageExec stage = new NativeStageExec(1, scan);
            PhysicalPlan project = PlanFixtures.projectOf(stage, "id");

            store.addRecursively(project, Unsupported.appendable("whole stage"));

            assertThat(store.nonEmpty(project)).isTrue();
            assertThat(store.nonEmpty(stage)).isFalse();
            assertThat(store.nonEmpty(scan)).isFalse();
        }

        @Test
        @DisplayName("addRecursively tags a child shared by two parents once")
        void testSharedChildTaggedOnce() {
            FilterExec filter = new FilterExec(PlanFixtures.amountAbove100(scan), scan);
            UnionExec union = new UnionExec(List.of(filter, filter));

            store.addRecursively(union, Unsupported.appendable("x"));

            assertThat(store.getTag(union)).isEqualTo(Unsupported.appendable("x"));
            assertThat(store.getTag(filter)).isEqualTo(Unsupported.appendable("x"));
            assertThat(store.getTag(scan)).isEqualTo(Unsupported.appendable("x"));
        }
    }

    @Nested
    @DisplayName("Tag Origin")
    class TagOrigin {

        @Test
        @DisplayName("Origin is recorded only when enabled")
        void testOrigin() {
            FallbackTagStore recording = new FallbackTagStore(true);
            recording.add(scan, "r0");
            store.add(scan, "r0");

            Optional<String> origin = recording.origin(scan);
            assertThat(origin).isPresent();
            assertThat(origin.get()).contains("Fallback tag origin").contains("FallbackTagStoreTest");
            assertThat(store.origin(scan)).isEmpty();
        }

        @Test
        @DisplayName("untag drops the origin")
        void testUntagDropsOrigin() {
            FallbackTagStore recording = new FallbackTagStore(true);
            recording.add(scan, "r0");
            recording.untag(scan);

            assertThat(recording.origin(scan)).isEmpty();
        }

        @Test
        @DisplayName("transfer moves the tag together with its first origin")
        void testTransferKeepsOrigin() {
            FallbackTagStore recording = new FallbackTagStore(true);
            recording.add(scan, "r0");
            String firstOrigin = recording.origin(scan).orElseThrow();
            ScanExec replacement = PlanFixtures.salesScan();

            recording.transfer(scan, replacement);

            assertThat(recording.nonEmpty(scan)).isFalse();
            assertThat(recording.origin(scan)).isEmpty();
            assertThat(recording.getTag(replacement)).isEqualTo(Unsupported.appendable("r0"));
            assertThat(recording.origin(replacement)).contains(firstOrigin);
        }

        @Test
        @DisplayName("transfer of an untagged node does nothing")
        void testTransferUntagged() {
            ScanExec replacement = PlanFixtures.salesScan();

            store.transfer(scan, replacement);

            assertThat(store.isEmpty()).isTrue();
        }
    }
}
