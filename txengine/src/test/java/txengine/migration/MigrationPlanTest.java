package txengine.migration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import txengine.RecordingOperation;
import txengine.ValidationResult;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MigrationPlan")
class MigrationPlanTest {

    private final List<String> journal = new ArrayList<>();

    private MigrationStep step(String id, String... prerequisites) {
        MigrationStep.Builder b = MigrationStep.builder(id, "Step " + id).operation(new RecordingOperation(id + "-op", journal));
        for (String p : prerequisites) {
            b.prerequisite(p);
        }
        return b.build();
    }

    @Test
    @DisplayName("should accept steps whose prerequisites run earlier")
    void shouldAcceptOrderedPlan() {
        ValidationResult result = MigrationPlan.validate(List.of(step("a"), step("b", "a"), step("c", "a", "b")));

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    @DisplayName("should reject duplicate step ids")
    void shouldRejectDuplicates() {
        ValidationResult result = MigrationPlan.validate(List.of(step("a"), step("a")));

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("Duplicate migration step id: a");
    }

    @Test
    @DisplayName("should reject unknown and out-of-order prerequisites")
    void shouldRejectBadPrerequisites() {
        ValidationResult result = MigrationPlan.validate(List.of(step("a", "b"), step("b", "zz")));

        assertThat(result.errors()).containsExactly(
                "Step a requires step b which runs after it",
                "Step b requires unknown step zz");
    }

    @Test
    @DisplayName("should reject a step that requires itself")
    void shouldRejectSelfPrerequisite() {
        assertThat(MigrationPlan.validate(List.of(step("a", "a"))).valid()).isFalse();
    }

    @Test
    @DisplayName("should warn about steps without operations")
    void shouldWarnAboutEmptySteps() {
        ValidationResult result = MigrationPlan.validate(List.of(MigrationStep.builder("empty", "Nothing").build()));

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).containsExactly("Step empty has no operations");
    }

    @Test
    @DisplayName("builder should default to step-scoped rollback")
    void builderDefaults() {
        MigrationStep s = MigrationStep.builder("s", "S").build();

        assertThat(s.rollbackStrategy()).isEqualTo(RollbackScope.STEP);
        assertThat(s.prerequisites()).isEmpty();
        assertThat(s.phase()).isNull();
        assertThatThrownBy(() -> MigrationStep.builder(null, "x")).isInstanceOf(NullPointerException.class);
    }
}
