package txengine.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import txengine.MemoryStateProvider;
import txengine.RecordingOperation;
import txengine.ValidationResult;
import txengine.config.AlertLevel;
import txengine.config.EngineConfig;
import txengine.exceptions.MigrationStepException;
import txengine.migration.MigrationResult;
import txengine.migration.MigrationStep;
import txengine.migration.RollbackScope;
import txengine.rollback.RollbackPoint;
import txengine.rollback.RollbackPointType;
import txengine.transaction.TransactionOptions;
import txengine.transaction.TransactionResult;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TransactionManager migrations")
class MigrationExecutionTest {

    private MemoryStateProvider provider;
    private TransactionManager manager;
    private List<String> journal;

    @BeforeEach
    void setUp() {
        provider = new MemoryStateProvider();
        provider.set("init;");
        manager = TransactionManager.create(provider, EngineConfig.builder().alertLevel(AlertLevel.ERROR).build());
        journal = Collections.synchronizedList(new ArrayList<>());
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private RecordingOperation op(String id) {
        return new RecordingOperation(id, journal).mutating(provider);
    }

    @Nested
    @DisplayName("successful migration")
    class Successful {

        @Test
        @DisplayName("should run every step in order and complete")
        void shouldCompleteAllSteps() {
            MigrationStep s1 = MigrationStep.builder("s1", "Create table").operation(op("a")).operation(op("b")).build();
            MigrationStep s2 = MigrationStep.builder("s2", "Backfill").operation(op("c")).prerequisite("s1").build();

            MigrationResult result = manager.executeMigration(List.of(s1, s2), null);

            assertThat(result.success()).isTrue();
            assertThat(result.migrationId()).startsWith("migration_");
            assertThat(result.completedSteps()).containsExactly("s1", "s2");
            assertThat(result.failedStep()).isNull();
            assertThat(result.error()).isNull();
            assertThat(journal).containsExactly("execute:a", "execute:b", "execute:c");
            assertThat(provider.get()).isEqualTo("init;a;b;c;");
        }

        @Test
        @DisplayName("should take a 'Before step' checkpoint per step")
        void shouldCheckpointEachStep() {
            MigrationStep s1 = MigrationStep.builder("s1", "Create table").operation(op("a")).build();
            MigrationStep s2 = MigrationStep.builder("s2", "Backfill").operation(op("b")).build();

            MigrationResult result = manager.executeMigration(List.of(s1, s2), null);

            assertThat(result.rollbackPoints()).extracting(RollbackPoint::description)
                    .containsExactly("Before step: Create table", "Before step: Backfill");
            assertThat(result.rollbackPoints()).extracting(RollbackPoint::type)
                    .containsOnly(RollbackPointType.MIGRATION_STEP);
        }

        @Test
        @DisplayName("should archive step transactions tagged with the migration id")
        void shouldArchiveStepTransactions() {
            MigrationStep s1 = MigrationStep.builder("s1", "Create table").operation(op("a")).build();

            MigrationResult result = manager.executeMigration(List.of(s1),
                    TransactionOptions.builder().userId("deployer").build());

            assertThat(manager.getActiveTransactions()).isEmpty();
            List<TransactionResult<?>> history = manager.getTransactionHistory();
            assertThat(history).isNotEmpty().allSatisfy(r -> {
                assertThat(r.metadata()).containsEntry("migrationId", result.migrationId());
                assertThat(r.metadata()).containsEntry("migrationStep", "s1");
                assertThat(r.userId()).isEqualTo("deployer");
                assertThat(r.isCommitted()).isTrue();
            });
        }

        @Test
        @DisplayName("should succeed trivially with no steps")
        void shouldHandleEmptyMigration() {
            MigrationResult result = manager.executeMigration(List.of(), null);

            assertThat(result.success()).isTrue();
            assertThat(result.completedSteps()).isEmpty();
            assertThat(result.rollbackPoints()).isEmpty();
        }
    }

    @Nested
    @DisplayName("step failure")
    class StepFailure {

        @Test
        @DisplayName("phase scope should undo completed steps and leave no step completed")
        void phaseRollbackUndoesCompletedSteps() {
            RecordingOperation a = op("a");
            RecordingOperation b = op("b");
            RecordingOperation c = op("c").failOnExecute(new IOException("disk full"));
            MigrationStep s1 = MigrationStep.builder("s1", "Create table").operation(a).operation(b).build();
            MigrationStep s2 = MigrationStep.builder("s2", "Backfill").operation(c)
                    .rollbackStrategy(RollbackScope.PHASE).build();

            MigrationResult result = manager.executeMigration(List.of(s1, s2), null);

            assertThat(result.success()).isFalse();
            assertThat(result.failedStep()).isEqualTo("s2");
            assertThat(result.completedSteps()).isEmpty();
            assertThat(result.error()).hasMessage("disk full");
            assertThat(a.rollbacks()).isEqualTo(1);
            assertThat(b.rollbacks()).isEqualTo(1);
            assertThat(c.rollbacks()).isZero();
            assertThat(journal).containsExactly(
                    "execute:a", "execute:b", "execute:c", "rollback:b", "rollback:a");
            assertThat(provider.get()).isEqualTo("init;");
        }

        @Test
        @DisplayName("phase scope should restore step checkpoints even after their history entries are evicted")
        void phaseRollbackRestoresEvictedCheckpoints() {
            manager.close();
            manager = TransactionManager.create(provider,
                    EngineConfig.builder().alertLevel(AlertLevel.ERROR).historySize(2).build());
            RecordingOperation a = op("a").failOnRollback(new IOException("undo failed"));
            RecordingOperation b = op("b");
            RecordingOperation c = op("c").failOnExecute(new IOException("disk full"));
            MigrationStep s1 = MigrationStep.builder("s1", "Create table").operation(a).build();
            MigrationStep s2 = MigrationStep.builder("s2", "Add column").operation(b).build();
            MigrationStep s3 = MigrationStep.builder("s3", "Backfill").operation(c)
                    .rollbackStrategy(RollbackScope.PHASE).build();

            MigrationResult result = manager.executeMigration(List.of(s1, s2, s3), null);

            assertThat(result.success()).isFalse();
            assertThat(result.completedSteps()).isEmpty();
            assertThat(provider.get()).isEqualTo("init;");
            assertThat(result.error().getSuppressed()).singleElement().satisfies(e ->
                    assertThat(e).hasMessageContaining("Undo of migration step s1 did not complete"));
        }

        @Test
        @DisplayName("step scope should undo only the failing step")
        void stepRollbackKeepsCompletedSteps() {
            RecordingOperation a = op("a");
            RecordingOperation c = op("c");
            RecordingOperation d = op("d").failOnExecute(new IOException("constraint violated"));
            MigrationStep s1 = MigrationStep.builder("s1", "Create table").operation(a).build();
            MigrationStep s2 = MigrationStep.builder("s2", "Backfill").operation(c).operation(d).build();
            MigrationStep s3 = MigrationStep.builder("s3", "Index").operation(op("e")).build();

            MigrationResult result = manager.executeMigration(List.of(s1, s2, s3), null);

            assertThat(result.success()).isFalse();
            assertThat(result.failedStep()).isEqualTo("s2");
            assertThat(result.completedSteps()).containsExactly("s1");
            assertThat(a.rollbacks()).isZero();
            assertThat(c.rollbacks()).isEqualTo(1);
            assertThat(d.rollbacks()).isZero();
            assertThat(journal).doesNotContain("execute:e");
            assertThat(provider.get()).isEqualTo("init;a;");
        }

        @Test
        @DisplayName("a failing validation rule should fail the step before its operations run")
        void validationRuleFailsStep() {
            RecordingOperation c = op("c");
            MigrationStep s1 = MigrationStep.builder("s1", "Create table").operation(op("a")).build();
            MigrationStep s2 = MigrationStep.builder("s2", "Backfill").operation(c)
                    .validationRule(ctx -> ValidationResult.invalid("table locked"))
                    .build();

            MigrationResult result = manager.executeMigration(List.of(s1, s2), null);

            assertThat(result.success()).isFalse();
            assertThat(result.failedStep()).isEqualTo("s2");
            assertThat(result.error()).isInstanceOf(MigrationStepException.class)
                    .hasMessageContaining("table locked");
            assertThat(((MigrationStepException) result.error()).getStepId()).isEqualTo("s2");
            assertThat(c.executions()).isZero();
        }

        @Test
        @DisplayName("a throwing validation rule should fail the step")
        void throwingValidationRuleFailsStep() {
            MigrationStep s1 = MigrationStep.builder("s1", "Create table").operation(op("a"))
                    .validationRule(ctx -> {
                        throw new IllegalStateException("catalog unavailable");
                    })
                    .build();

            MigrationResult result = manager.executeMigration(List.of(s1), null);

            assertThat(result.success()).isFalse();
            assertThat(result.error()).isInstanceOf(MigrationStepException.class)
                    .hasMessageContaining("catalog unavailable");
            assertThat(journal).isEmpty();
        }

        @Test
        @DisplayName("an invalid plan should fail before any step runs")
        void invalidPlanRunsNothing() {
            MigrationStep s1 = MigrationStep.builder("s1", "Backfill").operation(op("a")).prerequisite("s2").build();
            MigrationStep s2 = MigrationStep.builder("s2", "Create table").operation(op("b")).build();

            MigrationResult result = manager.executeMigration(List.of(s1, s2), null);

            assertThat(result.success()).isFalse();
            assertThat(result.failedStep()).isNull();
            assertThat(result.error()).hasMessageContaining("requires step s2 which runs after it");
            assertThat(journal).isEmpty();
            assertThat(manager.getTransactionHistory()).isEmpty();
        }
    }
}
