package txengine.alert;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.slf4j.Logger;
import txengine.config.AlertLevel;
import txengine.transaction.TransactionStatus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@DisplayName("TransactionAlertLogger")
class TransactionAlertLoggerTest {

    @Mock
    private Logger log;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Nested
    @DisplayName("level filtering")
    class LevelFiltering {

        @Test
        @DisplayName("DEBUG should emit lifecycle events")
        void debugEmitsInfo() {
            TransactionAlertLogger alerts = new TransactionAlertLogger(log, AlertLevel.DEBUG);

            alerts.transactionStarted("txn_1", "alice");

            verify(log).info(anyString(), eq("txn_1"), eq("alice"));
        }

        @Test
        @DisplayName("WARNING should drop lifecycle events but keep warnings")
        void warningDropsInfo() {
            TransactionAlertLogger alerts = new TransactionAlertLogger(log, AlertLevel.WARNING);

            alerts.transactionCommitted("txn_1", 12);
            alerts.transactionCancelled("txn_1");

            verify(log, never()).info(anyString(), any(), any());
            verify(log).warn(anyString(), eq("txn_1"));
        }

        @Test
        @DisplayName("ERROR should only emit failures")
        void errorOnlyEmitsFailures() {
            TransactionAlertLogger alerts = new TransactionAlertLogger(log, AlertLevel.ERROR);

            alerts.transactionCancelled("txn_1");
            alerts.transactionFailed("txn_1", TransactionStatus.ROLLED_BACK, new IllegalStateException("boom"));

            verify(log, never()).warn(anyString(), any(Object.class));
            verify(log).error(anyString(), eq("txn_1"), eq(TransactionStatus.ROLLED_BACK), eq("boom"));
        }

        @Test
        @DisplayName("null level should default to WARNING")
        void nullLevelDefaultsToWarning() {
            TransactionAlertLogger alerts = new TransactionAlertLogger(log, null);

            assertThat(alerts.getAlertLevel()).isEqualTo(AlertLevel.WARNING);
        }
    }

    @Test
    @DisplayName("a failing logging backend should not propagate")
    void brokenBackendIsContained() {
        doThrow(new IllegalStateException("appender closed"))
                .when(log).error(anyString(), any(), any(), any());
        TransactionAlertLogger alerts = new TransactionAlertLogger(log, AlertLevel.ERROR);

        assertThatCode(() -> alerts.transactionFailed("txn_1", TransactionStatus.FAILED, new RuntimeException("x")))
                .doesNotThrowAnyException();
    }
}
