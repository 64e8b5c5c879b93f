package com.ryuqq.kernelmonitor.testkit.contract;

import ch.qos.logback.classic.Level;
import com.ryuqq.kernelmonitor.application.publisher.MetadataContentTypes;
import com.ryuqq.kernelmonitor.core.config.MonitorConfig;
import com.ryuqq.kernelmonitor.core.outcome.ExecutionOutcome;
import com.ryuqq.kernelmonitor.core.outcome.Failed;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the four reference scenarios.
 *
 * <p>Thresholds are scaled down (1s → 40ms) so the suite stays fast; the ratios between
 * warning, timeout and cell duration are kept.</p>
 *
 * <ul>
 *   <li>A: long cell, auto interrupt off → warning, timeout notice, successful completion</li>
 *   <li>B: long cell, auto interrupt on → cancelled shortly after the timeout</li>
 *   <li>C: quick cell, monitoring on → no timer output, even well after the thresholds</li>
 *   <li>D: monitoring off → tracking and metadata only</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ScenarioContractTest extends AbstractContractTest {

    private static final double WARNING_SECONDS = 0.2;
    private static final double TIMEOUT_SECONDS = 0.4;
    private static final long LONG_CELL_MS = 480;

    @Test
    @DisplayName("Scenario A: 장기 실행 경고와 타임아웃 알림 후 정상 종료")
    void scenarioA_LongCellWithoutAutoInterrupt_CompletesSuccessfully() throws Exception {
        // Given
        install(MonitorConfig.enabled(WARNING_SECONDS, TIMEOUT_SECONDS, false));

        // When
        ExecutionOutcome outcome = host.execute("cell-a", "time.sleep(12)", sleepingCell(LONG_CELL_MS));

        // Then
        assertTrue(outcome.isSuccess());
        assertEquals(1, countLines("EXEC_START"));
        assertEquals(1, countLines("LONG_EXECUTION"));
        assertEquals(1, countLines("TIMEOUT_INTERRUPT"));
        assertEquals(1, countLines("EXEC_END"));
        assertTrue(linesOf("TIMEOUT_INTERRUPT").get(0).endsWith("| action=none"));
        assertTrue(linesOf("EXEC_END").get(0).endsWith("| success=true"));

        assertTrue(indexOf("EXEC_START") < indexOf("LONG_EXECUTION"));
        assertTrue(indexOf("LONG_EXECUTION") < indexOf("TIMEOUT_INTERRUPT"));
        assertTrue(indexOf("TIMEOUT_INTERRUPT") < indexOf("EXEC_END"));

        assertEquals(Level.WARN, levelOf("LONG_EXECUTION"));
        assertEquals(Level.ERROR, levelOf("TIMEOUT_INTERRUPT"));
        assertEquals(2, sink.payloadsOf(MetadataContentTypes.EXECUTION_NOTICE).size());
        assertEquals(1, sink.payloadsOf(MetadataContentTypes.EXECUTION_METADATA).size());
    }

    @Test
    @DisplayName("Scenario B: auto interrupt 시 타임아웃 직후 실행 취소")
    void scenarioB_LongCellWithAutoInterrupt_IsCancelledAfterTimeout() throws Exception {
        // Given
        install(MonitorConfig.enabled(WARNING_SECONDS, TIMEOUT_SECONDS, true));
        long start = System.nanoTime();

        // When: 셀은 5초 동안 돌지만 체크포인트에서 인터럽트를 받음
        ExecutionOutcome outcome = host.execute("cell-b", "while True: step()", busyCell(5_000));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        // Then
        assertEquals(Failed.interrupted(), outcome);
        assertTrue(elapsedMs >= 350, "Cell should run until the timeout, took " + elapsedMs + "ms");
        assertTrue(elapsedMs < 3_000, "Cell should be cancelled shortly after the timeout, took " + elapsedMs + "ms");

        assertEquals(1, countLines("LONG_EXECUTION"));
        assertEquals(1, countLines("TIMEOUT_INTERRUPT"));
        assertTrue(linesOf("TIMEOUT_INTERRUPT").get(0).endsWith("| action=interrupt"));
        assertTrue(linesOf("EXEC_END").get(0).endsWith("| success=false | error=Interrupted"));

        String metadata = sink.payloadsOf(MetadataContentTypes.EXECUTION_METADATA).get(0);
        assertTrue(metadata.contains("\"success\":false"));
        assertTrue(metadata.contains("\"error_kind\":\"Interrupted\""));
    }

    @Test
    @DisplayName("Scenario C: 빠른 실행은 disarm 후 늦은 콜백 없음")
    void scenarioC_QuickCell_LeavesNoTrailingTimerOutput() throws Exception {
        // Given
        install(MonitorConfig.enabled(WARNING_SECONDS, TIMEOUT_SECONDS, true));

        // When
        ExecutionOutcome outcome = host.execute("cell-c", "1 + 1", sleepingCell(10));
        sleep(600);

        // Then
        assertTrue(outcome.isSuccess());
        assertEquals(1, countLines("EXEC_START"));
        assertEquals(1, countLines("EXEC_END"));
        assertNoLine("LONG_EXECUTION");
        assertNoLine("TIMEOUT_INTERRUPT");
        assertTrue(sink.payloadsOf(MetadataContentTypes.EXECUTION_NOTICE).isEmpty());
    }

    @Test
    @DisplayName("Scenario D: 모니터링 비활성 시 추적과 메타데이터만 수행")
    void scenarioD_MonitoringDisabled_TracksAndPublishesOnly() throws Exception {
        // Given
        install(MonitorConfig.disabled().withThresholds(WARNING_SECONDS, TIMEOUT_SECONDS));

        // When
        ExecutionOutcome outcome = host.execute("cell-d", "time.sleep(12)", sleepingCell(LONG_CELL_MS));

        // Then
        assertTrue(outcome.isSuccess());
        assertFalse(installation.isTimeoutMonitoringActive());
        assertEquals(1, countLines("EXEC_START"));
        assertEquals(1, countLines("EXEC_END"));
        assertNoLine("LONG_EXECUTION");
        assertNoLine("TIMEOUT_INTERRUPT");
        assertEquals(1, sink.payloadsOf(MetadataContentTypes.EXECUTION_METADATA).size());
        assertTrue(sink.payloadsOf(MetadataContentTypes.EXECUTION_NOTICE).isEmpty());
    }
}
