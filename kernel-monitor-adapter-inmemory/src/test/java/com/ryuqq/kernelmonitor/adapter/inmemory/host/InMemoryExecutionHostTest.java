package com.ryuqq.kernelmonitor.adapter.inmemory.host;

import com.ryuqq.kernelmonitor.core.outcome.ExecutionOutcome;
import com.ryuqq.kernelmonitor.core.outcome.Failed;
import com.ryuqq.kernelmonitor.core.spi.ExecutionLifecycleListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryExecutionHost}.
 *
 * <p><strong>Verified behavior:</strong></p>
 * <ul>
 *   <li>Hook order per cell</li>
 *   <li>Outcome classification</li>
 *   <li>Interrupt delivery only while a body runs</li>
 *   <li>Listener failure isolation</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryExecutionHostTest {

    private InMemoryExecutionHost host;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        host = new InMemoryExecutionHost();
        listener = new RecordingListener();
        host.register(listener);
    }

    @AfterEach
    void tearDown() {
        host.close();
    }

    @Test
    void testExecute_FiresHooksInOrder() throws Exception {
        // when
        ExecutionOutcome outcome = host.execute("cell-1", "x = 1", () -> { });

        // then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(listener.events()).containsExactly(
            "pre_run_cell:x = 1",
            "pre_execute:cell-1",
            "post_execute:true",
            "post_run_cell:1");
        assertThat(host.executionCount()).isEqualTo(1);
    }

    @Test
    void testExecute_FailingBody_ClassifiedBySimpleName() throws Exception {
        // when
        ExecutionOutcome outcome = host.execute(null, "int('x')", () -> {
            throw new NumberFormatException("bad");
        });

        // then
        assertThat(outcome).isEqualTo(Failed.of("NumberFormatException"));
        assertThat(listener.events()).contains("post_execute:false");
    }

    @Test
    void testExecute_CheckedException_ClassifiedBySimpleName() throws Exception {
        // when
        ExecutionOutcome outcome = host.execute(null, "open()", () -> {
            throw new java.io.IOException("missing");
        });

        // then
        assertThat(outcome.errorKindOrNull()).isEqualTo("IOException");
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testInterrupt_WhileRunning_EndsCellAsInterrupted() throws Exception {
        // given
        Future<ExecutionOutcome> future = host.submit("c", "sleep()", () -> Thread.sleep(30_000));
        awaitExecuting();

        // when
        boolean delivered = host.interruptCurrentExecution();

        // then
        assertThat(delivered).isTrue();
        assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(Failed.interrupted());
        assertThat(host.isExecuting()).isFalse();
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testInterrupt_CooperativeCheckpoint_EndsCellAsInterrupted() throws Exception {
        // given
        Future<ExecutionOutcome> future = host.submit("c", "loop()", () -> {
            while (true) {
                CellTask.checkpoint();
                Thread.onSpinWait();
            }
        });
        awaitExecuting();

        // when
        host.interruptCurrentExecution();

        // then
        assertThat(future.get(5, TimeUnit.SECONDS).errorKindOrNull()).isEqualTo(Failed.INTERRUPTED);
    }

    @Test
    void testInterrupt_WhenIdle_ReturnsFalse() throws Exception {
        // given
        host.execute("c", "x", () -> { });

        // when & then
        assertThat(host.interruptCurrentExecution()).isFalse();
    }

    @Test
    void testInterruptFlag_DoesNotLeakIntoNextCell() throws Exception {
        // given: body sets the flag on itself and completes normally
        host.execute("c1", "x", () -> Thread.currentThread().interrupt());

        // when
        List<Boolean> observed = Collections.synchronizedList(new ArrayList<>());
        ExecutionOutcome outcome = host.execute("c2", "y",
            () -> observed.add(Thread.currentThread().isInterrupted()));

        // then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(observed).containsExactly(false);
        assertThat(listener.interruptedAtPostExecute()).containsExactly(false, false);
    }

    @Test
    void testListenerFailure_DoesNotAffectCellOrOtherListeners() throws Exception {
        // given
        InMemoryExecutionHost isolated = new InMemoryExecutionHost();
        RecordingListener second = new RecordingListener();
        isolated.register(new FailingListener());
        isolated.register(second);

        try {
            // when
            ExecutionOutcome outcome = isolated.execute("c", "x", () -> { });

            // then
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(second.events()).hasSize(4);
        } finally {
            isolated.close();
        }
    }

    @Test
    void testUnregister_StopsDelivery() throws Exception {
        // given
        host.unregister(listener);

        // when
        host.execute("c", "x", () -> { });

        // then
        assertThat(listener.events()).isEmpty();
        assertThat(host.listenerCount()).isZero();
    }

    @Test
    void testRegister_Null_ThrowsException() {
        assertThatThrownBy(() -> host.register(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("listener cannot be null");
    }

    @Test
    void testSubmit_AfterClose_Rejected() {
        // given
        host.close();

        // when & then
        assertThatThrownBy(() -> host.submit("c", "x", () -> { }))
            .isInstanceOf(RejectedExecutionException.class);
    }

    private void awaitExecuting() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!host.isExecuting()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Cell did not start");
            }
            Thread.sleep(5);
        }
    }

    // ============================================================
    // Test listeners
    // ============================================================

    private static final class RecordingListener implements ExecutionLifecycleListener {

        private final List<String> events = Collections.synchronizedList(new ArrayList<>());
        private final List<Boolean> interruptedAtPostExecute = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void onPreExecute(String cellId, String source) {
            events.add("pre_execute:" + cellId);
        }

        @Override
        public void onPostExecute(ExecutionOutcome outcome) {
            interruptedAtPostExecute.add(Thread.currentThread().isInterrupted());
            events.add("post_execute:" + outcome.isSuccess());
        }

        @Override
        public void onPreRunCell(String source) {
            events.add("pre_run_cell:" + source);
        }

        @Override
        public void onPostRunCell(long executionCount) {
            events.add("post_run_cell:" + executionCount);
        }

        List<String> events() {
            return List.copyOf(events);
        }

        List<Boolean> interruptedAtPostExecute() {
            return List.copyOf(interruptedAtPostExecute);
        }
    }

    private static final class FailingListener implements ExecutionLifecycleListener {

        @Override
        public void onPreExecute(String cellId, String source) {
            throw new IllegalStateException("pre_execute failure");
        }

        @Override
        public void onPostExecute(ExecutionOutcome outcome) {
            throw new IllegalStateException("post_execute failure");
        }

        @Override
        public void onPreRunCell(String source) {
            throw new IllegalStateException("pre_run_cell failure");
        }

        @Override
        public void onPostRunCell(long executionCount) {
            throw new IllegalStateException("post_run_cell failure");
        }
    }
}
