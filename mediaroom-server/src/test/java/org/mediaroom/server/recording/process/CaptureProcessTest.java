package org.mediaroom.server.recording.process;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CaptureProcessTest {

    @Test
    void quitCommandIsEnoughForACooperativeProcess() {
        FakeProcess process = new FakeProcess(true, true);
        CaptureProcess capture = new CaptureProcess("peer1", process);

        assertThat(capture.stop(1000, 1000)).isZero();
        assertThat(process.isQuitReceived()).isTrue();
        assertThat(process.isTerminated()).isFalse();
        assertThat(capture.getExitFuture()).isCompleted();
    }

    @Test
    void escalatesToTerminate() {
        FakeProcess process = new FakeProcess(false, true);
        CaptureProcess capture = new CaptureProcess("peer1", process);

        assertThat(capture.stop(50, 1000)).isEqualTo(143);
        assertThat(process.isTerminated()).isTrue();
        assertThat(process.isKilled()).isFalse();
    }

    @Test
    void escalatesToKill() {
        FakeProcess process = new FakeProcess(false, false);
        CaptureProcess capture = new CaptureProcess("peer1", process);

        assertThat(capture.stop(50, 50)).isEqualTo(137);
        assertThat(process.isTerminated()).isTrue();
        assertThat(process.isKilled()).isTrue();
        assertThat(capture.isAlive()).isFalse();
    }

    @Test
    void stoppingAnExitedProcessReturnsItsCode() {
        FakeProcess process = new FakeProcess(true, true);
        process.exit(1);
        CaptureProcess capture = new CaptureProcess("peer1", process);

        assertThat(capture.stop(50, 50)).isEqualTo(1);
        assertThat(process.isQuitReceived()).isFalse();
    }

    @Test
    void keepsTheTailOfStandardError() throws InterruptedException {
        StringBuilder stderr = new StringBuilder();
        for (int i = 1; i <= 25; i++) {
            stderr.append("line ").append(i).append('\n');
        }
        CaptureProcess capture = new CaptureProcess("peer1", new FakeProcess(true, true, stderr.toString()));

        long deadline = System.currentTimeMillis() + 5000;
        while (!capture.getStderrTail().contains("line 25") && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(capture.getStderrTail()).hasSize(20).endsWith("line 25");
        assertThat(capture.getStderrTail().get(0)).isEqualTo("line 6");
    }
}
