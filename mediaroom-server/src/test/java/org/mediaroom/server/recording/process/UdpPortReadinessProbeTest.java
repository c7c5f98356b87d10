package org.mediaroom.server.recording.process;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mediaroom.client.MediaRoomException;

import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UdpPortReadinessProbeTest {

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final Set<Integer> bound = ConcurrentHashMap.newKeySet();

    private final UdpPortReadinessProbe probe = new UdpPortReadinessProbe(scheduler, 10) {
        @Override
        protected boolean isBound(String ip, int port) {
            return bound.contains(port);
        }
    };

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void readyOnceEveryPortIsBound() throws Exception {
        CaptureProcess process = new CaptureProcess("peer1", new FakeProcess(true, true));
        bound.add(40000);

        CompletableFuture<Void> ready = probe.awaitReady(process, "127.0.0.1", Arrays.asList(40000, 40002));
        Thread.sleep(50);
        assertThat(ready).isNotDone();

        bound.add(40002);
        ready.get(2, TimeUnit.SECONDS);
        assertThat(ready).isCompleted();
    }

    @Test
    void failsWhenTheProcessDiesFirst() {
        FakeProcess fake = new FakeProcess(true, true, "bind failed\n");
        CaptureProcess process = new CaptureProcess("peer1", fake);
        fake.exit(1);

        CompletableFuture<Void> ready = probe.awaitReady(process, "127.0.0.1", Collections.singletonList(40000));

        assertThatThrownBy(() -> ready.get(2, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(MediaRoomException.class);
    }

    @Test
    void realProbeSeesAHeldSocket() throws Exception {
        UdpPortReadinessProbe realProbe = new UdpPortReadinessProbe(scheduler, 10);
        try (DatagramSocket socket = new DatagramSocket(new InetSocketAddress("127.0.0.1", 0))) {
            assertThat(realProbe.isBound("127.0.0.1", socket.getLocalPort())).isTrue();
        }
    }
}
