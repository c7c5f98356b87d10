package org.mediaroom.server.recording.process;

import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Considers a subprocess ready once none of its receive ports can be bound
 * any more, which means the subprocess holds them.
 */
public class UdpPortReadinessProbe implements ReadinessProbe {

    private static final Logger log = LoggerFactory.getLogger(UdpPortReadinessProbe.class);

    private final ScheduledExecutorService scheduler;
    private final long pollIntervalMillis;

    public UdpPortReadinessProbe(ScheduledExecutorService scheduler, long pollIntervalMillis) {
        this.scheduler = scheduler;
        this.pollIntervalMillis = pollIntervalMillis;
    }

    @Override
    public CompletableFuture<Void> awaitReady(CaptureProcess process, String ip, Collection<Integer> ports) {
        CompletableFuture<Void> ready = new CompletableFuture<>();
        List<Integer> pending = new ArrayList<>(ports);
        long start = System.currentTimeMillis();
        ScheduledFuture<?> poller = scheduler.scheduleWithFixedDelay(() -> {
            if (ready.isDone()) {
                return;
            }
            pending.removeIf(port -> isBound(ip, port));
            if (pending.isEmpty()) {
                log.info("[{}] listening on {} after {} ms", process.getName(), ports,
                        System.currentTimeMillis() - start);
                ready.complete(null);
            } else if (!process.isAlive()) {
                ready.completeExceptionally(new MediaRoomException(Code.SUBPROCESS_ERROR_CODE,
                        "Capture process " + process.getName() + " exited before listening on " + pending + ": "
                                + String.join(" | ", process.getStderrTail())));
            }
        }, 0, pollIntervalMillis, TimeUnit.MILLISECONDS);
        ready.whenComplete((v, t) -> poller.cancel(false));
        return ready;
    }

    protected boolean isBound(String ip, int port) {
        try (DatagramSocket socket = new DatagramSocket(null)) {
            socket.setReuseAddress(false);
            socket.bind(new InetSocketAddress(ip, port));
            return false;
        } catch (IOException e) {
            return true;
        }
    }
}
