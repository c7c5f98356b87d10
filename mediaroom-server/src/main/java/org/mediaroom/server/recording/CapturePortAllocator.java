package org.mediaroom.server.recording;

import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Hands out the ports capture subprocesses receive RTP on. Ports are even
 * (RTCP uses the next odd one), taken from the RTC port range and never handed
 * out twice until released.
 */
public class CapturePortAllocator {

    private static final Logger log = LoggerFactory.getLogger(CapturePortAllocator.class);

    private final String listenIp;
    private final int minPort;
    private final int maxPort;

    private final Set<Integer> reserved = new HashSet<>();
    private int next;

    public CapturePortAllocator(String listenIp, int minPort, int maxPort) {
        if (minPort <= 0 || maxPort > 65535 || maxPort - minPort < 1) {
            throw new IllegalArgumentException("Invalid RTC port range " + minPort + "-" + maxPort);
        }
        this.listenIp = listenIp;
        this.minPort = minPort % 2 == 0 ? minPort : minPort + 1;
        this.maxPort = maxPort;
        this.next = this.minPort;
    }

    /**
     * @throws MediaRoomException RESOURCE_EXHAUSTED_ERROR_CODE if the range has
     *                            not enough free ports
     */
    public synchronized List<Integer> allocate(int count) {
        List<Integer> ports = new ArrayList<>(count);
        int candidates = (maxPort - minPort) / 2 + 1;
        for (int tried = 0; tried < candidates && ports.size() < count; tried++) {
            int port = next;
            next += 2;
            if (next + 1 > maxPort) {
                next = minPort;
            }
            if (port + 1 > maxPort || reserved.contains(port)) {
                continue;
            }
            if (isFree(port) && isFree(port + 1)) {
                reserved.add(port);
                ports.add(port);
            } else {
                log.debug("Capture port {} is in use, skipping it", port);
            }
        }
        if (ports.size() < count) {
            reserved.removeAll(ports);
            throw new MediaRoomException(Code.RESOURCE_EXHAUSTED_ERROR_CODE,
                    "No " + count + " free capture ports left in range " + minPort + "-" + maxPort);
        }
        return ports;
    }

    public synchronized void release(Collection<Integer> ports) {
        reserved.removeAll(ports);
    }

    public synchronized int getReservedCount() {
        return reserved.size();
    }

    protected boolean isFree(int port) {
        try (DatagramSocket socket = new DatagramSocket(null)) {
            socket.setReuseAddress(false);
            socket.bind(new InetSocketAddress(listenIp, port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
