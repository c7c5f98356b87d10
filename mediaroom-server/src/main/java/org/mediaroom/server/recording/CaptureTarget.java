package org.mediaroom.server.recording;

import org.mediaroom.server.engine.EngineProducer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Producers of one peer to be captured, as seen when the capture was
 * requested. The producers are borrowed: the capture never closes them.
 */
public class CaptureTarget {

    private final String peerId;
    private final String username;
    private final List<EngineProducer> producers;

    public CaptureTarget(String peerId, String username, List<EngineProducer> producers) {
        this.peerId = peerId;
        this.username = username;
        this.producers = Collections.unmodifiableList(new ArrayList<>(producers));
    }

    public String getPeerId() {
        return peerId;
    }

    public String getUsername() {
        return username;
    }

    public List<EngineProducer> getProducers() {
        return producers;
    }

    @Override
    public String toString() {
        return "[peerId=" + peerId + ", username=" + username + ", producers=" + producers.size() + "]";
    }
}
