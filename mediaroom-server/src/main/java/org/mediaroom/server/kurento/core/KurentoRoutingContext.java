package org.mediaroom.server.kurento.core;

import org.kurento.client.Continuation;
import org.kurento.client.ErrorEvent;
import org.kurento.client.EventListener;
import org.kurento.client.MediaPipeline;
import org.kurento.client.RtpEndpoint;
import org.kurento.client.WebRtcEndpoint;
import org.mediaroom.server.engine.CandidateListener;
import org.mediaroom.server.engine.CaptureTransport;
import org.mediaroom.server.engine.ClientTransport;
import org.mediaroom.server.engine.RoutingContext;
import org.mediaroom.server.engine.TransportDirection;
import org.mediaroom.server.kurento.endpoint.KurentoCaptureTransport;
import org.mediaroom.server.kurento.endpoint.KurentoClientTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routing context backed by a {@link MediaPipeline}. Releasing the pipeline
 * releases every endpoint built in it.
 */
public class KurentoRoutingContext implements RoutingContext {

    private static final Logger log = LoggerFactory.getLogger(KurentoRoutingContext.class);

    private final MediaPipeline pipeline;
    private final Object pipelineReleaseLock = new Object();
    private volatile boolean closed = false;

    public KurentoRoutingContext(MediaPipeline pipeline) {
        this.pipeline = pipeline;
        this.pipeline.addErrorListener(new EventListener<ErrorEvent>() {
            @Override
            public void onEvent(ErrorEvent event) {
                log.warn("PIPELINE {}: error encountered: {}: {} (errCode={})", getId(), event.getType(),
                        event.getDescription(), event.getErrorCode());
            }
        });
    }

    @Override
    public String getId() {
        return pipeline.getId();
    }

    @Override
    public ClientTransport createClientTransport(TransportDirection direction, CandidateListener candidateListener) {
        WebRtcEndpoint endpoint = new WebRtcEndpoint.Builder(pipeline).build();
        return new KurentoClientTransport(endpoint, direction, candidateListener);
    }

    @Override
    public CaptureTransport createCaptureTransport(String listenIp) {
        RtpEndpoint endpoint = new RtpEndpoint.Builder(pipeline).build();
        return new KurentoCaptureTransport(endpoint, listenIp);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        synchronized (pipelineReleaseLock) {
            if (closed) {
                return;
            }
            closed = true;
            pipeline.release(new Continuation<Void>() {
                @Override
                public void onSuccess(Void result) throws Exception {
                    log.debug("PIPELINE {}: released", getId());
                }

                @Override
                public void onError(Throwable cause) throws Exception {
                    log.warn("PIPELINE {}: could not successfully release", getId(), cause);
                }
            });
        }
    }
}
