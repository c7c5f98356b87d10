package org.mediaroom.server.kurento.endpoint;

import com.google.gson.JsonObject;
import org.kurento.client.Continuation;
import org.kurento.client.EventListener;
import org.kurento.client.IceCandidate;
import org.kurento.client.IceCandidateFoundEvent;
import org.kurento.client.WebRtcEndpoint;
import org.kurento.jsonrpc.JsonUtils;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.server.engine.CandidateListener;
import org.mediaroom.server.engine.ClientTransport;
import org.mediaroom.server.engine.EngineConsumer;
import org.mediaroom.server.engine.EngineProducer;
import org.mediaroom.server.engine.MediaKind;
import org.mediaroom.server.engine.RtpCodec;
import org.mediaroom.server.engine.TransportDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client transport over a {@link WebRtcEndpoint}. The client sends its SDP
 * offer on connect and gets the answer back; local ICE candidates are pushed
 * through the {@link CandidateListener}.
 */
public class KurentoClientTransport implements ClientTransport {

    private static final Logger log = LoggerFactory.getLogger(KurentoClientTransport.class);

    public static final String SDP_OFFER_PARAM = "sdpOffer";
    public static final String SDP_ANSWER_PARAM = "sdpAnswer";

    private final WebRtcEndpoint endpoint;
    private final TransportDirection direction;
    private volatile boolean closed = false;

    public KurentoClientTransport(WebRtcEndpoint endpoint, TransportDirection direction,
                                  CandidateListener candidateListener) {
        this.endpoint = endpoint;
        this.direction = direction;
        final String transportId = endpoint.getId();
        endpoint.addIceCandidateFoundListener(new EventListener<IceCandidateFoundEvent>() {
            @Override
            public void onEvent(IceCandidateFoundEvent event) {
                candidateListener.onLocalCandidate(transportId, JsonUtils.toJsonObject(event.getCandidate()));
            }
        });
    }

    @Override
    public String getId() {
        return endpoint.getId();
    }

    @Override
    public TransportDirection getDirection() {
        return direction;
    }

    @Override
    public JsonObject getConnectionParameters() {
        JsonObject parameters = new JsonObject();
        parameters.addProperty("negotiation", SDP_OFFER_PARAM);
        return parameters;
    }

    /**
     * @param dtlsParameters must carry the client's <code>sdpOffer</code>
     * @return <code>{sdpAnswer}</code>
     */
    @Override
    public JsonObject connect(JsonObject dtlsParameters) {
        checkClosed();
        if (dtlsParameters == null || !dtlsParameters.has(SDP_OFFER_PARAM)) {
            throw new MediaRoomException(Code.VALIDATION_ERROR_CODE,
                    "Transport '" + getId() + "' needs an " + SDP_OFFER_PARAM + " to connect");
        }
        String sdpAnswer = endpoint.processOffer(dtlsParameters.get(SDP_OFFER_PARAM).getAsString());
        endpoint.gatherCandidates(new Continuation<Void>() {
            @Override
            public void onSuccess(Void result) throws Exception {
                log.trace("Transport {}: started to gather candidates", getId());
            }

            @Override
            public void onError(Throwable cause) throws Exception {
                log.warn("Transport {}: failed to start gathering candidates", getId(), cause);
            }
        });
        JsonObject ack = new JsonObject();
        ack.addProperty(SDP_ANSWER_PARAM, sdpAnswer);
        return ack;
    }

    /**
     * @param candidate <code>{candidate, sdpMid, sdpMLineIndex}</code>
     */
    @Override
    public void addRemoteCandidate(JsonObject candidate) {
        checkClosed();
        IceCandidate iceCandidate = new IceCandidate(candidate.get("candidate").getAsString(),
                candidate.get("sdpMid").getAsString(), candidate.get("sdpMLineIndex").getAsInt());
        endpoint.addIceCandidate(iceCandidate, new Continuation<Void>() {
            @Override
            public void onSuccess(Void result) throws Exception {
                log.trace("Transport {}: ice candidate added", getId());
            }

            @Override
            public void onError(Throwable cause) throws Exception {
                log.warn("Transport {}: failed to add ice candidate", getId(), cause);
            }
        });
    }

    @Override
    public EngineProducer produce(MediaKind kind, RtpCodec codec, JsonObject rtpParameters) {
        checkClosed();
        return new KurentoProducer(endpoint, kind, codec, rtpParameters);
    }

    @Override
    public EngineConsumer consume(EngineProducer producer, boolean paused) {
        checkClosed();
        return new KurentoConsumer(KurentoProducer.cast(producer), endpoint, paused);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        endpoint.release();
        log.debug("Transport {} released", getId());
    }

    private void checkClosed() {
        if (closed) {
            throw new MediaRoomException(Code.TRANSPORT_NOT_FOUND_ERROR_CODE, "Transport '" + getId() + "' is closed");
        }
    }
}
