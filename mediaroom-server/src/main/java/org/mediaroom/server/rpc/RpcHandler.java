package org.mediaroom.server.rpc;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.kurento.jsonrpc.DefaultJsonRpcHandler;
import org.kurento.jsonrpc.Session;
import org.kurento.jsonrpc.Transaction;
import org.kurento.jsonrpc.internal.ws.WebSocketServerSession;
import org.kurento.jsonrpc.message.Request;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.client.internal.ProtocolElements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

import java.net.InetAddress;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Connection bookkeeping of the signaling endpoint. Every request is answered
 * exactly once, with its result or with a JSON-RPC error built from the
 * {@link MediaRoomException} it failed with.
 */
public abstract class RpcHandler extends DefaultJsonRpcHandler<JsonObject> {

    private static final Logger logger = LoggerFactory.getLogger(RpcHandler.class);

    protected final RpcNotificationService notificationService;

    private final ConcurrentMap<String, Boolean> webSocketEOFTransportError = new ConcurrentHashMap<>();

    protected RpcHandler(RpcNotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @Override
    public void handleRequest(Transaction transaction, Request<JsonObject> request) throws Exception {
        String participantPrivateId = getParticipantPrivateIdByTransaction(transaction);
        logger.info("WebSocket session #{} - Request: {}", participantPrivateId, request);

        RpcMethod method = RpcMethod.fromMethodName(request.getMethod());
        if (method == null) {
            rejectRequest(transaction, new MediaRoomException(Code.VALIDATION_ERROR_CODE,
                    "Unknown method '" + request.getMethod() + "'"));
            return;
        }
        RpcConnection rpcConnection = notificationService.getRpcConnection(participantPrivateId);
        if (!method.requiresRoom()) {
            rpcConnection = notificationService.newRpcConnection(transaction, request);
        } else if (rpcConnection == null || rpcConnection.getRoomId() == null) {
            logger.warn("No room joined by connection {} when trying to execute method '{}'. "
                    + "Method 'joinRoom' must be the first operation called", participantPrivateId, method);
            rejectRequest(transaction, new MediaRoomException(Code.TRANSPORT_ERROR_CODE,
                    "No room joined by connection " + participantPrivateId
                            + ". Method 'joinRoom' must be the first operation called"));
            return;
        }

        rpcConnection = notificationService.addTransaction(transaction, request);
        transaction.startAsync();
        try {
            dispatch(method, rpcConnection, request);
        } catch (MediaRoomException e) {
            logger.warn("Request {} of {} failed: {}", method.getMethodName(), participantPrivateId, e.toString());
            notificationService.sendErrorResponse(participantPrivateId, request.getId(), e);
        } catch (RuntimeException e) {
            logger.error("Unexpected error handling {} of {}", method.getMethodName(), participantPrivateId, e);
            notificationService.sendErrorResponse(participantPrivateId, request.getId(),
                    new MediaRoomException(Code.GENERIC_ERROR_CODE, String.valueOf(e.getMessage()), e));
        }
    }

    /**
     * Runs one request. Must answer it through the notification service or
     * throw.
     */
    protected abstract void dispatch(RpcMethod method, RpcConnection rpcConnection, Request<JsonObject> request);

    /**
     * The connection went away, gracefully or not.
     *
     * @param networkFailure whether it was lost without a close handshake
     */
    protected abstract void onConnectionLost(RpcConnection rpcConnection, boolean networkFailure);

    private void rejectRequest(Transaction transaction, MediaRoomException error) {
        try {
            JsonObject data = new JsonObject();
            data.addProperty(ProtocolElements.ERROR_PARAM, error.getMessage());
            transaction.sendError(error.getCodeValue(), error.getMessage(), data.toString());
        } catch (Exception e) {
            logger.error("Exception rejecting request of session {}", transaction.getSession().getSessionId(), e);
        }
    }

    public static String getStringParam(Request<JsonObject> request, String key) {
        return getParam(request, key).getAsString();
    }

    /**
     * @return the value, or <code>null</code> if absent
     */
    public static String getOptionalStringParam(Request<JsonObject> request, String key) {
        if (request.getParams() == null || request.getParams().get(key) == null
                || request.getParams().get(key).isJsonNull()) {
            return null;
        }
        return request.getParams().get(key).getAsString();
    }

    public static int getIntParam(Request<JsonObject> request, String key) {
        return getParam(request, key).getAsInt();
    }

    public static boolean getBooleanParam(Request<JsonObject> request, String key) {
        return getParam(request, key).getAsBoolean();
    }

    /**
     * @return the value, or <code>false</code> if absent
     */
    public static boolean getOptionalBooleanParam(Request<JsonObject> request, String key) {
        if (request.getParams() == null || request.getParams().get(key) == null
                || request.getParams().get(key).isJsonNull()) {
            return false;
        }
        return request.getParams().get(key).getAsBoolean();
    }

    public static JsonArray getArrayParam(Request<JsonObject> request, String key) {
        JsonElement param = getParam(request, key);
        if (!param.isJsonArray()) {
            throw new MediaRoomException(Code.VALIDATION_ERROR_CODE,
                    "Request element '" + key + "' of method '" + request.getMethod() + "' must be a list");
        }
        return param.getAsJsonArray();
    }

    public static JsonObject getObjectParam(Request<JsonObject> request, String key) {
        JsonElement param = getParam(request, key);
        if (!param.isJsonObject()) {
            throw new MediaRoomException(Code.VALIDATION_ERROR_CODE,
                    "Request element '" + key + "' of method '" + request.getMethod() + "' must be an object");
        }
        return param.getAsJsonObject();
    }

    public static JsonElement getParam(Request<JsonObject> request, String key) {
        if (request.getParams() == null || request.getParams().get(key) == null
                || request.getParams().get(key).isJsonNull()) {
            throw new MediaRoomException(Code.VALIDATION_ERROR_CODE,
                    "Request element '" + key + "' is missing in method '" + request.getMethod() + "'");
        }
        return request.getParams().get(key);
    }

    public String getParticipantPrivateIdByTransaction(Transaction transaction) {
        String participantPrivateId = null;
        try {
            participantPrivateId = transaction.getSession().getSessionId();
        } catch (Throwable e) {
            logger.error("Error getting WebSocket session ID from transaction {}", transaction, e);
            throw e;
        }
        return participantPrivateId;
    }

    @Override
    public void afterConnectionEstablished(Session rpcSession) throws Exception {
        super.afterConnectionEstablished(rpcSession);
        logger.info("After connection established for WebSocket session: {}", rpcSession.getSessionId());
        if (rpcSession instanceof WebSocketServerSession) {
            InetAddress address;
            HttpHeaders headers = ((WebSocketServerSession) rpcSession).getWebSocketSession().getHandshakeHeaders();
            if (headers.containsKey("x-real-ip")) {
                address = InetAddress.getByName(headers.get("x-real-ip").get(0));
            } else {
                address = ((WebSocketServerSession) rpcSession).getWebSocketSession().getRemoteAddress().getAddress();
            }
            rpcSession.getAttributes().put("remoteAddress", address);
        }
    }

    @Override
    public void afterConnectionClosed(Session rpcSession, String status) throws Exception {
        super.afterConnectionClosed(rpcSession, status);
        String rpcSessionId = rpcSession.getSessionId();
        logger.info("After connection closed for WebSocket session: {} - Status: {}", rpcSessionId, status);
        boolean networkFailure = this.webSocketEOFTransportError.remove(rpcSessionId) != null;
        RpcConnection rpcConnection = notificationService.getRpcConnection(rpcSessionId);
        if (rpcConnection != null) {
            try {
                onConnectionLost(rpcConnection, networkFailure);
            } catch (RuntimeException e) {
                logger.error("Error cleaning up after connection {}", rpcSessionId, e);
            }
        }
        notificationService.closeRpcSession(rpcSessionId);
    }

    @Override
    public void handleTransportError(Session rpcSession, Throwable exception) throws Exception {
        logger.error("Transport exception for WebSocket session: {} - Exception: {}", rpcSession.getSessionId(),
                exception.getMessage());
        if ("IOException".equals(exception.getClass().getSimpleName()) && exception.getCause() != null
                && "Broken pipe".equals(exception.getCause().getMessage())) {
            logger.warn("Peer {} unexpectedly closed the websocket", rpcSession.getSessionId());
        }
        if ("EOFException".equals(exception.getClass().getSimpleName())) {
            // Evict the peer as disconnected by the network on "afterConnectionClosed"
            this.webSocketEOFTransportError.put(rpcSession.getSessionId(), true);
        }
    }

    @Override
    public void handleUncaughtException(Session rpcSession, Exception exception) {
        logger.error("Uncaught exception for WebSocket session: {}", rpcSession.getSessionId(), exception);
    }

    @Override
    public List<String> allowedOrigins() {
        return Arrays.asList("*");
    }
}
