package org.mediaroom.server.rpc;

import com.google.gson.JsonObject;
import org.kurento.jsonrpc.Session;
import org.kurento.jsonrpc.Transaction;
import org.kurento.jsonrpc.message.Request;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.internal.ProtocolElements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class RpcNotificationService {

    private static final Logger log = LoggerFactory.getLogger(RpcNotificationService.class);

    private ConcurrentMap<String, RpcConnection> rpcConnections = new ConcurrentHashMap<>();

    public RpcConnection newRpcConnection(Transaction t, Request<JsonObject> request) {
        String participantPrivateId = t.getSession().getSessionId();
        RpcConnection connection = new RpcConnection(t.getSession());
        RpcConnection oldConnection = rpcConnections.putIfAbsent(participantPrivateId, connection);
        if (oldConnection != null) {
            log.warn("Concurrent initialization of rpcSession #{}", participantPrivateId);
            connection = oldConnection;
        }
        return connection;
    }

    public RpcConnection addTransaction(Transaction t, Request<JsonObject> request) {
        String participantPrivateId = t.getSession().getSessionId();
        RpcConnection connection = rpcConnections.get(participantPrivateId);
        connection.addTransaction(request.getId(), t);
        return connection;
    }

    public void sendResponse(String participantPrivateId, Integer transactionId, Object result) {
        Transaction t = getAndRemoveTransaction(participantPrivateId, transactionId);
        if (t == null) {
            log.error("No transaction {} found for paticipant with private id {}, unable to send result {}",
                    transactionId, participantPrivateId, result);
            return;
        }
        try {
            t.sendResponse(result);
        } catch (Exception e) {
            log.error("Exception responding to participant ({})", participantPrivateId, e);
        }
    }

    /**
     * Answers with a JSON-RPC error whose data is <code>{"error": message}</code>.
     */
    public void sendErrorResponse(String participantPrivateId, Integer transactionId, MediaRoomException error) {
        Transaction t = getAndRemoveTransaction(participantPrivateId, transactionId);
        if (t == null) {
            log.error("No transaction {} found for paticipant with private id {}, unable to send error {}",
                    transactionId, participantPrivateId, error.getMessage());
            return;
        }
        try {
            JsonObject data = new JsonObject();
            data.addProperty(ProtocolElements.ERROR_PARAM, error.getMessage());
            t.sendError(error.getCodeValue(), error.getMessage(), data.toString());
        } catch (Exception e) {
            log.error("Exception sending error response to user ({})", transactionId, e);
        }
    }

    /**
     * Best effort: a client that is already gone is logged and skipped.
     */
    public void sendNotification(final String participantPrivateId, final String method, final Object params) {
        RpcConnection rpcSession = rpcConnections.get(participantPrivateId);
        if (rpcSession == null || rpcSession.getSession() == null) {
            log.warn("No rpc session found for private id {}, unable to send notification {}: {}",
                    participantPrivateId, method, params);
            return;
        }
        Session s = rpcSession.getSession();

        try {
            if (params != null)
                s.sendNotification(method, params);
            else
                s.sendNotification(method);
        } catch (Exception e) {
            log.error("Exception sending notification '{}': {} to participant with private id {}", method, params,
                    participantPrivateId, e);
        }
    }

    public RpcConnection closeRpcSession(String participantPrivateId) {
        RpcConnection rpcSession = rpcConnections.remove(participantPrivateId);
        if (rpcSession == null || rpcSession.getSession() == null) {
            log.error("No session found for private id {}, unable to cleanup", participantPrivateId);
            return null;
        }
        Session s = rpcSession.getSession();
        try {
            s.close();
            log.info("Closed session for participant with private id {}", participantPrivateId);
            this.showRpcConnections();
            return rpcSession;
        } catch (IOException e) {
            log.error("Error closing session for participant with private id {}", participantPrivateId, e);
        }
        return rpcSession;
    }

    private Transaction getAndRemoveTransaction(String participantPrivateId, Integer transactionId) {
        RpcConnection rpcSession = rpcConnections.get(participantPrivateId);
        if (rpcSession == null) {
            log.warn("Invalid WebSocket session id {}", participantPrivateId);
            return null;
        }
        log.trace("#{} - {} transactions", participantPrivateId, rpcSession.getTransactions().size());
        Transaction t = rpcSession.getTransaction(transactionId);
        rpcSession.removeTransaction(transactionId);
        return t;
    }

    public void showRpcConnections() {
        log.info("<PRIVATE_ID, RPC_CONNECTION>: {}", this.rpcConnections.toString());
    }

    public RpcConnection getRpcConnection(String participantPrivateId) {
        return this.rpcConnections.get(participantPrivateId);
    }

    public Collection<RpcConnection> getRpcConnections() {
        return rpcConnections.values();
    }

}
