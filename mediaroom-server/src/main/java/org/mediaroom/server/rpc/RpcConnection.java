/*
 * (C) Copyright 2017-2019 OpenVidu (https://openvidu.io/)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package org.mediaroom.server.rpc;

import org.kurento.jsonrpc.Session;
import org.kurento.jsonrpc.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Signaling connection of one client. Its private id is the peer id used in
 * every room.
 */
public class RpcConnection {

    private static final Logger log = LoggerFactory.getLogger(RpcConnection.class);

    private Session session;
    private ConcurrentMap<Integer, Transaction> transactions;
    private String participantPrivateId;
    private volatile String roomId;

    public RpcConnection(Session session) {
        this.session = session;
        this.transactions = new ConcurrentHashMap<>();
        this.participantPrivateId = session.getSessionId();
    }

    public Session getSession() {
        return session;
    }

    public String getParticipantPrivateId() {
        return participantPrivateId;
    }

    /**
     * @return the room joined through this connection, <code>null</code> before
     * joinRoom or after leaveRoom
     */
    public String getRoomId() {
        return roomId;
    }

    public void setRoomId(String roomId) {
        this.roomId = roomId;
    }

    public Transaction getTransaction(Integer transactionId) {
        return transactions.get(transactionId);
    }

    public void addTransaction(Integer transactionId, Transaction t) {
        Transaction oldT = transactions.putIfAbsent(transactionId, t);
        if (oldT != null) {
            log.error("Found an existing transaction for the key {}", transactionId);
        }
    }

    public void removeTransaction(Integer transactionId) {
        transactions.remove(transactionId);
    }

    public Collection<Transaction> getTransactions() {
        return transactions.values();
    }

    @Override
    public String toString() {
        return "[privateId=" + participantPrivateId + ", roomId=" + roomId + "]";
    }
}
