package org.mediaroom.server.engine;

import com.google.gson.JsonObject;

/**
 * Receives the local ICE candidates an engine gathers for a client transport.
 */
public interface CandidateListener {

    void onLocalCandidate(String transportId, JsonObject candidate);
}
