package org.mediaroom.server.core;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.client.internal.ProtocolElements;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Poll of a room. A peer may vote again, which replaces its previous vote.
 * Accessed under the lock of the owning room.
 */
public class Poll {

    private final String pollId;
    private final String question;
    private final List<String> options;
    private final int[] votes;
    private final String creatorId;
    private final String creatorUsername;
    private final boolean allowMultiple;
    private final boolean anonymous;
    private final long createdAt;

    private final Map<String, List<Integer>> votesByPeer = new LinkedHashMap<>();
    private boolean active = true;

    public Poll(String pollId, String question, List<String> options, String creatorId, String creatorUsername,
                boolean allowMultiple, boolean anonymous, long createdAt) {
        this.pollId = pollId;
        this.question = question;
        this.options = Collections.unmodifiableList(new ArrayList<>(options));
        this.votes = new int[options.size()];
        this.creatorId = creatorId;
        this.creatorUsername = creatorUsername;
        this.allowMultiple = allowMultiple;
        this.anonymous = anonymous;
        this.createdAt = createdAt;
    }

    public String getPollId() {
        return pollId;
    }

    public String getCreatorId() {
        return creatorId;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * @throws MediaRoomException VALIDATION_ERROR_CODE if the poll is closed or
     *                            the selection is empty, out of range or has
     *                            several options on a single-choice poll
     */
    void vote(String peerId, JsonArray selectedOptions) {
        if (!active) {
            throw new MediaRoomException(Code.VALIDATION_ERROR_CODE, "Poll '" + pollId + "' is closed");
        }
        Set<Integer> selection = new LinkedHashSet<>();
        if (selectedOptions != null) {
            for (JsonElement element : selectedOptions) {
                if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
                    throw new MediaRoomException(Code.VALIDATION_ERROR_CODE, "Invalid vote " + selectedOptions);
                }
                int index = element.getAsInt();
                if (index < 0 || index >= options.size()) {
                    throw new MediaRoomException(Code.VALIDATION_ERROR_CODE,
                            "Option " + index + " does not exist in poll '" + pollId + "'");
                }
                selection.add(index);
            }
        }
        if (selection.isEmpty()) {
            throw new MediaRoomException(Code.VALIDATION_ERROR_CODE, "Invalid vote: no option selected");
        }
        if (!allowMultiple && selection.size() > 1) {
            throw new MediaRoomException(Code.VALIDATION_ERROR_CODE,
                    "Poll '" + pollId + "' does not allow multiple options");
        }
        List<Integer> previous = votesByPeer.put(peerId, new ArrayList<>(selection));
        if (previous != null) {
            previous.forEach(index -> votes[index]--);
        }
        selection.forEach(index -> votes[index]++);
    }

    /**
     * @throws MediaRoomException VALIDATION_ERROR_CODE if the peer did not
     *                            create the poll
     */
    void close(String peerId) {
        if (!creatorId.equals(peerId)) {
            throw new MediaRoomException(Code.VALIDATION_ERROR_CODE,
                    "Only the creator can close poll '" + pollId + "'");
        }
        active = false;
    }

    public int[] getResults() {
        return votes.clone();
    }

    /**
     * @return number of selected options over every vote
     */
    public int getTotalVotes() {
        int total = 0;
        for (List<Integer> selection : votesByPeer.values()) {
            total += selection.size();
        }
        return total;
    }

    /**
     * @return <code>{pollId, results | finalResults, totalVotes}</code>
     */
    JsonObject resultsJson(String resultsParam) {
        JsonObject json = new JsonObject();
        json.addProperty(ProtocolElements.POLLID_PARAM, pollId);
        json.add(resultsParam, resultsArray());
        json.addProperty(ProtocolElements.TOTALVOTES_PARAM, getTotalVotes());
        return json;
    }

    private JsonArray resultsArray() {
        JsonArray results = new JsonArray();
        for (int count : votes) {
            results.add(count);
        }
        return results;
    }

    /**
     * @return the poll with its current results, as shown to joining peers
     */
    JsonObject toStateJson() {
        JsonObject json = toJson();
        json.add(ProtocolElements.POLLUPDATED_RESULTS_PARAM, resultsArray());
        json.addProperty(ProtocolElements.TOTALVOTES_PARAM, getTotalVotes());
        return json;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty(ProtocolElements.ID_PARAM, pollId);
        json.addProperty(ProtocolElements.CREATEPOLL_QUESTION_PARAM, question);
        JsonArray optionsJson = new JsonArray();
        options.forEach(optionsJson::add);
        json.add(ProtocolElements.CREATEPOLL_OPTIONS_PARAM, optionsJson);
        json.addProperty("createdBy", creatorUsername);
        json.addProperty(ProtocolElements.CREATEPOLL_ALLOWMULTIPLE_PARAM, allowMultiple);
        json.addProperty(ProtocolElements.CREATEPOLL_ANONYMOUS_PARAM, anonymous);
        json.addProperty("createdAt", createdAt);
        json.addProperty("active", active);
        return json;
    }
}
