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

package org.mediaroom.java.client;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State of one room recording, from the start request until every output file
 * has been finalized.
 */
public class RecordingInfo {

	/**
	 * See {@link RecordingInfo#getStatus()}
	 */
	public enum Status {

		/**
		 * Capture pipelines are being attached (cannot be stopped yet)
		 */
		starting,

		/**
		 * The recording has started and is going on
		 */
		started,

		/**
		 * Capture processes are being shut down
		 */
		stopping,

		/**
		 * The recording has finished OK
		 */
		stopped,

		/**
		 * The recording has failed
		 */
		failed;
	}

	/**
	 * See {@link RecordingInfo#getOutputMode()}
	 */
	public enum OutputMode {

		/**
		 * Mix every peer into a single archive (audio mixed, video tiled in a grid)
		 */
		COMPOSED,

		/**
		 * Record each peer into its own archive
		 */
		INDIVIDUAL;
	}

	private RecordingInfo.Status status;

	private String id;
	private String roomId;
	private String startedBy;
	private long startedAt; // milliseconds (UNIX Epoch time)
	private long endedAt;
	private RecordingProperties recordingProperties;
	private final List<RecordingFile> files = Collections.synchronizedList(new ArrayList<>());

	public RecordingInfo(String roomId, String id, String startedBy, RecordingProperties recordingProperties) {
		this.roomId = roomId;
		this.id = id;
		this.startedBy = startedBy;
		this.startedAt = System.currentTimeMillis();
		this.status = Status.starting;
		this.recordingProperties = recordingProperties;
	}

	public RecordingInfo(JsonObject json) {
		this.id = json.get("recordingId").getAsString();
		this.roomId = json.get("roomId").getAsString();
		this.startedBy = json.has("startedBy") && !json.get("startedBy").isJsonNull()
				? json.get("startedBy").getAsString()
				: null;
		this.startedAt = json.get("startedAt").getAsLong();
		this.endedAt = json.has("endedAt") ? json.get("endedAt").getAsLong() : 0;
		this.status = json.has("status") ? Status.valueOf(json.get("status").getAsString()) : Status.stopped;
		RecordingProperties.Builder builder = new RecordingProperties.Builder()
				.outputMode(OutputMode.valueOf(json.get("outputMode").getAsString()));
		if (json.has("name")) {
			builder.name(json.get("name").getAsString());
		}
		this.recordingProperties = builder.build();
		if (json.has("files")) {
			for (JsonElement file : json.getAsJsonArray("files")) {
				this.files.add(new RecordingFile(file.getAsJsonObject()));
			}
		}
	}

	public JsonObject toJson() {
		JsonObject json = new JsonObject();
		json.addProperty("recordingId", this.id);
		json.addProperty("roomId", this.roomId);
		json.addProperty("name", this.recordingProperties.name());
		json.addProperty("outputMode", this.getOutputMode().name());
		json.addProperty("startedBy", this.startedBy);
		json.addProperty("startedAt", this.startedAt);
		json.addProperty("endedAt", this.endedAt);
		json.addProperty("status", this.status.name());
		JsonArray filesJson = new JsonArray();
		for (RecordingFile file : this.getFiles()) {
			filesJson.add(file.toJson());
		}
		json.add("files", filesJson);
		return json;
	}

	public RecordingProperties getRecordingProperties() {
		return this.recordingProperties;
	}

	public void setStatus(Status status) {
		this.status = status;
	}

	/**
	 * Status of the recording
	 */
	public RecordingInfo.Status getStatus() {
		return status;
	}

	/**
	 * Recording unique identifier, <code>ROOM_ID-START_MILLIS</code>
	 */
	public String getId() {
		return id;
	}

	public String getName() {
		return this.recordingProperties.name();
	}

	/**
	 * Mode of recording: COMPOSED for a single archive or INDIVIDUAL for one
	 * archive for each peer
	 */
	public OutputMode getOutputMode() {
		return this.recordingProperties.outputMode();
	}

	/**
	 * Room associated to the recording
	 */
	public String getRoomId() {
		return roomId;
	}

	/**
	 * Identifier of the peer that requested the recording
	 */
	public String getStartedBy() {
		return startedBy;
	}

	public void setStartedAt(long startedAt) {
		this.startedAt = startedAt;
	}

	/**
	 * Time when the recording started in UTC milliseconds
	 */
	public long getStartedAt() {
		return startedAt;
	}

	public void setEndedAt(long endedAt) {
		this.endedAt = endedAt;
	}

	/**
	 * Time when the recording was finalized in UTC milliseconds (0 until stopped)
	 */
	public long getEndedAt() {
		return endedAt;
	}

	public void addFile(RecordingFile file) {
		this.files.add(file);
	}

	/**
	 * Finalized output files. Empty until the recording is stopped
	 */
	public List<RecordingFile> getFiles() {
		synchronized (this.files) {
			return new ArrayList<>(this.files);
		}
	}

	/**
	 * Sum of the sizes of every finalized file, in bytes
	 */
	public long getSize() {
		long size = 0;
		for (RecordingFile file : this.getFiles()) {
			size += file.getSize();
		}
		return size;
	}

	public boolean hasAudio() {
		return this.recordingProperties.hasAudio();
	}

	public boolean hasVideo() {
		return this.recordingProperties.hasVideo();
	}

}
