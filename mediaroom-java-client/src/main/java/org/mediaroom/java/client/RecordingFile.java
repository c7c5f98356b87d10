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

import com.google.gson.JsonObject;

/**
 * One finalized output file of a recording
 */
public class RecordingFile {

	private String peerId;
	private String username;
	private String file;
	private String path;
	private long size; // bytes
	private double duration; // seconds
	private boolean hasVideo;

	public RecordingFile(String peerId, String username, String file, String path, long size, double duration,
			boolean hasVideo) {
		this.peerId = peerId;
		this.username = username;
		this.file = file;
		this.path = path;
		this.size = size;
		this.duration = duration;
		this.hasVideo = hasVideo;
	}

	public RecordingFile(JsonObject json) {
		this.peerId = json.has("peerId") && !json.get("peerId").isJsonNull() ? json.get("peerId").getAsString()
				: null;
		this.username = json.has("username") && !json.get("username").isJsonNull()
				? json.get("username").getAsString()
				: null;
		this.file = json.get("file").getAsString();
		this.path = json.has("path") && !json.get("path").isJsonNull() ? json.get("path").getAsString() : null;
		this.size = json.get("size").getAsLong();
		this.duration = json.has("duration") ? json.get("duration").getAsDouble() : 0;
		this.hasVideo = json.has("hasVideo") && json.get("hasVideo").getAsBoolean();
	}

	public JsonObject toJson() {
		JsonObject json = new JsonObject();
		json.addProperty("peerId", this.peerId);
		json.addProperty("username", this.username);
		json.addProperty("file", this.file);
		json.addProperty("path", this.path);
		json.addProperty("size", this.size);
		json.addProperty("duration", this.duration);
		json.addProperty("hasVideo", this.hasVideo);
		return json;
	}

	/**
	 * Peer captured in this file. <code>null</code> for a composed file
	 */
	public String getPeerId() {
		return peerId;
	}

	public String getUsername() {
		return username;
	}

	/**
	 * File name, without directories
	 */
	public String getFile() {
		return file;
	}

	/**
	 * Location of the file once handed to the recording storage
	 */
	public String getPath() {
		return path;
	}

	public void setPath(String path) {
		this.path = path;
	}

	public long getSize() {
		return size;
	}

	public double getDuration() {
		return duration;
	}

	/**
	 * <code>false</code> for audio-only captures
	 */
	public boolean hasVideo() {
		return hasVideo;
	}

}
