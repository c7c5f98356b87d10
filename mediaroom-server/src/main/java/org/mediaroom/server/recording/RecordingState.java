package org.mediaroom.server.recording;

/**
 * Life cycle of the recording of a room. Transitions only move forward.
 */
public enum RecordingState {

    IDLE, STARTING, ACTIVE, STOPPING, FINALIZED;

    public boolean canMoveTo(RecordingState next) {
        return next.ordinal() > this.ordinal();
    }
}
