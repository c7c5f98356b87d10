package org.mediaroom.server.core;

public enum EndReason {

	leaveRoom,
	disconnect,
	networkDisconnect,
	lastParticipantLeft,
	inactivityTimeout,
	mediaServerDisconnect,
	mediaRoomServerStopped,
	recordingStoppedByUser,
	recordingStoppedByServer,
	recordingSubprocessFailed,
	automaticStop,
	roomClosedByServer

}
