package com.autonomous.approval.exception;

public class NameCollisionException extends PlatformException {

    private final String channelName;

    public NameCollisionException(String operation, String channelName) {
        super(operation, "name_taken", "Channel name already taken: " + channelName);
        this.channelName = channelName;
    }

    public String getChannelName() {
        return channelName;
    }
}
