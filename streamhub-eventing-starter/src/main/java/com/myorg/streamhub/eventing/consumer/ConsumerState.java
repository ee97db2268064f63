package com.myorg.streamhub.eventing.consumer;

public enum ConsumerState {
    IDLE,
    SUBSCRIBED,
    RUNNING,
    // terminal
    STOPPED
}
