package com.myorg.streamhub.eventing;

/**
 * Where an event type lives: the stream it is appended to and the group that reads it.
 */
public record StreamRoute(String stream, String group) {}
