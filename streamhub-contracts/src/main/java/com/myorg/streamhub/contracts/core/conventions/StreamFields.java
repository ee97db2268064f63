package com.myorg.streamhub.contracts.core.conventions;

/**
 * Field names inside a stream entry.
 */
public final class StreamFields {
    private StreamFields() {}

    // field carrying the JSON envelope
    public static final String DATA = "data";
    // older producers used this one, still read for compatibility
    public static final String PAYLOAD = "payload";
}
