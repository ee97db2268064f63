package com.myorg.streamhub.eventing.codec;

import com.myorg.streamhub.contracts.core.envelope.EventEnvelope;
import com.myorg.streamhub.contracts.core.exception.MalformedEnvelopeException;

/**
 * Text form of an {@link EventEnvelope} as stored in a stream entry.
 */
public interface EnvelopeCodec {

    /** Canonical camelCase JSON, null fields omitted. */
    default String encode(EventEnvelope envelope) {
        return encode(envelope, FieldDialect.CAMEL_CASE);
    }

    String encode(EventEnvelope envelope, FieldDialect dialect);

    /**
     * Parses either dialect into the single internal representation.
     *
     * @throws MalformedEnvelopeException when the text is not a JSON object or lacks the event id or type
     */
    EventEnvelope decode(String raw);
}
