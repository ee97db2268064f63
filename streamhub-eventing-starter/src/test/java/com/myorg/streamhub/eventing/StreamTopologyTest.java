package com.myorg.streamhub.eventing;

import com.myorg.streamhub.contracts.core.exception.InvalidEventTypeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamTopologyTest {

    private final StreamTopology topology = new StreamTopology(null, "order-service");

    @Test
    void mapsDomainToPluralStream() {
        assertThat(topology.streamName("order.created")).isEqualTo("events:orders");
        assertThat(topology.streamName("order.cancelled")).isEqualTo("events:orders");
        assertThat(topology.streamName("user.profile.updated")).isEqualTo("events:users");
    }

    @Test
    void resolveUsesConfiguredGroupForEveryStream() {
        assertThat(topology.resolve("order.created")).isEqualTo(new StreamRoute("events:orders", "order-service"));
        assertThat(topology.resolve("payment.captured")).isEqualTo(new StreamRoute("events:payments", "order-service"));
    }

    @Test
    void honoursCustomPrefix() {
        StreamTopology custom = new StreamTopology("shop", "billing");

        assertThat(custom.streamName("invoice.issued")).isEqualTo("shop:invoices");
        assertThat(custom.groupName()).isEqualTo("billing");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" ", "ordercreated", ".created", "order."})
    void rejectsMalformedTypes(String type) {
        assertThatThrownBy(() -> topology.resolve(type))
                .isInstanceOf(InvalidEventTypeException.class)
                .extracting("reason").isEqualTo("INVALID_EVENT_TYPE");
    }

    @Test
    void requiresGroup() {
        assertThatThrownBy(() -> new StreamTopology("events", " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
