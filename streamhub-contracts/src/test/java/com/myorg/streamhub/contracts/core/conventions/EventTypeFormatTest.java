package com.myorg.streamhub.contracts.core.conventions;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class EventTypeFormatTest {

    @ParameterizedTest
    @ValueSource(strings = {"order.created", "user.profile.updated", "a.b"})
    void acceptsDomainDotAction(String type) {
        assertThat(EventTypeFormat.isValid(type)).isTrue();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "ordercreated", ".created", "order."})
    void rejectsEverythingElse(String type) {
        assertThat(EventTypeFormat.isValid(type)).isFalse();
    }
}
