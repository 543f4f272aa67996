package com.example.realtime.shared.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionKeysTest {

    @Test
    @DisplayName("Key is the upper-cased event type followed by the comma-joined params")
    void encodesEventTypeAndParams() {
        assertThat(SubscriptionKeys.encode("deployment", List.of("repo-1", "main")))
                .isEqualTo("DEPLOYMENT:REPO-1,MAIN");
    }

    @Test
    void sameInputsAlwaysGiveSameKey() {
        List<String> params = List.of("a", "b");

        assertThat(SubscriptionKeys.encode("foo", params))
                .isEqualTo(SubscriptionKeys.encode("foo", params))
                .isEqualTo(SubscriptionKeys.encode("foo", List.of("a", "b")));
    }

    @Test
    void keyIsCaseInsensitive() {
        assertThat(SubscriptionKeys.encode("Foo", List.of("Bar")))
                .isEqualTo(SubscriptionKeys.encode("FOO", List.of("bar")));
    }

    @Test
    void parameterOrderMatters() {
        assertThat(SubscriptionKeys.encode("foo", List.of("a", "b")))
                .isNotEqualTo(SubscriptionKeys.encode("foo", List.of("b", "a")));
    }

    @Test
    void emptyAndMissingParamsEncodeTheSame() {
        assertThat(SubscriptionKeys.encode("user_context_change", List.of())).isEqualTo("USER_CONTEXT_CHANGE:");
        assertThat(SubscriptionKeys.encode("user_context_change", null)).isEqualTo("USER_CONTEXT_CHANGE:");
    }

    @Test
    void extractsEventTypeFromKey() {
        assertThat(SubscriptionKeys.eventTypeOf("DEPLOYMENT:REPO-1")).isEqualTo("DEPLOYMENT");
        assertThat(SubscriptionKeys.eventTypeOf("PLAIN")).isEqualTo("PLAIN");
    }
}
