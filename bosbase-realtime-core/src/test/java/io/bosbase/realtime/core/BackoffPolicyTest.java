package io.bosbase.realtime.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    @Test
    void defaultTable() {
        BackoffPolicy policy = BackoffPolicy.defaults();

        assertThat(policy.delay(0)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.delay(3)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delay(6)).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void clampsToLastInterval() {
        BackoffPolicy policy = BackoffPolicy.of(Duration.ofMillis(10), Duration.ofMillis(50));

        assertThat(policy.delay(1)).isEqualTo(Duration.ofMillis(50));
        assertThat(policy.delay(100)).isEqualTo(Duration.ofMillis(50));
    }

    @Test
    void rejectsInvalidInput() {
        assertThatThrownBy(() -> new BackoffPolicy(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BackoffPolicy.of(Duration.ofMillis(-1))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BackoffPolicy.defaults().delay(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
