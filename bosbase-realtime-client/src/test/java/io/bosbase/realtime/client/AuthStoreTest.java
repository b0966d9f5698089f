package io.bosbase.realtime.client;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AuthStoreTest {

    @Test
    void saveAndClearNotifyListeners() {
        AuthStore store = new AuthStore();
        List<AuthStore.State> changes = new ArrayList<>();
        Runnable remove = store.onChange(changes::add);

        assertThat(store.isValid()).isFalse();
        store.save("tok", Map.of("id", "u1"));
        assertThat(store.isValid()).isTrue();
        assertThat(store.token()).isEqualTo("tok");
        assertThat(store.record()).containsEntry("id", "u1");

        store.clear();
        assertThat(store.token()).isNull();

        remove.run();
        store.save("other", null);

        assertThat(changes).hasSize(2);
        assertThat(changes.get(0).token()).isEqualTo("tok");
        assertThat(changes.get(1).token()).isNull();
    }
}
