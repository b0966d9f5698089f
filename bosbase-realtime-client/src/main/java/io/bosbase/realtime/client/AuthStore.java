package io.bosbase.realtime.client;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Thread-safe holder of the current auth token and auth record.
 *
 * <p>The realtime engine only reads the token, at the moment a physical connection is established.
 */
public final class AuthStore {

    /**
     * Immutable snapshot of the auth state.
     *
     * @param token the bearer token, or {@code null}
     * @param record the authenticated record, or {@code null}
     */
    public record State(String token, Map<String, Object> record) {
        public State {
            record = record == null ? null : Map.copyOf(record);
        }
    }

    private final List<Consumer<State>> listeners = new CopyOnWriteArrayList<>();
    private volatile State state;

    public AuthStore() {
        this(null, null);
    }

    public AuthStore(String token, Map<String, Object> record) {
        this.state = new State(token, record);
    }

    public String token() {
        return state.token();
    }

    public Map<String, Object> record() {
        return state.record();
    }

    public State state() {
        return state;
    }

    public boolean isValid() {
        String token = state.token();
        return token != null && !token.isEmpty();
    }

    public void save(String token, Map<String, Object> record) {
        State next = new State(token, record);
        synchronized (this) {
            state = next;
        }
        notifyListeners(next);
    }

    public void clear() {
        save(null, null);
    }

    /**
     * Registers a callback invoked after every {@link #save} or {@link #clear}.
     *
     * @return a handle that removes the callback
     */
    public Runnable onChange(Consumer<State> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void notifyListeners(State current) {
        for (Consumer<State> l : listeners) {
            l.accept(current);
        }
    }
}
