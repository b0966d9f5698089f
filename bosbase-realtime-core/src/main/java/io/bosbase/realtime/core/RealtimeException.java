package io.bosbase.realtime.core;

/**
 * Base class for realtime engine failures.
 *
 * <p>All failures are delivered to the caller awaiting the affected operation, either thrown
 * directly (validation) or as the cause of a failed {@link java.util.concurrent.CompletableFuture}.
 * None of them is fatal to the engine.
 */
public abstract class RealtimeException extends RuntimeException {

    protected RealtimeException(String message) {
        super(message);
    }

    protected RealtimeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when the transport could not be established or was closed.
     */
    public static class ConnectionFailure extends RealtimeException {
        public ConnectionFailure(String message) {
            super(message);
        }

        public ConnectionFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when the server did not complete the handshake within the configured bound.
     */
    public static class HandshakeTimeout extends ConnectionFailure {
        public HandshakeTimeout(String message) {
            super(message);
        }

        public HandshakeTimeout(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when no acknowledgement for a request id arrived in time.
     */
    public static class AckTimeout extends RealtimeException {
        private final String requestId;

        public AckTimeout(String requestId, String message) {
            super(message);
            this.requestId = requestId;
        }

        public String requestId() {
            return requestId;
        }
    }

    /**
     * Raised when the server answered a request with an explicit error frame.
     */
    public static class ServerError extends RealtimeException {
        private final String requestId;

        public ServerError(String requestId, String message) {
            super(message);
            this.requestId = requestId;
        }

        public String requestId() {
            return requestId;
        }
    }

    /**
     * Raised synchronously, before any network activity, when arguments are invalid.
     */
    public static class Validation extends RealtimeException {
        public Validation(String message) {
            super(message);
        }

        public Validation(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
