package io.bosbase.realtime.json.spi;

/**
 * Failure to write a value as JSON or to read one back.
 *
 * <p>Read failures keep the start of the offending text so that malformed frames can be logged
 * without dumping whole payloads.
 */
public class JsonException extends Exception {

    static final int EXCERPT_LENGTH = 64;

    private final String excerpt;

    public JsonException(String message) {
        this(message, null, null);
    }

    public JsonException(String message, Throwable cause) {
        this(message, null, cause);
    }

    /**
     * @param input the text that could not be read, abbreviated to {@value #EXCERPT_LENGTH} characters
     */
    public JsonException(String message, String input, Throwable cause) {
        super(message, cause);
        this.excerpt = abbreviate(input);
    }

    /**
     * @return the beginning of the unreadable input, or {@code null} for write failures
     */
    public String excerpt() {
        return excerpt;
    }

    private static String abbreviate(String input) {
        if (input == null || input.length() <= EXCERPT_LENGTH) return input;
        return input.substring(0, EXCERPT_LENGTH) + "...";
    }
}
