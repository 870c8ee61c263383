package imstream.core;

/**
 * Base exception for stream and sequence errors.
 *
 * <p>I/O failures are reported as {@link java.io.IOException} instead; everything
 * else the library raises extends this class.</p>
 */
public class MediaStreamException extends RuntimeException {

    public MediaStreamException(String message) {
        super(message);
    }

    public MediaStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
