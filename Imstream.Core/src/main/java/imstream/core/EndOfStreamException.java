package imstream.core;

/**
 * Thrown by sequential reads once the last frame has been consumed.
 */
public class EndOfStreamException extends MediaStreamException {

    public EndOfStreamException(String message) {
        super(message);
    }
}
