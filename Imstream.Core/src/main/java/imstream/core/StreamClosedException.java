package imstream.core;

/**
 * Thrown when a stream is used after {@code close()}.
 */
public class StreamClosedException extends MediaStreamException {

    public StreamClosedException(String message) {
        super(message);
    }
}
