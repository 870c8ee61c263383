package imstream.core;

/**
 * Thrown when a file name carries no frame number, so no sequence can be derived from it.
 */
public class SequenceDetectionException extends MediaStreamException {

    public SequenceDetectionException(String message) {
        super(message);
    }
}
