package imstream.core;

/**
 * Thrown when a file extension matches neither the image nor the video formats.
 */
public class UnsupportedFormatException extends MediaStreamException {

    public UnsupportedFormatException(String message) {
        super(message);
    }
}
