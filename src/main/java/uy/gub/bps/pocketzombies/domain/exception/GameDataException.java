package uy.gub.bps.pocketzombies.domain.exception;

/**
 * Thrown when tile or event card data cannot be loaded or is malformed.
 */
public class GameDataException extends RuntimeException {

    public GameDataException(String message) {
        super(message);
    }

    public GameDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
