package uy.gub.bps.pocketzombies.infrastructure.websocket;

/**
 * Raised on the game worker when the connection goes away while a prompt is waiting for an answer.
 */
public class SessionClosedException extends RuntimeException {

    public SessionClosedException(String sessionId, Throwable cause) {
        super("Session " + sessionId + " closed while waiting for an answer", cause);
    }
}
