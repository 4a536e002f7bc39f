package uy.gub.bps.pocketzombies.domain.service;

/**
 * What happened to a requested action. Only {@link Outcome#ACCEPTED} changes game state.
 */
public record ActionResult(Outcome outcome, String message) {

    public enum Outcome {
        ACCEPTED,
        // bad input or an action that is not allowed right now
        REJECTED,
        // the deck the action needed is empty
        EXHAUSTED,
        GAME_OVER
    }

    public static ActionResult accepted(String message) {
        return new ActionResult(Outcome.ACCEPTED, message);
    }

    public static ActionResult rejected(String message) {
        return new ActionResult(Outcome.REJECTED, message);
    }

    public static ActionResult exhausted(String message) {
        return new ActionResult(Outcome.EXHAUSTED, message);
    }

    public static ActionResult gameOver(String message) {
        return new ActionResult(Outcome.GAME_OVER, message);
    }

    public boolean isAccepted() {
        return outcome == Outcome.ACCEPTED;
    }
}
