package uy.gub.bps.pocketzombies.domain.model;

public enum GameStatus {
    IN_PROGRESS(false, null),
    WON(true, "All zombies collapse. You WIN!"),
    LOST_HEALTH(true, "You died. GAME OVER!"),
    LOST_TIME(true, "You ran out of time. GAME OVER!");

    public final boolean terminal;
    public final String message;

    GameStatus(boolean terminal, String message) {
        this.terminal = terminal;
        this.message = message;
    }
}
