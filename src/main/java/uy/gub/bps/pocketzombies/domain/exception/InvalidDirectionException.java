package uy.gub.bps.pocketzombies.domain.exception;

public class InvalidDirectionException extends IllegalArgumentException {

    public InvalidDirectionException(String direction) {
        super(direction + " is not a valid exit direction");
    }
}
