package uy.gub.bps.pocketzombies.domain.service;

import uy.gub.bps.pocketzombies.domain.exception.InvalidDirectionException;
import uy.gub.bps.pocketzombies.domain.model.Direction;
import uy.gub.bps.pocketzombies.domain.model.GameSnapshot;
import uy.gub.bps.pocketzombies.domain.model.GameStatus;
import uy.gub.bps.pocketzombies.domain.model.InputMessage;

import java.util.Locale;

public interface GameEngine {
    void attach(GameObserver observer);

    void detach(GameObserver observer);

    ActionResult move(Direction direction);

    ActionResult bash(Direction direction);

    ActionResult cower();

    ActionResult findOrBuryTotem();

    ActionResult inspect();

    GameSnapshot getCurrentState();

    GameStatus getStatus();

    default ActionResult processInput(InputMessage input) {
        if (input == null || input.getType() == null) {
            return ActionResult.rejected("Empty command.");
        }
        try {
            return switch (input.getType().toUpperCase(Locale.ROOT)) {
                case "MOVE", "GO" -> move(Direction.parse(input.getPayload()));
                case "BASH" -> bash(Direction.parse(input.getPayload()));
                case "COWER" -> cower();
                case "TOTEM" -> findOrBuryTotem();
                case "DETAILS", "INSPECT" -> inspect();
                default -> ActionResult.rejected("Unknown command '" + input.getType() + "'.");
            };
        } catch (InvalidDirectionException e) {
            return ActionResult.rejected("Invalid direction. Please enter 'N', 'E', 'S', or 'W'.");
        }
    }
}
