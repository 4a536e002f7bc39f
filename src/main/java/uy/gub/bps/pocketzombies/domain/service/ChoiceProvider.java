package uy.gub.bps.pocketzombies.domain.service;

import java.util.List;

/**
 * Asks the player to pick one of a fixed set of options in the middle of a turn.
 * Implementations block until an answer is available. An answer outside {@code options}
 * (or null) is treated as invalid and the engine asks again.
 */
public interface ChoiceProvider {

    enum Encounter {
        FIGHT,
        RUN
    }

    enum Confirmation {
        YES,
        NO
    }

    <T> T choose(ChoiceKind kind, String prompt, List<T> options);
}
