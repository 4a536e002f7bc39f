package uy.gub.bps.pocketzombies.infrastructure.websocket;

import uy.gub.bps.pocketzombies.domain.service.ChoiceKind;
import uy.gub.bps.pocketzombies.domain.service.ChoiceProvider;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.function.Consumer;

/**
 * Sends a PROMPT frame and blocks the game worker until the client answers with a CHOICE message.
 */
public class SessionChoiceProvider implements ChoiceProvider {

    private final String sessionId;
    private final Consumer<Map<String, Object>> sender;
    private final BlockingQueue<String> answers;

    public SessionChoiceProvider(String sessionId, Consumer<Map<String, Object>> sender, BlockingQueue<String> answers) {
        this.sessionId = sessionId;
        this.sender = sender;
        this.answers = answers;
    }

    @Override
    public <T> T choose(ChoiceKind kind, String prompt, List<T> options) {
        // Answers sent while nothing was being asked belong to no prompt
        answers.clear();
        sender.accept(Map.of(
            "t", "PROMPT",
            "k", kind.name(),
            "m", prompt,
            "o", options.stream().map(Object::toString).toList()
        ));

        String answer;
        try {
            answer = answers.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionClosedException(sessionId, e);
        }
        return match(options, answer);
    }

    /**
     * The first option whose label equals the answer, otherwise the only enum option whose
     * name starts with a one-letter answer, otherwise null.
     */
    static <T> T match(List<T> options, String answer) {
        String value = answer.trim();
        for (T option : options) {
            if (option.toString().equalsIgnoreCase(value)
                    || (option instanceof Enum<?> e && e.name().equalsIgnoreCase(value))) {
                return option;
            }
        }
        if (value.length() != 1) {
            return null;
        }
        String letter = value.toUpperCase(Locale.ROOT);
        List<T> byLetter = options.stream()
                .filter(o -> o instanceof Enum<?> e && e.name().startsWith(letter))
                .toList();
        return byLetter.size() == 1 ? byLetter.get(0) : null;
    }
}
