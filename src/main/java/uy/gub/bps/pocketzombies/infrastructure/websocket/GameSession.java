package uy.gub.bps.pocketzombies.infrastructure.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.WebSocketSession;
import uy.gub.bps.pocketzombies.domain.model.InputMessage;
import uy.gub.bps.pocketzombies.domain.service.ActionResult;
import uy.gub.bps.pocketzombies.domain.service.GameEngine;
import uy.gub.bps.pocketzombies.infrastructure.config.GameFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * One private game bound to one connection. Actions run one at a time on a dedicated worker,
 * so the socket thread stays free to deliver answers to prompts.
 */
@Slf4j
public class GameSession {

    private final WebSocketSession session;
    private final ObjectMapper msgPackMapper;
    private final BlockingQueue<String> answers = new LinkedBlockingQueue<>();
    private final ExecutorService worker;
    private final GameEngine engine;

    public GameSession(WebSocketSession session, GameFactory gameFactory, ObjectMapper msgPackMapper) {
        this.session = session;
        this.msgPackMapper = msgPackMapper;
        this.worker = Executors.newSingleThreadExecutor(r -> new Thread(r, "game-" + session.getId()));
        this.engine = gameFactory.newGame(new SessionChoiceProvider(session.getId(), this::send, answers));
        engine.attach(new SessionObserver(this::send));
    }

    public void accept(InputMessage input) {
        if (input.getType() != null && "CHOICE".equalsIgnoreCase(input.getType())) {
            answers.offer(input.getPayload() != null ? input.getPayload() : "");
            return;
        }
        worker.execute(() -> run(input));
    }

    private void run(InputMessage input) {
        try {
            ActionResult result = engine.processInput(input);
            send(Map.of("t", "RESULT", "o", result.outcome().name(), "m", result.message()));
        } catch (SessionClosedException e) {
            log.info(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error processing {} for session {}", input, session.getId(), e);
            send(Map.of("t", "ERROR", "m", "The action could not be completed."));
        }
    }

    void send(Map<String, Object> frame) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(new BinaryMessage(msgPackMapper.writeValueAsBytes(frame)));
        } catch (IOException e) {
            log.error("Error sending message to session {}: {}", session.getId(), e.getMessage());
        }
    }

    public GameEngine getEngine() {
        return engine;
    }

    public void close() {
        // Interrupts a worker blocked on a prompt
        worker.shutdownNow();
    }
}
