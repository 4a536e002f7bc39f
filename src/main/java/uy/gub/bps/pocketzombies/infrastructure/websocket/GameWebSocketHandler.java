package uy.gub.bps.pocketzombies.infrastructure.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.msgpack.jackson.dataformat.MessagePackFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import uy.gub.bps.pocketzombies.domain.model.InputMessage;
import uy.gub.bps.pocketzombies.infrastructure.config.GameFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class GameWebSocketHandler extends AbstractWebSocketHandler {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final GameFactory gameFactory;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper msgPackMapper;
    private final Map<String, GameSession> games = new ConcurrentHashMap<>();

    public GameWebSocketHandler(GameFactory gameFactory) {
        this.gameFactory = gameFactory;
        this.jsonMapper = new ObjectMapper();
        this.msgPackMapper = new ObjectMapper(new MessagePackFactory());
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String sessionId = session.getId();
        // Prompts and results are sent from the game worker, snapshots may come from here
        WebSocketSession safeSession = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);

        byte[] payload = msgPackMapper.writeValueAsBytes(Map.of(
            "t", "WELCOME",
            "si", sessionId,
            "bs", gameFactory.boardSize()
        ));
        safeSession.sendMessage(new BinaryMessage(payload));

        games.put(sessionId, new GameSession(safeSession, gameFactory, msgPackMapper));
        log.info("New game for connection {}", sessionId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        handleInput(session, message.getPayload().getBytes(StandardCharsets.UTF_8));
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) throws Exception {
        handleInput(session, message.getPayload().array());
    }

    private void handleInput(WebSocketSession session, byte[] payload) throws IOException {
        GameSession game = games.get(session.getId());
        if (game == null) {
            return;
        }
        InputMessage input;
        if (payload.length > 0 && payload[0] == '{') { // JSON from a plain text client
            input = jsonMapper.readValue(payload, InputMessage.class);
        } else {
            input = msgPackMapper.readValue(payload, InputMessage.class);
        }
        log.debug("Input from {}: {}", session.getId(), input);
        game.accept(input);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        GameSession game = games.remove(session.getId());
        if (game != null) {
            game.close();
        }
        log.info("Connection closed: {} ({})", session.getId(), status);
    }

    int activeGames() {
        return games.size();
    }
}
