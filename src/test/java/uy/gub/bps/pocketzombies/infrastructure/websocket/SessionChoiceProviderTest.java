package uy.gub.bps.pocketzombies.infrastructure.websocket;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uy.gub.bps.pocketzombies.domain.model.Direction;
import uy.gub.bps.pocketzombies.domain.model.Item;
import uy.gub.bps.pocketzombies.domain.service.ChoiceKind;
import uy.gub.bps.pocketzombies.domain.service.ChoiceProvider.Confirmation;
import uy.gub.bps.pocketzombies.domain.service.ChoiceProvider.Encounter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.LinkedBlockingQueue;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Session choice provider")
class SessionChoiceProviderTest {

    @Nested
    @DisplayName("Matching answers")
    class Matching {

        @Test
        @DisplayName("Should match option labels and enum names in any case")
        void exactMatch() {
            assertEquals(Encounter.RUN, SessionChoiceProvider.match(List.of(Encounter.FIGHT, Encounter.RUN), "run"));
            assertEquals(Direction.EAST, SessionChoiceProvider.match(List.of(Direction.NORTH, Direction.EAST), "east"));
            assertEquals(Item.GOLF_CLUB, SessionChoiceProvider.match(List.of(Item.CANDLE, Item.GOLF_CLUB), "golf club"));
        }

        @Test
        @DisplayName("Should accept a single letter only when one option starts with it")
        void letterShortcut() {
            assertEquals(Confirmation.YES, SessionChoiceProvider.match(List.of(Confirmation.YES, Confirmation.NO), "y"));
            assertEquals(Encounter.FIGHT, SessionChoiceProvider.match(List.of(Encounter.FIGHT, Encounter.RUN), " F "));
            assertNull(SessionChoiceProvider.match(List.of(Item.GOLF_CLUB, Item.GRISLY_FEMUR), "G"));
        }

        @Test
        @DisplayName("Should return null for an answer that fits no option")
        void noMatch() {
            assertNull(SessionChoiceProvider.match(List.of(Encounter.FIGHT, Encounter.RUN), "hide"));
            assertNull(SessionChoiceProvider.match(List.of(Direction.NORTH), "S"));
            assertNull(SessionChoiceProvider.match(List.of(Direction.NORTH), ""));
        }
    }

    @Nested
    @DisplayName("Prompting")
    class Prompting {

        private final List<Map<String, Object>> sent = new CopyOnWriteArrayList<>();
        private final BlockingQueue<String> answers = new LinkedBlockingQueue<>();
        private SessionChoiceProvider provider;

        @BeforeEach
        void setUp() {
            provider = new SessionChoiceProvider("s1", sent::add, answers);
        }

        @Test
        @DisplayName("Should send a PROMPT frame and return the queued answer")
        void choose_sendsPromptAndWaitsForAnswer() {
            answers.offer("W");

            Direction chosen = provider.choose(ChoiceKind.ENTRY_SIDE, "Choose a side",
                    List.of(Direction.NORTH, Direction.EAST, Direction.WEST));

            assertEquals(Direction.WEST, chosen);
            assertEquals(1, sent.size());
            Map<String, Object> prompt = sent.get(0);
            assertEquals("PROMPT", prompt.get("t"));
            assertEquals("ENTRY_SIDE", prompt.get("k"));
            assertEquals("Choose a side", prompt.get("m"));
            assertEquals(List.of("N", "E", "W"), prompt.get("o"));
        }

        @Test
        @DisplayName("Should ignore an answer that arrived before the prompt was sent")
        void earlyAnswer_isNotUsedForNextPrompt() throws Exception {
            answers.offer("W");

            CompletableFuture<Direction> chosen = CompletableFuture.supplyAsync(() -> provider.choose(
                    ChoiceKind.ENTRY_SIDE, "Choose a side", List.of(Direction.NORTH, Direction.WEST)));
            for (int i = 0; i < 200 && sent.isEmpty(); i++) {
                Thread.sleep(10);
            }
            assertEquals(1, sent.size(), "prompt sent");
            assertFalse(chosen.isDone(), "must wait for an answer to this prompt");
            answers.offer("N");

            assertEquals(Direction.NORTH, chosen.get(2, TimeUnit.SECONDS));
            assertEquals(1, sent.size());
        }

        @Test
        @DisplayName("Should give up with the thread still interrupted when the session goes away")
        void interrupted_throwsSessionClosed() {
            Thread.currentThread().interrupt();

            SessionClosedException e = assertThrows(SessionClosedException.class,
                    () -> provider.choose(ChoiceKind.FIGHT_OR_RUN, "Fight?", List.of(Encounter.FIGHT)));

            assertTrue(Thread.interrupted());
            assertTrue(e.getMessage().contains("s1"));
        }
    }
}
