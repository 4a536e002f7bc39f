package uy.gub.bps.pocketzombies.domain.service;

import lombok.extern.slf4j.Slf4j;
import uy.gub.bps.pocketzombies.domain.model.Board;
import uy.gub.bps.pocketzombies.domain.model.Coordinate;
import uy.gub.bps.pocketzombies.domain.model.Direction;
import uy.gub.bps.pocketzombies.domain.model.EventCard;
import uy.gub.bps.pocketzombies.domain.model.EventContent;
import uy.gub.bps.pocketzombies.domain.model.GameSnapshot;
import uy.gub.bps.pocketzombies.domain.model.GameStatus;
import uy.gub.bps.pocketzombies.domain.model.Item;
import uy.gub.bps.pocketzombies.domain.model.Player;
import uy.gub.bps.pocketzombies.domain.model.Tile;
import uy.gub.bps.pocketzombies.domain.model.TilePlacement;
import uy.gub.bps.pocketzombies.domain.service.ChoiceProvider.Confirmation;
import uy.gub.bps.pocketzombies.domain.service.ChoiceProvider.Encounter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turn state machine for one game. Every public action runs to completion, including any
 * choices it has to ask for, before it returns. Not thread safe: callers serialize actions.
 */
@Slf4j
public class GameEngineImpl implements GameEngine {

    static final int BASH_ZOMBIES = 3;
    static final int MAX_ZOMBIE_DAMAGE = 4;
    static final int COWER_HEALTH = 3;
    static final int ROOM_HEALTH = 1;
    static final int ESCAPE_COST = 1;

    static final String DINING_ROOM = "Dining Room";
    static final String EVIL_TEMPLE = "Evil Temple";
    static final String GRAVEYARD = "Graveyard";
    static final String KITCHEN = "Kitchen";
    static final String GARDEN = "Garden";
    static final String STORAGE = "Storage";

    private final Board board;
    private final Player player;
    private final ChoiceProvider choices;
    private final List<GameObserver> observers = new ArrayList<>();

    private boolean turnSequenceCompleted;
    private GameStatus status = GameStatus.IN_PROGRESS;

    public GameEngineImpl(Board board, Player player, ChoiceProvider choices) {
        this.board = board;
        this.player = player;
        this.choices = choices;
    }

    @Override
    public void attach(GameObserver observer) {
        observers.add(observer);
        // Bring a late observer up to date with the map drawn so far
        for (Map.Entry<Coordinate, Tile> placed : board.getTileMap().entrySet()) {
            observer.onTilePlaced(new TilePlacement(placed.getValue().view(), placed.getKey()));
        }
        observer.onSnapshot(getCurrentState());
    }

    @Override
    public void detach(GameObserver observer) {
        observers.remove(observer);
    }

    @Override
    public ActionResult move(Direction direction) {
        ActionResult refused = refuseIfOver();
        if (refused != null) return refused;

        Tile room = currentRoom();
        if (direction == null || !room.hasExit(direction)) {
            return reject("Invalid direction. Choose from: " + room.possibleExits());
        }

        Coordinate target = player.getLocation().step(direction);
        if (board.isExplored(target)) {
            Tile next = board.getTile(target);
            if (!next.hasExit(direction.opposite())) {
                return reject("This exit is blocked by a wall from another room.");
            }
            player.setLocation(target);
            log.info("Player moved {} into the {} at {}", direction, next.getName(), target);
            resolveDevCard();
        } else {
            Board.TileDraw draw = board.drawTile(room);
            if (draw.tile().isEmpty()) {
                return exhausted("No more " + draw.category().label + " tiles to draw.");
            }
            Tile newTile = draw.tile().get();
            player.setLocation(target);
            log.info("Player explored {} and found the {} at {}", direction, newTile.getName(), target);
            placeNewTile(direction, newTile);
        }

        turnSequenceCompleted = true;
        return completed();
    }

    @Override
    public ActionResult bash(Direction direction) {
        ActionResult refused = refuseIfOver();
        if (refused != null) return refused;

        if (!turnSequenceCompleted) {
            return reject("You can't bash through a wall right after cowering or before completing a turn.");
        }
        if (direction == null) {
            return reject("Invalid direction. Please enter 'N', 'E', 'S', or 'W'.");
        }
        Tile room = currentRoom();
        if (room.hasExit(direction)) {
            return reject("No need to bash. A valid exit exists, use 'go " + direction + "'.");
        }

        Coordinate here = player.getLocation();
        Coordinate target = here.step(direction);
        if (board.isExplored(target)) {
            Tile next = board.getTile(target);
            if (!next.hasExit(direction.opposite())) {
                next.addExit(direction.opposite());
            }
            room.addExit(direction);
            notifyTilePlaced(room, here);
            notifyTilePlaced(next, target);
            player.setLocation(target);
            log.info("Player bashed {} into the {} at {}", direction, next.getName(), target);
            combat(BASH_ZOMBIES);
            checkGameOver();
            notifySnapshot();
        } else {
            Board.TileDraw draw = board.drawTile(room);
            if (draw.tile().isEmpty()) {
                return exhausted("Can't bash from the " + room.getName() + ", no more "
                        + draw.category().label + " rooms to explore.");
            }
            Tile newTile = draw.tile().get();
            room.addExit(direction);
            notifyTilePlaced(room, here);
            player.setLocation(target);
            log.info("Player bashed {} and found the {} at {}", direction, newTile.getName(), target);
            combat(BASH_ZOMBIES);
            placeNewTile(direction, newTile);
        }

        turnSequenceCompleted = true;
        return completed();
    }

    @Override
    public ActionResult cower() {
        ActionResult refused = refuseIfOver();
        if (refused != null) return refused;

        if (!turnSequenceCompleted) {
            return reject("You need to complete a turn sequence before cowering.");
        }
        turnSequenceCompleted = false;
        player.heal(COWER_HEALTH);
        drawDevCard().ifPresent(card -> log.debug("Cowering discarded the {} card", card.getName()));
        message("You cower in a corner and recover " + COWER_HEALTH + " health.");
        checkGameOver();
        notifySnapshot();
        return completed();
    }

    @Override
    public ActionResult findOrBuryTotem() {
        ActionResult refused = refuseIfOver();
        if (refused != null) return refused;

        String roomName = currentRoom().getName();
        if (EVIL_TEMPLE.equals(roomName)) {
            return findTotem();
        } else if (GRAVEYARD.equals(roomName)) {
            return buryTotem();
        }
        return reject("You are not in the right room!");
    }

    private ActionResult findTotem() {
        if (player.isCarryingTotem()) {
            return reject("You already have the Totem!");
        }
        message("You are searching for the Totem!");
        resolveDevCard();
        if (!checkGameOver()) {
            player.setCarryingTotem(true);
            log.info("Totem found at {}", player.getLocation());
            message("You found the Totem!");
            notifySnapshot();
        }
        return completed();
    }

    private ActionResult buryTotem() {
        if (!player.isCarryingTotem()) {
            return reject("You don't have the Totem!");
        }
        message("You are burying the Totem!");
        resolveDevCard();
        if (!checkGameOver()) {
            end(GameStatus.WON);
            notifySnapshot();
        }
        return completed();
    }

    @Override
    public ActionResult inspect() {
        String details = player.getDetails();
        message(details);
        notifySnapshot();
        return ActionResult.accepted(details);
    }

    @Override
    public GameSnapshot getCurrentState() {
        return GameSnapshot.builder()
                .devCardsLeft(board.getDevCardCount())
                .time(board.getTime())
                .indoorTilesLeft(board.getIndoorTileCount())
                .outdoorTilesLeft(board.getOutdoorTileCount())
                .health(player.getHealth())
                .attack(player.getAttack())
                .items(List.copyOf(player.getItems()))
                .location(player.getLocation())
                .carryingTotem(player.isCarryingTotem())
                .status(status)
                .build();
    }

    @Override
    public GameStatus getStatus() {
        return status;
    }

    public boolean isTurnSequenceCompleted() {
        return turnSequenceCompleted;
    }

    public Player getPlayer() {
        return player;
    }

    public Board getBoard() {
        return board;
    }

    private void placeNewTile(Direction movedIn, Tile newTile) {
        List<Direction> entries = newTile.possibleExits();
        if (entries.size() > 1) {
            if (DINING_ROOM.equals(newTile.getName())) {
                placePatio(movedIn, newTile);
            } else {
                chooseEntry(movedIn, newTile, entries);
            }
        } else if (entries.size() == 1) {
            newTile.rotate(entries.get(0), movedIn);
        }

        board.place(player.getLocation(), newTile);
        notifyTilePlaced(newTile, player.getLocation());
        message("You are in the " + newTile.getName() + ". Exits: " + newTile.possibleExits());

        if (checkGameOver()) {
            notifySnapshot();
        } else {
            resolveDevCard();
        }
    }

    private void chooseEntry(Direction movedIn, Tile newTile, List<Direction> entries) {
        Direction entry = ask(ChoiceKind.ENTRY_SIDE,
                "You found the " + newTile.getName() + ", choose a side to enter from: " + entries,
                entries);
        newTile.rotate(entry, movedIn);
    }

    /**
     * The Dining Room keeps its north door for the Patio. Coming in heading south the room is
     * turned around and the Patio goes below it; otherwise the Patio goes above.
     */
    private void placePatio(Direction movedIn, Tile diningRoom) {
        Coordinate patioAt;
        if (movedIn == Direction.SOUTH) {
            diningRoom.rotate(Direction.SOUTH, Direction.SOUTH);
            patioAt = player.getLocation().step(Direction.SOUTH);
        } else {
            patioAt = player.getLocation().step(Direction.NORTH);
        }

        if (board.isExplored(patioAt)) {
            log.info("Patio not placed, {} is already explored", patioAt);
            return;
        }
        Optional<Tile> patio = board.takePatio();
        if (patio.isEmpty()) {
            log.warn("No Patio tile available for the Dining Room");
            return;
        }
        board.place(patioAt, patio.get());
        notifyTilePlaced(patio.get(), patioAt);
    }

    private void resolveDevCard() {
        Optional<EventCard> drawn = drawDevCard();
        if (drawn.isEmpty()) {
            notifySnapshot();
            return;
        }
        EventCard card = drawn.get();
        EventContent content = card.contentAt(board.getTime());
        log.debug("Resolving {} card at {}: {}", card.getName(), board.getTime(), content);
        message(content.text());

        boolean ranAway = false;
        if (content instanceof EventContent.ZombieEncounter encounter) {
            ranAway = runAwayOrFight(encounter.zombies());
        } else if (content instanceof EventContent.ItemFind) {
            findItem();
        } else if (content instanceof EventContent.HealthChange change) {
            player.heal(change.delta());
        } else {
            throw new IllegalStateException("Unhandled event content " + content);
        }

        if (!checkGameOver() && !ranAway) {
            applyRoomBonus();
        }
        notifySnapshot();
    }

    /** Draws the next card, first moving the clock on if the previous pass ran out. */
    private Optional<EventCard> drawDevCard() {
        if (board.getDevCardCount() == 0 && checkGameOver()) {
            return Optional.empty();
        }
        return board.drawDevCard();
    }

    private void applyRoomBonus() {
        String roomName = currentRoom().getName();
        if (KITCHEN.equals(roomName) || GARDEN.equals(roomName)) {
            player.heal(ROOM_HEALTH);
            message("The " + roomName + " lets you catch your breath: +" + ROOM_HEALTH + " health.");
        } else if (STORAGE.equals(roomName)) {
            message("You search the Storage.");
            findItem();
        }
    }

    private boolean runAwayOrFight(int zombies) {
        notifySnapshot();
        List<Direction> escapes = escapeDirections();
        List<Encounter> actions = escapes.isEmpty()
                ? List.of(Encounter.FIGHT)
                : List.of(Encounter.FIGHT, Encounter.RUN);
        Encounter action = ask(ChoiceKind.FIGHT_OR_RUN,
                zombies + " zombies! Fight or run away? " + actions, actions);

        if (action == Encounter.RUN) {
            escape(escapes);
            return true;
        }
        combat(zombies);
        return false;
    }

    private List<Direction> escapeDirections() {
        List<Direction> escapes = new ArrayList<>();
        for (Direction d : currentRoom().possibleExits()) {
            if (board.isExplored(player.getLocation().step(d))) {
                escapes.add(d);
            }
        }
        return escapes;
    }

    private void escape(List<Direction> escapes) {
        Direction direction = ask(ChoiceKind.ESCAPE_DIRECTION,
                "Choose your escape direction. You can only escape to previously explored rooms: " + escapes,
                escapes);
        player.setLocation(player.getLocation().step(direction));
        log.info("Player ran {} to {}", direction, player.getLocation());

        Optional<Item> cover = player.getItems().stream().filter(i -> i.coversEscape).findFirst();
        if (cover.isPresent()) {
            player.discard(cover.get());
            message("You used the " + cover.get() + " to get away unharmed.");
            return;
        }
        player.takeDamage(ESCAPE_COST);
        message("You got away but lost " + ESCAPE_COST + " health.");
    }

    /**
     * Fights off the zombies. Every zombie beyond the player's attack costs one health,
     * never more than {@value #MAX_ZOMBIE_DAMAGE} in one fight.
     */
    void combat(int zombies) {
        int damage = zombies - player.getAttack();
        if (damage >= 0) {
            damage = Math.min(damage, MAX_ZOMBIE_DAMAGE);
            player.takeDamage(damage);
            message("You fought " + zombies + " zombies and lost " + damage + " health.");
        } else {
            message("You fought off " + zombies + " zombies without a scratch.");
        }
        log.debug("Combat against {} zombies, health now {}", zombies, player.getHealth());
    }

    private void findItem() {
        if (checkGameOver()) return;
        Optional<EventCard> card = drawDevCard();
        if (card.isEmpty()) return;

        Item found = card.get().item();
        message("You found " + found + ".");
        if (player.hasRoomForItem()) {
            player.pickUp(found);
            return;
        }

        List<Confirmation> answers = List.of(Confirmation.YES, Confirmation.NO);
        Confirmation replace = ask(ChoiceKind.REPLACE_ITEM,
                "Do you want to replace an item? Your current items: " + player.getItems(), answers);
        if (replace == Confirmation.NO) {
            message("You leave the " + found + " behind.");
            return;
        }

        List<Item> carried = List.copyOf(player.getItems());
        Item old = ask(ChoiceKind.ITEM_TO_DISCARD, "Choose an item to replace: " + carried, carried);
        player.discard(old);
        player.pickUp(found);
        message("You replaced " + old + " with " + found + ".");
    }

    /**
     * Loss by health first, then by time. An empty deck before the last hour moves the clock on instead.
     *
     * @return true once the game has ended
     */
    private boolean checkGameOver() {
        if (status.terminal) {
            return true;
        }
        if (player.isDead()) {
            end(GameStatus.LOST_HEALTH);
            return true;
        }
        if (board.getDevCardCount() == 0) {
            if (board.isLastHour()) {
                end(GameStatus.LOST_TIME);
                return true;
            }
            board.updateTime();
            log.info("Development cards exhausted, the clock moves on to {}", board.getTime());
            message("It is now " + board.getTime() + ".");
        }
        return false;
    }

    private void end(GameStatus finalStatus) {
        status = finalStatus;
        log.info("Game over: {}", finalStatus);
        message(finalStatus.message);
        observers.forEach(o -> o.onGameOver(finalStatus));
    }

    private ActionResult refuseIfOver() {
        if (status.terminal) {
            return ActionResult.gameOver(status.message);
        }
        return null;
    }

    private ActionResult completed() {
        if (status.terminal) {
            return ActionResult.accepted(status.message);
        }
        return ActionResult.accepted("You are in the " + currentRoom().getName() + ".");
    }

    private <T> T ask(ChoiceKind kind, String prompt, List<T> options) {
        while (true) {
            T answer = choices.choose(kind, prompt, options);
            if (answer != null && options.contains(answer)) {
                return answer;
            }
            log.debug("Invalid {} answer {}, asking again", kind, answer);
            message("Invalid choice. Please choose from: " + options);
        }
    }

    private Tile currentRoom() {
        return board.getTile(player.getLocation());
    }

    private ActionResult reject(String reason) {
        log.debug("Rejected: {}", reason);
        message(reason);
        return ActionResult.rejected(reason);
    }

    private ActionResult exhausted(String reason) {
        log.info(reason);
        message(reason);
        return ActionResult.exhausted(reason);
    }

    private void message(String text) {
        observers.forEach(o -> o.onMessage(text));
    }

    private void notifyTilePlaced(Tile tile, Coordinate coordinate) {
        TilePlacement placement = new TilePlacement(tile.view(), coordinate);
        observers.forEach(o -> o.onTilePlaced(placement));
    }

    private void notifySnapshot() {
        GameSnapshot snapshot = getCurrentState();
        observers.forEach(o -> o.onSnapshot(snapshot));
    }
}
