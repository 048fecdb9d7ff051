package games.scramble.game;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared Memory Scramble board: a grid of cards flipped concurrently by many players.
 * <p>
 * <strong>Rules.</strong> A flip by a player holding no card tries to take a first card; a flip
 * by a player holding one card tries to take a second card and either matches (the player keeps
 * both) or not (the player lets go of both). Concretely:
 * <ul>
 *   <li>1-A empty location: fails with {@link BoardError#EMPTY_LOCATION}.</li>
 *   <li>1-B face down: turned up, player takes control.</li>
 *   <li>1-C face up, uncontrolled: player takes control.</li>
 *   <li>1-D face up, controlled by another player: the call blocks until the card is released,
 *       then re-runs from the top.</li>
 *   <li>2-A empty location: first card released, fails with {@link BoardError#EMPTY_LOCATION}.</li>
 *   <li>2-B controlled by anyone: first card released, fails with
 *       {@link BoardError#LOCATION_UNDER_CONTROL}. Never blocks, so two players holding each
 *       other's wanted card cannot deadlock.</li>
 *   <li>2-C face down: turned up.</li>
 *   <li>2-D same symbol: player controls both until its next flip, which removes them.</li>
 *   <li>2-E different symbol: first card released, both stay face up.</li>
 * </ul>
 * Face-up cards a player let go of are turned back down at the start of that player's next
 * flip, unless someone controls them by then.
 * <p>
 * <strong>Thread safety.</strong> All state is guarded by a single {@link ReentrantLock}. The
 * only point where a caller suspends is rule 1-D, with the lock released while it waits on a
 * {@link WaitQueue} future. When the card frees up every waiter is woken at once and they race
 * for the lock; the first one in wins and the others queue again or fail, depending on what
 * they find. Watch futures are completed after the lock is released.
 */
public class Board {
    private static final Logger log = LoggerFactory.getLogger(Board.class);

    private final int rows;
    private final int cols;
    private final Map<Location, Card> grid;
    private final Map<String, Player> players = new LinkedHashMap<>();
    private final WaitQueue queue = new WaitQueue();
    private final List<Watch> watchers = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final BoardFormatter formatter = new BoardFormatter(this);
    /** Display forms indexed by symbol id; replaced wholesale by {@link #map}. */
    private List<String> catalog;

    /** A pending one-shot watch. */
    private record Watch(String actorId, CompletableFuture<String> future) {
    }

    /** A watch that fired, with the rendering it will be completed with. */
    private record Delivery(CompletableFuture<String> future, String view) {
    }

    /**
     * Creates a board from a fully built grid.
     *
     * @param rows number of rows; must be positive
     * @param cols number of columns; must be positive
     * @param grid cards by location; locations absent from the map are empty
     * @param symbolCatalog display forms, indexed by symbol id; entries must be non-empty
     * @throws IllegalArgumentException if any of the above does not hold, or a card's symbol id
     *         has no catalog entry
     */
    public Board(int rows, int cols, Map<Location, Card> grid, List<String> symbolCatalog) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Board dimensions must be positive: " + rows + "x" + cols);
        }
        Objects.requireNonNull(grid, "grid");
        this.rows = rows;
        this.cols = cols;
        this.catalog = validateCatalog(symbolCatalog);
        this.grid = new HashMap<>();
        for (Map.Entry<Location, Card> entry : grid.entrySet()) {
            Location location = Objects.requireNonNull(entry.getKey(), "location");
            Card card = Objects.requireNonNull(entry.getValue(), "card at " + location);
            if (!location.isWithin(rows, cols)) {
                throw new IllegalArgumentException("Location " + location + " out of bounds for " + rows + "x" + cols);
            }
            if (card.getSymbolId() >= catalog.size()) {
                throw new IllegalArgumentException("Card at " + location + " has unknown symbol " + card.getSymbolId());
            }
            this.grid.put(location, card);
        }
        checkRep();
    }

    /**
     * Returns the number of rows.
     * @return rows, positive
     */
    public int getRows() {
        return rows;
    }

    /**
     * Returns the number of columns.
     * @return columns, positive
     */
    public int getCols() {
        return cols;
    }

    /**
     * Renders the board from a player's point of view, registering the player if new.
     * <p>
     * The first line is {@code <rows>x<cols>}; then one line per location in row-major order:
     * {@code none}, {@code down}, {@code my <symbol>} (controlled by this player) or
     * {@code up <symbol>}.
     *
     * @param actorId the viewing player
     * @return the rendering, lines separated by {@code \n}
     * @throws BoardException {@link BoardError#INVALID_IDENTIFIER} on a malformed id
     */
    public String look(String actorId) {
        Player.requireValidId(actorId);
        lock.lock();
        try {
            playerFor(actorId);
            return formatter.format(actorId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a future completed with a fresh {@link #look(String)} rendering the next time any
     * flip or map completes. Each call registers a single notification.
     *
     * @param actorId the watching player
     * @return the pending rendering
     * @throws BoardException {@link BoardError#INVALID_IDENTIFIER} on a malformed id
     */
    public CompletableFuture<String> watch(String actorId) {
        Player.requireValidId(actorId);
        CompletableFuture<String> future = new CompletableFuture<>();
        lock.lock();
        try {
            playerFor(actorId);
            watchers.add(new Watch(actorId, future));
        } finally {
            lock.unlock();
        }
        return future;
    }

    /**
     * Flips the card at {@code location} on behalf of a player, following the rules described on
     * this class. Blocks while the card is held by another player (rule 1-D).
     *
     * @param actorId the flipping player
     * @param location the target location
     * @throws BoardException when a rule refuses the flip; see {@link BoardError}
     * @throws IllegalArgumentException if the location is outside the board
     * @throws InterruptedException if interrupted while waiting; the wait is withdrawn
     */
    public void flip(String actorId, Location location) throws InterruptedException {
        Player.requireValidId(actorId);
        requireOnBoard(location);
        while (true) {
            CompletableFuture<Void> grant = attemptFlip(actorId, location);
            if (grant == null) {
                return;
            }
            awaitGrant(actorId, location, grant);
            if (log.isDebugEnabled()) {
                log.debug("{} released from wait on {}, retrying", actorId, location);
            }
        }
    }

    /**
     * Replaces every symbol's display form with {@code f(form)}. Symbol identities, and therefore
     * matching, are unchanged. The function runs outside the board lock; if another map lands in
     * the meantime the function is applied again to the newer catalog.
     *
     * @param actorId the requesting player
     * @param f the transformation; must return non-empty text
     * @throws IllegalArgumentException if {@code f} produces null or empty text
     */
    public void map(String actorId, UnaryOperator<String> f) {
        Player.requireValidId(actorId);
        Objects.requireNonNull(f, "f");
        List<String> before;
        lock.lock();
        try {
            playerFor(actorId);
            before = catalog;
        } finally {
            lock.unlock();
        }
        while (true) {
            List<String> mapped = new ArrayList<>(before.size());
            for (String form : before) {
                mapped.add(f.apply(form));
            }
            List<String> replacement = validateCatalog(mapped);
            List<Delivery> deliveries = List.of();
            lock.lock();
            try {
                if (catalog != before) {
                    before = catalog;
                    continue;
                }
                catalog = replacement;
                checkRep();
                deliveries = drainWatchers();
            } finally {
                lock.unlock();
                deliver(deliveries);
            }
            return;
        }
    }

    /**
     * Returns what currently occupies a location.
     */
    public LocationState stateAt(Location location) {
        requireOnBoard(location);
        lock.lock();
        try {
            Card card = grid.get(location);
            if (card == null) {
                return LocationState.EMPTY;
            }
            if (!card.isFaceUp()) {
                return LocationState.FACE_DOWN;
            }
            return findController(location) == null
                    ? LocationState.FACE_UP_UNCONTROLLED
                    : LocationState.FACE_UP_CONTROLLED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the id of the player controlling a location, if any.
     */
    public Optional<String> controllerOf(Location location) {
        lock.lock();
        try {
            return Optional.ofNullable(findController(location)).map(Player::getId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the display form of the card at a location, or empty if there is no card.
     */
    public Optional<String> symbolAt(Location location) {
        lock.lock();
        try {
            Card card = grid.get(location);
            return card == null ? Optional.empty() : Optional.of(catalog.get(card.getSymbolId()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of cards still on the board.
     */
    public int cardCount() {
        lock.lock();
        try {
            return grid.size();
        } finally {
            lock.unlock();
        }
    }

    boolean isWaiting(String actorId, Location location) {
        lock.lock();
        try {
            return queue.contains(actorId, location);
        } finally {
            lock.unlock();
        }
    }

    List<Location> controlledBy(String actorId) {
        lock.lock();
        try {
            Player player = players.get(actorId);
            return player == null ? List.of() : player.getControlled();
        } finally {
            lock.unlock();
        }
    }

    Set<Location> seenBy(String actorId) {
        lock.lock();
        try {
            Player player = players.get(actorId);
            return player == null ? Set.of() : player.getSeen();
        } finally {
            lock.unlock();
        }
    }

    /**
     * One pass of the flip rules under the lock. Returns {@code null} when the flip finished, or
     * the future to wait on under rule 1-D.
     */
    private CompletableFuture<Void> attemptFlip(String actorId, Location location) {
        List<Delivery> deliveries = List.of();
        lock.lock();
        try {
            CompletableFuture<Void> grant = null;
            try {
                grant = applyRules(playerFor(actorId), location);
                return grant;
            } finally {
                if (grant == null) {
                    releaseAvailable();
                    deliveries = drainWatchers();
                }
                checkRep();
            }
        } finally {
            lock.unlock();
            deliver(deliveries);
        }
    }

    private CompletableFuture<Void> applyRules(Player player, Location target) {
        cleanUp(player);
        collectMatchedPair(player, target);
        List<Location> held = player.getControlled();
        if (held.isEmpty()) {
            return takeFirstCard(player, target);
        }
        takeSecondCard(player, held.get(0), target);
        return null;
    }

    /**
     * Turns down the cards this player let go of earlier, unless someone holds them now. The seen
     * set itself is left alone: a location leaves it only when another player marks it seen or
     * its card is removed.
     */
    private void cleanUp(Player player) {
        for (Location location : player.getSeen()) {
            if (findController(location) != null) {
                continue;
            }
            Card card = grid.get(location);
            if (card != null) {
                card.flipDown();
            }
        }
    }

    /**
     * Removes a pair matched on the player's previous turn.
     */
    private void collectMatchedPair(Player player, Location target) {
        List<Location> held = player.getControlled();
        if (held.size() < Player.MAX_CONTROLLED) {
            return;
        }
        assert grid.get(held.get(0)).matches(grid.get(held.get(1))) : "holding an unmatched pair: " + held;
        for (Location location : held) {
            grid.remove(location);
            player.giveUpControl(location);
            for (Player other : players.values()) {
                if (other.hasSeen(location)) {
                    other.clearSeen(location);
                }
            }
            for (String waiting : queue.waitingOn(location)) {
                queue.denyOne(waiting, location);
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("{} collected matched pair {}", player.getId(), held);
        }
        if (held.contains(target)) {
            throw new BoardException(BoardError.EMPTY_LOCATION);
        }
    }

    private CompletableFuture<Void> takeFirstCard(Player player, Location target) {
        Card card = grid.get(target);
        if (card == null) {
            throw new BoardException(BoardError.EMPTY_LOCATION);
        }
        if (!card.isFaceUp()) {
            card.flipUp();
            player.takeControl(target);
            return null;
        }
        Player holder = findController(target);
        if (holder == null) {
            player.takeControl(target);
            return null;
        }
        if (log.isDebugEnabled()) {
            log.debug("{} waits for {} held by {}", player.getId(), target, holder.getId());
        }
        return queue.enqueue(player.getId(), target);
    }

    private void takeSecondCard(Player player, Location first, Location target) {
        Card card = grid.get(target);
        if (card == null) {
            player.giveUpControl(first);
            throw new BoardException(BoardError.EMPTY_LOCATION);
        }
        if (card.isFaceUp() && findController(target) != null) {
            player.giveUpControl(first);
            markSeen(player, first, target);
            throw new BoardException(BoardError.LOCATION_UNDER_CONTROL);
        }
        card.flipUp();
        if (grid.get(first).matches(card)) {
            player.takeControl(target);
            if (log.isDebugEnabled()) {
                log.debug("{} matched {} and {}", player.getId(), first, target);
            }
        } else {
            markSeen(player, first, target);
            player.giveUpControl(first);
        }
    }

    /**
     * Records the locations as seen by this player only; whoever touched a card last is the one
     * who turns it down.
     */
    private void markSeen(Player player, Location... locations) {
        player.markSeen(locations);
        for (Player other : players.values()) {
            if (other == player) {
                continue;
            }
            for (Location location : locations) {
                if (other.hasSeen(location)) {
                    other.clearSeen(location);
                }
            }
        }
    }

    /**
     * Wakes everyone queued on a location nobody controls any more.
     */
    private void releaseAvailable() {
        Set<Location> contested = new LinkedHashSet<>();
        for (WaitQueue.Entry entry : queue.snapshot()) {
            contested.add(entry.location());
        }
        for (Location location : contested) {
            if (findController(location) == null) {
                int released = queue.releaseAll(location);
                if (log.isDebugEnabled()) {
                    log.debug("Released {} waiter(s) on {}", released, location);
                }
            }
        }
    }

    private List<Delivery> drainWatchers() {
        if (watchers.isEmpty()) {
            return List.of();
        }
        List<Delivery> deliveries = new ArrayList<>(watchers.size());
        for (Watch watch : watchers) {
            deliveries.add(new Delivery(watch.future(), formatter.format(watch.actorId())));
        }
        watchers.clear();
        return deliveries;
    }

    private static void deliver(List<Delivery> deliveries) {
        for (Delivery delivery : deliveries) {
            delivery.future().complete(delivery.view());
        }
    }

    private void awaitGrant(String actorId, Location location, CompletableFuture<Void> grant)
            throws InterruptedException {
        try {
            grant.get();
        } catch (InterruptedException e) {
            lock.lock();
            try {
                queue.withdraw(actorId, location);
            } finally {
                lock.unlock();
            }
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (!(cause instanceof BoardException)) {
                throw new IllegalStateException("Unexpected failure while waiting for " + location, cause);
            }
            BoardException denied = (BoardException) cause;
            finishDeniedFlip();
            throw new BoardException(denied.getError(), denied.getMessage() + ": " + location, denied);
        }
    }

    /**
     * A denied wait still ends a flip call, so waiters and watchers are settled as usual.
     */
    private void finishDeniedFlip() {
        List<Delivery> deliveries = List.of();
        lock.lock();
        try {
            releaseAvailable();
            deliveries = drainWatchers();
            checkRep();
        } finally {
            lock.unlock();
            deliver(deliveries);
        }
    }

    private Player playerFor(String actorId) {
        return players.computeIfAbsent(actorId, Player::new);
    }

    private Player findController(Location location) {
        for (Player player : players.values()) {
            if (player.hasControl(location)) {
                return player;
            }
        }
        return null;
    }

    private void requireOnBoard(Location location) {
        Objects.requireNonNull(location, "location");
        if (!location.isWithin(rows, cols)) {
            throw new IllegalArgumentException("Location " + location + " out of bounds for " + rows + "x" + cols);
        }
    }

    private static List<String> validateCatalog(List<String> symbolCatalog) {
        Objects.requireNonNull(symbolCatalog, "symbolCatalog");
        for (int i = 0; i < symbolCatalog.size(); i++) {
            String form = symbolCatalog.get(i);
            if (form == null || form.isEmpty()) {
                throw new IllegalArgumentException("Symbol at index " + i + " is empty");
            }
        }
        return List.copyOf(symbolCatalog);
    }

    /**
     * Representation invariant; active when assertions are enabled (as under Surefire).
     */
    private void checkRep() {
        assert rows > 0 && cols > 0 : "board dimensions must be positive";
        for (Map.Entry<Location, Card> entry : grid.entrySet()) {
            assert entry.getKey().isWithin(rows, cols) : "out of bounds: " + entry.getKey();
            assert entry.getValue().getSymbolId() < catalog.size() : "unknown symbol at " + entry.getKey();
        }
        Set<Location> claimed = new HashSet<>();
        for (Player player : players.values()) {
            List<Location> held = player.getControlled();
            assert held.size() <= Player.MAX_CONTROLLED : player + " controls too many cards";
            for (Location location : held) {
                Card card = grid.get(location);
                assert card != null && card.isFaceUp() : player + " controls a missing or face-down card at " + location;
                assert claimed.add(location) : location + " controlled by more than one player";
            }
        }
    }

    /**
     * Renders the board for an observer that controls nothing.
     */
    @Override
    public String toString() {
        lock.lock();
        try {
            return formatter.format(null);
        } finally {
            lock.unlock();
        }
    }
}
