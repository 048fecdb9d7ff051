package games.scramble.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Per-actor state kept by the {@link Board}.
 * <p>
 * A player controls at most two locations at a time (in acquisition order) and remembers the
 * locations it previously touched but no longer controls. The latter drive the deferred
 * flip-down performed at the start of the player's next turn.
 * <p>
 * Instances are owned by the board and only mutated under the board's lock; queries return
 * immutable snapshots.
 */
public class Player {
    /** Upper bound on simultaneously controlled locations. */
    public static final int MAX_CONTROLLED = 2;

    private static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9_]+$");

    private final String id;
    private final List<Location> controlled = new ArrayList<>(MAX_CONTROLLED);
    private final Set<Location> seen = new LinkedHashSet<>();

    /**
     * Creates a player with nothing controlled and nothing seen.
     *
     * @param id the actor id
     * @throws BoardException with {@link BoardError#INVALID_IDENTIFIER} if the id is malformed
     */
    public Player(String id) {
        requireValidId(id);
        this.id = id;
    }

    /**
     * Returns whether {@code id} is a well-formed actor id: non-empty, letters, digits and
     * underscores only.
     */
    public static boolean isValidId(String id) {
        return id != null && ID_PATTERN.matcher(id).matches();
    }

    static void requireValidId(String id) {
        if (!isValidId(id)) {
            throw new BoardException(BoardError.INVALID_IDENTIFIER,
                    BoardError.INVALID_IDENTIFIER.getDefaultMessage() + ": " + id);
        }
    }

    public String getId() {
        return id;
    }

    /**
     * Takes control of a location.
     *
     * @param location the location to control
     * @throws BoardException {@link BoardError#ALREADY_CONTROLLED} if already held,
     *         {@link BoardError#CONTROL_LIMIT_EXCEEDED} if two locations are already held
     */
    public void takeControl(Location location) {
        Objects.requireNonNull(location, "location");
        if (controlled.contains(location)) {
            throw new BoardException(BoardError.ALREADY_CONTROLLED,
                    "Player " + id + " already controls " + location);
        }
        if (controlled.size() >= MAX_CONTROLLED) {
            throw new BoardException(BoardError.CONTROL_LIMIT_EXCEEDED,
                    "Player " + id + " cannot control any more cards");
        }
        controlled.add(location);
    }

    /**
     * Gives up control of a location.
     *
     * @param location the location to release
     * @throws BoardException {@link BoardError#NOT_CONTROLLING} if the location is not held
     */
    public void giveUpControl(Location location) {
        if (!controlled.remove(location)) {
            throw new BoardException(BoardError.NOT_CONTROLLING,
                    "Player " + id + " is not controlling " + location);
        }
    }

    public boolean hasControl(Location location) {
        return controlled.contains(location);
    }

    /**
     * Returns the controlled locations in acquisition order.
     *
     * @return an immutable snapshot, at most {@link #MAX_CONTROLLED} entries
     */
    public List<Location> getControlled() {
        return List.copyOf(controlled);
    }

    /**
     * Records locations as previously seen, ignoring ones already recorded.
     */
    public void markSeen(Location... locations) {
        for (Location location : locations) {
            seen.add(Objects.requireNonNull(location, "location"));
        }
    }

    /**
     * Forgets a single previously seen location.
     *
     * @throws BoardException {@link BoardError#NOT_SEEN} if the location was not recorded
     */
    public void clearSeen(Location location) {
        if (!seen.remove(location)) {
            throw new BoardException(BoardError.NOT_SEEN,
                    "Location " + location + " was not previously seen by " + id);
        }
    }

    public void clearAllSeen() {
        seen.clear();
    }

    public boolean hasSeen(Location location) {
        return seen.contains(location);
    }

    /**
     * Returns the previously seen locations in the order they were first recorded.
     */
    public Set<Location> getSeen() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(seen));
    }

    @Override
    public String toString() {
        return "Player " + id + " with cards " + controlled;
    }
}
