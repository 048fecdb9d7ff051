package games.scramble.game;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Actors blocked on a location held by someone else.
 * <p>
 * Each waiting actor owns a {@link CompletableFuture} that completes normally when the location
 * is released ({@link #releaseAll(Location)}) or exceptionally with
 * {@link BoardError#LOCATION_UNAVAILABLE} when the location is withdrawn from contention
 * ({@link #denyOne(String, Location)}). A release is not a grant of control: every released
 * actor re-runs its flip and they race for the board lock.
 * <p>
 * Not thread-safe on its own; the owning {@link Board} only touches it under its lock.
 */
public class WaitQueue {

    /**
     * Read-only view of a queued actor, as returned by {@link #snapshot()}.
     */
    public record Entry(String actorId, Location location) {
        public Entry {
            Objects.requireNonNull(actorId, "actorId");
            Objects.requireNonNull(location, "location");
        }
    }

    private static final class Waiter {
        private final Entry entry;
        private final CompletableFuture<Void> future = new CompletableFuture<>();

        private Waiter(String actorId, Location location) {
            this.entry = new Entry(actorId, location);
        }

        private boolean is(String actorId, Location location) {
            return entry.actorId().equals(actorId) && entry.location().equals(location);
        }
    }

    /** Insertion order is kept only for readable snapshots; release order is unspecified. */
    private final List<Waiter> waiters = new ArrayList<>();

    /**
     * Queues an actor on a location.
     *
     * @param actorId the waiting actor
     * @param location the contested location
     * @return a future that completes when the actor may retry, or fails if the location goes away
     * @throws BoardException {@link BoardError#ALREADY_WAITING} if the actor already waits there
     */
    public CompletableFuture<Void> enqueue(String actorId, Location location) {
        Player.requireValidId(actorId);
        Objects.requireNonNull(location, "location");
        if (contains(actorId, location)) {
            throw new BoardException(BoardError.ALREADY_WAITING,
                    "Player " + actorId + " already in queue for " + location);
        }
        Waiter waiter = new Waiter(actorId, location);
        waiters.add(waiter);
        return waiter.future;
    }

    /**
     * Removes every actor queued on a location and wakes them all.
     *
     * @param location the location that became available
     * @return how many actors were released
     */
    public int releaseAll(Location location) {
        List<Waiter> released = new ArrayList<>();
        Iterator<Waiter> it = waiters.iterator();
        while (it.hasNext()) {
            Waiter waiter = it.next();
            if (waiter.entry.location().equals(location)) {
                it.remove();
                released.add(waiter);
            }
        }
        for (Waiter waiter : released) {
            waiter.future.complete(null);
        }
        return released.size();
    }

    /**
     * Removes one actor's wait on a location and fails it with
     * {@link BoardError#LOCATION_UNAVAILABLE}. Does nothing if the actor is not queued there.
     *
     * @return {@code true} if an entry was removed
     */
    public boolean denyOne(String actorId, Location location) {
        Waiter waiter = remove(actorId, location);
        if (waiter == null) {
            return false;
        }
        waiter.future.completeExceptionally(new BoardException(BoardError.LOCATION_UNAVAILABLE));
        return true;
    }

    /**
     * Drops an actor's wait without completing it; used when the waiting caller has given up
     * (for instance after being interrupted).
     *
     * @return {@code true} if an entry was removed
     */
    public boolean withdraw(String actorId, Location location) {
        Waiter waiter = remove(actorId, location);
        if (waiter == null) {
            return false;
        }
        waiter.future.cancel(false);
        return true;
    }

    public boolean contains(String actorId, Location location) {
        for (Waiter waiter : waiters) {
            if (waiter.is(actorId, location)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the ids of actors currently queued on a location.
     */
    public List<String> waitingOn(Location location) {
        List<String> ids = new ArrayList<>();
        for (Waiter waiter : waiters) {
            if (waiter.entry.location().equals(location)) {
                ids.add(waiter.entry.actorId());
            }
        }
        return List.copyOf(ids);
    }

    /**
     * Returns a copy of the queue contents.
     */
    public List<Entry> snapshot() {
        List<Entry> entries = new ArrayList<>(waiters.size());
        for (Waiter waiter : waiters) {
            entries.add(waiter.entry);
        }
        return List.copyOf(entries);
    }

    /**
     * Returns whether nobody is waiting.
     */
    public boolean isEmpty() {
        return waiters.isEmpty();
    }

    /**
     * Returns the number of queued waiters.
     */
    public int size() {
        return waiters.size();
    }

    private Waiter remove(String actorId, Location location) {
        Iterator<Waiter> it = waiters.iterator();
        while (it.hasNext()) {
            Waiter waiter = it.next();
            if (waiter.is(actorId, location)) {
                it.remove();
                return waiter;
            }
        }
        return null;
    }
}
