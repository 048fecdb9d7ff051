package games.scramble.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * A shuffled set of card pairs used to lay out a fresh board.
 * <p>
 * A deck for a {@code rows} x {@code cols} board holds {@code rows * cols / 2} pairs, cycling
 * through the given symbols so that a small symbol list still fills a large board. With an odd
 * number of cells the last location (in dealt order) stays empty. The deck is shuffled on
 * construction; pass a seeded {@link Random} for a reproducible layout.
 */
public class Deck {
    private final int rows;
    private final int cols;
    private final List<String> symbols;
    private final Random random;
    /** Symbol ids in dealing order (row-major). */
    private final List<Integer> cards = new ArrayList<>();

    /**
     * Constructs a shuffled deck.
     *
     * @param rows board rows; must be positive
     * @param cols board columns; must be positive
     * @param symbols distinct display forms; must not be empty
     * @param random source of randomness for shuffling
     * @throws IllegalArgumentException if the dimensions are not positive or no symbols are given
     */
    public Deck(int rows, int cols, List<String> symbols, Random random) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Board dimensions must be positive: " + rows + "x" + cols);
        }
        Objects.requireNonNull(symbols, "symbols");
        if (symbols.isEmpty()) {
            throw new IllegalArgumentException("At least one symbol is required");
        }
        this.rows = rows;
        this.cols = cols;
        this.symbols = List.copyOf(symbols);
        this.random = Objects.requireNonNull(random, "random");
        reset();
    }

    /**
     * Shuffles the remaining cards.
     */
    public void shuffle() {
        Collections.shuffle(cards, random);
    }

    /**
     * Refills the deck with all pairs and shuffles it.
     */
    public final void reset() {
        cards.clear();
        int pairs = rows * cols / 2;
        for (int i = 0; i < pairs; i++) {
            int symbolId = i % symbols.size();
            cards.add(symbolId);
            cards.add(symbolId);
        }
        shuffle();
    }

    /**
     * Returns the number of cards in the deck.
     */
    public int size() {
        return cards.size();
    }

    /**
     * Lays the deck out on a new board, row by row.
     *
     * @return a board with every card face down and no players
     */
    public Board deal() {
        Map<Location, Card> grid = new HashMap<>();
        for (int i = 0; i < cards.size(); i++) {
            grid.put(Location.of(i / cols, i % cols), new Card(cards.get(i)));
        }
        return new Board(rows, cols, grid, symbols);
    }

    @Override
    public String toString() {
        return "Deck(" + rows + "x" + cols + ", size=" + cards.size() + ")";
    }
}
