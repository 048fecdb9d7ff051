package games.scramble.game;

/**
 * A single two-sided card on the board.
 * <p>
 * The symbol identity is fixed at construction and indexes the board's symbol catalog; the
 * display form lives in the catalog so it can be remapped without touching the cards. Only
 * the face-up/face-down side changes over a card's lifetime. Cards are mutated exclusively by
 * the owning {@link Board}, under its lock.
 */
public class Card {
    /** Index of this card's symbol in the board's catalog. */
    private final int symbolId;
    /** Whether the symbol side is currently showing. */
    private boolean faceUp;

    /**
     * Constructs a face-down card with the given symbol identity.
     *
     * @param symbolId the symbol identity; must be non-negative
     * @throws IllegalArgumentException if symbolId is negative
     */
    public Card(int symbolId) {
        if (symbolId < 0) {
            throw new IllegalArgumentException("symbolId must be non-negative: " + symbolId);
        }
        this.symbolId = symbolId;
    }

    /**
     * Returns the symbol identity of this card.
     *
     * @return the catalog index of this card's symbol
     */
    public int getSymbolId() {
        return symbolId;
    }

    /**
     * Returns whether the card is face up.
     *
     * @return {@code true} if the symbol side is showing
     */
    public boolean isFaceUp() {
        return faceUp;
    }

    /**
     * Turns the card face up. Calling it on a face-up card has no effect.
     */
    public void flipUp() {
        faceUp = true;
    }

    /**
     * Turns the card face down. Calling it on a face-down card has no effect.
     */
    public void flipDown() {
        faceUp = false;
    }

    /**
     * Returns whether this card shows the same symbol as another.
     *
     * @param other the card to compare against; must not be null
     * @return {@code true} if both cards share a symbol identity
     */
    public boolean matches(Card other) {
        return symbolId == other.symbolId;
    }

    @Override
    public String toString() {
        return "Card(" + symbolId + (faceUp ? ", up)" : ", down)");
    }
}
