package games.scramble.game;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single cell on the board, addressed by zero-based row and column.
 *
 * <p>The canonical textual form is {@code <row>x<col>} (e.g. {@code 0x0}, {@code 4x2}), which is
 * also what {@link #toString()} returns. Bounds against a concrete board are checked by the
 * {@link Board}; a location on its own only guarantees non-negative coordinates.
 */
public record Location(int row, int col) {
    private static final Pattern CANONICAL = Pattern.compile("(\\d+)x(\\d+)");

    public Location {
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("Invalid location " + row + "x" + col);
        }
    }

    /**
     * Shorthand for {@code new Location(row, col)}.
     */
    public static Location of(int row, int col) {
        return new Location(row, col);
    }

    /**
     * Parses the canonical {@code <row>x<col>} form.
     *
     * @param text the location text, e.g. {@code "2x3"}
     * @return the parsed location
     * @throws IllegalArgumentException if the text is not exactly {@code <digits>x<digits>}, or a
     *         coordinate does not fit in an {@code int}
     */
    public static Location parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Location text is null");
        }
        Matcher m = CANONICAL.matcher(text);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid location: " + text);
        }
        try {
            return new Location(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Location out of range: " + text, e);
        }
    }

    /**
     * Returns whether this location lies inside a {@code rows} x {@code cols} grid.
     */
    public boolean isWithin(int rows, int cols) {
        return row < rows && col < cols;
    }

    @Override
    public String toString() {
        return row + "x" + col;
    }
}
