package games.scramble.game;

import java.util.StringJoiner;

/**
 * Renders a {@link Board} as the line-oriented text returned by {@link Board#look(String)}.
 * <p>
 * The first line holds the dimensions ({@code 5x5}); each following line describes one location
 * in row-major order:
 * <ul>
 *   <li>{@code none}: no card</li>
 *   <li>{@code down}: face down</li>
 *   <li>{@code my <symbol>}: face up and controlled by the viewer</li>
 *   <li>{@code up <symbol>}: face up and uncontrolled, or controlled by someone else</li>
 * </ul>
 * Lines are separated by {@code \n} with no trailing newline.
 */
public class BoardFormatter {
    /** Reference to the board being rendered. */
    private final Board board;

    /**
     * Constructs a formatter for the given board.
     *
     * @param board the board to render; must not be null
     */
    public BoardFormatter(Board board) {
        this.board = board;
    }

    /**
     * Renders the board as seen by {@code viewerId}.
     *
     * @param viewerId the viewing player, or {@code null} for an observer that controls nothing
     * @return the rendering
     */
    public String format(String viewerId) {
        StringJoiner lines = new StringJoiner("\n");
        lines.add(board.getRows() + "x" + board.getCols());
        for (int row = 0; row < board.getRows(); row++) {
            for (int col = 0; col < board.getCols(); col++) {
                lines.add(describe(Location.of(row, col), viewerId));
            }
        }
        return lines.toString();
    }

    private String describe(Location location, String viewerId) {
        switch (board.stateAt(location)) {
            case EMPTY:
                return "none";
            case FACE_DOWN:
                return "down";
            default:
                String symbol = board.symbolAt(location).orElseThrow();
                boolean mine = viewerId != null
                        && board.controllerOf(location).map(viewerId::equals).orElse(false);
                return (mine ? "my " : "up ") + symbol;
        }
    }
}
