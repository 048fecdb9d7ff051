package games.scramble.game;

/**
 * What occupies a board location, as seen by the flip rules.
 */
public enum LocationState {
    /** No card; terminal once a matched pair has been removed. */
    EMPTY,
    FACE_DOWN,
    FACE_UP_UNCONTROLLED,
    FACE_UP_CONTROLLED
}
