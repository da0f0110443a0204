package structview;

/**
 * The source text side of the viewer, as seen by {@link SyncCoordinator}.
 */
public interface TextView {

    /** Select {@code [start, end)} and scroll it into view. */
    void selectRange(int start, int end);
}
