package structview;

/**
 * Two-way exclusion latch for tree/editor synchronization.
 * Only one direction may be in progress; a callback arriving while the other direction
 * is active is the echo of our own update and must be dropped.
 */
public final class SyncLatch {

    public enum Direction { FROM_TREE, FROM_EDITOR }

    private Direction active; // null when idle

    /** Enters {@code direction}; false if any sync is already in progress. */
    public boolean tryEnter(Direction direction) {
        if (active != null) return false;
        active = direction;
        return true;
    }

    public void exit() {
        active = null;
    }

    public boolean isIdle() {
        return active == null;
    }

    public boolean isActive(Direction direction) {
        return active == direction;
    }
}
