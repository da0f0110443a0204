package structview;

import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SyncLatchTest {

    @Test
    public void refusesReentryInEitherDirection() {
        SyncLatch latch = new SyncLatch();
        assertTrue(latch.isIdle());

        assertTrue(latch.tryEnter(SyncLatch.Direction.FROM_TREE));
        assertTrue(latch.isActive(SyncLatch.Direction.FROM_TREE));
        assertFalse(latch.tryEnter(SyncLatch.Direction.FROM_EDITOR));
        assertFalse(latch.tryEnter(SyncLatch.Direction.FROM_TREE));
        latch.exit();

        assertTrue(latch.tryEnter(SyncLatch.Direction.FROM_EDITOR));
        assertFalse(latch.tryEnter(SyncLatch.Direction.FROM_TREE));
        assertFalse(latch.isActive(SyncLatch.Direction.FROM_TREE));
        latch.exit();
        assertTrue(latch.isIdle());
    }
}
