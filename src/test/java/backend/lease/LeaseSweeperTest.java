package backend.lease;

import org.junit.After;
import org.junit.Test;
import org.lupenghan.holodsm.backend.LeaseManager.Dataform.LeaseType;
import org.lupenghan.holodsm.backend.LeaseManager.Impl.LeaseManagerImpl;
import org.lupenghan.holodsm.backend.LeaseManager.LeaseManager;
import org.lupenghan.holodsm.backend.LeaseManager.LeaseSweeper;

import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class LeaseSweeperTest {
    private LeaseSweeper sweeper;

    @After
    public void tearDown() {
        if (sweeper != null) {
            sweeper.stop();
        }
    }

    @Test
    public void testSweeperRemovesExpiredLeases() throws Exception {
        LeaseManager lm = new LeaseManagerImpl(5);
        lm.acquireLease("array-1", 0, LeaseType.WRITE, "node-a", 1);
        lm.acquireLease("array-1", 1, LeaseType.READ, "node-b", 1);

        sweeper = new LeaseSweeper(lm);
        sweeper.start(10, 10, TimeUnit.MILLISECONDS);
        assertTrue(sweeper.isRunning());

        long deadline = System.currentTimeMillis() + 5_000;
        while (lm.getLeaseCount() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, lm.getLeaseCount());

        sweeper.stop();
        assertFalse(sweeper.isRunning());
    }

    @Test
    public void testLiveLeasesSurvive() throws Exception {
        LeaseManager lm = new LeaseManagerImpl(60_000);
        lm.acquireLease("array-1", 0, LeaseType.WRITE, "node-a", 1);

        sweeper = new LeaseSweeper(lm);
        sweeper.start(0, 5, TimeUnit.MILLISECONDS);
        Thread.sleep(50);

        assertEquals(1, lm.getLeaseCount());
    }
}
