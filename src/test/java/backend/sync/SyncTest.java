package backend.sync;

import backend.TestCluster;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.lupenghan.holodsm.backend.DSMSystem;
import org.lupenghan.holodsm.backend.DistributedArray;
import org.lupenghan.holodsm.backend.PageManager.Dataform.ElementType;
import org.lupenghan.holodsm.backend.SyncManager.Dataform.SyncState;
import org.lupenghan.holodsm.backend.utils.DSMException;
import org.lupenghan.holodsm.backend.utils.ErrorType;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SyncTest {
    private static final long TTL = 10_000;

    private TestCluster cluster;
    private DSMSystem a;
    private DSMSystem b;
    private DSMSystem c;

    @Before
    public void setUp() {
        cluster = new TestCluster(TTL);
        a = cluster.addNode("node-a");
        b = cluster.addNode("node-b");
        c = cluster.addNode("node-c");
    }

    @After
    public void tearDown() {
        cluster.close();
    }

    @Test
    public void testSetSyncGetAcrossNodes() throws Exception {
        DistributedArray onA = a.createArray(100);
        onA.setLong(5, 42);
        onA.sync();

        DistributedArray onB = b.openArray(onA.getId());
        assertEquals(42, onB.getLong(5));
        assertEquals(0, onB.getLong(6));
    }

    @Test
    public void testWriterOnNonHomeNode() throws Exception {
        DistributedArray onA = a.createArray(100);
        DistributedArray onB = b.openArray(onA.getId());
        onB.setLong(0, 7);
        onB.setLong(99, 8);
        onB.sync();

        DistributedArray onC = c.openArray(onA.getId());
        assertEquals(7, onC.getLong(0));
        assertEquals(8, onC.getLong(99));
        assertEquals(7, onA.getLong(0));

        // 同步后所有节点的版本一致
        assertEquals(2, onA.getVersion());
        assertEquals(2, onB.getVersion());
        assertEquals(2, onC.getVersion());
    }

    @Test
    public void testWriterReadsOwnWrites() throws Exception {
        DistributedArray onA = a.createArray(100);
        DistributedArray onB = b.openArray(onA.getId());
        onB.setLong(3, 11);
        assertEquals(11, onB.getLong(3));
    }

    @Test
    public void testSyncSequenceStates() throws Exception {
        DistributedArray onA = a.createArray(100);
        onA.setLong(0, 1);
        assertEquals(SyncState.ACTIVE, onA.getSyncState());
        assertEquals(1, a.getSyncManager().getHeldWriteLeaseCount(onA.getId()));

        onA.sync();
        assertEquals(SyncState.SYNCED, onA.getSyncState());
        assertEquals(0, a.getSyncManager().getHeldWriteLeaseCount(onA.getId()));
        assertEquals(0, a.getLeaseManager().getLeaseCount());

        onA.setLong(1, 2);
        assertEquals(SyncState.ACTIVE, onA.getSyncState());
    }

    @Test
    public void testConcurrentWriterConflicts() throws Exception {
        DistributedArray onA = a.createArray(100);
        DistributedArray onB = b.openArray(onA.getId());
        onA.setLong(0, 1);

        // 同一页的另一个写者和读者都冲突
        assertConflict(() -> onB.setLong(1, 2));
        assertConflict(() -> onB.getLong(1));

        // 不同页互不影响
        onB.setLong(50, 3);

        onA.sync();
        onB.setLong(1, 2);
        onB.sync();

        DistributedArray onC = c.openArray(onA.getId());
        assertEquals(1, onC.getLong(0));
        assertEquals(2, onC.getLong(1));
        assertEquals(3, onC.getLong(50));
    }

    @Test
    public void testSyncInvalidatesCachedCopies() throws Exception {
        DistributedArray onA = a.createArray(100);
        onA.setLong(10, 1);
        onA.sync();

        DistributedArray onC = c.openArray(onA.getId());
        assertEquals(1, onC.getLong(10));
        int page = onA.getArray().pageOf(10);
        assertTrue(c.getPageCache().contains(onA.getId(), page));

        DistributedArray onB = b.openArray(onA.getId());
        onB.setLong(10, 2);
        onB.sync();

        assertEquals(2, onC.getLong(10));
    }

    @Test
    public void testExpiredWriteIsDiscarded() throws Exception {
        DistributedArray onA = a.createArray(100);
        DistributedArray onB = b.openArray(onA.getId());
        onB.setLong(0, 5);
        onB.setLong(50, 6);

        cluster.getClock().advance(TTL + 1);
        try {
            onB.sync();
            fail("过期的写入应该报告EXPIRED");
        } catch (DSMException e) {
            assertEquals(ErrorType.EXPIRED, e.getErrorType());
            assertEquals(onA.getId(), e.getArrayId());
        }

        // 其余步骤照常完成
        assertEquals(SyncState.SYNCED, onB.getSyncState());
        assertEquals(2, onA.getVersion());
        assertEquals(0, a.getLeaseManager().getLeaseCount());
        assertEquals(0, c.openArray(onA.getId()).getLong(0));
        assertEquals(0, c.openArray(onA.getId()).getLong(50));
    }

    @Test
    public void testFailedFlushKeepsLeaseAndVersion() throws Exception {
        DistributedArray onA = a.createArray(100);
        String id = onA.getId();

        // c 读取时认领第0页
        assertEquals(0, c.openArray(id).getLong(0));
        assertEquals("node-c", onA.getArray().getPageOwner(0));

        DistributedArray onB = b.openArray(id);
        onB.setLong(0, 99);

        cluster.getNetwork().disconnect("node-c");
        try {
            onB.sync();
            fail("所有者不可达时同步应该失败");
        } catch (DSMException e) {
            assertEquals(ErrorType.UNREACHABLE, e.getErrorType());
        }

        // 同步未完成：版本不变，写租约和工作副本保留
        assertEquals(1, onA.getVersion());
        assertEquals(1, onB.getVersion());
        assertEquals(SyncState.ACTIVE, onB.getSyncState());
        assertEquals(1, b.getSyncManager().getHeldWriteLeaseCount(id));
        assertTrue(a.getLeaseManager().hasWriteLease(id, 0));
        assertEquals(99, onB.getLong(0));

        // 恢复后重试
        cluster.getNetwork().reconnect("node-c");
        onB.sync();
        assertEquals(SyncState.SYNCED, onB.getSyncState());
        assertEquals(2, onA.getVersion());
        assertEquals(2, onB.getVersion());
        assertEquals(0, b.getSyncManager().getHeldWriteLeaseCount(id));
        assertEquals(0, a.getLeaseManager().getLeaseCount());
        assertEquals(99, c.openArray(id).getLong(0));
        assertEquals(99, onA.getLong(0));
    }

    @Test
    public void testReadLeaseHeldUntilEachReaderFinishes() throws Exception {
        DistributedArray onA = a.createArray(100);
        String id = onA.getId();
        onA.setLong(0, 5);
        onA.sync();
        DistributedArray onB = b.openArray(id);
        DistributedArray onC = c.openArray(id);

        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch finish = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Long> slow = pool.submit(() -> b.getSyncManager().<Long>read(id, 0, page -> {
                inside.countDown();
                try {
                    finish.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    throw new DSMException(ErrorType.CANCELLED, "读取被中断");
                }
                return page.getLong(0);
            }));
            assertTrue(inside.await(5, TimeUnit.SECONDS));

            // 同一节点上的另一次读取结束，只释放它自己的读租约
            assertEquals(5, onB.getLong(0));
            assertEquals(1, a.getLeaseManager().getLeases(id, 0).size());

            // 第一次读取还没结束，其他节点拿不到写租约
            assertConflict(() -> onC.setLong(0, 2));

            finish.countDown();
            assertEquals(5L, (long) slow.get(5, TimeUnit.SECONDS));
        } finally {
            finish.countDown();
            pool.shutdown();
        }

        assertEquals(0, a.getLeaseManager().getLeaseCount());
        onC.setLong(0, 2);
        onC.sync();
        assertEquals(2, onB.getLong(0));
    }

    @Test
    public void testWriteOnExpiredLeaseFails() throws Exception {
        DistributedArray onA = a.createArray(100);
        DistributedArray onB = b.openArray(onA.getId());
        onB.setLong(0, 5);

        cluster.getClock().advance(TTL + 1);
        try {
            onB.setLong(1, 6);
            fail("写租约过期后应该报告EXPIRED");
        } catch (DSMException e) {
            assertEquals(ErrorType.EXPIRED, e.getErrorType());
        }

        // 重新获取后可以继续写入
        onB.setLong(1, 6);
        onB.sync();
        assertEquals(0, onA.getLong(0));
        assertEquals(6, onA.getLong(1));
    }

    @Test
    public void testCloseReleasesLeases() throws Exception {
        DistributedArray onA = a.createArray(100);
        DistributedArray onB = b.openArray(onA.getId());
        onB.setLong(0, 9);
        assertEquals(1, a.getLeaseManager().getLeaseCount());

        onB.close();
        assertEquals(0, a.getLeaseManager().getLeaseCount());

        onA.setLong(0, 1);
        onA.sync();
        assertEquals(1, c.openArray(onA.getId()).getLong(0));
    }

    @Test
    public void testSlice() throws Exception {
        DistributedArray onA = a.createArray(100);
        DistributedArray tail = onA.slice(90, 100);
        assertEquals(10, tail.length());

        tail.setLong(0, 90);
        tail.setLong(9, 99);
        tail.sync();

        assertEquals(90, onA.getLong(90));
        assertEquals(99, onA.getLong(99));
        try {
            tail.getLong(10);
            fail("切片下标越界");
        } catch (DSMException e) {
            assertEquals(ErrorType.OUT_OF_BOUNDS, e.getErrorType());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidSlice() {
        a.createArray(10).slice(5, 11);
    }

    @Test
    public void testFloatArray() throws Exception {
        DistributedArray onA = a.createArray(40, ElementType.FLOAT32);
        assertEquals(3, onA.getArray().getNumPages());
        onA.setFloat(17, 2.5f);
        onA.sync();

        assertEquals(2.5f, b.openArray(onA.getId()).getFloat(17), 0.0f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrongElementType() throws Exception {
        a.createArray(40, ElementType.FLOAT32).getLong(0);
    }

    @Test
    public void testIndexOutOfRange() throws Exception {
        DistributedArray onA = a.createArray(10);
        try {
            onA.setLong(10, 1);
            fail("下标越界");
        } catch (DSMException e) {
            assertEquals(ErrorType.OUT_OF_BOUNDS, e.getErrorType());
        }
    }

    @Test
    public void testUnknownArray() {
        try {
            b.openArray("no-such-array");
            fail("未知数组");
        } catch (DSMException e) {
            assertEquals(ErrorType.NOT_FOUND, e.getErrorType());
        }
    }

    @Test
    public void testParallelWritersOnDisjointPages() throws Exception {
        DistributedArray onA = a.createArray(160);
        DistributedArray onB = b.openArray(onA.getId());

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<Void>> tasks = new ArrayList<>();
            tasks.add(pool.submit(() -> {
                fill(onA, 0, 80);
                return null;
            }));
            tasks.add(pool.submit(() -> {
                fill(onB, 80, 160);
                return null;
            }));
            for (Future<Void> task : tasks) {
                task.get();
            }
        } finally {
            pool.shutdown();
        }

        DistributedArray onC = c.openArray(onA.getId());
        long sum = 0;
        for (long i = 0; i < onC.length(); i++) {
            sum += onC.getLong(i);
        }
        long expected = 0;
        for (long i = 0; i < 160; i++) {
            expected += i * i + 3 * i + 1;
        }
        assertEquals(expected, sum);
    }

    @Test
    public void testDeleteArrayEverywhere() throws Exception {
        DistributedArray onA = a.createArray(100);
        onA.setLong(0, 1);
        onA.sync();
        b.openArray(onA.getId()).getLong(0);

        a.deleteArray(onA.getId());
        try {
            b.openArray(onA.getId());
            fail("数组已删除");
        } catch (DSMException e) {
            assertEquals(ErrorType.NOT_FOUND, e.getErrorType());
        }
        assertEquals(0, b.getCacheSize());
        assertEquals(0, a.getMemoryManager().getLocalPageCount());
    }

    private static void fill(DistributedArray array, long begin, long end) throws DSMException {
        for (long i = begin; i < end; i++) {
            array.setLong(i, i * i + 3 * i + 1);
        }
        array.sync();
    }

    private interface Call {
        void run() throws DSMException;
    }

    private static void assertConflict(Call call) {
        try {
            call.run();
            fail("应该发生租约冲突");
        } catch (DSMException e) {
            assertEquals(ErrorType.CONFLICT, e.getErrorType());
        }
    }
}
