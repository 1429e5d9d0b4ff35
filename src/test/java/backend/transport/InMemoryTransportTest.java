package backend.transport;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.lupenghan.holodsm.backend.transport.Dataform.Message;
import org.lupenghan.holodsm.backend.transport.Dataform.MessageType;
import org.lupenghan.holodsm.backend.transport.Impl.InMemoryNetwork;
import org.lupenghan.holodsm.backend.transport.Impl.InMemoryTransport;
import org.lupenghan.holodsm.backend.transport.Messenger;
import org.lupenghan.holodsm.backend.utils.DSMException;
import org.lupenghan.holodsm.backend.utils.ErrorType;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class InMemoryTransportTest {
    private InMemoryNetwork network;
    private InMemoryTransport a;
    private InMemoryTransport b;
    private InMemoryTransport c;

    @Before
    public void setUp() {
        network = new InMemoryNetwork();
        a = network.join("node-a");
        b = network.join("node-b");
        c = network.join("node-c");

        // b和c把请求中的版本号加一后返回
        b.registerHandler((connection, stream, data) -> {
            Message request = Message.deserialize(data);
            stream.writeMessage(Message.createArrayVersion(connection.getRemoteNodeId(),
                    request.getVersion() + 1).serialize());
        });
        c.registerHandler((connection, stream, data) ->
                stream.writeMessage(Message.createAck().serialize()));
    }

    @After
    public void tearDown() {
        a.close();
        b.close();
        c.close();
    }

    @Test
    public void testRequestResponse() throws Exception {
        Messenger messenger = new Messenger(a, 1_000);
        Message reply = messenger.request("node-b",
                Message.createArrayVersion("array-1", 41), MessageType.ARRAY_VERSION);

        assertEquals(42, reply.getVersion());
        // 处理器看到的远端就是请求方
        assertEquals("node-a", reply.getArrayId());
    }

    @Test
    public void testPeers() {
        assertEquals(2, a.getPeers().size());
        assertTrue(a.getPeers().contains("node-b"));
        assertTrue(a.getPeers().contains("node-c"));
    }

    @Test
    public void testUnexpectedReplyType() {
        Messenger messenger = new Messenger(a, 1_000);
        try {
            messenger.request("node-c", Message.createArraySync("array-1"), MessageType.ARRAY_VERSION);
            fail("应答类型不符");
        } catch (DSMException e) {
            assertEquals(ErrorType.PROTOCOL, e.getErrorType());
        }
    }

    @Test
    public void testErrorReplyIsRethrown() {
        c.registerHandler((connection, stream, data) -> stream.writeMessage(Message.createError(
                new DSMException(ErrorType.NOT_FOUND, "no such array", "array-1", 0, null)).serialize()));
        Messenger messenger = new Messenger(a, 1_000);
        try {
            messenger.request("node-c", Message.createArraySync("array-1"));
            fail("应该抛出远端的错误");
        } catch (DSMException e) {
            assertEquals(ErrorType.NOT_FOUND, e.getErrorType());
            assertEquals("array-1", e.getArrayId());
        }
    }

    @Test
    public void testDisconnectedNodeIsUnreachable() {
        network.disconnect("node-b");
        Messenger messenger = new Messenger(a, 1_000);
        try {
            messenger.request("node-b", Message.createAck());
            fail("断开的节点不可达");
        } catch (DSMException e) {
            assertEquals(ErrorType.UNREACHABLE, e.getErrorType());
        }

        // 被断开的节点也发不出消息
        try {
            new Messenger(b, 1_000).request("node-c", Message.createAck());
            fail("断开的节点不能发送");
        } catch (DSMException e) {
            assertEquals(ErrorType.UNREACHABLE, e.getErrorType());
        }
    }

    @Test
    public void testUnknownNodeIsUnreachable() {
        try {
            a.connect("node-x");
            fail("未知节点不可达");
        } catch (DSMException e) {
            assertEquals(ErrorType.UNREACHABLE, e.getErrorType());
        }
    }

    @Test
    public void testSilentPeerTimesOut() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        c.registerHandler((connection, stream, data) -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        Messenger messenger = new Messenger(a, 50);
        try {
            messenger.request("node-c", Message.createAck());
            fail("应该超时");
        } catch (DSMException e) {
            assertEquals(ErrorType.TIMEOUT, e.getErrorType());
        } finally {
            release.countDown();
        }
    }

    @Test
    public void testInterruptedRequestIsCancelled() {
        c.registerHandler((connection, stream, data) -> {
            // 不应答
        });
        Messenger messenger = new Messenger(a, 5_000);
        Thread.currentThread().interrupt();
        try {
            messenger.request("node-c", Message.createAck());
            fail("应该被取消");
        } catch (DSMException e) {
            assertEquals(ErrorType.CANCELLED, e.getErrorType());
            assertTrue(Thread.interrupted());
        }
    }

    @Test
    public void testBroadcastSkipsUnreachable() {
        Messenger messenger = new Messenger(a, 1_000);
        assertEquals(2, messenger.broadcast(Message.createArrayVersion("array-1", 1)));

        network.disconnect("node-c");
        assertEquals(1, messenger.broadcast(Message.createArrayVersion("array-1", 1)));
        assertEquals(0, messenger.broadcastExcept(Message.createArrayVersion("array-1", 1), "node-b"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNodeId() {
        network.join("node-a");
    }
}
