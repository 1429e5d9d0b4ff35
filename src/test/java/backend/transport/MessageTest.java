package backend.transport;

import org.junit.Test;
import org.lupenghan.holodsm.backend.LeaseManager.Dataform.Lease;
import org.lupenghan.holodsm.backend.LeaseManager.Dataform.LeaseType;
import org.lupenghan.holodsm.backend.PageManager.Dataform.ElementType;
import org.lupenghan.holodsm.backend.transport.Dataform.Message;
import org.lupenghan.holodsm.backend.transport.Dataform.MessageType;
import org.lupenghan.holodsm.backend.utils.DSMException;
import org.lupenghan.holodsm.backend.utils.ErrorType;

import java.nio.ByteBuffer;
import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

public class MessageTest {

    @Test
    public void testFrameHeaderIsBigEndian() {
        byte[] frame = Message.createArraySync("a").serialize();
        ByteBuffer buffer = ByteBuffer.wrap(frame);
        assertEquals(MessageType.ARRAY_SYNC.getValue(), buffer.getShort());
        assertEquals(frame.length - Message.HEADER_SIZE, buffer.getInt());
    }

    @Test
    public void testPagePushCarriesImage() throws Exception {
        byte[] image = new byte[4096];
        image[0] = 42;
        image[4095] = -1;

        Message decoded = Message.deserialize(
                Message.createPagePush("array-1", 7, 3, image, "lease-1").serialize());

        assertEquals(MessageType.PAGE_PUSH, decoded.getType());
        assertEquals("array-1", decoded.getArrayId());
        assertEquals(7, decoded.getPageId());
        assertEquals(3, decoded.getVersion());
        assertEquals("lease-1", decoded.getLeaseId());
        assertArrayEquals(image, decoded.getData());
    }

    @Test
    public void testLeaseGrantRestoresLease() throws Exception {
        Lease lease = new Lease("lease-1", "array-1", 2, LeaseType.WRITE, "node-b", 4, 123_456);
        Message decoded = Message.deserialize(Message.createLeaseGrant(lease, "node-b").serialize());

        Lease restored = decoded.toLease();
        assertEquals("lease-1", restored.getLeaseId());
        assertEquals(LeaseType.WRITE, restored.getType());
        assertEquals("node-b", restored.getOwner());
        assertEquals(123_456, restored.getExpiresAt());
        assertEquals("node-b", decoded.getNodeId());
    }

    @Test
    public void testNullStringsSurvive() throws Exception {
        Message decoded = Message.deserialize(Message.createOwnerInfo("array-1", 0, null).serialize());
        assertNull(decoded.getNodeId());
    }

    @Test
    public void testArrayAnnounce() throws Exception {
        Message decoded = Message.deserialize(
                Message.createArrayAnnounce("array-1", 1000, ElementType.FLOAT32, 4096, 1, "node-a").serialize());
        assertEquals(1000, decoded.getLength());
        assertEquals(ElementType.FLOAT32, decoded.getElementType());
        assertEquals(4096, decoded.getPageSize());
        assertEquals("node-a", decoded.getNodeId());
    }

    @Test
    public void testInvalidateCarriesPageIds() throws Exception {
        Message decoded = Message.deserialize(Message.createInvalidate("array-1", new int[]{1, 5, 9}).serialize());
        assertArrayEquals(new int[]{1, 5, 9}, decoded.getPageIds());
    }

    @Test
    public void testErrorReplyRestoresException() throws Exception {
        DSMException original = new DSMException(ErrorType.CONFLICT, "busy", "array-1", 3, "lease-9");
        DSMException restored = Message.deserialize(Message.createError(original).serialize()).toException();

        assertEquals(ErrorType.CONFLICT, restored.getErrorType());
        assertEquals("busy", restored.getMessage());
        assertEquals("array-1", restored.getArrayId());
        assertEquals(3, restored.getPageId());
        assertEquals("lease-9", restored.getLeaseId());
    }

    @Test
    public void testTruncatedFrameIsProtocolError() {
        byte[] frame = Message.createPageRequest("array-1", 0, 1).serialize();
        assertProtocolError(Arrays.copyOf(frame, frame.length - 3));
    }

    @Test
    public void testTrailingBytesAreProtocolError() {
        byte[] frame = Message.createAck().serialize();
        byte[] padded = Arrays.copyOf(frame, frame.length + 2);
        // 头部长度同步修改，只留多余的负载
        ByteBuffer.wrap(padded).putShort((short) MessageType.ACK.getValue()).putInt(2);
        assertProtocolError(padded);
    }

    @Test
    public void testUnknownTypeIsProtocolError() {
        byte[] frame = Message.createAck().serialize();
        ByteBuffer.wrap(frame).putShort((short) 999);
        assertProtocolError(frame);
    }

    private static void assertProtocolError(byte[] frame) {
        try {
            Message.deserialize(frame);
            fail("应该是协议错误");
        } catch (DSMException e) {
            assertEquals(ErrorType.PROTOCOL, e.getErrorType());
        }
    }
}
