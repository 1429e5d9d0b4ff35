package org.lupenghan.holodsm.backend.transport.Dataform;

import lombok.Getter;
import org.lupenghan.holodsm.backend.LeaseManager.Dataform.Lease;
import org.lupenghan.holodsm.backend.LeaseManager.Dataform.LeaseType;
import org.lupenghan.holodsm.backend.PageManager.Dataform.ElementType;
import org.lupenghan.holodsm.backend.utils.DSMException;
import org.lupenghan.holodsm.backend.utils.ErrorType;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * 节点间消息
 * 帧格式：大端头部 [类型:u16][长度:u32]，随后是按类型编码的负载。
 * 页面数据是小端的原始页面镜像
 */
@Getter
public class Message {
    // 帧头长度
    public static final int HEADER_SIZE = 2 + 4;

    private MessageType type;

    private String arrayId;
    private int pageId = DSMException.NO_PAGE;
    private long version;
    private byte[] data = new byte[0];

    // 租约相关
    private String leaseId;
    private LeaseType leaseType;
    private String owner;
    private long expiresAt;

    // 节点ID：页面所有者或数组的归属节点
    private String nodeId;

    // 数组元数据
    private long length;
    private ElementType elementType;
    private int pageSize;

    // 失效页面列表
    private int[] pageIds = new int[0];

    // 错误应答
    private ErrorType errorType;
    private String errorMessage;

    private Message(MessageType type) {
        this.type = type;
    }

    // ---- 构造方法 ----

    public static Message createPageRequest(String arrayId, int pageId, long version) {
        Message msg = new Message(MessageType.PAGE_REQUEST);
        msg.arrayId = arrayId;
        msg.pageId = pageId;
        msg.version = version;
        return msg;
    }

    public static Message createPageResponse(String arrayId, int pageId, long version, byte[] data) {
        Message msg = new Message(MessageType.PAGE_RESPONSE);
        msg.arrayId = arrayId;
        msg.pageId = pageId;
        msg.version = version;
        msg.data = data;
        return msg;
    }

    public static Message createPagePush(String arrayId, int pageId, long version, byte[] data, String leaseId) {
        Message msg = new Message(MessageType.PAGE_PUSH);
        msg.arrayId = arrayId;
        msg.pageId = pageId;
        msg.version = version;
        msg.data = data;
        msg.leaseId = leaseId;
        return msg;
    }

    public static Message createLeaseAcquire(String leaseId, String arrayId, int pageId, LeaseType leaseType,
                                             String owner, long version) {
        Message msg = new Message(MessageType.LEASE_ACQUIRE);
        msg.leaseId = leaseId;
        msg.arrayId = arrayId;
        msg.pageId = pageId;
        msg.leaseType = leaseType;
        msg.owner = owner;
        msg.version = version;
        return msg;
    }

    /**
     * 租约授予应答
     * @param lease 授予的租约
     * @param pageOwner 授予后页面的所有者，可能为null
     */
    public static Message createLeaseGrant(Lease lease, String pageOwner) {
        Message msg = new Message(MessageType.LEASE_GRANT);
        msg.leaseId = lease.getLeaseId();
        msg.arrayId = lease.getArrayId();
        msg.pageId = lease.getPageId();
        msg.leaseType = lease.getType();
        msg.owner = lease.getOwner();
        msg.version = lease.getVersion();
        msg.expiresAt = lease.getExpiresAt();
        msg.nodeId = pageOwner;
        return msg;
    }

    public static Message createLeaseRelease(String leaseId) {
        Message msg = new Message(MessageType.LEASE_RELEASE);
        msg.leaseId = leaseId;
        return msg;
    }

    public static Message createLeaseRevoke(String arrayId, int pageId) {
        Message msg = new Message(MessageType.LEASE_REVOKE);
        msg.arrayId = arrayId;
        msg.pageId = pageId;
        return msg;
    }

    public static Message createOwnerLookup(String arrayId, int pageId) {
        Message msg = new Message(MessageType.OWNER_LOOKUP);
        msg.arrayId = arrayId;
        msg.pageId = pageId;
        return msg;
    }

    public static Message createOwnerClaim(String arrayId, int pageId, String nodeId) {
        Message msg = new Message(MessageType.OWNER_CLAIM);
        msg.arrayId = arrayId;
        msg.pageId = pageId;
        msg.nodeId = nodeId;
        return msg;
    }

    public static Message createOwnerInfo(String arrayId, int pageId, String nodeId) {
        Message msg = new Message(MessageType.OWNER_INFO);
        msg.arrayId = arrayId;
        msg.pageId = pageId;
        msg.nodeId = nodeId;
        return msg;
    }

    public static Message createArrayAnnounce(String arrayId, long length, ElementType elementType, int pageSize,
                                              long version, String homeNode) {
        Message msg = new Message(MessageType.ARRAY_ANNOUNCE);
        msg.arrayId = arrayId;
        msg.length = length;
        msg.elementType = elementType;
        msg.pageSize = pageSize;
        msg.version = version;
        msg.nodeId = homeNode;
        return msg;
    }

    public static Message createArrayDelete(String arrayId) {
        Message msg = new Message(MessageType.ARRAY_DELETE);
        msg.arrayId = arrayId;
        return msg;
    }

    public static Message createArraySync(String arrayId) {
        Message msg = new Message(MessageType.ARRAY_SYNC);
        msg.arrayId = arrayId;
        return msg;
    }

    public static Message createArrayVersion(String arrayId, long version) {
        Message msg = new Message(MessageType.ARRAY_VERSION);
        msg.arrayId = arrayId;
        msg.version = version;
        return msg;
    }

    public static Message createInvalidate(String arrayId, int[] pageIds) {
        Message msg = new Message(MessageType.INVALIDATE);
        msg.arrayId = arrayId;
        msg.pageIds = pageIds;
        return msg;
    }

    public static Message createAck() {
        return new Message(MessageType.ACK);
    }

    public static Message createError(DSMException e) {
        Message msg = new Message(MessageType.ERROR);
        msg.errorType = e.getErrorType();
        msg.errorMessage = e.getMessage();
        msg.arrayId = e.getArrayId();
        msg.pageId = e.getPageId();
        msg.leaseId = e.getLeaseId();
        return msg;
    }

    /**
     * 把错误应答还原为异常
     * @return 与远端抛出的错误类型相同的异常
     */
    public DSMException toException() {
        if (type != MessageType.ERROR) {
            throw new IllegalStateException("不是错误应答: " + type);
        }
        return new DSMException(errorType, errorMessage, arrayId, pageId, leaseId);
    }

    /**
     * 从授予应答还原租约
     */
    public Lease toLease() {
        if (type != MessageType.LEASE_GRANT) {
            throw new IllegalStateException("不是租约授予应答: " + type);
        }
        return new Lease(leaseId, arrayId, pageId, leaseType, owner, version, expiresAt);
    }

    // ---- 序列化 ----

    public byte[] serialize() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            writePayload(out);
        } catch (IOException e) {
            // ByteArrayOutputStream 不会抛出IO异常
            throw new UncheckedIOException(e);
        }
        byte[] payload = bytes.toByteArray();

        ByteBuffer frame = ByteBuffer.allocate(HEADER_SIZE + payload.length);
        frame.putShort((short) type.getValue());
        frame.putInt(payload.length);
        frame.put(payload);
        return frame.array();
    }

    private void writePayload(DataOutputStream out) throws IOException {
        switch (type) {
            case PAGE_REQUEST:
                writeString(out, arrayId);
                out.writeInt(pageId);
                out.writeLong(version);
                break;
            case PAGE_RESPONSE:
                writeString(out, arrayId);
                out.writeInt(pageId);
                out.writeLong(version);
                writeBytes(out, data);
                break;
            case PAGE_PUSH:
                writeString(out, arrayId);
                out.writeInt(pageId);
                out.writeLong(version);
                writeString(out, leaseId);
                writeBytes(out, data);
                break;
            case LEASE_ACQUIRE:
                writeString(out, leaseId);
                writeString(out, arrayId);
                out.writeInt(pageId);
                out.writeByte(leaseType.getValue());
                writeString(out, owner);
                out.writeLong(version);
                break;
            case LEASE_GRANT:
                writeString(out, leaseId);
                writeString(out, arrayId);
                out.writeInt(pageId);
                out.writeByte(leaseType.getValue());
                writeString(out, owner);
                out.writeLong(version);
                out.writeLong(expiresAt);
                writeString(out, nodeId);
                break;
            case LEASE_RELEASE:
                writeString(out, leaseId);
                break;
            case LEASE_REVOKE:
            case OWNER_LOOKUP:
                writeString(out, arrayId);
                out.writeInt(pageId);
                break;
            case OWNER_CLAIM:
            case OWNER_INFO:
                writeString(out, arrayId);
                out.writeInt(pageId);
                writeString(out, nodeId);
                break;
            case ARRAY_ANNOUNCE:
                writeString(out, arrayId);
                out.writeLong(length);
                out.writeByte(elementType.getValue());
                out.writeInt(pageSize);
                out.writeLong(version);
                writeString(out, nodeId);
                break;
            case ARRAY_DELETE:
            case ARRAY_SYNC:
                writeString(out, arrayId);
                break;
            case ARRAY_VERSION:
                writeString(out, arrayId);
                out.writeLong(version);
                break;
            case INVALIDATE:
                writeString(out, arrayId);
                out.writeInt(pageIds.length);
                for (int id : pageIds) {
                    out.writeInt(id);
                }
                break;
            case ACK:
                break;
            case ERROR:
                out.writeByte(errorType.getValue());
                writeString(out, errorMessage);
                writeString(out, arrayId);
                out.writeInt(pageId);
                writeString(out, leaseId);
                break;
            default:
                throw new IllegalStateException("未知消息类型: " + type);
        }
    }

    // ---- 反序列化 ----

    /**
     * 解析一帧消息
     * @param frame 帧字节
     * @return 消息
     * @throws DSMException 帧格式错误时抛出PROTOCOL
     */
    public static Message deserialize(byte[] frame) throws DSMException {
        try {
            ByteBuffer buffer = ByteBuffer.wrap(frame);
            MessageType type = MessageType.fromValue(buffer.getShort() & 0xFFFF);
            int size = buffer.getInt();
            if (size != buffer.remaining()) {
                throw new DSMException(ErrorType.PROTOCOL,
                        "帧长度不一致: 头部声明 " + size + " 字节，实际 " + buffer.remaining() + " 字节");
            }
            Message msg = new Message(type);
            msg.readPayload(buffer);
            if (buffer.hasRemaining()) {
                throw new DSMException(ErrorType.PROTOCOL, "帧末尾有多余的 " + buffer.remaining() + " 字节");
            }
            return msg;
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new DSMException(ErrorType.PROTOCOL, "无法解析消息帧: " + e, e);
        }
    }

    private void readPayload(ByteBuffer in) {
        switch (type) {
            case PAGE_REQUEST:
                arrayId = readString(in);
                pageId = in.getInt();
                version = in.getLong();
                break;
            case PAGE_RESPONSE:
                arrayId = readString(in);
                pageId = in.getInt();
                version = in.getLong();
                data = readBytes(in);
                break;
            case PAGE_PUSH:
                arrayId = readString(in);
                pageId = in.getInt();
                version = in.getLong();
                leaseId = readString(in);
                data = readBytes(in);
                break;
            case LEASE_ACQUIRE:
                leaseId = readString(in);
                arrayId = readString(in);
                pageId = in.getInt();
                leaseType = LeaseType.fromValue(in.get());
                owner = readString(in);
                version = in.getLong();
                break;
            case LEASE_GRANT:
                leaseId = readString(in);
                arrayId = readString(in);
                pageId = in.getInt();
                leaseType = LeaseType.fromValue(in.get());
                owner = readString(in);
                version = in.getLong();
                expiresAt = in.getLong();
                nodeId = readString(in);
                break;
            case LEASE_RELEASE:
                leaseId = readString(in);
                break;
            case LEASE_REVOKE:
            case OWNER_LOOKUP:
                arrayId = readString(in);
                pageId = in.getInt();
                break;
            case OWNER_CLAIM:
            case OWNER_INFO:
                arrayId = readString(in);
                pageId = in.getInt();
                nodeId = readString(in);
                break;
            case ARRAY_ANNOUNCE:
                arrayId = readString(in);
                length = in.getLong();
                elementType = ElementType.fromValue(in.get());
                pageSize = in.getInt();
                version = in.getLong();
                nodeId = readString(in);
                break;
            case ARRAY_DELETE:
            case ARRAY_SYNC:
                arrayId = readString(in);
                break;
            case ARRAY_VERSION:
                arrayId = readString(in);
                version = in.getLong();
                break;
            case INVALIDATE:
                arrayId = readString(in);
                int count = in.getInt();
                if (count < 0 || count > in.remaining() / Integer.BYTES) {
                    throw new IllegalArgumentException("非法的页面数量: " + count);
                }
                pageIds = new int[count];
                for (int i = 0; i < count; i++) {
                    pageIds[i] = in.getInt();
                }
                break;
            case ACK:
                break;
            case ERROR:
                errorType = ErrorType.fromValue(in.get());
                errorMessage = readString(in);
                arrayId = readString(in);
                pageId = in.getInt();
                leaseId = readString(in);
                break;
            default:
                throw new IllegalArgumentException("未知消息类型: " + type);
        }
    }

    // 字符串编码：长度(-1表示null) + UTF-8字节
    private static void writeString(DataOutputStream out, String value) throws IOException {
        if (value == null) {
            out.writeInt(-1);
            return;
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    private static String readString(ByteBuffer in) {
        int len = in.getInt();
        if (len == -1) {
            return null;
        }
        if (len < 0 || len > in.remaining()) {
            throw new IllegalArgumentException("非法的字符串长度: " + len);
        }
        byte[] bytes = new byte[len];
        in.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static void writeBytes(DataOutputStream out, byte[] value) throws IOException {
        out.writeInt(value.length);
        out.write(value);
    }

    private static byte[] readBytes(ByteBuffer in) {
        int len = in.getInt();
        if (len < 0 || len > in.remaining()) {
            throw new IllegalArgumentException("非法的数据长度: " + len);
        }
        byte[] bytes = new byte[len];
        in.get(bytes);
        return bytes;
    }

    @Override
    public String toString() {
        return "Message{type=" + type + ", arrayId=" + arrayId + ", pageId=" + pageId + "}";
    }
}
