package org.lupenghan.holodsm.backend;

import org.lupenghan.holodsm.backend.LeaseManager.Dataform.Lease;
import org.lupenghan.holodsm.backend.MemoryManager.Dataform.SharedArray;
import org.lupenghan.holodsm.backend.MemoryManager.MemoryManager;
import org.lupenghan.holodsm.backend.PageManager.Page;
import org.lupenghan.holodsm.backend.transport.Connection;
import org.lupenghan.holodsm.backend.transport.Dataform.Message;
import org.lupenghan.holodsm.backend.transport.MessageHandler;
import org.lupenghan.holodsm.backend.transport.Stream;
import org.lupenghan.holodsm.backend.utils.DSMException;
import org.lupenghan.holodsm.backend.utils.ErrorType;

import java.util.logging.Logger;

/**
 * 入站请求分发：把每种请求交给内存管理器处理，失败以ERROR应答返回请求方
 */
public class NodeRequestHandler implements MessageHandler {
    private static final Logger LOGGER = Logger.getLogger(NodeRequestHandler.class.getName());

    private final MemoryManager memoryManager;

    public NodeRequestHandler(MemoryManager memoryManager) {
        this.memoryManager = memoryManager;
    }

    @Override
    public void handleMessage(Connection connection, Stream stream, byte[] data) throws DSMException {
        Message reply;
        try {
            Message request = Message.deserialize(data);
            reply = dispatch(request, connection.getRemoteNodeId());
        } catch (DSMException e) {
            LOGGER.fine("处理来自 " + connection.getRemoteNodeId() + " 的请求失败: " + e);
            reply = Message.createError(e);
        } catch (IllegalArgumentException e) {
            reply = Message.createError(new DSMException(ErrorType.PROTOCOL, "非法请求: " + e.getMessage()));
        }
        stream.writeMessage(reply.serialize());
    }

    Message dispatch(Message request, String requester) throws DSMException {
        String arrayId = request.getArrayId();
        int pageId = request.getPageId();
        switch (request.getType()) {
            case PAGE_REQUEST: {
                Page page = memoryManager.servePage(arrayId, pageId, request.getVersion());
                return Message.createPageResponse(arrayId, pageId, page.getVersion(), page.snapshot());
            }
            case PAGE_PUSH:
                memoryManager.storePage(arrayId, pageId, request.getData(), request.getVersion(),
                        request.getLeaseId());
                return Message.createAck();
            case LEASE_ACQUIRE: {
                Lease lease = memoryManager.grantLease(request.getLeaseId(), arrayId, pageId,
                        request.getLeaseType(), request.getOwner(), request.getVersion());
                String owner = memoryManager.getArray(arrayId).getPageOwner(pageId);
                return Message.createLeaseGrant(lease, owner);
            }
            case LEASE_RELEASE:
                memoryManager.getLeaseManager().releaseLease(request.getLeaseId());
                return Message.createAck();
            case LEASE_REVOKE:
                memoryManager.getLeaseManager().revokeLease(arrayId, pageId);
                return Message.createAck();
            case OWNER_LOOKUP:
                return Message.createOwnerInfo(arrayId, pageId, memoryManager.lookupOwner(arrayId, pageId));
            case OWNER_CLAIM:
                return Message.createOwnerInfo(arrayId, pageId,
                        memoryManager.assignOwner(arrayId, pageId, request.getNodeId()));
            case ARRAY_ANNOUNCE:
                registerAnnounced(request);
                return Message.createAck();
            case ARRAY_DELETE:
                memoryManager.forgetArray(arrayId);
                return Message.createAck();
            case ARRAY_SYNC:
                return Message.createArrayVersion(arrayId, memoryManager.advanceArrayVersion(arrayId, requester));
            case ARRAY_VERSION:
                memoryManager.applyArrayVersion(arrayId, request.getVersion());
                return Message.createAck();
            case INVALIDATE:
                memoryManager.invalidateLocal(arrayId, request.getPageIds());
                return Message.createAck();
            default:
                throw new DSMException(ErrorType.PROTOCOL, "不是请求消息: " + request.getType());
        }
    }

    private void registerAnnounced(Message request) throws DSMException {
        int localPageSize = memoryManager.getPageSize();
        if (request.getPageSize() != localPageSize) {
            throw new DSMException(ErrorType.PROTOCOL,
                    "页面大小不一致: " + request.getPageSize() + "，本节点为 " + localPageSize,
                    request.getArrayId(), DSMException.NO_PAGE, null);
        }
        memoryManager.registerArray(new SharedArray(request.getArrayId(), request.getLength(),
                request.getElementType(), request.getPageSize(), request.getNodeId(), request.getVersion()));
    }
}
