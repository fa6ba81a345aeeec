package com.loom.backend.service;

/**
 * 다른 사용자가 아직 유효한 lock을 잡고 있는 node를 잠그려 할 때.
 */
public class LockConflictException extends IllegalStateException {
    private final String nodeId;
    private final String holderId;
    private final String holderName;

    public LockConflictException(String nodeId, String holderId, String holderName) {
        super("Node is being edited by " + holderName);
        this.nodeId = nodeId;
        this.holderId = holderId;
        this.holderName = holderName;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getHolderId() {
        return holderId;
    }

    public String getHolderName() {
        return holderName;
    }
}
