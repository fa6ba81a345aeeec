package com.loom.backend.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * node 하나에 대한 시간 제한 편집 잠금.
 * 만료는 다른 사용자가 같은 node를 잡으려 할 때만 평가된다.
 */
public record EditLock(
        String nodeId,
        String userId,
        String userName,
        Instant lockedAt,
        Instant expiresAt
) {
    public static final Duration TIMEOUT = Duration.ofSeconds(300);

    public static EditLock grant(String nodeId, String userId, String userName, Instant now) {
        return new EditLock(nodeId, userId, userName, now, now.plus(TIMEOUT));
    }

    public boolean isHeldBy(String otherUserId) {
        return userId.equals(otherUserId);
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
