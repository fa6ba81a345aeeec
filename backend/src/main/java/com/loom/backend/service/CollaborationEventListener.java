package com.loom.backend.service;

import com.loom.backend.domain.CollaborationEvent;

/**
 * engine이 상태를 바꿀 때마다 동기적으로 호출된다.
 * 예외를 던져도 다른 listener나 engine에는 영향이 없다.
 */
@FunctionalInterface
public interface CollaborationEventListener {
    void onEvent(CollaborationEvent event);
}
