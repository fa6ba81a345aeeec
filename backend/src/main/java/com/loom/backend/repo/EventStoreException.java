package com.loom.backend.repo;

/**
 * Event log 저장소에 접근할 수 없을 때. 재시도는 호출자가 결정한다.
 */
public class EventStoreException extends RuntimeException {

    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
