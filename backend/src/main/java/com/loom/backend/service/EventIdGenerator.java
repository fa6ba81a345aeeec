package com.loom.backend.service;

/**
 * event id 생성 전략. 더 강한 방식이 필요하면 bean을 교체한다.
 */
@FunctionalInterface
public interface EventIdGenerator {
    String nextId(String seed);
}
