package com.loom.backend.service;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;

/**
 * "evt-" + sha256(seed-고해상도 시각)의 앞 12자리 hex.
 * 정상 운영에서 충돌이 없을 정도의 유일성만 보장한다.
 */
@Component
public class HashEventIdGenerator implements EventIdGenerator {
    static final String PREFIX = "evt-";
    static final int HEX_LENGTH = 12;

    private final Clock clock;

    public HashEventIdGenerator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String nextId(String seed) {
        Instant now = clock.instant();
        String material = seed + "-" + now.getEpochSecond() + "." + now.getNano() + "-" + System.nanoTime();
        return PREFIX + sha256Hex(material).substring(0, HEX_LENGTH);
    }

    private static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // 모든 JDK에 SHA-256은 있다
            throw new IllegalStateException(e);
        }
    }
}
