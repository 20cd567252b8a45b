package com.framegate.infrastructure.pipeline;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Random;
import java.util.zip.CRC32;

/**
 * First attempts get a seed derived from the run, frame and attempt so they can be replayed;
 * retries get a fresh random seed.
 */
@Component
public class SeedPolicy {

    private final Random random;

    public SeedPolicy() {
        this(new Random());
    }

    SeedPolicy(Random random) {
        this.random = random;
    }

    public long seedFor(String runId, int frameIndex, int attemptIndex) {
        if (attemptIndex == 1) {
            return deterministicSeed(runId, frameIndex, attemptIndex);
        }
        return random.nextInt() & 0xFFFFFFFFL;
    }

    public static long deterministicSeed(String runId, int frameIndex, int attemptIndex) {
        CRC32 crc = new CRC32();
        crc.update((runId + "::" + frameIndex + "::" + attemptIndex).getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }
}
