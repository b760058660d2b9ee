package com.workforce.core.engine;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates run ids of the form {@code yyyyMMdd_HHmmss_SSSSSS-xxxx}: UTC time to the microsecond,
 * then four random hex digits. Ids sort in start order and the microsecond part never repeats
 * within a process, even when the clock stands still or steps back.
 */
@Component
public class RunIdGenerator {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSSSSS").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final Random random;
    private final AtomicLong lastMicros = new AtomicLong();

    @Autowired
    public RunIdGenerator(Clock clock) {
        this(clock, new SecureRandom());
    }

    public RunIdGenerator(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    public String next() {
        Instant now = clock.instant();
        long nowMicros = TimeUnit.SECONDS.toMicros(now.getEpochSecond()) + now.getNano() / 1_000;
        long micros = lastMicros.updateAndGet(last -> Math.max(nowMicros, last + 1));
        Instant stamp = Instant.ofEpochSecond(micros / 1_000_000, (micros % 1_000_000) * 1_000);
        byte[] suffix = new byte[2];
        random.nextBytes(suffix);
        return FORMAT.format(stamp) + "-" + HexFormat.of().formatHex(suffix);
    }
}
