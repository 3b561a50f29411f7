package com.datapipeline.core.error;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/** Log entry ids: {@code ERR-<epoch millis, base 36>-<6 random base-36 chars>}. */
final class ErrorIds {
  private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

  private ErrorIds() {}

  static String next(Clock clock) {
    StringBuilder sb = new StringBuilder("ERR-").append(Long.toString(clock.millis(), 36)).append('-');
    ThreadLocalRandom r = ThreadLocalRandom.current();
    for (int i = 0; i < 6; i++) sb.append(ALPHABET.charAt(r.nextInt(ALPHABET.length())));
    return sb.toString();
  }
}
