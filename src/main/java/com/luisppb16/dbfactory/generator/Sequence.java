/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfactory.generator;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongFunction;

/**
 * Monotonic counter for minting values that must not collide, such as e-mail addresses on a
 * table with a unique constraint.
 *
 * <pre>{@code
 * String email = Sequence.sequence(n -> "user-" + n + "@example.com");
 * }</pre>
 *
 * <p>Every call observes a distinct number, also across threads. Which thread gets the lower
 * number is not defined. The counter starts at 0 and the first value handed out is 1.
 *
 * <p>{@link #sequence(LongFunction)} uses one instance shared by the whole process. Suites that
 * want their own numbering can create and pass around a separate {@code Sequence}.
 */
public final class Sequence {

  private static final Sequence GLOBAL = new Sequence();

  private final AtomicLong counter;

  public Sequence() {
    this(0L);
  }

  Sequence(final long start) {
    this.counter = new AtomicLong(start);
  }

  public static Sequence global() {
    return GLOBAL;
  }

  public static <T> T sequence(final LongFunction<T> format) {
    return GLOBAL.next(format);
  }

  public <T> T next(final LongFunction<T> format) {
    Objects.requireNonNull(format, "Format function cannot be null");
    return format.apply(counter.incrementAndGet());
  }

  /** Last value handed out, or the start value if none was. */
  public long current() {
    return counter.get();
  }
}
