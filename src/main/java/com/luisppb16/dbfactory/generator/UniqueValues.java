/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfactory.generator;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import net.datafaker.Faker;

/**
 * Realistic-looking values for factory defaults that are still guaranteed unique: a Faker word
 * plus a number drawn from a {@link Sequence}.
 *
 * <p>Useful for columns under a unique constraint, where a fixed default would make the second
 * insert fail.
 */
public final class UniqueValues {

  private static final Pattern NON_IDENTIFIER = Pattern.compile("[^a-z0-9]");
  private static final String FALLBACK_LOCAL_PART = "user";
  private static final String EMAIL_DOMAIN = "example.com";

  private final Faker faker;
  private final Sequence sequence;

  public UniqueValues() {
    this(new Faker(), Sequence.global());
  }

  public UniqueValues(final Faker faker, final Sequence sequence) {
    this.faker = Objects.requireNonNull(faker, "Faker cannot be null");
    this.sequence = Objects.requireNonNull(sequence, "Sequence cannot be null");
  }

  public String username() {
    final String base = sanitize(faker.name().firstName());
    return sequence.next(n -> base + n);
  }

  public String email() {
    return username() + "@" + EMAIL_DOMAIN;
  }

  public String word() {
    final String base = sanitize(faker.lorem().word());
    return sequence.next(n -> base + "-" + n);
  }

  public String name(final String prefix) {
    Objects.requireNonNull(prefix, "Prefix cannot be null");
    return sequence.next(n -> prefix + " " + n);
  }

  public long number() {
    return sequence.next(n -> n);
  }

  private static String sanitize(final String raw) {
    final String cleaned =
        NON_IDENTIFIER.matcher(raw == null ? "" : raw.toLowerCase(Locale.ROOT)).replaceAll("");
    return cleaned.isEmpty() ? FALLBACK_LOCAL_PART : cleaned;
  }
}
