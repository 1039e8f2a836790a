/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfactory.factory;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A "belongs to" reference from a child factory to its parent, which may or may not have been
 * inserted yet.
 *
 * <p>{@link Existing} points at a parent the test already inserted. Several children can hold the
 * same model and they all end up with the same foreign key, without any extra insert.
 *
 * <p>{@link Pending} owns a parent factory. Resolving it inserts a copy of that factory, so two
 * children built with their own default association get two distinct parents. Handing the same
 * factory to two children gives each its own copy.
 *
 * <pre>{@code
 * Country denmark = new CountryFactory().name("Denmark").insert(connection);
 * City aarhus = new CityFactory().name("Aarhus").country(denmark).insert(connection);
 * City odense = new CityFactory().name("Odense").country(denmark).insert(connection);
 * }</pre>
 *
 * @param <M> parent model type
 * @param <I> parent primary key type
 * @param <C> connection type
 */
public sealed interface Association<M, I, C>
    permits Association.Existing, Association.Pending {

  /**
   * Association to a persisted parent. The key is read once, here, and kept as a copy.
   *
   * @param idExtractor projection of the model's primary key, usually {@code Country::id}
   */
  static <M, I, C> Association<M, I, C> existing(
      @NotNull M model, @NotNull Function<? super M, ? extends I> idExtractor) {
    Objects.requireNonNull(model, "Associated model cannot be null");
    Objects.requireNonNull(idExtractor, "Id extractor cannot be null");
    return new Existing<>(model, idExtractor.apply(model));
  }

  /**
   * Association to a parent that still has to be inserted. Holds a copy of {@code factory}, so
   * later changes to the argument do not reach the association.
   */
  static <M, I, C> Association<M, I, C> pending(@NotNull Factory<M, I, C> factory) {
    Objects.requireNonNull(factory, "Associated factory cannot be null");
    return new Pending<>(factory.copy());
  }

  /** Default association: a pending parent built from the parent factory's own defaults. */
  static <M, I, C> Association<M, I, C> defaultOf(
      @NotNull Supplier<? extends Factory<M, I, C>> defaults) {
    Objects.requireNonNull(defaults, "Default factory supplier cannot be null");
    return new Pending<>(defaults.get());
  }

  /**
   * Resolves an optional association. A {@code null} association resolves to a {@code null} key
   * and touches nothing.
   */
  @Nullable
  static <M, I, C> I insertReturningIdOrNull(
      @Nullable Association<M, I, C> association, C connection) {
    return association == null ? null : association.insertReturningId(connection);
  }

  /**
   * Primary key of the parent, inserting it first when it is still pending. At most one parent
   * row is written per call.
   *
   * @throws FactoryInsertException if the pending parent cannot be inserted
   */
  I insertReturningId(C connection);

  /** Copy for use by a copied child factory. Persisted parents are shared, pending ones copied. */
  Association<M, I, C> copy();

  record Existing<M, I, C>(@NotNull M model, @NotNull I id) implements Association<M, I, C> {

    public Existing {
      Objects.requireNonNull(model, "Associated model cannot be null");
      Objects.requireNonNull(id, "Associated model has no id");
    }

    @Override
    public I insertReturningId(C connection) {
      return id;
    }

    @Override
    public Association<M, I, C> copy() {
      return this;
    }
  }

  record Pending<M, I, C>(@NotNull Factory<M, I, C> factory) implements Association<M, I, C> {

    public Pending {
      Objects.requireNonNull(factory, "Associated factory cannot be null");
    }

    @Override
    public I insertReturningId(C connection) {
      // insert consumes its factory; the one held here stays untouched
      final M model = factory.copy().insert(connection);
      return factory.idForModel(model);
    }

    @Override
    public Association<M, I, C> copy() {
      return new Pending<>(factory.copy());
    }
  }
}
