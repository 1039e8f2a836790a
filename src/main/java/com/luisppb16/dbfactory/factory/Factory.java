/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfactory.factory;

/**
 * A record that has not been inserted yet, together with everything needed to insert it.
 *
 * <p>Implementations hold default values for every column, expose fluent setters to override
 * them, and keep parent references as {@link Association} fields. {@link #insert(Object)} turns
 * the factory into a persisted model and leaves the factory itself unchanged, so it can serve as a
 * template for further inserts.
 *
 * <p>Implementations must not cache or deduplicate inserts. Every call to {@code insert} writes a
 * new row; sharing a parent between several children is done by handing them the same persisted
 * model through {@link Association#existing(Object, java.util.function.Function)}.
 *
 * @param <M> the model type the factory inserts
 * @param <I> the primary key type of the model
 * @param <C> the connection type the insert runs against
 */
public interface Factory<M, I, C> {

  /**
   * Inserts the record, resolving its own associations first.
   *
   * @throws FactoryInsertException if the underlying insert fails, for this record or for any
   *     parent that had to be inserted on the way
   */
  M insert(C connection);

  /** Primary key of an already persisted model. Never touches the database. */
  I idForModel(M model);

  /**
   * Independent copy of this factory. Scalar fields and pending parents are copied, parents that
   * are already persisted are shared.
   */
  Factory<M, I, C> copy();
}
