/* -*- mode: Java; c-basic-offset: 2; indent-tabs-mode: nil; coding: utf-8-unix -*-
 *
 * Copyright © 2018–2019 microBean.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or
 * implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.microbean.helidon.webserver.controller;

import java.util.Objects;

import java.util.concurrent.CompletionStage;

/**
 * The outcome of a {@link ControllerMethod} invocation.
 *
 * <p>A {@link HandlerResult} is exactly one of three things:</p>
 *
 * <ul>
 *
 * <li>an {@linkplain #immediate(Object) immediate} value that should
 * be written as the response body,</li>
 *
 * <li>a {@linkplain #deferred(CompletionStage) deferred} value that
 * will be written, or whose failure will be forwarded to the
 * routing's error handlers, once it settles, or</li>
 *
 * <li>an indication that the controller has {@linkplain
 * #alreadyWritten() already written} the response itself.</li>
 *
 * </ul>
 *
 * <p>Callers distinguish among the variants with a {@link Visitor},
 * so every variant must be handled.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see ControllerHandler
 */
public abstract class HandlerResult {

  private static final HandlerResult ALREADY_WRITTEN = new AlreadyWritten();

  private HandlerResult() {
    super();
  }

  /**
   * Returns the {@link Kind} of this {@link HandlerResult}.
   *
   * @return the {@link Kind} of this {@link HandlerResult}; never
   * {@code null}
   */
  public abstract Kind kind();

  /**
   * Calls the {@link Visitor} method appropriate for this {@link
   * HandlerResult}'s variant and returns its result.
   *
   * @param <R> the type of the visitor's result
   *
   * @param visitor the {@link Visitor}; must not be {@code null}
   *
   * @return the result of the visit; may be {@code null}
   *
   * @exception NullPointerException if {@code visitor} is {@code
   * null}
   */
  public abstract <R> R accept(final Visitor<R> visitor);

  /**
   * Returns a {@link HandlerResult} representing a value that is
   * available now.
   *
   * @param value the value; may be {@code null} in which case nothing
   * will be written
   *
   * @return a new {@link HandlerResult}; never {@code null}
   */
  public static final HandlerResult immediate(final Object value) {
    return new Immediate(value);
  }

  /**
   * Returns a {@link HandlerResult} representing a value that will be
   * available once the supplied {@link CompletionStage} settles.
   *
   * @param stage the {@link CompletionStage}; must not be {@code
   * null}
   *
   * @return a new {@link HandlerResult}; never {@code null}
   *
   * @exception NullPointerException if {@code stage} is {@code null}
   */
  public static final HandlerResult deferred(final CompletionStage<?> stage) {
    return new Deferred(stage);
  }

  /**
   * Returns a {@link HandlerResult} indicating that the response has
   * already been written by the controller.
   *
   * @return a {@link HandlerResult}; never {@code null}
   */
  public static final HandlerResult alreadyWritten() {
    return ALREADY_WRITTEN;
  }


  /*
   * Inner and nested classes.
   */


  /**
   * The variants a {@link HandlerResult} may take.
   */
  public enum Kind {

    /**
     * A value available now.
     */
    IMMEDIATE,

    /**
     * A value that will be available once a {@link CompletionStage}
     * settles.
     */
    DEFERRED,

    /**
     * No value; the response has already been written.
     */
    ALREADY_WRITTEN

  }

  /**
   * Receives the contents of a {@link HandlerResult}.
   *
   * @param <R> the type of the result of a visit
   *
   * @see HandlerResult#accept(Visitor)
   */
  public interface Visitor<R> {

    /**
     * Visits an {@linkplain HandlerResult#immediate(Object) immediate}
     * result.
     *
     * @param value the value; may be {@code null}
     *
     * @return the result of the visit; may be {@code null}
     */
    R visitImmediate(final Object value);

    /**
     * Visits a {@linkplain HandlerResult#deferred(CompletionStage)
     * deferred} result.
     *
     * @param stage the {@link CompletionStage}; never {@code null}
     *
     * @return the result of the visit; may be {@code null}
     */
    R visitDeferred(final CompletionStage<?> stage);

    /**
     * Visits an {@linkplain HandlerResult#alreadyWritten() already
     * written} result.
     *
     * @return the result of the visit; may be {@code null}
     */
    R visitAlreadyWritten();

  }

  private static final class Immediate extends HandlerResult {

    private final Object value;

    private Immediate(final Object value) {
      super();
      this.value = value;
    }

    @Override
    public final Kind kind() {
      return Kind.IMMEDIATE;
    }

    @Override
    public final <R> R accept(final Visitor<R> visitor) {
      return visitor.visitImmediate(this.value);
    }

    @Override
    public final String toString() {
      return "Immediate(" + this.value + ")";
    }

  }

  private static final class Deferred extends HandlerResult {

    private final CompletionStage<?> stage;

    private Deferred(final CompletionStage<?> stage) {
      super();
      this.stage = Objects.requireNonNull(stage);
    }

    @Override
    public final Kind kind() {
      return Kind.DEFERRED;
    }

    @Override
    public final <R> R accept(final Visitor<R> visitor) {
      return visitor.visitDeferred(this.stage);
    }

    @Override
    public final String toString() {
      return "Deferred(" + this.stage + ")";
    }

  }

  private static final class AlreadyWritten extends HandlerResult {

    private AlreadyWritten() {
      super();
    }

    @Override
    public final Kind kind() {
      return Kind.ALREADY_WRITTEN;
    }

    @Override
    public final <R> R accept(final Visitor<R> visitor) {
      return visitor.visitAlreadyWritten();
    }

    @Override
    public final String toString() {
      return "AlreadyWritten";
    }

  }

}
