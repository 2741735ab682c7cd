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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.helidon.webserver.Handler;

/**
 * Controller-level routing information: the base path under which a
 * {@link Controller}'s routes are mounted, the middleware that runs
 * before any of them, and the name under which the {@link
 * ControllerRegistry} resolves the {@link Controller}.
 *
 * <p>Instances of this class are immutable.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see #builder(Class)
 *
 * @see ControllerMetadata.Builder#controller(ControllerDescriptor)
 */
public final class ControllerDescriptor {

  private final Class<? extends Controller> type;

  private final String name;

  private final String path;

  private final List<Handler> middleware;

  private ControllerDescriptor(final Builder builder) {
    super();
    this.type = builder.type;
    this.name = builder.name == null ? builder.type.getName() : builder.name;
    this.path = builder.path;
    this.middleware = Collections.unmodifiableList(new ArrayList<>(builder.middleware));
  }

  /**
   * Returns the {@link Controller} type this {@link
   * ControllerDescriptor} describes.
   *
   * @return the {@link Controller} type; never {@code null}
   */
  public final Class<? extends Controller> type() {
    return this.type;
  }

  /**
   * Returns the name under which the {@link Controller} is resolved
   * from a {@link ControllerRegistry}.
   *
   * @return the name; never {@code null}
   *
   * @see ControllerRegistry#getNamed(String)
   */
  public final String name() {
    return this.name;
  }

  /**
   * Returns the base path under which the {@link Controller}'s routes
   * are mounted.
   *
   * @return the base path; never {@code null}
   */
  public final String path() {
    return this.path;
  }

  /**
   * Returns the middleware {@link Handler}s that run, in order, before
   * any of the {@link Controller}'s routes.
   *
   * @return an immutable {@link List} of {@link Handler}s; never
   * {@code null}
   */
  public final List<Handler> middleware() {
    return this.middleware;
  }

  @Override
  public final String toString() {
    return this.name + " -> " + this.path;
  }

  /**
   * Returns a new {@link Builder} for a {@link ControllerDescriptor}
   * describing the supplied {@link Controller} type.
   *
   * @param type the {@link Controller} type; must not be {@code null}
   *
   * @return a new {@link Builder}; never {@code null}
   *
   * @exception NullPointerException if {@code type} is {@code null}
   */
  public static final Builder builder(final Class<? extends Controller> type) {
    return new Builder(type);
  }


  /*
   * Inner and nested classes.
   */


  /**
   * A builder of {@link ControllerDescriptor}s.
   *
   * @see ControllerDescriptor#builder(Class)
   */
  public static final class Builder implements io.helidon.common.Builder<ControllerDescriptor> {

    private final Class<? extends Controller> type;

    private String name;

    private String path;

    private final List<Handler> middleware;

    private Builder(final Class<? extends Controller> type) {
      super();
      this.type = Objects.requireNonNull(type);
      this.path = "/";
      this.middleware = new ArrayList<>();
    }

    /**
     * Sets the name under which the {@link Controller} will be
     * resolved.
     *
     * <p>If this method is never called, the fully-qualified name of
     * the {@link Controller} type is used.</p>
     *
     * @param name the name; must not be {@code null}
     *
     * @return this {@link Builder}; never {@code null}
     *
     * @exception NullPointerException if {@code name} is {@code null}
     */
    public final Builder name(final String name) {
      this.name = Objects.requireNonNull(name);
      return this;
    }

    /**
     * Sets the base path.  The default is {@code /}.
     *
     * @param path the base path; must not be {@code null}
     *
     * @return this {@link Builder}; never {@code null}
     *
     * @exception NullPointerException if {@code path} is {@code null}
     */
    public final Builder path(final String path) {
      this.path = Objects.requireNonNull(path);
      return this;
    }

    /**
     * Appends middleware {@link Handler}s.
     *
     * @param handlers the {@link Handler}s; may be {@code null}
     *
     * @return this {@link Builder}; never {@code null}
     */
    public final Builder middleware(final Handler... handlers) {
      if (handlers != null && handlers.length > 0) {
        for (final Handler handler : handlers) {
          this.middleware.add(Objects.requireNonNull(handler));
        }
      }
      return this;
    }

    @Override
    public final ControllerDescriptor build() {
      return new ControllerDescriptor(this);
    }

  }

}
