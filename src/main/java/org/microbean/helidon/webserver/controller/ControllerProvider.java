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

import javax.inject.Provider;

/**
 * A typed handle through which a {@link ControllerRegistry} resolves
 * instances of one kind of {@link Controller}.
 *
 * <p>Each call to {@link #get()} performs a resolution.  Whether that
 * yields a new instance depends on the registry's scoping; callers
 * must not cache the result across requests.</p>
 *
 * @param <C> the type of {@link Controller} provided
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see ControllerRegistry
 */
public interface ControllerProvider<C extends Controller> extends Provider<C> {

  /**
   * Returns the name under which this {@link ControllerProvider} is
   * registered.
   *
   * @return the name; never {@code null}
   */
  String name();

  /**
   * Returns the type of {@link Controller} this {@link
   * ControllerProvider} provides.
   *
   * <p>This is the type used to look up routing descriptors with a
   * {@link MetadataReader}.</p>
   *
   * @return the {@link Controller} type; never {@code null}
   */
  Class<C> type();

  /**
   * Resolves a {@link Controller}.
   *
   * @return a {@link Controller}; never {@code null}
   */
  @Override
  C get();

  /**
   * Releases a {@link Controller} previously {@linkplain #get()
   * resolved} by this {@link ControllerProvider}, once the response
   * of the request it served has been sent.
   *
   * <p>The default implementation does nothing.</p>
   *
   * @param controller the {@link Controller} to release; must not be
   * {@code null}
   */
  default void release(final C controller) {

  }

}
