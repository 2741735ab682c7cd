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

import java.util.List;

/**
 * The container that owns the construction and lifetime of {@link
 * Controller}s.
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see SimpleControllerRegistry
 *
 * @see org.microbean.helidon.webserver.controller.cdi.BeanManagerControllerRegistry
 */
public interface ControllerRegistry {

  /**
   * Returns a {@link ControllerProvider} for every {@link Controller}
   * known to this {@link ControllerRegistry}, in a stable order.
   *
   * <p>This is called once per {@link ControllerServer#build()}.</p>
   *
   * @return an immutable {@link List} of {@link ControllerProvider}s;
   * never {@code null}
   */
  List<ControllerProvider<?>> getAll();

  /**
   * Returns the {@link ControllerProvider} registered under the
   * supplied name.
   *
   * <p>This is called once per request.</p>
   *
   * @param name the name; must not be {@code null}
   *
   * @return a {@link ControllerProvider}; never {@code null}
   *
   * @exception NullPointerException if {@code name} is {@code null}
   *
   * @exception UnknownControllerException if no {@link
   * ControllerProvider} is registered under {@code name}
   */
  ControllerProvider<?> getNamed(final String name);

}
