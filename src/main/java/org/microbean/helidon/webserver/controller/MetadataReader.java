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
import java.util.Optional;

/**
 * A read-only source of routing descriptors keyed by {@link
 * Controller} type.
 *
 * <p>Absence of descriptors is a valid outcome, not an error.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see ControllerMetadata
 */
public interface MetadataReader {

  /**
   * Returns the {@link ControllerDescriptor} attached to the supplied
   * type, if there is one.
   *
   * @param controllerType the type; must not be {@code null}
   *
   * @return an {@link Optional} {@link ControllerDescriptor}; never
   * {@code null}
   *
   * @exception NullPointerException if {@code controllerType} is
   * {@code null}
   */
  Optional<ControllerDescriptor> readController(final Class<?> controllerType);

  /**
   * Returns the {@link MethodDescriptor}s attached to the supplied
   * type in the order in which they were attached.
   *
   * @param controllerType the type; must not be {@code null}
   *
   * @return an immutable {@link List} of {@link MethodDescriptor}s;
   * never {@code null}; empty if none are attached
   *
   * @exception NullPointerException if {@code controllerType} is
   * {@code null}
   */
  List<MethodDescriptor<?>> readMethods(final Class<?> controllerType);

}
