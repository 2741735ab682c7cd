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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable {@link MetadataReader} populated by explicit
 * registration at startup.
 *
 * <p>Descriptors are keyed by the exact {@link Controller} type they
 * were registered for; no supertype is consulted.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see #builder()
 */
public final class ControllerMetadata implements MetadataReader {

  private final Map<Class<?>, ControllerDescriptor> controllers;

  private final Map<Class<?>, List<MethodDescriptor<?>>> methods;

  private ControllerMetadata(final Builder builder) {
    super();
    this.controllers = Collections.unmodifiableMap(new HashMap<>(builder.controllers));
    final Map<Class<?>, List<MethodDescriptor<?>>> methods = new HashMap<>();
    for (final Entry<Class<?>, List<MethodDescriptor<?>>> entry : builder.methods.entrySet()) {
      methods.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
    }
    this.methods = Collections.unmodifiableMap(methods);
  }

  @Override
  public final Optional<ControllerDescriptor> readController(final Class<?> controllerType) {
    return Optional.ofNullable(this.controllers.get(Objects.requireNonNull(controllerType)));
  }

  @Override
  public final List<MethodDescriptor<?>> readMethods(final Class<?> controllerType) {
    final List<MethodDescriptor<?>> methods = this.methods.get(Objects.requireNonNull(controllerType));
    final List<MethodDescriptor<?>> returnValue;
    if (methods == null) {
      returnValue = Collections.emptyList();
    } else {
      returnValue = methods;
    }
    return returnValue;
  }

  /**
   * Returns a new {@link Builder}.
   *
   * @return a new {@link Builder}; never {@code null}
   */
  public static final Builder builder() {
    return new Builder();
  }


  /*
   * Inner and nested classes.
   */


  /**
   * A builder of {@link ControllerMetadata} instances.
   *
   * <p>When this library is used inside a CDI container, a {@link
   * Builder} is fired as an event before the {@link
   * ControllerMetadata} is built, so observer methods may register
   * descriptors with it.</p>
   */
  public static final class Builder implements io.helidon.common.Builder<ControllerMetadata> {

    private final Map<Class<?>, ControllerDescriptor> controllers;

    private final Map<Class<?>, List<MethodDescriptor<?>>> methods;

    private Builder() {
      super();
      this.controllers = new HashMap<>();
      this.methods = new HashMap<>();
    }

    /**
     * Attaches a {@link ControllerDescriptor} to its {@linkplain
     * ControllerDescriptor#type() type}.
     *
     * @param descriptor the {@link ControllerDescriptor}; must not be
     * {@code null}
     *
     * @return this {@link Builder}; never {@code null}
     *
     * @exception NullPointerException if {@code descriptor} is {@code
     * null}
     *
     * @exception IllegalStateException if a {@link
     * ControllerDescriptor} has already been attached to the same type
     */
    public final Builder controller(final ControllerDescriptor descriptor) {
      Objects.requireNonNull(descriptor);
      final ControllerDescriptor old = this.controllers.putIfAbsent(descriptor.type(), descriptor);
      if (old != null) {
        throw new IllegalStateException("A ControllerDescriptor is already attached to " + descriptor.type().getName() + ": " + old);
      }
      return this;
    }

    /**
     * Appends a {@link MethodDescriptor} to the descriptors attached to
     * its {@linkplain MethodDescriptor#controllerType() controller
     * type}.
     *
     * <p>The order in which this method is called determines route
     * matching precedence.</p>
     *
     * @param descriptor the {@link MethodDescriptor}; must not be
     * {@code null}
     *
     * @return this {@link Builder}; never {@code null}
     *
     * @exception NullPointerException if {@code descriptor} is {@code
     * null}
     */
    public final Builder method(final MethodDescriptor<?> descriptor) {
      Objects.requireNonNull(descriptor);
      this.methods.computeIfAbsent(descriptor.controllerType(), k -> new ArrayList<>()).add(descriptor);
      return this;
    }

    @Override
    public final ControllerMetadata build() {
      return new ControllerMetadata(this);
    }

  }

}
