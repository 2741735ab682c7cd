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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import java.util.function.Supplier;

/**
 * A {@link ControllerRegistry} backed by {@link Supplier}s registered
 * by hand.
 *
 * <p>{@link #getAll()} reports {@link ControllerProvider}s in
 * registration order.  Every call to a provider's {@link
 * ControllerProvider#get() get()} method calls its {@link Supplier}
 * again.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 */
public class SimpleControllerRegistry implements ControllerRegistry {

  // @GuardedBy("this")
  private final Map<String, ControllerProvider<?>> providers;

  /**
   * Creates a new, empty {@link SimpleControllerRegistry}.
   */
  public SimpleControllerRegistry() {
    super();
    this.providers = new LinkedHashMap<>();
  }

  /**
   * Registers a {@link Supplier} of {@link Controller}s under the
   * supplied name.
   *
   * @param <C> the type of {@link Controller}
   *
   * @param name the name; must not be {@code null}
   *
   * @param type the {@link Controller} type; must not be {@code null}
   *
   * @param factory the {@link Supplier}, called once per resolution;
   * must not be {@code null} and must not return {@code null}
   *
   * @return this {@link SimpleControllerRegistry}; never {@code null}
   *
   * @exception NullPointerException if any parameter is {@code null}
   *
   * @exception IllegalArgumentException if something is already
   * registered under {@code name}
   */
  public synchronized <C extends Controller> SimpleControllerRegistry register(final String name,
                                                                            final Class<C> type,
                                                                            final Supplier<? extends C> factory) {
    final ControllerProvider<C> provider = new SupplierControllerProvider<>(name, type, factory);
    if (this.providers.putIfAbsent(name, provider) != null) {
      throw new IllegalArgumentException("A controller named " + name + " is already registered");
    }
    return this;
  }

  @Override
  public synchronized List<ControllerProvider<?>> getAll() {
    return Collections.unmodifiableList(new ArrayList<>(this.providers.values()));
  }

  @Override
  public synchronized ControllerProvider<?> getNamed(final String name) {
    final ControllerProvider<?> returnValue = this.providers.get(Objects.requireNonNull(name));
    if (returnValue == null) {
      throw new UnknownControllerException(name);
    }
    return returnValue;
  }


  /*
   * Inner and nested classes.
   */


  private static final class SupplierControllerProvider<C extends Controller> implements ControllerProvider<C> {

    private final String name;

    private final Class<C> type;

    private final Supplier<? extends C> factory;

    private SupplierControllerProvider(final String name, final Class<C> type, final Supplier<? extends C> factory) {
      super();
      this.name = Objects.requireNonNull(name);
      this.type = Objects.requireNonNull(type);
      this.factory = Objects.requireNonNull(factory);
    }

    @Override
    public final String name() {
      return this.name;
    }

    @Override
    public final Class<C> type() {
      return this.type;
    }

    @Override
    public final C get() {
      final C returnValue = this.factory.get();
      if (returnValue == null) {
        throw new IllegalStateException("The factory for controller " + this.name + " returned null");
      }
      return returnValue;
    }

    @Override
    public final String toString() {
      return this.name + " (" + this.type.getName() + ")";
    }

  }

}
