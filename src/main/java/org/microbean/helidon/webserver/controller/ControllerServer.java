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
import java.util.Objects;

import java.util.function.Consumer;

import io.helidon.config.Config;

import io.helidon.webserver.Routing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles a {@link Routing.Builder} from every {@link Controller} a
 * {@link ControllerRegistry} knows about.
 *
 * <p>{@link #build()} runs, in order:</p>
 *
 * <ol>
 *
 * <li>the {@linkplain #setConfig(Consumer) configuration function},
 * where application-level middleware is registered,</li>
 *
 * <li>the binding of every {@link Controller} that has routing
 * descriptors, in {@link ControllerRegistry#getAll()} order,
 * and</li>
 *
 * <li>the {@linkplain #setErrorConfig(Consumer) error configuration
 * function}, where error handlers are registered.</li>
 *
 * </ol>
 *
 * <p>The {@link Routing.Builder} is created once, when this {@link
 * ControllerServer} is created, and is returned by every call to
 * {@link #build()}.  Calling {@link #build()} more than once registers
 * every route again.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see ControllerRouteBinder
 */
public class ControllerServer {


  /*
   * Static fields.
   */


  /**
   * The configuration key, relative to the {@link Config} supplied to
   * {@link #create(ControllerRegistry, MetadataReader, Config)}, whose
   * value is used as the {@linkplain #rootPath(String) root path}.
   */
  public static final String ROOT_PATH_KEY = "controllers.root-path";

  private static final Logger logger = LoggerFactory.getLogger(ControllerServer.class);


  /*
   * Instance fields.
   */


  private final ControllerRegistry registry;

  private final MetadataReader metadataReader;

  private final Routing.Builder routingBuilder;

  private Consumer<? super Routing.Builder> configFunction;

  private Consumer<? super Routing.Builder> errorConfigFunction;

  private String rootPath;


  /*
   * Constructors.
   */


  /**
   * Creates a new {@link ControllerServer} with a fresh {@link
   * Routing.Builder}.
   *
   * @param registry the {@link ControllerRegistry} that owns all
   * {@link Controller}s; must not be {@code null}
   *
   * @param metadataReader the {@link MetadataReader} supplying routing
   * descriptors; must not be {@code null}
   *
   * @exception NullPointerException if either parameter is {@code
   * null}
   */
  public ControllerServer(final ControllerRegistry registry, final MetadataReader metadataReader) {
    this(registry, metadataReader, Routing.builder());
  }

  /**
   * Creates a new {@link ControllerServer} that adds routes to the
   * supplied {@link Routing.Builder}.
   *
   * @param registry the {@link ControllerRegistry} that owns all
   * {@link Controller}s; must not be {@code null}
   *
   * @param metadataReader the {@link MetadataReader} supplying routing
   * descriptors; must not be {@code null}
   *
   * @param routingBuilder the {@link Routing.Builder} to add routes
   * to; must not be {@code null}
   *
   * @exception NullPointerException if any parameter is {@code null}
   */
  public ControllerServer(final ControllerRegistry registry,
                          final MetadataReader metadataReader,
                          final Routing.Builder routingBuilder) {
    super();
    this.registry = Objects.requireNonNull(registry);
    this.metadataReader = Objects.requireNonNull(metadataReader);
    this.routingBuilder = Objects.requireNonNull(routingBuilder);
    this.rootPath = "/";
  }


  /*
   * Instance methods.
   */


  /**
   * Sets the function in which application-level middleware can be
   * registered.  It is not run until {@link #build()} is called.
   *
   * @param configFunction the function; may be {@code null}
   *
   * @return this {@link ControllerServer}; never {@code null}
   */
  public ControllerServer setConfig(final Consumer<? super Routing.Builder> configFunction) {
    this.configFunction = configFunction;
    return this;
  }

  /**
   * Sets the function in which application-level error handlers can be
   * registered.  It is not run until {@link #build()} is called, and
   * then only after every {@link Controller} route has been added.
   *
   * @param errorConfigFunction the function; may be {@code null}
   *
   * @return this {@link ControllerServer}; never {@code null}
   */
  public ControllerServer setErrorConfig(final Consumer<? super Routing.Builder> errorConfigFunction) {
    this.errorConfigFunction = errorConfigFunction;
    return this;
  }

  /**
   * Sets the path prefixed to every {@link Controller}'s base path.
   * The default is {@code /}, meaning no prefix.
   *
   * @param rootPath the root path; {@code null} is treated as {@code
   * /}
   *
   * @return this {@link ControllerServer}; never {@code null}
   */
  public ControllerServer rootPath(final String rootPath) {
    this.rootPath = ControllerRouteBinder.normalize(rootPath);
    return this;
  }

  /**
   * Returns the path prefixed to every {@link Controller}'s base path.
   *
   * @return the root path; never {@code null}
   */
  public String rootPath() {
    return this.rootPath;
  }

  /**
   * Runs the configuration function, binds every {@link Controller},
   * runs the error configuration function and returns the resulting
   * {@link Routing.Builder}.
   *
   * <p>Any exception thrown along the way propagates and leaves the
   * {@link Routing.Builder} as it was at that point.</p>
   *
   * @return the {@link Routing.Builder}; never {@code null}
   */
  public Routing.Builder build() {
    if (this.configFunction != null) {
      this.configFunction.accept(this.routingBuilder);
    }

    final ControllerRouteBinder binder = new ControllerRouteBinder(this.registry, this.metadataReader, this.rootPath);
    final List<ControllerProvider<?>> providers = this.registry.getAll();
    int bound = 0;
    if (providers != null) {
      for (final ControllerProvider<?> provider : providers) {
        if (binder.bind(this.routingBuilder, provider)) {
          ++bound;
        }
      }
    }
    logger.debug("Bound {} of {} controller(s) under {}", bound, providers == null ? 0 : providers.size(), this.rootPath);

    if (this.errorConfigFunction != null) {
      this.errorConfigFunction.accept(this.routingBuilder);
    }
    return this.routingBuilder;
  }


  /*
   * Static methods.
   */


  /**
   * Creates a new {@link ControllerServer} whose {@linkplain
   * #rootPath(String) root path} is taken from the value of the
   * {@value #ROOT_PATH_KEY} key in the supplied {@link Config}.
   *
   * @param registry the {@link ControllerRegistry}; must not be {@code
   * null}
   *
   * @param metadataReader the {@link MetadataReader}; must not be
   * {@code null}
   *
   * @param config the {@link Config}; may be {@code null} in which
   * case the root path is {@code /}
   *
   * @return a new {@link ControllerServer}; never {@code null}
   *
   * @exception NullPointerException if {@code registry} or {@code
   * metadataReader} is {@code null}
   */
  public static ControllerServer create(final ControllerRegistry registry,
                                        final MetadataReader metadataReader,
                                        final Config config) {
    final ControllerServer returnValue = new ControllerServer(registry, metadataReader);
    if (config != null) {
      returnValue.rootPath(config.get(ROOT_PATH_KEY).asString().orElse("/"));
    }
    return returnValue;
  }

}
