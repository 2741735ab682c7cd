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

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.helidon.common.http.Http;

import io.helidon.webserver.Handler;
import io.helidon.webserver.Routing;
import io.helidon.webserver.Service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds one {@link Controller} at a time into a {@link Routing.Rules}
 * by mounting a {@link Service} holding one route per {@link
 * MethodDescriptor} under the controller's base path.
 *
 * <p>A {@link Controller} whose type has no {@link
 * ControllerDescriptor} or no {@link MethodDescriptor}s is skipped
 * without error.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see ControllerServer#build()
 */
public class ControllerRouteBinder {

  private static final Logger logger = LoggerFactory.getLogger(ControllerRouteBinder.class);

  private final ControllerRegistry registry;

  private final MetadataReader metadataReader;

  private final String rootPath;

  /**
   * Creates a new {@link ControllerRouteBinder} that mounts
   * controllers directly under their base paths.
   *
   * @param registry the {@link ControllerRegistry} the installed
   * {@link ControllerHandler}s resolve {@link Controller}s from; must
   * not be {@code null}
   *
   * @param metadataReader the {@link MetadataReader} to read
   * descriptors with; must not be {@code null}
   *
   * @exception NullPointerException if either parameter is {@code
   * null}
   */
  public ControllerRouteBinder(final ControllerRegistry registry, final MetadataReader metadataReader) {
    this(registry, metadataReader, "/");
  }

  /**
   * Creates a new {@link ControllerRouteBinder}.
   *
   * @param registry the {@link ControllerRegistry} the installed
   * {@link ControllerHandler}s resolve {@link Controller}s from; must
   * not be {@code null}
   *
   * @param metadataReader the {@link MetadataReader} to read
   * descriptors with; must not be {@code null}
   *
   * @param rootPath a path prefixed to every controller's base path;
   * {@code null} and {@code /} mean no prefix
   *
   * @exception NullPointerException if {@code registry} or {@code
   * metadataReader} is {@code null}
   */
  public ControllerRouteBinder(final ControllerRegistry registry,
                               final MetadataReader metadataReader,
                               final String rootPath) {
    super();
    this.registry = Objects.requireNonNull(registry);
    this.metadataReader = Objects.requireNonNull(metadataReader);
    this.rootPath = normalize(rootPath);
  }

  /**
   * Mounts the routes of the {@link Controller} supplied by the
   * supplied {@link ControllerProvider}, if it has routing
   * descriptors.
   *
   * <p>The {@link ControllerProvider} is consulted only for its
   * {@linkplain ControllerProvider#type() type}, and the registry
   * only to check that the descriptor's name is known; no {@link
   * Controller} is resolved by this method.</p>
   *
   * @param rules the {@link Routing.Rules} to mount routes on; must
   * not be {@code null}
   *
   * @param provider the {@link ControllerProvider}; must not be {@code
   * null}
   *
   * @return {@code true} if routes were mounted; {@code false} if the
   * {@link Controller} was skipped
   *
   * @exception NullPointerException if either parameter is {@code
   * null}
   *
   * @exception UnknownControllerException if the {@linkplain
   * ControllerDescriptor#name() name} in the {@link Controller}'s
   * {@link ControllerDescriptor} is not known to the {@link
   * ControllerRegistry}
   *
   * @exception IllegalStateException if that name denotes a {@link
   * Controller} of a different type
   */
  @SuppressWarnings("rawtypes")
  public boolean bind(final Routing.Rules rules, final ControllerProvider<?> provider) {
    Objects.requireNonNull(rules);
    Objects.requireNonNull(provider);
    final Class<?> type = provider.type();
    final Optional<ControllerDescriptor> controllerDescriptor = this.metadataReader.readController(type);
    final List<MethodDescriptor<?>> methodDescriptors = this.metadataReader.readMethods(type);
    final boolean returnValue;
    if (!controllerDescriptor.isPresent() || methodDescriptors.isEmpty()) {
      logger.debug("Skipping {}; controller descriptor present: {}; method descriptors: {}",
                   provider, controllerDescriptor.isPresent(), methodDescriptors.size());
      returnValue = false;
    } else {
      final ControllerDescriptor descriptor = controllerDescriptor.get();
      // Handlers resolve by descriptor name; fail now rather than on every request.
      final ControllerProvider<?> named = this.registry.getNamed(descriptor.name());
      if (!type.equals(named.type())) {
        throw new IllegalStateException("The controller named " + descriptor.name() + " is a " + named.type().getName() +
                                        ", not a " + type.getName());
      }
      final String mountPath = join(this.rootPath, descriptor.path());
      rules.register(mountPath, new ControllerService(this.registry, descriptor, methodDescriptors));
      logger.debug("Mounted {} with {} route(s) at {}", descriptor.name(), methodDescriptors.size(), mountPath);
      returnValue = true;
    }
    return returnValue;
  }

  static final String normalize(final String path) {
    String returnValue = path == null ? "" : path.trim();
    while (returnValue.endsWith("/")) {
      returnValue = returnValue.substring(0, returnValue.length() - 1);
    }
    if (returnValue.isEmpty()) {
      returnValue = "/";
    } else if (!returnValue.startsWith("/")) {
      returnValue = "/" + returnValue;
    }
    return returnValue;
  }

  static final String join(final String rootPath, final String path) {
    final String root = normalize(rootPath);
    final String child = normalize(path);
    final String returnValue;
    if ("/".equals(root)) {
      returnValue = child;
    } else if ("/".equals(child)) {
      returnValue = root;
    } else {
      returnValue = root + child;
    }
    return returnValue;
  }


  /*
   * Inner and nested classes.
   */


  private static final class ControllerService implements Service {

    private final ControllerRegistry registry;

    private final ControllerDescriptor descriptor;

    private final List<MethodDescriptor<?>> methodDescriptors;

    private ControllerService(final ControllerRegistry registry,
                              final ControllerDescriptor descriptor,
                              final List<MethodDescriptor<?>> methodDescriptors) {
      super();
      this.registry = registry;
      this.descriptor = descriptor;
      this.methodDescriptors = methodDescriptors;
    }

    @Override
    @SuppressWarnings("rawtypes")
    public final void update(final Routing.Rules rules) {
      final List<Handler> controllerMiddleware = this.descriptor.middleware();
      if (!controllerMiddleware.isEmpty()) {
        rules.any(controllerMiddleware.toArray(new Handler[controllerMiddleware.size()]));
      }
      for (final MethodDescriptor<?> methodDescriptor : this.methodDescriptors) {
        final List<Handler> methodMiddleware = methodDescriptor.middleware();
        final Handler[] handlers = methodMiddleware.toArray(new Handler[methodMiddleware.size() + 1]);
        handlers[handlers.length - 1] = new ControllerHandler(this.registry, this.descriptor.name(), methodDescriptor);
        final List<Http.RequestMethod> verbs = Collections.singletonList(methodDescriptor.verb());
        rules.anyOf(verbs, methodDescriptor.path(), handlers);
      }
    }

    @Override
    public final String toString() {
      return this.descriptor.toString();
    }

  }

}
