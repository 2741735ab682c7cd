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

import io.helidon.common.http.Http;

import io.helidon.webserver.Handler;
import io.helidon.webserver.ServerRequest;
import io.helidon.webserver.ServerResponse;

/**
 * Method-level routing information: the HTTP method and path, relative
 * to its {@link ControllerDescriptor#path() controller's base path},
 * at which a {@link ControllerMethod} is reachable, together with the
 * middleware that runs before it.
 *
 * <p>Instances of this class are immutable.</p>
 *
 * @param <C> the type of {@link Controller} the {@link
 * ControllerMethod} is invoked on
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see ControllerMetadata.Builder#method(MethodDescriptor)
 */
public final class MethodDescriptor<C extends Controller> {

  // Http.Method has no PATCH constant.
  private static final Http.RequestMethod PATCH = Http.RequestMethod.create("PATCH");

  private final Class<C> controllerType;

  private final Http.RequestMethod verb;

  private final String path;

  private final String key;

  private final ControllerMethod<? super C> method;

  private final List<Handler> middleware;

  /**
   * Creates a new {@link MethodDescriptor}.
   *
   * @param controllerType the {@link Controller} type; must not be
   * {@code null}
   *
   * @param verb the HTTP method; must not be {@code null}
   *
   * @param path the path relative to the controller's base path; may
   * contain parameter segments such as {@code /{id}}; must not be
   * {@code null}
   *
   * @param key the name of the method, used for diagnostics; must not
   * be {@code null}
   *
   * @param method the {@link ControllerMethod} to invoke; must not be
   * {@code null}
   *
   * @param middleware middleware {@link Handler}s that run, in order,
   * before {@code method}; may be {@code null}
   *
   * @exception NullPointerException if any parameter other than
   * {@code middleware} is {@code null}
   */
  public MethodDescriptor(final Class<C> controllerType,
                          final Http.RequestMethod verb,
                          final String path,
                          final String key,
                          final ControllerMethod<? super C> method,
                          final Handler... middleware) {
    super();
    this.controllerType = Objects.requireNonNull(controllerType);
    this.verb = Objects.requireNonNull(verb);
    this.path = Objects.requireNonNull(path);
    this.key = Objects.requireNonNull(key);
    this.method = Objects.requireNonNull(method);
    if (middleware == null || middleware.length <= 0) {
      this.middleware = Collections.emptyList();
    } else {
      final List<Handler> handlers = new ArrayList<>(middleware.length);
      for (final Handler handler : middleware) {
        handlers.add(Objects.requireNonNull(handler));
      }
      this.middleware = Collections.unmodifiableList(handlers);
    }
  }

  public final Class<C> controllerType() {
    return this.controllerType;
  }

  public final Http.RequestMethod verb() {
    return this.verb;
  }

  public final String path() {
    return this.path;
  }

  public final String key() {
    return this.key;
  }

  public final List<Handler> middleware() {
    return this.middleware;
  }

  /**
   * Invokes this {@link MethodDescriptor}'s {@link ControllerMethod}
   * on the supplied {@link Controller}.
   *
   * @param controller the {@link Controller}; must not be {@code
   * null} and must be an instance of {@link #controllerType()}
   *
   * @param request the {@link ServerRequest}; must not be {@code
   * null}
   *
   * @param response the {@link ServerResponse}; must not be {@code
   * null}
   *
   * @return the {@link HandlerResult} produced, or {@code null}
   *
   * @exception ClassCastException if {@code controller} is not an
   * instance of {@link #controllerType()}
   *
   * @exception Exception if the {@link ControllerMethod} throws
   */
  public final HandlerResult invoke(final Controller controller,
                                    final ServerRequest request,
                                    final ServerResponse response)
    throws Exception {
    Objects.requireNonNull(controller);
    return this.method.invoke(this.controllerType.cast(controller), request, response);
  }

  @Override
  public final String toString() {
    return this.verb.name() + " " + this.path + " -> " + this.controllerType.getName() + "#" + this.key;
  }

  /**
   * Creates a new {@link MethodDescriptor}.
   *
   * @param <C> the type of {@link Controller}
   *
   * @param controllerType the {@link Controller} type; must not be
   * {@code null}
   *
   * @param verb the HTTP method; must not be {@code null}
   *
   * @param path the relative path; must not be {@code null}
   *
   * @param key the name of the method; must not be {@code null}
   *
   * @param method the {@link ControllerMethod}; must not be {@code
   * null}
   *
   * @param middleware middleware {@link Handler}s; may be {@code
   * null}
   *
   * @return a new {@link MethodDescriptor}; never {@code null}
   *
   * @exception NullPointerException if any parameter other than
   * {@code middleware} is {@code null}
   */
  public static final <C extends Controller> MethodDescriptor<C> of(final Class<C> controllerType,
                                                                    final Http.RequestMethod verb,
                                                                    final String path,
                                                                    final String key,
                                                                    final ControllerMethod<? super C> method,
                                                                    final Handler... middleware) {
    return new MethodDescriptor<>(controllerType, verb, path, key, method, middleware);
  }

  public static final <C extends Controller> MethodDescriptor<C> get(final Class<C> controllerType,
                                                                     final String path,
                                                                     final String key,
                                                                     final ControllerMethod<? super C> method,
                                                                     final Handler... middleware) {
    return of(controllerType, Http.Method.GET, path, key, method, middleware);
  }

  public static final <C extends Controller> MethodDescriptor<C> post(final Class<C> controllerType,
                                                                      final String path,
                                                                      final String key,
                                                                      final ControllerMethod<? super C> method,
                                                                      final Handler... middleware) {
    return of(controllerType, Http.Method.POST, path, key, method, middleware);
  }

  public static final <C extends Controller> MethodDescriptor<C> put(final Class<C> controllerType,
                                                                     final String path,
                                                                     final String key,
                                                                     final ControllerMethod<? super C> method,
                                                                     final Handler... middleware) {
    return of(controllerType, Http.Method.PUT, path, key, method, middleware);
  }

  public static final <C extends Controller> MethodDescriptor<C> delete(final Class<C> controllerType,
                                                                        final String path,
                                                                        final String key,
                                                                        final ControllerMethod<? super C> method,
                                                                        final Handler... middleware) {
    return of(controllerType, Http.Method.DELETE, path, key, method, middleware);
  }

  public static final <C extends Controller> MethodDescriptor<C> patch(final Class<C> controllerType,
                                                                       final String path,
                                                                       final String key,
                                                                       final ControllerMethod<? super C> method,
                                                                       final Handler... middleware) {
    return of(controllerType, PATCH, path, key, method, middleware);
  }

}
