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

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

import java.util.concurrent.atomic.AtomicBoolean;

import io.helidon.webserver.Handler;
import io.helidon.webserver.ServerRequest;
import io.helidon.webserver.ServerResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A terminal {@link Handler} that resolves a {@link Controller} by
 * name from a {@link ControllerRegistry} on every request, invokes one
 * of its {@linkplain MethodDescriptor methods} and writes the
 * resulting {@link HandlerResult}.
 *
 * <p>The value of an {@linkplain HandlerResult#immediate(Object)
 * immediate} or successfully completed {@linkplain
 * HandlerResult#deferred(java.util.concurrent.CompletionStage)
 * deferred} result is {@linkplain ServerResponse#send(Object) sent}
 * unless it is {@code null} or the response has already been written.
 * Failures, whether thrown by the controller or carried by a deferred
 * result, are forwarded to {@link ServerRequest#next(Throwable)} so
 * that the routing's error handlers receive them.</p>
 *
 * <p>{@link ControllerHandler} never caches the {@link Controller} it
 * resolves.  Once the response has been sent the {@link Controller}
 * is {@linkplain ControllerProvider#release(Controller) released}.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see ControllerRouteBinder
 */
public final class ControllerHandler implements Handler {

  private static final Logger logger = LoggerFactory.getLogger(ControllerHandler.class);

  private final ControllerRegistry registry;

  private final String controllerName;

  private final MethodDescriptor<?> methodDescriptor;

  /**
   * Creates a new {@link ControllerHandler}.
   *
   * @param registry the {@link ControllerRegistry} to resolve {@link
   * Controller}s from; must not be {@code null}
   *
   * @param controllerName the name of the {@link Controller} to
   * resolve; must not be {@code null}
   *
   * @param methodDescriptor the {@link MethodDescriptor} describing
   * the method to invoke; must not be {@code null}
   *
   * @exception NullPointerException if any parameter is {@code null}
   */
  public ControllerHandler(final ControllerRegistry registry,
                           final String controllerName,
                           final MethodDescriptor<?> methodDescriptor) {
    super();
    this.registry = Objects.requireNonNull(registry);
    this.controllerName = Objects.requireNonNull(controllerName);
    this.methodDescriptor = Objects.requireNonNull(methodDescriptor);
  }

  @Override
  public final void accept(final ServerRequest request, final ServerResponse response) {
    Objects.requireNonNull(request);
    Objects.requireNonNull(response);

    final AtomicBoolean written = new AtomicBoolean();
    response.headers().beforeSend(headers -> written.set(true));

    try {
      this.handle(this.registry.getNamed(this.controllerName), request, response, written);
    } catch (final Exception exception) {
      this.forward(request, exception);
    }
  }

  private final <C extends Controller> void handle(final ControllerProvider<C> provider,
                                                   final ServerRequest request,
                                                   final ServerResponse response,
                                                   final AtomicBoolean written)
    throws Exception {
    final C controller = provider.get();
    if (logger.isTraceEnabled()) {
      logger.trace("Resolved {} for {}", controller, this.methodDescriptor);
    }
    response.whenSent().whenComplete((sentResponse, throwable) -> release(provider, controller));
    HandlerResult result = this.methodDescriptor.invoke(controller, request, response);
    if (result == null) {
      result = HandlerResult.alreadyWritten();
    }
    result.accept(new ResultWriter(request, response, written));
  }

  private final void forward(final ServerRequest request, final Throwable failure) {
    final Throwable cause = unwrap(failure);
    logger.debug("Forwarding failure from {} to error handlers", this.methodDescriptor, cause);
    request.next(cause);
  }

  @Override
  public final String toString() {
    return this.controllerName + ": " + this.methodDescriptor;
  }

  private static final <C extends Controller> void release(final ControllerProvider<C> provider, final C controller) {
    try {
      provider.release(controller);
    } catch (final RuntimeException releaseFailure) {
      logger.warn("Failed to release {}", controller, releaseFailure);
    }
  }

  private static final Throwable unwrap(Throwable throwable) {
    while ((throwable instanceof CompletionException || throwable instanceof ExecutionException) &&
           throwable.getCause() != null) {
      throwable = throwable.getCause();
    }
    return throwable;
  }


  /*
   * Inner and nested classes.
   */


  private final class ResultWriter implements HandlerResult.Visitor<Void> {

    private final ServerRequest request;

    private final ServerResponse response;

    private final AtomicBoolean written;

    private ResultWriter(final ServerRequest request, final ServerResponse response, final AtomicBoolean written) {
      super();
      this.request = request;
      this.response = response;
      this.written = written;
    }

    @Override
    public final Void visitImmediate(final Object value) {
      this.write(value);
      return null;
    }

    @Override
    public final Void visitDeferred(final CompletionStage<?> stage) {
      stage.whenComplete((value, throwable) -> {
          if (throwable == null) {
            try {
              this.write(value);
            } catch (final RuntimeException writeFailure) {
              forward(this.request, writeFailure);
            }
          } else {
            forward(this.request, throwable);
          }
        });
      return null;
    }

    @Override
    public final Void visitAlreadyWritten() {
      return null;
    }

    private final void write(final Object value) {
      if (value != null && !this.written.get()) {
        this.response.send(value);
      }
    }

  }

}
