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

import io.helidon.webserver.ServerRequest;
import io.helidon.webserver.ServerResponse;

/**
 * A request-handling method of a {@link Controller}, usually supplied
 * as a method reference such as {@code MyController::list}.
 *
 * @param <C> the type of {@link Controller} the method is invoked on
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see MethodDescriptor
 */
@FunctionalInterface
public interface ControllerMethod<C extends Controller> {

  /**
   * Handles a request using the supplied {@link Controller}.
   *
   * @param controller the {@link Controller} resolved for this
   * request; never {@code null}
   *
   * @param request the {@link ServerRequest}; never {@code null}
   *
   * @param response the {@link ServerResponse}; never {@code null}
   *
   * @return a {@link HandlerResult}; a {@code null} return value is
   * treated as {@link HandlerResult#alreadyWritten()}
   *
   * @exception Exception if an error occurs; it will be forwarded to
   * the routing's error handlers
   */
  HandlerResult invoke(final C controller, final ServerRequest request, final ServerResponse response) throws Exception;

}
