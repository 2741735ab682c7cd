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

/**
 * A {@link RuntimeException} indicating that a {@link
 * ControllerRegistry} has no {@link Controller} registered under a
 * given name.
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see ControllerRegistry#getNamed(String)
 */
public class UnknownControllerException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String name;

  /**
   * Creates a new {@link UnknownControllerException}.
   *
   * @param name the name that could not be resolved; may be {@code
   * null}
   */
  public UnknownControllerException(final String name) {
    super("No controller named " + name);
    this.name = name;
  }

  /**
   * Returns the name that could not be resolved.
   *
   * @return the name; may be {@code null}
   */
  public final String getName() {
    return this.name;
  }

}
