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
 * A marker interface identifying an object that exposes one or more
 * request-handling methods and whose lifecycle is owned by a {@link
 * ControllerRegistry}.
 *
 * <p>Implementations are never constructed by this library.  Their
 * request-handling methods are described by {@link
 * MethodDescriptor}s and their routing information by a {@link
 * ControllerDescriptor}.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see ControllerRegistry
 *
 * @see MetadataReader
 */
public interface Controller {

}
