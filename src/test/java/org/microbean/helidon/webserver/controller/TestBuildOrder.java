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
import java.util.Arrays;
import java.util.List;

import io.helidon.webserver.Routing;
import io.helidon.webserver.ServerRequest;
import io.helidon.webserver.ServerResponse;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestBuildOrder {

  private final List<String> events = new ArrayList<>();

  public TestBuildOrder() {
    super();
  }

  private ControllerRegistry registry() {
    return new SimpleControllerRegistry() {
      @Override
      public synchronized List<ControllerProvider<?>> getAll() {
        events.add("controllers");
        return super.getAll();
      }
    }.register("hoopy", Hoopy.class, Hoopy::new);
  }

  private static MetadataReader metadata() {
    return ControllerMetadata.builder()
      .controller(ControllerDescriptor.builder(Hoopy.class).name("hoopy").path("/hoopy").build())
      .method(MethodDescriptor.get(Hoopy.class, "/", "handle", Hoopy::handle))
      .build();
  }

  @Test
  public void testConfigThenControllersThenErrorConfig() {
    final Routing.Builder routingBuilder = Routing.builder();
    final ControllerServer server = new ControllerServer(this.registry(), metadata(), routingBuilder);
    assertSame(server, server.setErrorConfig(rb -> {
          assertSame(routingBuilder, rb);
          events.add("errorConfig");
        }));
    assertSame(server, server.setConfig(rb -> {
          assertSame(routingBuilder, rb);
          events.add("config");
        }));
    assertSame(routingBuilder, server.build());
    assertEquals(Arrays.asList("config", "controllers", "errorConfig"), this.events);
  }

  @Test
  public void testBuildWithoutConfigFunctions() {
    final ControllerServer server = new ControllerServer(this.registry(), metadata());
    final Routing.Builder routingBuilder = server.build();
    assertSame(routingBuilder, server.build());
    assertEquals(Arrays.asList("controllers", "controllers"), this.events);
  }

  @Test
  public void testConfigFailureAbortsBuild() {
    final ControllerServer server = new ControllerServer(this.registry(), metadata())
      .setConfig(rb -> {
          throw new IllegalStateException("nope");
        })
      .setErrorConfig(rb -> events.add("errorConfig"));
    try {
      server.build();
      fail();
    } catch (final IllegalStateException expected) {
      assertEquals("nope", expected.getMessage());
    }
    assertTrue(this.events.isEmpty());
  }

  @Test
  public void testBinderReportsSkippedControllers() {
    final ControllerRegistry registry = this.registry();
    final ControllerRouteBinder binder = new ControllerRouteBinder(registry, metadata());
    assertTrue(binder.bind(Routing.builder(), registry.getNamed("hoopy")));
    final ControllerRouteBinder emptyBinder = new ControllerRouteBinder(registry, ControllerMetadata.builder().build());
    assertFalse(emptyBinder.bind(Routing.builder(), registry.getNamed("hoopy")));
  }

  @Test(expected = UnknownControllerException.class)
  public void testDefaultNameNotInRegistryFailsBuild() {
    final MetadataReader defaultNamed = ControllerMetadata.builder()
      .controller(ControllerDescriptor.builder(Hoopy.class).path("/hoopy").build())
      .method(MethodDescriptor.get(Hoopy.class, "/", "handle", Hoopy::handle))
      .build();
    new ControllerServer(this.registry(), defaultNamed).build();
  }

  @Test
  public void testNameBoundToAnotherTypeFailsBuild() {
    final ControllerRegistry registry = new SimpleControllerRegistry()
      .register("hoopy", Frood.class, Frood::new)
      .register(Hoopy.class.getName(), Hoopy.class, Hoopy::new);
    final MetadataReader metadata = ControllerMetadata.builder()
      .controller(ControllerDescriptor.builder(Hoopy.class).name("hoopy").path("/hoopy").build())
      .method(MethodDescriptor.get(Hoopy.class, "/", "handle", Hoopy::handle))
      .build();
    try {
      new ControllerRouteBinder(registry, metadata).bind(Routing.builder(), registry.getNamed(Hoopy.class.getName()));
      fail();
    } catch (final IllegalStateException expected) {
      assertTrue(expected.getMessage(), expected.getMessage().contains(Frood.class.getName()));
    }
  }

  @Test
  public void testPathJoining() {
    assertEquals("/", ControllerRouteBinder.normalize(null));
    assertEquals("/", ControllerRouteBinder.normalize("///"));
    assertEquals("/api", ControllerRouteBinder.normalize("api/"));
    assertEquals("/foo", ControllerRouteBinder.join("/", "/foo"));
    assertEquals("/api", ControllerRouteBinder.join("/api", "/"));
    assertEquals("/api/foo", ControllerRouteBinder.join("api/", "foo/"));
  }

  static final class Hoopy implements Controller {

    HandlerResult handle(final ServerRequest request, final ServerResponse response) {
      return HandlerResult.immediate("hoopy");
    }

  }

  static final class Frood implements Controller {

  }

}
