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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import java.util.concurrent.atomic.AtomicInteger;

import io.helidon.common.http.Http;

import io.helidon.config.Config;
import io.helidon.config.ConfigSources;

import io.helidon.webserver.ServerRequest;
import io.helidon.webserver.ServerResponse;
import io.helidon.webserver.WebServer;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static java.util.Collections.singletonMap;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class TestControllerServer {


  /*
   * Test boilerplate.
   */


  private final List<Throwable> handledErrors = new CopyOnWriteArrayList<>();

  private WebServer webServer;

  public TestControllerServer() {
    super();
  }

  @Before
  public void resetCounters() {
    FooController.instances.set(0);
    MiddlewareController.instances.set(0);
    BarController.instances.set(0);
    BazController.instances.set(0);
  }

  @After
  public void stopWebServer() throws Exception {
    Requests.stop(this.webServer);
  }

  private WebServer start(final ControllerServer server) throws Exception {
    server
      .setConfig(routingBuilder -> routingBuilder.any((request, response) -> {
            response.headers().add("X-Pre-Config", "true");
            request.next();
          }))
      .setErrorConfig(routingBuilder -> routingBuilder.error(ControllerFailure.class, (request, response, failure) -> {
            this.handledErrors.add(failure);
            response.status(Http.Status.INTERNAL_SERVER_ERROR_500);
            response.send("handled: " + failure.getMessage());
          }));
    this.webServer = Requests.start(server.build().build());
    return this.webServer;
  }

  private WebServer start() throws Exception {
    return this.start(new ControllerServer(registry(), metadata()));
  }


  /*
   * Tests.
   */


  @Test
  public void testImmediateValueIsWritten() throws Exception {
    final WebServer webServer = this.start();
    final Requests.Reply reply = Requests.get(webServer, "/foo");
    assertEquals(200, reply.status);
    assertEquals("foo 1", reply.body);
  }

  @Test
  public void testControllerIsResolvedForEveryRequest() throws Exception {
    final WebServer webServer = this.start();
    assertEquals(0, FooController.instances.get());
    assertEquals("foo 1", Requests.get(webServer, "/foo").body);
    assertEquals("foo 2", Requests.get(webServer, "/foo").body);
    assertEquals(2, FooController.instances.get());
  }

  @Test
  public void testPathParametersAndVerbs() throws Exception {
    final WebServer webServer = this.start();
    assertEquals("foo 42", Requests.get(webServer, "/foo/42").body);
    final Requests.Reply created = Requests.request(webServer, "POST", "/foo");
    assertEquals(200, created.status);
    assertEquals("created", created.body);
    assertEquals(404, Requests.request(webServer, "DELETE", "/foo").status);
  }

  @Test
  public void testPatch() throws Exception {
    final WebServer webServer = this.start();
    final Requests.Reply patched = Requests.raw(webServer, "PATCH", "/foo/7");
    assertEquals(200, patched.status);
    assertTrue(patched.body, patched.body.contains("patched 7"));
    assertEquals(1, FooController.instances.get());
    assertEquals(404, Requests.raw(webServer, "PATCH", "/foo").status);
  }

  @Test
  public void testDeferredValueIsWritten() throws Exception {
    final WebServer webServer = this.start();
    final Requests.Reply reply = Requests.get(webServer, "/async/ok");
    assertEquals(200, reply.status);
    assertEquals("later", reply.body);
  }

  @Test
  public void testDeferredFailureIsForwardedToErrorHandlers() throws Exception {
    final WebServer webServer = this.start();
    final Requests.Reply reply = Requests.get(webServer, "/async/fail");
    assertEquals(500, reply.status);
    assertEquals("handled: boom", reply.body);
    assertEquals(1, this.handledErrors.size());
    assertEquals("boom", this.handledErrors.get(0).getMessage());
  }

  @Test
  public void testSynchronousFailureIsForwardedToErrorHandlers() throws Exception {
    final WebServer webServer = this.start();
    final Requests.Reply reply = Requests.get(webServer, "/writer/throw");
    assertEquals(500, reply.status);
    assertEquals("handled: sync", reply.body);
    assertEquals(1, this.handledErrors.size());
  }

  @Test
  public void testWrittenResponseIsNotOverwritten() throws Exception {
    final WebServer webServer = this.start();
    assertEquals("written", Requests.get(webServer, "/writer/immediate").body);
    assertEquals("written", Requests.get(webServer, "/writer/deferred").body);
    assertEquals("self", Requests.get(webServer, "/writer/self").body);
    assertEquals("null", Requests.get(webServer, "/writer/null").body);
    assertTrue(this.handledErrors.isEmpty());
  }

  @Test
  public void testControllerWithoutControllerDescriptorIsSkipped() throws Exception {
    final WebServer webServer = this.start();
    assertEquals(404, Requests.get(webServer, "/bar").status);
    assertEquals(404, Requests.get(webServer, "/").status);
    assertEquals(0, BarController.instances.get());
  }

  @Test
  public void testControllerWithoutMethodDescriptorsIsSkipped() throws Exception {
    final WebServer webServer = this.start();
    assertEquals(404, Requests.get(webServer, "/baz").status);
    assertEquals(0, BazController.instances.get());
  }

  @Test
  public void testConfigFunctionPrecedesEveryControllerRoute() throws Exception {
    final WebServer webServer = this.start();
    assertEquals("true", Requests.get(webServer, "/foo").preConfigHeader);
    assertEquals("true", Requests.get(webServer, "/async/ok").preConfigHeader);
    assertEquals("true", Requests.get(webServer, "/mw").preConfigHeader);
    assertTrue(this.handledErrors.isEmpty());
  }

  @Test
  public void testControllerAndMethodMiddleware() throws Exception {
    final WebServer webServer = this.start();
    final Requests.Reply reply = Requests.get(webServer, "/mw");
    assertEquals("mw", reply.body);
    assertEquals("true", reply.controllerHeader);
    assertEquals("true", reply.methodHeader);
    assertEquals(1, MiddlewareController.instances.get());

    final Requests.Reply denied = Requests.get(webServer, "/mw/deny");
    assertEquals(403, denied.status);
    assertEquals("true", denied.controllerHeader);
    assertNull(denied.methodHeader);
    assertEquals(1, MiddlewareController.instances.get());
  }

  @Test
  public void testRootPathFromConfig() throws Exception {
    final Config config = Config.builder()
      .sources(ConfigSources.create(singletonMap(ControllerServer.ROOT_PATH_KEY, "api/")))
      .build();
    final ControllerServer server = ControllerServer.create(registry(), metadata(), config);
    assertEquals("/api", server.rootPath());
    final WebServer webServer = this.start(server);
    assertEquals("foo 1", Requests.get(webServer, "/api/foo").body);
    assertEquals("later", Requests.get(webServer, "/api/async/ok").body);
    assertEquals(404, Requests.get(webServer, "/foo").status);
  }


  /*
   * Fixtures.
   */


  private static ControllerRegistry registry() {
    return new SimpleControllerRegistry()
      .register("foo", FooController.class, FooController::new)
      .register("async", AsyncController.class, AsyncController::new)
      .register("writer", WritingController.class, WritingController::new)
      .register("mw", MiddlewareController.class, MiddlewareController::new)
      .register("bar", BarController.class, BarController::new)
      .register("baz", BazController.class, BazController::new);
  }

  private static ControllerMetadata metadata() {
    return ControllerMetadata.builder()
      .controller(ControllerDescriptor.builder(FooController.class).name("foo").path("/foo").build())
      .method(MethodDescriptor.get(FooController.class, "/", "list", FooController::list))
      .method(MethodDescriptor.get(FooController.class, "/{id}", "show", FooController::show))
      .method(MethodDescriptor.post(FooController.class, "/", "create", FooController::create))
      .method(MethodDescriptor.patch(FooController.class, "/{id}", "update", FooController::update))

      .controller(ControllerDescriptor.builder(AsyncController.class).name("async").path("/async").build())
      .method(MethodDescriptor.get(AsyncController.class, "/ok", "ok", AsyncController::ok))
      .method(MethodDescriptor.get(AsyncController.class, "/fail", "fail", AsyncController::fail))

      .controller(ControllerDescriptor.builder(WritingController.class).name("writer").path("/writer").build())
      .method(MethodDescriptor.get(WritingController.class, "/immediate", "immediate", WritingController::immediate))
      .method(MethodDescriptor.get(WritingController.class, "/deferred", "deferred", WritingController::deferred))
      .method(MethodDescriptor.get(WritingController.class, "/self", "self", WritingController::self))
      .method(MethodDescriptor.get(WritingController.class, "/null", "nothing", WritingController::nothing))
      .method(MethodDescriptor.get(WritingController.class, "/throw", "fail", WritingController::fail))

      .controller(ControllerDescriptor.builder(MiddlewareController.class)
                  .name("mw")
                  .path("/mw")
                  .middleware((request, response) -> {
                      response.headers().add("X-Controller", "true");
                      request.next();
                    })
                  .build())
      .method(MethodDescriptor.get(MiddlewareController.class, "/", "index", MiddlewareController::index,
                                   (request, response) -> {
                                     response.headers().add("X-Method", "true");
                                     request.next();
                                   }))
      .method(MethodDescriptor.get(MiddlewareController.class, "/deny", "deny", MiddlewareController::index,
                                   (request, response) -> {
                                     response.status(Http.Status.FORBIDDEN_403);
                                     response.send("denied");
                                   }))

      // No ControllerDescriptor for BarController.
      .method(MethodDescriptor.get(BarController.class, "/bar", "list", BarController::list))

      // No MethodDescriptors for BazController.
      .controller(ControllerDescriptor.builder(BazController.class).name("baz").path("/baz").build())
      .build();
  }

  static final class ControllerFailure extends RuntimeException {

    private static final long serialVersionUID = 1L;

    ControllerFailure(final String message) {
      super(message);
    }

  }

  static final class FooController implements Controller {

    static final AtomicInteger instances = new AtomicInteger();

    private final int id;

    FooController() {
      super();
      this.id = instances.incrementAndGet();
    }

    HandlerResult list(final ServerRequest request, final ServerResponse response) {
      return HandlerResult.immediate("foo " + this.id);
    }

    HandlerResult show(final ServerRequest request, final ServerResponse response) {
      return HandlerResult.immediate("foo " + request.path().param("id"));
    }

    HandlerResult create(final ServerRequest request, final ServerResponse response) {
      return HandlerResult.immediate("created");
    }

    HandlerResult update(final ServerRequest request, final ServerResponse response) {
      return HandlerResult.immediate("patched " + request.path().param("id"));
    }

  }

  static final class AsyncController implements Controller {

    AsyncController() {
      super();
    }

    HandlerResult ok(final ServerRequest request, final ServerResponse response) {
      return HandlerResult.deferred(CompletableFuture.supplyAsync(() -> "later"));
    }

    HandlerResult fail(final ServerRequest request, final ServerResponse response) {
      return HandlerResult.deferred(CompletableFuture.supplyAsync(() -> {
            throw new ControllerFailure("boom");
          }));
    }

  }

  static final class WritingController implements Controller {

    WritingController() {
      super();
    }

    HandlerResult immediate(final ServerRequest request, final ServerResponse response) {
      response.send("written");
      return HandlerResult.immediate("ignored");
    }

    HandlerResult deferred(final ServerRequest request, final ServerResponse response) {
      response.send("written");
      return HandlerResult.deferred(CompletableFuture.completedFuture("ignored"));
    }

    HandlerResult self(final ServerRequest request, final ServerResponse response) {
      response.send("self");
      return HandlerResult.alreadyWritten();
    }

    HandlerResult nothing(final ServerRequest request, final ServerResponse response) {
      response.send("null");
      return null;
    }

    HandlerResult fail(final ServerRequest request, final ServerResponse response) {
      throw new ControllerFailure("sync");
    }

  }

  static final class MiddlewareController implements Controller {

    static final AtomicInteger instances = new AtomicInteger();

    MiddlewareController() {
      super();
      instances.incrementAndGet();
    }

    HandlerResult index(final ServerRequest request, final ServerResponse response) {
      return HandlerResult.immediate("mw");
    }

  }

  static final class BarController implements Controller {

    static final AtomicInteger instances = new AtomicInteger();

    BarController() {
      super();
      instances.incrementAndGet();
    }

    HandlerResult list(final ServerRequest request, final ServerResponse response) {
      return HandlerResult.immediate("bar");
    }

  }

  static final class BazController implements Controller {

    static final AtomicInteger instances = new AtomicInteger();

    BazController() {
      super();
      instances.incrementAndGet();
    }

  }

}
