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
package org.microbean.helidon.webserver.controller.cdi;

import java.lang.reflect.Type;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import javax.annotation.Priority;

import javax.enterprise.event.Observes;

import javax.enterprise.inject.CreationException;

import javax.enterprise.inject.spi.AfterBeanDiscovery;
import javax.enterprise.inject.spi.AnnotatedType;
import javax.enterprise.inject.spi.Bean;
import javax.enterprise.inject.spi.BeanManager;
import javax.enterprise.inject.spi.Extension;
import javax.enterprise.inject.spi.ProcessAnnotatedType;

import javax.inject.Singleton;

import io.helidon.config.Config;

import org.microbean.helidon.webserver.controller.Controller;
import org.microbean.helidon.webserver.controller.ControllerMetadata;
import org.microbean.helidon.webserver.controller.ControllerRegistry;
import org.microbean.helidon.webserver.controller.ControllerServer;
import org.microbean.helidon.webserver.controller.MetadataReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A <a
 * href="http://docs.jboss.org/cdi/spec/2.0/cdi-spec.html">CDI</a> <a
 * href="http://docs.jboss.org/cdi/spec/2.0/cdi-spec.html#spi">portable
 * extension</a> that makes a {@link ControllerServer} whose {@link
 * Controller}s are CDI beans available for injection.
 *
 * <p>Unless the application already provides beans of these types,
 * this extension adds {@link Singleton}-scoped beans for {@link
 * Config.Builder}, {@link Config}, {@link ControllerMetadata}, {@link
 * ControllerRegistry} and {@link ControllerServer}.</p>
 *
 * <p>The {@link ControllerMetadata} bean is built from a {@link
 * ControllerMetadata.Builder} that is first fired as an event, so
 * routing descriptors are registered by observing it:</p>
 *
 * <blockquote><pre>private static void routes(&#64;Observes final ControllerMetadata.Builder builder) {
 *   builder.controller(ControllerDescriptor.builder(Foo.class).name("foo").path("/foo").build())
 *     .method(MethodDescriptor.get(Foo.class, "/", "list", Foo::list));
 *}</pre></blockquote>
 *
 * <p>{@link Config.Builder} and {@link Config} instances may be
 * customized in the same way.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see BeanManagerControllerRegistry
 */
public class ControllerRoutingExtension implements Extension {

  private static final Logger logger = LoggerFactory.getLogger(ControllerRoutingExtension.class);

  // @GuardedBy("self")
  private final Map<Class<?>, Integer> priorities;

  /**
   * Creates a new {@link ControllerRoutingExtension}.
   */
  public ControllerRoutingExtension() {
    super();
    this.priorities = new HashMap<>();
  }

  private final <T extends Controller> void processAnnotatedType(@Observes final ProcessAnnotatedType<T> event) {
    if (event != null) {
      final AnnotatedType<T> annotatedType = event.getAnnotatedType();
      assert annotatedType != null;
      final Class<?> javaClass = annotatedType.getJavaClass();
      assert javaClass != null;
      final Priority priority = annotatedType.getAnnotation(Priority.class);
      synchronized (this.priorities) {
        if (priority == null) {
          this.priorities.put(javaClass, Integer.valueOf(0));
        } else {
          this.priorities.put(javaClass, Integer.valueOf(priority.value()));
        }
      }
    }
  }

  private final void addBeans(@Observes final AfterBeanDiscovery event, final BeanManager beanManager) {
    Objects.requireNonNull(event);
    Objects.requireNonNull(beanManager);

    // Config.Builder
    if (noBean(beanManager, Config.Builder.class)) {
      event.<Config.Builder>addBean()
        .addTransitiveTypeClosure(Config.Builder.class)
        .scope(Singleton.class)
        .createWith(cc -> createConfigBuilder(beanManager));
    }

    // Config
    if (noBean(beanManager, Config.class)) {
      event.<Config>addBean()
        .addTransitiveTypeClosure(Config.class)
        .scope(Singleton.class)
        .createWith(cc -> createConfig(beanManager));
    }

    // ControllerMetadata
    if (noBean(beanManager, MetadataReader.class)) {
      event.<ControllerMetadata>addBean()
        .addTransitiveTypeClosure(ControllerMetadata.class)
        .scope(Singleton.class) // can't be ApplicationScoped because it's final
        .createWith(cc -> createControllerMetadata(beanManager));
    }

    // ControllerRegistry
    if (noBean(beanManager, ControllerRegistry.class)) {
      final Map<Class<?>, Integer> priorities;
      synchronized (this.priorities) {
        priorities = new HashMap<>(this.priorities);
      }
      event.<BeanManagerControllerRegistry>addBean()
        .addTransitiveTypeClosure(BeanManagerControllerRegistry.class)
        .scope(Singleton.class)
        .createWith(cc -> new BeanManagerControllerRegistry(beanManager, priorities));
    }

    // ControllerServer
    if (noBean(beanManager, ControllerServer.class)) {
      event.<ControllerServer>addBean()
        .addTransitiveTypeClosure(ControllerServer.class)
        .scope(Singleton.class)
        .createWith(cc -> createControllerServer(beanManager));
    }
  }


  /*
   * Handy creation methods used in createWith() calls above.
   */


  private static final Config.Builder createConfigBuilder(final BeanManager beanManager) {
    Objects.requireNonNull(beanManager);

    final Config.Builder returnValue = Config.builder();
    assert returnValue != null;
    // Permit arbitrary customization.
    beanManager.getEvent().select(Config.Builder.class).fire(returnValue);
    return returnValue;
  }

  private static final Config createConfig(final BeanManager beanManager) {
    Objects.requireNonNull(beanManager);

    final Config.Builder builder = getReference(beanManager, Config.Builder.class);
    if (builder == null) {
      throw new CreationException("No Config.Builder available");
    }
    final Config returnValue = builder.build();
    assert returnValue != null;
    return returnValue;
  }

  private static final ControllerMetadata createControllerMetadata(final BeanManager beanManager) {
    Objects.requireNonNull(beanManager);

    final ControllerMetadata.Builder builder = ControllerMetadata.builder();
    assert builder != null;
    // Permit arbitrary customization; this is where descriptors are
    // registered.
    beanManager.getEvent().select(ControllerMetadata.Builder.class).fire(builder);
    return builder.build();
  }

  private static final ControllerServer createControllerServer(final BeanManager beanManager) {
    Objects.requireNonNull(beanManager);

    final ControllerRegistry registry = getReference(beanManager, ControllerRegistry.class);
    final MetadataReader metadataReader = getReference(beanManager, MetadataReader.class);
    if (registry == null || metadataReader == null) {
      throw new CreationException("Unable to create a ControllerServer; registry: " + registry +
                                  "; metadataReader: " + metadataReader);
    }
    final Config config = getReference(beanManager, Config.class);
    final ControllerServer returnValue = ControllerServer.create(registry, metadataReader, config);
    logger.debug("Created ControllerServer with root path {}", returnValue.rootPath());
    return returnValue;
  }


  /*
   * Utility methods.
   */


  private static final boolean noBean(final BeanManager beanManager, final Type type) {
    Objects.requireNonNull(beanManager);
    Objects.requireNonNull(type);
    final Collection<?> beans = beanManager.getBeans(type);
    final boolean returnValue = beans == null || beans.isEmpty();
    return returnValue;
  }

  private static final <T> T getReference(final BeanManager beanManager, final Type cls) {
    Objects.requireNonNull(beanManager);
    Objects.requireNonNull(cls);

    final Bean<?> bean = beanManager.resolve(beanManager.getBeans(cls));
    final T returnValue;
    if (bean == null) {
      returnValue = null;
    } else {
      @SuppressWarnings("unchecked")
        final T temp = (T)beanManager.getReference(bean, cls, beanManager.createCreationalContext(bean));
      returnValue = temp;
    }
    return returnValue;
  }

}
