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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import javax.annotation.Priority;

import javax.enterprise.context.Dependent;

import javax.enterprise.context.spi.CreationalContext;

import javax.enterprise.inject.Any;

import javax.enterprise.inject.spi.Bean;
import javax.enterprise.inject.spi.BeanAttributes;
import javax.enterprise.inject.spi.BeanManager;

import org.microbean.helidon.webserver.controller.Controller;
import org.microbean.helidon.webserver.controller.ControllerProvider;
import org.microbean.helidon.webserver.controller.ControllerRegistry;
import org.microbean.helidon.webserver.controller.UnknownControllerException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ControllerRegistry} whose {@link Controller}s are the
 * {@link Controller} beans of a {@link BeanManager}.
 *
 * <p>{@link #getAll()} orders beans by their {@link Priority}, lowest
 * first; a bean without one has a priority of {@code 0}.  A bean is
 * registered under its {@linkplain Bean#getName() name} if it has one
 * and under the fully-qualified name of its {@linkplain
 * Bean#getBeanClass() bean class} otherwise.</p>
 *
 * <p>Every call to {@link ControllerProvider#get()} on a provider
 * returned by this registry acquires a new contextual reference, so
 * {@link Dependent}-scoped controllers are created anew for every
 * request.  {@link ControllerProvider#release(Controller)} destroys
 * such a controller along with its dependent objects.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see ControllerRoutingExtension
 */
public class BeanManagerControllerRegistry implements ControllerRegistry {

  private static final Logger logger = LoggerFactory.getLogger(BeanManagerControllerRegistry.class);

  private final BeanManager beanManager;

  private final Map<Class<?>, Integer> priorities;

  // @GuardedBy("this")
  private Map<String, ControllerProvider<?>> providers;

  /**
   * Creates a new {@link BeanManagerControllerRegistry}.
   *
   * @param beanManager the {@link BeanManager}; must not be {@code
   * null}
   *
   * @exception NullPointerException if {@code beanManager} is {@code
   * null}
   */
  public BeanManagerControllerRegistry(final BeanManager beanManager) {
    this(beanManager, null);
  }

  /**
   * Creates a new {@link BeanManagerControllerRegistry}.
   *
   * @param beanManager the {@link BeanManager}; must not be {@code
   * null}
   *
   * @param priorities priorities recorded for bean classes, consulted
   * before any {@link Priority} annotation; may be {@code null}
   *
   * @exception NullPointerException if {@code beanManager} is {@code
   * null}
   */
  public BeanManagerControllerRegistry(final BeanManager beanManager,
                                       final Map<? extends Class<?>, ? extends Integer> priorities) {
    super();
    this.beanManager = Objects.requireNonNull(beanManager);
    if (priorities == null || priorities.isEmpty()) {
      this.priorities = Collections.emptyMap();
    } else {
      this.priorities = Collections.unmodifiableMap(new HashMap<>(priorities));
    }
  }

  @Override
  public List<ControllerProvider<?>> getAll() {
    return Collections.unmodifiableList(new ArrayList<>(this.providers().values()));
  }

  @Override
  public ControllerProvider<?> getNamed(final String name) {
    final ControllerProvider<?> returnValue = this.providers().get(Objects.requireNonNull(name));
    if (returnValue == null) {
      throw new UnknownControllerException(name);
    }
    return returnValue;
  }

  private synchronized Map<String, ControllerProvider<?>> providers() {
    if (this.providers == null) {
      final Set<Bean<?>> beans = new TreeSet<>(new BeanPriorityComparator());
      beans.addAll(this.beanManager.getBeans(Controller.class, Any.Literal.INSTANCE));
      final Map<String, ControllerProvider<?>> providers = new LinkedHashMap<>();
      for (final Bean<?> bean : beans) {
        assert bean != null;
        final Class<?> beanClass = bean.getBeanClass();
        if (beanClass == null || !Controller.class.isAssignableFrom(beanClass)) {
          logger.debug("Ignoring {}; its bean class is not a Controller", bean);
        } else {
          final ControllerProvider<?> provider = createProvider(this.beanManager, bean, beanClass.asSubclass(Controller.class));
          final ControllerProvider<?> old = providers.putIfAbsent(provider.name(), provider);
          if (old != null) {
            throw new IllegalStateException("Two controllers are named " + provider.name() + ": " + old + " and " + provider);
          }
        }
      }
      this.providers = Collections.unmodifiableMap(providers);
    }
    return this.providers;
  }

  private final int getPriority(final BeanAttributes<?> bean) {
    int returnValue = 0;
    if (bean != null) {
      final Set<Type> types = bean.getTypes();
      assert types != null;
      for (final Type type : types) {
        if (type instanceof Class) {
          final Class<?> c = (Class<?>)type;
          final Integer priorityInteger = this.priorities.get(c);
          if (priorityInteger == null) {
            final Priority priority = c.getAnnotation(Priority.class);
            if (priority != null) {
              returnValue = priority.value();
            }
          } else {
            returnValue = priorityInteger.intValue();
            break;
          }
        }
      }
    }
    return returnValue;
  }

  private static final <C extends Controller> ControllerProvider<C> createProvider(final BeanManager beanManager,
                                                                                    final Bean<?> bean,
                                                                                    final Class<C> type) {
    final String beanName = bean.getName();
    final String name = beanName == null || beanName.isEmpty() ? bean.getBeanClass().getName() : beanName;
    return new BeanControllerProvider<>(beanManager, bean, name, type);
  }


  @SuppressWarnings("unchecked")
  private static final <T> void destroy(final Bean<T> bean, final Object instance, final CreationalContext<?> cc) {
    bean.destroy((T)instance, (CreationalContext<T>)cc);
  }


  /*
   * Inner and nested classes.
   */


  private static final class BeanControllerProvider<C extends Controller> implements ControllerProvider<C> {

    private final BeanManager beanManager;

    private final Bean<?> bean;

    private final String name;

    private final Class<C> type;

    // Keyed by identity.
    private final Map<Object, CreationalContext<?>> creationalContexts;

    private BeanControllerProvider(final BeanManager beanManager,
                                   final Bean<?> bean,
                                   final String name,
                                   final Class<C> type) {
      super();
      this.beanManager = beanManager;
      this.bean = bean;
      this.name = name;
      this.type = type;
      this.creationalContexts = Collections.synchronizedMap(new IdentityHashMap<>());
    }

    @Override
    public final String name() {
      return this.name;
    }

    @Override
    public final Class<C> type() {
      return this.type;
    }

    @Override
    public final C get() {
      final CreationalContext<?> cc = this.beanManager.createCreationalContext(this.bean);
      final C returnValue = this.type.cast(this.beanManager.getReference(this.bean, this.type, cc));
      this.creationalContexts.put(returnValue, cc);
      return returnValue;
    }

    @Override
    public final void release(final C controller) {
      final CreationalContext<?> cc = this.creationalContexts.remove(Objects.requireNonNull(controller));
      if (cc != null) {
        if (Dependent.class.equals(this.bean.getScope())) {
          destroy(this.bean, controller, cc);
        } else {
          // Normal-scoped; the contextual instance stays.
          cc.release();
        }
      }
    }

    @Override
    public final String toString() {
      return this.name + " (" + this.bean + ")";
    }

  }

  private final class BeanPriorityComparator implements Comparator<Bean<?>> {

    @Override
    public final int compare(final Bean<?> bean1, final Bean<?> bean2) {
      final int returnValue;
      if (bean1 == null) {
        if (bean2 == null) {
          returnValue = 0;
        } else {
          returnValue = 1; // nulls sort to the end
        }
      } else if (bean2 == null) {
        returnValue = -1;
      } else {
        final int bean1Priority = getPriority(bean1);
        final int bean2Priority = getPriority(bean2);
        if (bean1Priority == bean2Priority) {
          if (bean1.equals(bean2)) {
            returnValue = 0;
          } else {
            returnValue = bean1.toString().compareTo(bean2.toString());
          }
        } else if (bean1Priority < bean2Priority) {
          returnValue = -1;
        } else {
          returnValue = 1;
        }
      }
      return returnValue;
    }

  }

}
