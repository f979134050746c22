package com.servicescaffold.core.jobs.handler;

import com.servicescaffold.core.events.IntegrationEvent;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.core.ResolvableType;
import org.springframework.util.ClassUtils;

/**
 * Builds a {@link HandlerRegistry} from the {@link BackgroundJobHandler} beans of a context.
 *
 * <p>The handled event type is read from each bean's generic signature. Handlers are looked up
 * from the bean factory for every job, so prototype-scoped handlers get a fresh instance per
 * job. When base packages are given, only handler classes inside them are registered.
 */
public class SpringHandlerRegistryFactory {
  private static final Logger log = LoggerFactory.getLogger(SpringHandlerRegistryFactory.class);

  private final ListableBeanFactory beanFactory;
  private final List<String> basePackages;

  public SpringHandlerRegistryFactory(ListableBeanFactory beanFactory, List<String> basePackages) {
    this.beanFactory = Objects.requireNonNull(beanFactory, "beanFactory must not be null");
    this.basePackages = basePackages == null ? List.of() : List.copyOf(basePackages);
  }

  public HandlerRegistry create() {
    HandlerRegistry.Builder builder = HandlerRegistry.builder();
    String[] beanNames = beanFactory.getBeanNamesForType(BackgroundJobHandler.class, true, false);
    for (String beanName : beanNames) {
      Class<?> beanType = beanFactory.getType(beanName);
      if (beanType == null) {
        throw new IllegalStateException("Cannot determine type of handler bean " + beanName);
      }
      Class<?> handlerClass = ClassUtils.getUserClass(beanType);
      if (!isInScannedPackages(handlerClass)) {
        log.debug("Ignoring handler bean outside scanned packages bean={}", beanName);
        continue;
      }
      register(builder, beanName, handlerClass);
    }

    HandlerRegistry registry = builder.build();
    log.info(
        "Registered background job handlers count={} event_types={}",
        registry.size(),
        registry.eventTypes());
    return registry;
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private void register(HandlerRegistry.Builder builder, String beanName, Class<?> handlerClass) {
    Class<?> eventType =
        ResolvableType.forClass(handlerClass)
            .as(BackgroundJobHandler.class)
            .getGeneric(0)
            .resolve();
    if (eventType == null || !IntegrationEvent.class.isAssignableFrom(eventType)) {
      throw new IllegalStateException(
          "Cannot resolve the event type handled by bean "
              + beanName
              + " ("
              + handlerClass.getName()
              + ")");
    }
    Class<IntegrationEvent> typed = (Class<IntegrationEvent>) eventType;
    builder.register(
        typed,
        () -> (BackgroundJobHandler) beanFactory.getBean(beanName, BackgroundJobHandler.class));
  }

  private boolean isInScannedPackages(Class<?> handlerClass) {
    if (basePackages.isEmpty()) {
      return true;
    }
    String packageName = handlerClass.getPackageName();
    for (String basePackage : basePackages) {
      if (packageName.equals(basePackage) || packageName.startsWith(basePackage + ".")) {
        return true;
      }
    }
    return false;
  }
}
