package io.ledgerbridge.spring.boot;

import io.ledgerbridge.MessageHandler;
import io.ledgerbridge.registry.DefaultHandlerRegistry;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;

/**
 * Scans for beans annotated with {@link BridgeHandler} and registers them in the
 * {@link DefaultHandlerRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see BridgeHandler
 */
public class BridgeHandlerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final DefaultHandlerRegistry registry;

    public BridgeHandlerRegistrar(ListableBeanFactory beanFactory, DefaultHandlerRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(BridgeHandler.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof MessageHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @BridgeHandler must implement MessageHandler, "
                                + "but " + bean.getClass().getName() + " does not");
            }

            // Proxies may hide the annotation from getAnnotation
            BridgeHandler annotation = AnnotationUtils.findAnnotation(bean.getClass(), BridgeHandler.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @BridgeHandler annotation on " + bean.getClass().getName());
            }

            try {
                if (annotation.kind() == BridgeHandler.ALL_KINDS) {
                    registry.registerAll(handler);
                } else {
                    registry.register(annotation.kind(), handler);
                }
            } catch (IllegalArgumentException | IllegalStateException e) {
                throw new BeanCreationException(beanName, "Cannot register @BridgeHandler: " + e.getMessage(), e);
            }
        }
    }
}
