package outreach.spring.boot;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;
import outreach.EventHandler;
import outreach.EventKind;
import outreach.dispatch.DefaultHandlerRegistry;

import java.util.EnumMap;
import java.util.Map;

/**
 * Scans for beans annotated with {@link OutreachHandler} and registers them in the
 * engine's {@link DefaultHandlerRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * which is before {@link OutreachLifecycle} starts the dispatch loop. Two beans claiming the
 * same kind fail the context.
 *
 * @see OutreachHandler
 */
public class OutreachHandlerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final DefaultHandlerRegistry registry;

    public OutreachHandlerRegistrar(ListableBeanFactory beanFactory, DefaultHandlerRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<EventKind, String> claimed = new EnumMap<>(EventKind.class);
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(OutreachHandler.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof EventHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @OutreachHandler must implement EventHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            OutreachHandler annotation = AnnotationUtils.findAnnotation(bean.getClass(), OutreachHandler.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @OutreachHandler annotation on " + bean.getClass().getName());
            }

            String previous = claimed.putIfAbsent(annotation.value(), beanName);
            if (previous != null) {
                throw new BeanCreationException(beanName,
                        "@OutreachHandler(" + annotation.value() + ") is already declared by bean '"
                                + previous + "'");
            }
            registry.register(annotation.value(), handler);
        }
    }
}
