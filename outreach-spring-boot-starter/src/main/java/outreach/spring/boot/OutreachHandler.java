package outreach.spring.boot;

import outreach.EventKind;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler for one {@link EventKind}, replacing the built-in one.
 *
 * <p>The annotated bean must implement {@link outreach.EventHandler}.
 *
 * <pre>{@code
 * @Component
 * @OutreachHandler(EventKind.MESSAGE)
 * public class SupportHandler implements EventHandler {
 *   public void handle(InboundEvent event) { ... }
 * }
 * }</pre>
 *
 * @see OutreachHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface OutreachHandler {

    /**
     * Event kind the bean handles.
     */
    EventKind value();
}
