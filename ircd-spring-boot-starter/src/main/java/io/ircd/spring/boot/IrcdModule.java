package io.ircd.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as an ircd feature module.
 *
 * <p>The annotated bean must implement {@link io.ircd.module.Module}. Annotated beans are
 * loaded into the {@link io.ircd.ServerContext} once all singletons exist.
 *
 * <pre>{@code
 * @Component
 * @IrcdModule(order = 10)
 * public class AccountModule implements Module {
 *   public String name() { return "m_account"; }
 *   public void load(ModuleContext ctx) { ... }
 * }
 * }</pre>
 *
 * @see IrcdModuleRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface IrcdModule {

    /**
     * Load order. Lower values load first; ties load in bean name order.
     */
    int order() default 0;
}
