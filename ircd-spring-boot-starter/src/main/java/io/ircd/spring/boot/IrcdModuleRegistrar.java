package io.ircd.spring.boot;

import io.ircd.ServerContext;
import io.ircd.module.Module;
import io.ircd.module.ModuleActivationException;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Loads beans annotated with {@link IrcdModule} into the {@link ServerContext}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 * A module that fails to load fails the application context.
 *
 * @see IrcdModule
 */
public class IrcdModuleRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(IrcdModuleRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final ServerContext serverContext;

    public IrcdModuleRegistrar(ListableBeanFactory beanFactory, ServerContext serverContext) {
        this.beanFactory = beanFactory;
        this.serverContext = serverContext;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = new TreeMap<>(beanFactory.getBeansWithAnnotation(IrcdModule.class));
        List<Candidate> candidates = new ArrayList<>();
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof Module module)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @IrcdModule must implement Module, "
                                + "but " + bean.getClass().getName() + " does not");
            }

            IrcdModule annotation = bean.getClass().getAnnotation(IrcdModule.class);
            if (annotation == null) {
                // Proxy may hide annotation; try the target class
                annotation = AnnotationUtils.findAnnotation(bean.getClass(), IrcdModule.class);
            }
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @IrcdModule annotation on " + bean.getClass().getName());
            }
            candidates.add(new Candidate(beanName, module, annotation.order()));
        }

        // List.sort is stable, so equal orders keep bean name order
        candidates.sort(Comparator.comparingInt(Candidate::order));
        for (Candidate candidate : candidates) {
            if (serverContext.modules().isLoaded(candidate.module().name())) {
                logger.fine(() -> "Module " + candidate.module().name() + " already loaded, skipping bean "
                        + candidate.beanName());
                continue;
            }
            try {
                serverContext.modules().load(candidate.module());
            } catch (ModuleActivationException e) {
                throw new BeanCreationException(candidate.beanName(),
                        "Failed to load ircd module " + e.moduleName(), e);
            }
        }
    }

    private record Candidate(String beanName, Module module, int order) {
    }
}
