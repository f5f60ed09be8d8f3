package com.visitrack.intake.infra.metrics.internal;

import com.visitrack.intake.infra.metrics.MetricsRegistry;
import com.visitrack.intake.infra.metrics.api.MetricsRegistryProvider;

import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves the process-wide registry on first use.
 *
 * <p><b>INTERNAL USE ONLY</b> - API may change without notice.
 */
public final class MetricsRegistryHolder {
    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    private MetricsRegistryHolder() {
    }

    public static MetricsRegistry get() {
        return Discovered.REGISTRY;
    }

    /**
     * Highest priority wins; on a tie the provider found first is kept. With no
     * provider intake metrics are discarded.
     */
    static MetricsRegistry select(Iterable<MetricsRegistryProvider> providers) {
        MetricsRegistryProvider chosen = null;
        for (MetricsRegistryProvider provider : providers) {
            if (chosen == null || provider.priority() > chosen.priority()) {
                chosen = provider;
            }
        }
        if (chosen == null) {
            logger.info("No metrics provider installed, intake metrics are discarded");
            return NoOpMetricsRegistry.INSTANCE;
        }
        logger.info("Intake metrics go to " + chosen.name() + " (priority " + chosen.priority() + ")");
        return chosen.create();
    }

    private static final class Discovered {
        static final MetricsRegistry REGISTRY = load();

        private static MetricsRegistry load() {
            try {
                return select(ServiceLoader.load(MetricsRegistryProvider.class,
                        MetricsRegistryHolder.class.getClassLoader()));
            } catch (ServiceConfigurationError e) {
                logger.log(Level.WARNING, "Broken metrics provider registration, intake metrics are discarded", e);
                return NoOpMetricsRegistry.INSTANCE;
            }
        }
    }
}
