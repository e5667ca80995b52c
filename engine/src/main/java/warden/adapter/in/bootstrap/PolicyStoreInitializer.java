package warden.adapter.in.bootstrap;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import warden.core.service.authz.PolicyStoreSynchronizer;

/**
 * Loads roles, policies and grants from durable storage before the engine serves decisions.
 *
 * <p>Startup fails if storage cannot be read within the load timeout.
 */
@ApplicationScoped
public class PolicyStoreInitializer {

    private static final Logger LOG = Logger.getLogger(PolicyStoreInitializer.class);
    private static final Duration LOAD_TIMEOUT = Duration.ofSeconds(30);

    private final PolicyStoreSynchronizer synchronizer;

    @Inject
    public PolicyStoreInitializer(PolicyStoreSynchronizer synchronizer) {
        this.synchronizer = synchronizer;
    }

    void onStart(@Observes StartupEvent event) {
        LOG.info("Loading authorization state from storage...");
        synchronizer.refresh().await().atMost(LOAD_TIMEOUT);
    }
}
