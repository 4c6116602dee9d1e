package org.tanzu.openstackmcp.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.tanzu.openstackmcp.openstack.ResourceKind;

import java.time.Clock;

/**
 * Worker pool and clock shared by the inventory engine.
 */
@Configuration
public class InventoryExecutorConfig {

    /**
     * Executor for collection fetches and service probes.
     *
     * Sized to the number of resource collections so a full snapshot runs every
     * fetch at once; further submissions queue behind it.
     */
    @Bean(name = "inventoryTaskExecutor")
    public ThreadPoolTaskExecutor inventoryTaskExecutor() {
        int poolSize = ResourceKind.values().length;
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("inventory-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
