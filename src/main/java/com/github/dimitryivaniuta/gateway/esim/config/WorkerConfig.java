package com.github.dimitryivaniuta.gateway.esim.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor that runs claimed provisioning jobs.
 *
 * <p>Sized to {@code app.queue.max-concurrency}; the runner never hands it more jobs than it has
 * free threads.</p>
 */
@Configuration
public class WorkerConfig {

    @Bean(name = "provisioningExecutor")
    public ThreadPoolTaskExecutor provisioningExecutor(AppProperties props) {
        int size = props.getQueue().getMaxConcurrency();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(size);
        executor.setThreadNamePrefix("provision-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
