package stargazer.compute.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pool acotado donde corre el cálculo (CPU-bound) mientras el hilo del servlet queda libre.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "skyComputeExecutor")
    public ThreadPoolTaskExecutor skyComputeExecutor(@Value("${stargazer.compute.pool-size:4}") int poolSize,
                                                     @Value("${stargazer.compute.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("sky-compute-");
        executor.initialize();
        return executor;
    }
}
