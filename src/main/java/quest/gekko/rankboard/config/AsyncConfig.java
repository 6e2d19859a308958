package quest.gekko.rankboard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
public class AsyncConfig {

    /** One group of channels runs at a time, so the pool never needs more threads than a group. */
    @Bean(name = "statsExecutor")
    public ThreadPoolTaskExecutor statsExecutor(final RankBoardProperties.Stats stats) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(stats.batchSize());
        executor.setMaxPoolSize(stats.batchSize());
        executor.setQueueCapacity(stats.batchSize());
        executor.setThreadNamePrefix("stats-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean(name = "reconciliationExecutor")
    public ThreadPoolTaskExecutor reconciliationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("peak-");
        executor.initialize();
        return executor;
    }
}
