package com.rally.leaguesync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncImportConfig {

    /** Bounded pool for cross-league runs; one league never uses more than one thread. */
    @Bean(name = "leagueImportExecutor")
    public ThreadPoolTaskExecutor leagueImportExecutor(LeagueSyncProperties properties) {
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(properties.getMaxParallelLeagues());
        exec.setMaxPoolSize(properties.getMaxParallelLeagues());
        exec.setQueueCapacity(100);
        exec.setThreadNamePrefix("LeagueSync-");
        exec.setWaitForTasksToCompleteOnShutdown(true);
        exec.initialize();
        return exec;
    }
}
