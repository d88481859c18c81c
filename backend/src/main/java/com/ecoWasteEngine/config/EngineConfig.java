package com.ecoWasteEngine.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
@RequiredArgsConstructor
public class EngineConfig {

    public static final String CLASSIFIER_EXECUTOR = "classifierExecutor";
    public static final String REWARD_EXECUTOR = "rewardExecutor";

    private final WasteEngineProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs classifier calls so the request thread can stop waiting on timeout */
    @Bean(name = CLASSIFIER_EXECUTOR)
    public TaskExecutor classifierExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getClassifier().getWorkerThreads());
        executor.setMaxPoolSize(properties.getClassifier().getWorkerThreads());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("classifier-");
        executor.initialize();
        return executor;
    }

    /** Background reward worker, fed by RewardDispatcher */
    @Bean(name = REWARD_EXECUTOR)
    public TaskExecutor rewardExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getRewards().getWorkerThreads());
        executor.setMaxPoolSize(properties.getRewards().getWorkerThreads());
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("reward-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public RestTemplate restTemplate() {
        return new RestTemplate();
    }
}
