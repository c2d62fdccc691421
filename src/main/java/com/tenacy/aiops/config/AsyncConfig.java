package com.tenacy.aiops.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableScheduling
public class AsyncConfig {

    @Value("${aiops.async.feature-pool-size:4}")
    private int featurePoolSize;

    @Value("${aiops.async.queue-capacity:500}")
    private int queueCapacity;

    @Bean(name = "featureExtractionExecutor")
    public Executor featureExtractionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(featurePoolSize);
        executor.setMaxPoolSize(featurePoolSize * 2);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("feature-");
        // 큐가 가득 차면 호출 스레드에서 직접 추출
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
