package com.heroespath.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
public class AppConfig {

    /**
     * 모든 시각 계산의 기준. 테스트에서는 고정/이동 가능한 Clock으로 교체
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate placesRestTemplate() {
        return new RestTemplate();
    }

    /**
     * 여러 경로의 동시 탐색용
     */
    @Bean(name = "discoveryExecutor")
    public Executor discoveryExecutor(@Value("${discovery.async.pool-size:4}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("discovery-");
        executor.initialize();
        return executor;
    }
}
