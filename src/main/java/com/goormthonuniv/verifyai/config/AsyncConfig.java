package com.goormthonuniv.verifyai.config;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;

@Configuration
public class AsyncConfig {

    public static final String OPINION_EXECUTOR = "opinionExecutor";

    /** 의견 provider 팬아웃용 풀. 호출 스레드의 MDC 를 작업 스레드로 넘긴다. */
    @Bean(name = OPINION_EXECUTOR)
    public ThreadPoolTaskExecutor opinionExecutor(@Value("${verifyai.orchestrator.pool-size:8}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(poolSize * 16);
        executor.setThreadNamePrefix("opinion-");
        executor.setTaskDecorator(mdcPropagating());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return command -> {
            Map<String, String> parent = MDC.getCopyOfContextMap();
            return () -> {
                if (parent != null) MDC.setContextMap(parent);
                try {
                    command.run();
                } finally {
                    MDC.clear();
                }
            };
        };
    }
}
