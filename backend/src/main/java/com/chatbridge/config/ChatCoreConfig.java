package com.chatbridge.config;

import com.chatbridge.common.time.MonotonicClock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@EnableScheduling
public class ChatCoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MonotonicClock monotonicClock() {
        return MonotonicClock.system();
    }

    /**
     * 팬아웃 전용 executor
     * 단일 스레드라 이벤트 순서가 유지되고, 큐가 가득 차면 TaskRejectedException으로 거부합니다.
     */
    @Bean(name = "fanoutExecutor")
    public ThreadPoolTaskExecutor fanoutExecutor(@Value("${chat.fanout.queue-capacity:1000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("fanout-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }
}
