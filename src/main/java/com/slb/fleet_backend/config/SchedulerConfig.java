package com.slb.fleet_backend.config;

import com.slb.fleet_backend.modules.asyncreq.config.AsyncRequestProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 启用 Spring 的定时任务功能，并提供异步请求的执行线程池。
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    @Bean(name = "asyncRequestExecutor")
    public ThreadPoolTaskExecutor asyncRequestExecutor(AsyncRequestProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerThreads());
        executor.setMaxPoolSize(properties.getWorkerThreads());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("async-req-");
        // 队列满时拒绝：请求仍为 PENDING，由定时拾取重新提交
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
