package com.slb.fleet_backend.modules.asyncreq.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 异步请求配置
 */
@Component
@ConfigurationProperties(prefix = "app.async-requests")
@Data
public class AsyncRequestProperties {

    /**
     * 创建后多久内必须开始执行，超时未被领取则置为 EXPIRED。
     */
    private Duration startTimeout = Duration.ofMinutes(5);

    /**
     * 领取后多久仍未写入结果即判定失败（置为 ERROR 并写入 500 结果），之后按保留时长清理。
     */
    private Duration processingTimeout = Duration.ofMinutes(30);

    /**
     * 终态记录保留时长，超过后清理（取回结果时会立即删除）。
     */
    private Duration retention = Duration.ofHours(24);

    /**
     * 执行线程数
     */
    private int workerThreads = 4;

    /**
     * 执行队列容量；队列满时请求保持 PENDING，等待定时拾取。
     */
    private int queueCapacity = 200;

    /**
     * 每次定时拾取的最大条数
     */
    private int pickupBatchSize = 50;
}
