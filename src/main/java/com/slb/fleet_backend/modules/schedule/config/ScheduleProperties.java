package com.slb.fleet_backend.modules.schedule.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 计划任务配置。tick 间隔见 app.schedules.tick-ms。
 */
@Component
@ConfigurationProperties(prefix = "app.schedules")
@Data
public class ScheduleProperties {

    /**
     * 每次 tick 处理的最大计划数
     */
    private int batchSize = 100;

    /**
     * 单个计划触发时持有的租约时长，多实例部署下防止重复触发
     */
    private Duration leaseTtl = Duration.ofSeconds(60);

    private String leaseKeyPrefix = "fleet:schedule:lease";

    /**
     * 预览接口最多返回的触发次数
     */
    private int maxPreview = 50;
}
