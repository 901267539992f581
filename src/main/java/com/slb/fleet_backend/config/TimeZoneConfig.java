package com.slb.fleet_backend.config;

import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.TimeZone;

/**
 * 统一服务端时区，避免服务器默认时区差异导致时间错位；数据库中的 DATETIME 均按该时区解释。
 * 计划任务的重复规则按各自的 timezone 计算，只在落库时换算回服务端时区。
 */
@Configuration
public class TimeZoneConfig {

    @Value("${app.time-zone:Asia/Shanghai}")
    private String timeZone;

    @PostConstruct
    public void init() {
        TimeZone.setDefault(TimeZone.getTimeZone(ZoneId.of(timeZone)));
    }

    @Bean
    public Clock clock() {
        return Clock.system(ZoneId.of(timeZone));
    }
}
