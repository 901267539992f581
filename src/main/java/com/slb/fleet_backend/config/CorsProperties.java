package com.slb.fleet_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 运维控制台的跨域配置（app.cors）。设备端不经过浏览器，不受影响。
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.cors")
public class CorsProperties {

    private boolean enabled = true;

    /**
     * 精确 Origin 列表，为空时使用 allowedOriginPatterns
     */
    private List<String> allowedOrigins = new ArrayList<>();

    private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));

    private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));

    private List<String> allowedHeaders = new ArrayList<>(List.of(
            "Content-Type", "Authorization", "X-Trace-Id", "X-Rig-Password"));

    private List<String> exposedHeaders = new ArrayList<>(List.of("X-Trace-Id"));

    private long maxAgeSeconds = 3600;
}
