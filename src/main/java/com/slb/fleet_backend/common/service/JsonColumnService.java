package com.slb.fleet_backend.common.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.fleet_backend.common.exception.BizException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * JSON 列的序列化/反序列化。超频配置、指令载荷、计划动作等以 JSON 字符串落库。
 */
@Service
@Slf4j
public class JsonColumnService {

    private final ObjectMapper objectMapper; // Spring Boot 自动配置

    public JsonColumnService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 对象写成 JSON 字符串；null 原样返回 null。
     */
    public String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new BizException(500, "JSON_WRITE_FAILED", "数据序列化失败: " + e.getOriginalMessage());
        }
    }

    /**
     * 读取 JSON 列；空串/null 返回 null。库中数据损坏属于系统错误，按 500 抛出。
     */
    public <T> T read(String json, Class<T> type) {
        if (!StringUtils.hasText(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("Corrupted JSON column for type {}: {}", type.getSimpleName(), e.getOriginalMessage());
            throw new BizException(500, "JSON_READ_FAILED", "数据解析失败");
        }
    }

    public <T> T read(String json, TypeReference<T> type) {
        if (!StringUtils.hasText(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("Corrupted JSON column for type {}: {}", type.getType(), e.getOriginalMessage());
            throw new BizException(500, "JSON_READ_FAILED", "数据解析失败");
        }
    }
}
