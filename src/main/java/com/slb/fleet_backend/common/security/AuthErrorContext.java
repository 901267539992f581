package com.slb.fleet_backend.common.security;

import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * 过滤器识别出的鉴权错误，暂存在 request 上，由入口点统一输出
 */
public record AuthErrorContext(
        AuthErrorType type,
        @Nullable String detail,
        @Nullable Map<String, String> errors
) {
}
