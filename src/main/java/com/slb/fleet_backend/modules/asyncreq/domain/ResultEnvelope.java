package com.slb.fleet_backend.modules.asyncreq.domain;

import java.util.Map;

/**
 * 原始 HTTP 响应：状态码、响应头、响应体。响应体按字节原样保存。
 */
public record ResultEnvelope(
        int status,
        Map<String, String> headers,
        String body
) {

    public boolean isFailure() {
        return status >= 400;
    }
}
