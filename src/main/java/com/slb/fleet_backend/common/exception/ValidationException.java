package com.slb.fleet_backend.common.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 入参校验失败（400），可携带字段级错误明细。
 */
public class ValidationException extends BizException {

    private static final long serialVersionUID = 1L;

    private final Map<String, String> fieldErrors;

    public ValidationException(String message) {
        this(message, Collections.emptyMap());
    }

    public ValidationException(String field, String message) {
        this(message, Map.of(field, message));
    }

    public ValidationException(String message, Map<String, String> fieldErrors) {
        super(400, "VALIDATION_FAILED", message);
        this.fieldErrors = fieldErrors == null ? Collections.emptyMap() : new LinkedHashMap<>(fieldErrors);
    }

    public Map<String, String> getFieldErrors() {
        return Collections.unmodifiableMap(fieldErrors);
    }
}
