package com.slb.fleet_backend.common.exception;

public class BizException extends RuntimeException{

    private static final long serialVersionUID = 1L;

    // 错误码，同时作为 HTTP 状态码使用
    private final int code;

    // 稳定机器码，便于前端/调用方区分错误类型
    private final String errorCode;

    public BizException(String message) {
        super(message);
        this.code = 400; // 默认400 - 业务错误
        this.errorCode = "BIZ_ERROR";
    }

    public BizException(int code, String message) {
        this(code, "BIZ_ERROR", message);
    }

    public BizException(int code, String errorCode, String message) {
        super(message);
        this.code = code;
        this.errorCode = errorCode;
    }

    public int getCode() {
        return code;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
