package com.slb.fleet_backend.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.slb.fleet_backend.common.trace.TraceIdHolder;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 统一响应封装 / Unified API response envelope.
 * 异步请求的结果会把整个信封序列化后落库，取回时原样回放，因此字段需保持可 JSON 往返。
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "统一响应结构，同步接口与异步回放均使用 / Envelope used by sync APIs and async replays.")
public class ApiResponse<T> {

    @Schema(description = "0 表示成功，失败时与 HTTP 状态码一致 / 0 on success, HTTP status on failure.", example = "0")
    private int code;

    @Schema(description = "成功为 'ok'，失败为错误原因（鉴权错误时为机器码）", example = "ok")
    private String message;

    @Schema(description = "展示用文案，仅鉴权错误返回", nullable = true)
    private String displayMessage;

    @Schema(description = "业务数据 / Payload.", nullable = true)
    private T data;

    @Schema(description = "链路追踪 ID；异步请求中为 requestId", example = "b3f7e6c9a1d24c31")
    private String traceId;

    @Schema(description = "错误扩展信息 / Structured error details.", nullable = true)
    private ErrorBody error;

    private ApiResponse(int code, String message, T data) {
        this.code = code;
        this.message = message;
        this.data = data;
        this.traceId = TraceIdHolder.require();
    }

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(0, "ok", data);
    }

    public static ApiResponse<Void> ok() {
        return ok(null);
    }

    public static ApiResponse<Void> error(int code, String message) {
        return new ApiResponse<>(code, message, null);
    }

    /**
     * 业务错误：message 为原因，error.code 为稳定机器码（如 SNAPSHOT_EXPIRED），errors 为字段级明细。
     */
    public static ApiResponse<Void> error(int code, String machineCode, String message, Map<String, String> errors) {
        ApiResponse<Void> resp = error(code, message);
        resp.setError(new ErrorBody(machineCode, message, errors == null || errors.isEmpty() ? null : errors, null));
        return resp;
    }

    /**
     * 鉴权错误：message 为机器码，displayMessage 为中文展示文案
     */
    public static ApiResponse<Void> authError(int httpStatus, String machineCode, String displayMessage,
                                              Map<String, String> errors) {
        ApiResponse<Void> resp = error(httpStatus, machineCode);
        resp.setDisplayMessage(displayMessage);
        resp.setError(new ErrorBody(machineCode, displayMessage, errors == null || errors.isEmpty() ? null : errors, null));
        return resp;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorBody {
        @Schema(description = "稳定机器错误码", example = "SNAPSHOT_EXPIRED")
        private String code;

        private String displayMessage;

        @Schema(description = "字段级错误，key 为字段路径（如 commands[0].payload.url）", nullable = true)
        private Map<String, String> errors;

        @Schema(description = "调试详情", nullable = true)
        private String detail;
    }
}
