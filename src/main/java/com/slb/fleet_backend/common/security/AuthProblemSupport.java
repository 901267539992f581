package com.slb.fleet_backend.common.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.fleet_backend.common.api.ApiResponse;
import com.slb.fleet_backend.common.trace.TraceIdHolder;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

/**
 * 鉴权错误的暂存与输出：JwtFilter 先 flag 到 request，入口点/拒绝处理器再统一写出 ApiResponse。
 */
public final class AuthProblemSupport {

    public static final String AUTH_ERROR_CONTEXT_ATTR = AuthProblemSupport.class.getName() + ".CONTEXT";

    private AuthProblemSupport() {
    }

    /**
     * 只记录第一个错误
     */
    public static void flag(HttpServletRequest request, AuthErrorType type, @Nullable String detail,
                            @Nullable Map<String, String> errors) {
        if (request.getAttribute(AUTH_ERROR_CONTEXT_ATTR) == null) {
            request.setAttribute(AUTH_ERROR_CONTEXT_ATTR, new AuthErrorContext(type, detail, errors));
        }
    }

    @Nullable
    public static AuthErrorContext get(HttpServletRequest request) {
        Object context = request.getAttribute(AUTH_ERROR_CONTEXT_ATTR);
        return context instanceof AuthErrorContext authErrorContext ? authErrorContext : null;
    }

    /**
     * 以 ApiResponse 输出：code 为 HTTP 状态，error.code 为机器码；401 时附带 WWW-Authenticate。
     */
    public static void writeApiResponse(HttpServletResponse response, AuthErrorContext context,
                                        ObjectMapper mapper) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        AuthErrorType type = context.type();
        int status = type.getStatus().value();
        Map<String, String> errors = context.errors() != null ? context.errors() : Collections.emptyMap();

        response.setStatus(status);
        response.setContentType("application/json;charset=UTF-8");
        response.setHeader(TraceIdHolder.TRACE_ID_HEADER, TraceIdHolder.require());
        if (status == 401) {
            // 不回显异常信息，只用固定文案
            response.setHeader("WWW-Authenticate", "Bearer error=\"" + type.getOauthError()
                    + "\", error_description=\"" + type.getDefaultDetail() + "\"");
        }

        ApiResponse<Void> body = ApiResponse.authError(status, type.getCode(), type.getDisplayMessage(), errors);
        ApiResponse.ErrorBody error = body.getError();
        if (error != null) {
            error.setDetail(StringUtils.hasText(context.detail()) ? context.detail() : type.getDefaultDetail());
        }
        mapper.writeValue(response.getOutputStream(), body);
    }
}
