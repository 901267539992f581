package com.slb.fleet_backend.common.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.Map;

/**
 * 未通过认证的运维端请求；JwtFilter 已标记原因时沿用，否则按 Authorization 头推断。
 */
@Component
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    public JwtAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        AuthErrorContext context = AuthProblemSupport.get(request);
        if (context == null) {
            context = StringUtils.hasText(request.getHeader("Authorization"))
                    ? new AuthErrorContext(AuthErrorType.INVALID_TOKEN, null, Map.of("token", "invalid"))
                    : new AuthErrorContext(AuthErrorType.MISSING_AUTHORIZATION, null, Map.of("Authorization", "缺少请求头"));
        }
        AuthProblemSupport.writeApiResponse(response, context, objectMapper);
    }
}
