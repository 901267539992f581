package com.slb.fleet_backend.common.trace;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;

/**
 * 线程级 traceId 持有者；同时写入 MDC，日志 pattern 中以 %X{traceId} 输出。
 * 后台任务（计划触发、异步请求执行）也通过 {@link #set(String)} 绑定自己的 traceId。
 */
public final class TraceIdHolder {
    public static final String TRACE_ID_HEADER = "X-Trace-Id";
    public static final String MDC_KEY = "traceId";

    private static final ThreadLocal<String> TRACE_ID = new ThreadLocal<>();

    private TraceIdHolder() {
    }

    public static void set(String traceId) {
        TRACE_ID.set(traceId);
        MDC.put(MDC_KEY, traceId);
    }

    public static Optional<String> getOptional() {
        return Optional.ofNullable(TRACE_ID.get());
    }

    public static String require() {
        return getOptional().orElseGet(() -> {
            String generated = newTraceId();
            set(generated);
            return generated;
        });
    }

    public static String newTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static void clear() {
        TRACE_ID.remove();
        MDC.remove(MDC_KEY);
    }
}
