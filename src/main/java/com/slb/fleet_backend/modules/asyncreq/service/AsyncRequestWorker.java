package com.slb.fleet_backend.modules.asyncreq.service;

import com.slb.fleet_backend.common.api.ApiResponse;
import com.slb.fleet_backend.common.exception.BizException;
import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.common.service.JsonColumnService;
import com.slb.fleet_backend.common.trace.TraceIdHolder;
import com.slb.fleet_backend.modules.asyncreq.config.AsyncRequestProperties;
import com.slb.fleet_backend.modules.asyncreq.domain.ResultEnvelope;
import com.slb.fleet_backend.modules.asyncreq.entity.AsyncRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * 异步请求执行器：提交到有界线程池；定时拾取遗留的 PENDING（重启、线程池满），定时过期与清理。
 */
@Service
@Slf4j
public class AsyncRequestWorker {

    private final AsyncRequestTracker tracker;
    private final JsonColumnService jsonColumnService;
    private final AsyncRequestProperties properties;
    private final TaskExecutor executor;
    private final Map<String, AsyncOperationHandler> handlers = new HashMap<>();

    public AsyncRequestWorker(AsyncRequestTracker tracker,
                              JsonColumnService jsonColumnService,
                              AsyncRequestProperties properties,
                              @Qualifier("asyncRequestExecutor") TaskExecutor executor,
                              List<AsyncOperationHandler> handlerList) {
        this.tracker = tracker;
        this.jsonColumnService = jsonColumnService;
        this.properties = properties;
        this.executor = executor;
        for (AsyncOperationHandler handler : handlerList) {
            AsyncOperationHandler previous = handlers.put(handler.operation(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate async operation handler: " + handler.operation());
            }
        }
    }

    /**
     * 提交执行；线程池满时请求保持 PENDING，等待下次拾取。
     */
    public void submit(String requestId) {
        try {
            executor.execute(() -> process(requestId));
        } catch (RejectedExecutionException ex) {
            log.warn("Async executor saturated, request {} left pending for pickup", requestId);
        }
    }

    /**
     * 领取并执行。领取失败（他人已领取 / 已过期）直接返回。
     */
    public void process(String requestId) {
        if (!tracker.claim(requestId)) {
            log.debug("Async request {} not claimable, skipped", requestId);
            return;
        }
        TraceIdHolder.set(requestId);
        try {
            AsyncRequest request = tracker.load(requestId);
            tracker.complete(requestId, execute(request));
        } catch (RuntimeException ex) {
            log.error("Async request {} failed to record its result", requestId, ex);
        } finally {
            TraceIdHolder.clear();
        }
    }

    private ResultEnvelope execute(AsyncRequest request) {
        AsyncOperationHandler handler = handlers.get(request.getOperation());
        if (handler == null) {
            log.error("No handler for async operation {}, request {}", request.getOperation(), request.getId());
            return envelope(500, ApiResponse.error(500, "UNKNOWN_OPERATION", "未知的异步操作: " + request.getOperation(), null));
        }
        try {
            return envelope(200, ApiResponse.ok(handler.handle(request.getPayload())));
        } catch (BizException ex) {
            Map<String, String> errors = ex instanceof ValidationException ve ? ve.getFieldErrors() : null;
            return envelope(ex.getCode(), ApiResponse.error(ex.getCode(), ex.getErrorCode(), ex.getMessage(), errors));
        } catch (RuntimeException ex) {
            log.error("Async request {} ({}) failed", request.getId(), request.getOperation(), ex);
            return envelope(500, ApiResponse.error(500, "INTERNAL_ERROR", "服务器内部错误", null));
        }
    }

    private ResultEnvelope envelope(int status, ApiResponse<?> body) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        headers.put(TraceIdHolder.TRACE_ID_HEADER, body.getTraceId());
        return new ResultEnvelope(status, headers, jsonColumnService.write(body));
    }

    @Scheduled(fixedDelayString = "${app.async-requests.pickup-fixed-delay-ms:5000}")
    public void pickupPending() {
        List<String> ids = tracker.findClaimable(properties.getPickupBatchSize());
        for (String id : ids) {
            submit(id);
        }
    }

    @Scheduled(fixedDelayString = "${app.async-requests.sweep-fixed-delay-ms:60000}")
    public void sweep() {
        tracker.expire();
        failStaleProcessing();
        tracker.purge();
    }

    /**
     * 执行实例宕机或结果写入失败时，请求会一直停在 PROCESSING；超时后写入 500 结果。
     */
    void failStaleProcessing() {
        for (String id : tracker.findStaleProcessing(properties.getPickupBatchSize())) {
            TraceIdHolder.set(id);
            try {
                tracker.failStale(id, envelope(500, ApiResponse.error(500, "PROCESSING_TIMEOUT", "异步请求执行超时", null)));
            } finally {
                TraceIdHolder.clear();
            }
        }
    }
}
