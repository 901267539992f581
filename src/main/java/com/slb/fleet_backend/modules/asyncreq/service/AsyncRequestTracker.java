package com.slb.fleet_backend.modules.asyncreq.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.slb.fleet_backend.common.exception.ConflictException;
import com.slb.fleet_backend.common.exception.NotFoundException;
import com.slb.fleet_backend.common.service.JsonColumnService;
import com.slb.fleet_backend.modules.asyncreq.config.AsyncRequestProperties;
import com.slb.fleet_backend.modules.asyncreq.domain.ResultEnvelope;
import com.slb.fleet_backend.modules.asyncreq.entity.AsyncRequest;
import com.slb.fleet_backend.modules.asyncreq.enums.AsyncRequestStatus;
import com.slb.fleet_backend.modules.asyncreq.mapper.AsyncRequestMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * 异步请求状态机。所有状态迁移都是带前置状态条件的 UPDATE（CAS），多实例并发下同一请求只会被领取一次。
 */
@Service
@Slf4j
public class AsyncRequestTracker {

    private static final TypeReference<LinkedHashMap<String, String>> HEADER_MAP = new TypeReference<>() {};

    private final AsyncRequestMapper requestMapper;
    private final JsonColumnService jsonColumnService;
    private final AsyncRequestProperties properties;
    private final Clock clock;

    public AsyncRequestTracker(AsyncRequestMapper requestMapper,
                               JsonColumnService jsonColumnService,
                               AsyncRequestProperties properties,
                               Clock clock) {
        this.requestMapper = requestMapper;
        this.jsonColumnService = jsonColumnService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 登记一个待执行的请求，截止时间为 now + startTimeout。
     */
    public String create(Long ownerId, String operation, Object payload) {
        LocalDateTime now = LocalDateTime.now(clock);
        AsyncRequest request = new AsyncRequest();
        request.setId(UUID.randomUUID().toString().replace("-", ""));
        request.setOwnerId(ownerId);
        request.setOperation(operation);
        request.setPayload(jsonColumnService.write(payload));
        request.setStatus(AsyncRequestStatus.PENDING);
        request.setCreatedAt(now);
        request.setStartBy(now.plus(properties.getStartTimeout()));
        requestMapper.insert(request);
        log.info("Async request {} created. operation={}, startBy={}", request.getId(), operation, request.getStartBy());
        return request.getId();
    }

    /**
     * PENDING -> PROCESSING，先到先得。已被领取、已过期或不存在时返回 false。
     */
    public boolean claim(String requestId) {
        LocalDateTime now = LocalDateTime.now(clock);
        AsyncRequest request = requestMapper.findById(requestId).orElse(null);
        if (request == null || request.getStatus() != AsyncRequestStatus.PENDING || isPastDeadline(request, now)) {
            return false;
        }
        // 条件更新再校验一次状态与截止时间，并发领取只有一个成功
        return requestMapper.claim(requestId, now) == 1;
    }

    /**
     * PROCESSING -> DONE（状态码 &lt; 400）或 ERROR。
     */
    public void complete(String requestId, ResultEnvelope envelope) {
        AsyncRequestStatus status = envelope.isFailure() ? AsyncRequestStatus.ERROR : AsyncRequestStatus.DONE;
        int updated = requestMapper.complete(requestId, status, envelope.status(),
                jsonColumnService.write(envelope.headers() == null ? Map.of() : envelope.headers()),
                envelope.body(), LocalDateTime.now(clock));
        if (updated != 1) {
            throw new ConflictException("异步请求不在执行中，无法写入结果: " + requestId);
        }
        log.info("Async request {} finished with {} (http {})", requestId, status, envelope.status());
    }

    /**
     * 查询请求；不存在（或不属于该运维人员）抛 NotFoundException。
     * 已过截止时间但还没被清扫的 PENDING 直接按 EXPIRED 返回。
     */
    public AsyncRequest getStatus(String requestId, Long ownerId) {
        AsyncRequest request = requestMapper.findById(requestId)
                .orElseThrow(() -> NotFoundException.of("异步请求", requestId));
        if (ownerId != null && !Objects.equals(ownerId, request.getOwnerId())) {
            throw NotFoundException.of("异步请求", requestId);
        }
        if (request.getStatus() == AsyncRequestStatus.PENDING && isPastDeadline(request, LocalDateTime.now(clock))) {
            request.setStatus(AsyncRequestStatus.EXPIRED);
        }
        return request;
    }

    public AsyncRequest load(String requestId) {
        return requestMapper.findById(requestId).orElseThrow(() -> NotFoundException.of("异步请求", requestId));
    }

    /**
     * 终态请求的原始响应；非 DONE/ERROR 返回 null
     */
    public ResultEnvelope envelopeOf(AsyncRequest request) {
        if (request.getStatus() != AsyncRequestStatus.DONE && request.getStatus() != AsyncRequestStatus.ERROR) {
            return null;
        }
        Map<String, String> headers = jsonColumnService.read(request.getResultHeaders(), HEADER_MAP);
        return new ResultEnvelope(request.getResultStatus(), headers == null ? Map.of() : headers, request.getResultBody());
    }

    /**
     * 结果被取走后删除
     */
    public void consume(String requestId) {
        requestMapper.deleteById(requestId);
    }

    public List<String> findClaimable(int limit) {
        return requestMapper.findClaimableIds(LocalDateTime.now(clock), limit);
    }

    /**
     * 只影响仍为 PENDING 且超过截止时间的请求
     */
    public int expire() {
        int expired = requestMapper.expirePending(LocalDateTime.now(clock));
        if (expired > 0) {
            log.info("Expired {} async requests that were never started", expired);
        }
        return expired;
    }

    /**
     * 领取后超过 processingTimeout 仍未完成的请求
     */
    public List<String> findStaleProcessing(int limit) {
        return requestMapper.findStaleProcessingIds(staleCutoff(), limit);
    }

    /**
     * 超时的 PROCESSING -> ERROR。期间执行方已写入结果时返回 false。
     */
    public boolean failStale(String requestId, ResultEnvelope envelope) {
        int updated = requestMapper.failStale(requestId, staleCutoff(), envelope.status(),
                jsonColumnService.write(envelope.headers() == null ? Map.of() : envelope.headers()),
                envelope.body(), LocalDateTime.now(clock));
        if (updated == 1) {
            log.warn("Async request {} timed out while processing, marked ERROR", requestId);
        }
        return updated == 1;
    }

    /**
     * 与领取 SQL 的 start_by &gt;= now 一致：截止时刻本身仍可领取
     */
    private static boolean isPastDeadline(AsyncRequest request, LocalDateTime now) {
        return request.getStartBy().isBefore(now);
    }

    private LocalDateTime staleCutoff() {
        return LocalDateTime.now(clock).minus(properties.getProcessingTimeout());
    }

    public int purge() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.getRetention());
        int purged = requestMapper.purgeFinishedBefore(cutoff);
        if (purged > 0) {
            log.info("Purged {} async requests finished before {}", purged, cutoff);
        }
        return purged;
    }
}
