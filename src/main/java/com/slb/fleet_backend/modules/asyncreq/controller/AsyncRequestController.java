package com.slb.fleet_backend.modules.asyncreq.controller;

import com.slb.fleet_backend.common.api.ApiResponse;
import com.slb.fleet_backend.common.exception.BizException;
import com.slb.fleet_backend.common.security.OperatorPrincipal;
import com.slb.fleet_backend.modules.asyncreq.domain.ResultEnvelope;
import com.slb.fleet_backend.modules.asyncreq.entity.AsyncRequest;
import com.slb.fleet_backend.modules.asyncreq.enums.AsyncRequestStatus;
import com.slb.fleet_backend.modules.asyncreq.service.AsyncRequestTracker;
import com.slb.fleet_backend.modules.asyncreq.vo.AsyncRequestStatusVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/requests")
@Tag(name = "运维端/异步请求", description = "批量操作以 async=true 提交后，通过 requestId 查询状态并取回结果")
public class AsyncRequestController {

    private final AsyncRequestTracker tracker;

    public AsyncRequestController(AsyncRequestTracker tracker) {
        this.tracker = tracker;
    }

    @GetMapping("/{requestId}")
    @Operation(
            summary = "取回异步请求结果",
            description = """
                    - PENDING / PROCESSING：返回 202 与当前状态；
                    - DONE / ERROR：原样回放原始响应（状态码、响应头、响应体），取回后记录即被删除；
                    - EXPIRED：截止时间前未开始执行，返回 410 REQUEST_EXPIRED；
                    - 不存在：返回 404。
                    """
    )
    public ResponseEntity<?> retrieve(@PathVariable String requestId,
                                      @Parameter(hidden = true)
                                      @AuthenticationPrincipal OperatorPrincipal operator) {
        AsyncRequest request = tracker.getStatus(requestId, operator.getUserId());
        if (request.getStatus() == AsyncRequestStatus.EXPIRED) {
            throw new BizException(410, "REQUEST_EXPIRED", "异步请求未在截止时间前开始执行，已过期: " + requestId);
        }
        ResultEnvelope envelope = tracker.envelopeOf(request);
        if (envelope == null) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.ok(toVo(request)));
        }
        tracker.consume(requestId);
        HttpHeaders headers = new HttpHeaders();
        envelope.headers().forEach(headers::set);
        return ResponseEntity.status(envelope.status()).headers(headers).body(envelope.body());
    }

    @GetMapping("/{requestId}/status")
    @Operation(summary = "查询异步请求状态（不取回结果）")
    public ApiResponse<AsyncRequestStatusVo> status(@PathVariable String requestId,
                                                    @Parameter(hidden = true)
                                                    @AuthenticationPrincipal OperatorPrincipal operator) {
        return ApiResponse.ok(toVo(tracker.getStatus(requestId, operator.getUserId())));
    }

    private AsyncRequestStatusVo toVo(AsyncRequest request) {
        AsyncRequestStatusVo vo = new AsyncRequestStatusVo();
        vo.setRequestId(request.getId());
        vo.setOperation(request.getOperation());
        vo.setStatus(request.getStatus());
        vo.setCreatedAt(request.getCreatedAt());
        vo.setStartBy(request.getStartBy());
        vo.setClaimedAt(request.getClaimedAt());
        vo.setFinishedAt(request.getFinishedAt());
        return vo;
    }
}
