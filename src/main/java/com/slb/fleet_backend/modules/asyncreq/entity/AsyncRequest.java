package com.slb.fleet_backend.modules.asyncreq.entity;

import com.slb.fleet_backend.modules.asyncreq.enums.AsyncRequestStatus;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 异步请求，对应 'async_requests' 表。结果按原始 HTTP 响应（状态码/响应头/响应体）保存，取回时原样回放。
 */
@Data
public class AsyncRequest {
    private String id;
    private Long ownerId;
    private String operation;
    private String payload; // JSON
    private AsyncRequestStatus status;
    private LocalDateTime createdAt;
    private LocalDateTime startBy;
    private LocalDateTime claimedAt;
    private LocalDateTime finishedAt;
    private Integer resultStatus;
    private String resultHeaders; // JSON
    private String resultBody;
}
