package com.slb.fleet_backend.modules.asyncreq.vo;

import com.slb.fleet_backend.modules.asyncreq.enums.AsyncRequestStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Schema(description = "异步请求状态")
public class AsyncRequestStatusVo {
    private String requestId;
    private String operation;
    private AsyncRequestStatus status;
    private LocalDateTime createdAt;
    private LocalDateTime startBy;
    private LocalDateTime claimedAt;
    private LocalDateTime finishedAt;
}
