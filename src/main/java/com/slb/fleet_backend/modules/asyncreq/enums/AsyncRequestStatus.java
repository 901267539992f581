package com.slb.fleet_backend.modules.asyncreq.enums;

/**
 * 异步请求状态：PENDING -> PROCESSING -> DONE | ERROR；PENDING 超过截止时间未被领取 -> EXPIRED
 */
public enum AsyncRequestStatus {
    PENDING,
    PROCESSING,
    DONE,
    ERROR,
    EXPIRED;

    public boolean isTerminal() {
        return this == DONE || this == ERROR || this == EXPIRED;
    }
}
