package com.slb.fleet_backend.common.exception;

/**
 * 并发竞争失败或状态不允许当前操作（409）。
 */
public class ConflictException extends BizException {

    private static final long serialVersionUID = 1L;

    public ConflictException(String message) {
        super(409, "CONFLICT", message);
    }
}
