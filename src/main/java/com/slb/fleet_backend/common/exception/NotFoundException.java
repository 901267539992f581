package com.slb.fleet_backend.common.exception;

/**
 * 设备/容器/计划/请求等 ID 不存在（404）。
 */
public class NotFoundException extends BizException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String message) {
        super(404, "NOT_FOUND", message);
    }

    public static NotFoundException of(String entity, Object id) {
        return new NotFoundException(entity + " 不存在: " + id);
    }
}
