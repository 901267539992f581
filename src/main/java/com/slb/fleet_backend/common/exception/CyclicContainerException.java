package com.slb.fleet_backend.common.exception;

/**
 * 容器嵌套形成环（409）。
 */
public class CyclicContainerException extends BizException {

    private static final long serialVersionUID = 1L;

    public CyclicContainerException(Long containerId) {
        super(409, "CONTAINER_CYCLE", "容器嵌套形成环路: " + containerId);
    }
}
