package com.slb.fleet_backend.common.exception;

/**
 * search_id 对应的设备快照已过期（410）。
 */
public class SnapshotExpiredException extends BizException {

    private static final long serialVersionUID = 1L;

    public SnapshotExpiredException(String searchId) {
        super(410, "SNAPSHOT_EXPIRED", "设备筛选快照已过期，请重新筛选: " + searchId);
    }
}
