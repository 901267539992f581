package com.slb.fleet_backend.modules.command.domain;

import java.util.List;

/**
 * 异步执行的批量动作。目标设备在提交时就已解析好，执行时不再受筛选条件变化影响。
 */
public record FleetActionJob(
        Long farmId,
        List<Long> deviceIds,
        FleetAction action
) {
}
