package com.slb.fleet_backend.modules.command.service;

import com.slb.fleet_backend.common.service.JsonColumnService;
import com.slb.fleet_backend.modules.asyncreq.service.AsyncOperationHandler;
import com.slb.fleet_backend.modules.command.domain.FleetActionJob;
import org.springframework.stereotype.Component;

/**
 * 异步执行批量动作，结果为 FanOutBatch。
 */
@Component
public class FleetActionAsyncHandler implements AsyncOperationHandler {

    private final FleetActionService fleetActionService;
    private final JsonColumnService jsonColumnService;

    public FleetActionAsyncHandler(FleetActionService fleetActionService, JsonColumnService jsonColumnService) {
        this.fleetActionService = fleetActionService;
        this.jsonColumnService = jsonColumnService;
    }

    @Override
    public String operation() {
        return FleetActionService.ASYNC_OPERATION;
    }

    @Override
    public Object handle(String payload) {
        FleetActionJob job = jsonColumnService.read(payload, FleetActionJob.class);
        return fleetActionService.executeOn(job.farmId(), job.deviceIds(), job.action());
    }
}
