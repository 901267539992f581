package com.slb.fleet_backend.modules.command.controller;

import com.slb.fleet_backend.common.api.ApiResponse;
import com.slb.fleet_backend.common.security.OperatorPrincipal;
import com.slb.fleet_backend.modules.asyncreq.service.AsyncRequestTracker;
import com.slb.fleet_backend.modules.asyncreq.service.AsyncRequestWorker;
import com.slb.fleet_backend.modules.command.domain.CommandSpec;
import com.slb.fleet_backend.modules.command.domain.FanOutBatch;
import com.slb.fleet_backend.modules.command.domain.FleetActionJob;
import com.slb.fleet_backend.modules.command.dto.FleetCommandDto;
import com.slb.fleet_backend.modules.command.service.CommandDispatcher;
import com.slb.fleet_backend.modules.command.service.FleetActionService;
import com.slb.fleet_backend.modules.command.vo.CommandVo;
import com.slb.fleet_backend.modules.device.service.DeviceRegistryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/farms/{farmId}/workers")
@Tag(name = "运维端/指令下发", description = "对单台或一批设备下发飞行表、超频与指令")
public class FleetCommandController {

    private final FleetActionService fleetActionService;
    private final CommandDispatcher commandDispatcher;
    private final DeviceRegistryService deviceRegistryService;
    private final AsyncRequestTracker asyncRequestTracker;
    private final AsyncRequestWorker asyncRequestWorker;

    public FleetCommandController(FleetActionService fleetActionService,
                                  CommandDispatcher commandDispatcher,
                                  DeviceRegistryService deviceRegistryService,
                                  AsyncRequestTracker asyncRequestTracker,
                                  AsyncRequestWorker asyncRequestWorker) {
        this.fleetActionService = fleetActionService;
        this.commandDispatcher = commandDispatcher;
        this.deviceRegistryService = deviceRegistryService;
        this.asyncRequestTracker = asyncRequestTracker;
        this.asyncRequestWorker = asyncRequestWorker;
    }

    @PostMapping("/command")
    @Operation(
            summary = "批量下发",
            description = """
                    target 为设备选择条件（ids / tagIds / searchId / containerId 四选一），
                    action 为飞行表、超频、指令的任意组合（至少一项）。

                    逐台执行，单台失败不影响其他设备：即便部分设备失败，HTTP 仍返回 200，
                    失败设备在 items 中以 status=error 标出。

                    async=true 时立即返回 202 与 requestId，通过 GET /api/v1/requests/{requestId} 取回结果。

                    示例请求 (JSON):
                    {
                      "target": {"tagIds": [3, 5], "tagMatch": "ANY"},
                      "action": {
                        "flightSheetId": 12,
                        "overclock": {"ocId": 7, "mode": "MERGE"},
                        "commands": [{"type": "miner", "payload": {"action": "restart"}}]
                      }
                    }
                    """
    )
    public ResponseEntity<ApiResponse<?>> command(@PathVariable Long farmId,
                                                  @Parameter(description = "是否异步执行") @RequestParam(defaultValue = "false") boolean async,
                                                  @Valid @RequestBody FleetCommandDto dto,
                                                  @Parameter(hidden = true)
                                                  @AuthenticationPrincipal OperatorPrincipal operator) {
        if (async) {
            FleetActionJob job = fleetActionService.prepareJob(farmId, operator.getUserId(), dto);
            String requestId = asyncRequestTracker.create(operator.getUserId(), FleetActionService.ASYNC_OPERATION, job);
            asyncRequestWorker.submit(requestId);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.ok(Map.of("requestId", requestId)));
        }
        FanOutBatch batch = fleetActionService.execute(farmId, operator.getUserId(), dto);
        return ResponseEntity.ok(ApiResponse.ok(batch));
    }

    @PostMapping("/{workerId}/commands")
    @Operation(summary = "单台入队指令", description = "不去重：重复提交会产生重复的队列项。")
    public ApiResponse<Long> enqueue(@PathVariable Long farmId,
                                     @PathVariable Long workerId,
                                     @RequestBody CommandSpec spec) {
        deviceRegistryService.requireDeviceInFarm(farmId, workerId);
        return ApiResponse.ok(commandDispatcher.enqueue(workerId, spec));
    }

    @GetMapping("/{workerId}/commands")
    @Operation(summary = "设备未回报的指令队列", description = "设备长期不轮询时指令会一直留在队列中，可在这里查看。")
    public ApiResponse<List<CommandVo>> queue(@PathVariable Long farmId, @PathVariable Long workerId) {
        return ApiResponse.ok(commandDispatcher.listQueue(farmId, workerId));
    }
}
