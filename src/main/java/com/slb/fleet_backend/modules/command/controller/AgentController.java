package com.slb.fleet_backend.modules.command.controller;

import com.slb.fleet_backend.common.api.ApiResponse;
import com.slb.fleet_backend.modules.command.dto.CommandReportDto;
import com.slb.fleet_backend.modules.command.service.CommandDispatcher;
import com.slb.fleet_backend.modules.command.vo.DevicePollVo;
import com.slb.fleet_backend.modules.device.service.DeviceRegistryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

/**
 * 设备端接口：不走 JWT，使用设备ID + 设备密码（X-Rig-Password）鉴权。
 */
@RestController
@RequestMapping("/api/v1/agent/workers/{workerId}")
@Tag(name = "设备端/轮询", description = "设备定期轮询拉取配置与指令，并回报执行结果")
public class AgentController {

    public static final String RIG_PASSWORD_HEADER = "X-Rig-Password";

    private final CommandDispatcher commandDispatcher;
    private final DeviceRegistryService deviceRegistryService;

    public AgentController(CommandDispatcher commandDispatcher, DeviceRegistryService deviceRegistryService) {
        this.commandDispatcher = commandDispatcher;
        this.deviceRegistryService = deviceRegistryService;
    }

    @PostMapping("/poll")
    @Operation(
            summary = "设备轮询",
            description = """
                    返回当前配置（飞行表、挖矿配置、超频）与全部未回报的指令。
                    轮询不会清空队列：指令在设备回报前每次都会返回，设备需按指令 id 幂等处理。
                    同时刷新设备心跳。
                    """
    )
    public ApiResponse<DevicePollVo> poll(@PathVariable Long workerId,
                                          @Parameter(description = "设备密码", required = true)
                                          @RequestHeader(RIG_PASSWORD_HEADER) String password) {
        deviceRegistryService.authenticate(workerId, password);
        return ApiResponse.ok(commandDispatcher.pull(workerId));
    }

    @PostMapping("/report")
    @Operation(
            summary = "回报指令结果 / 上报消息",
            description = "未知或已回报过的 commandId 会被忽略（data=false），不返回错误。"
    )
    public ApiResponse<Boolean> report(@PathVariable Long workerId,
                                       @Parameter(description = "设备密码", required = true)
                                       @RequestHeader(RIG_PASSWORD_HEADER) String password,
                                       @Valid @RequestBody CommandReportDto dto) {
        deviceRegistryService.authenticate(workerId, password);
        return ApiResponse.ok(commandDispatcher.report(workerId, dto));
    }
}
