package com.slb.fleet_backend.modules.device.controller;

import com.slb.fleet_backend.common.api.ApiResponse;
import com.slb.fleet_backend.common.vo.PageVo;
import com.slb.fleet_backend.modules.device.service.DeviceRegistryService;
import com.slb.fleet_backend.modules.device.vo.DeviceMessageVo;
import com.slb.fleet_backend.modules.device.vo.DeviceVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/farms/{farmId}/workers")
@Tag(name = "运维端/设备", description = "设备详情与设备消息")
public class DeviceController {

    private final DeviceRegistryService deviceRegistryService;

    public DeviceController(DeviceRegistryService deviceRegistryService) {
        this.deviceRegistryService = deviceRegistryService;
    }

    @GetMapping
    @Operation(summary = "批量查询设备概要", description = "按 ids 批量返回本矿场的设备（不含标签），不存在或不属于本矿场的 id 直接略过。")
    public ApiResponse<List<DeviceVo>> listDevices(@PathVariable Long farmId,
                                                   @Parameter(description = "设备ID列表，逗号分隔", required = true, example = "1001,1002")
                                                   @RequestParam List<Long> ids) {
        return ApiResponse.ok(deviceRegistryService.listDevices(farmId, ids));
    }

    @GetMapping("/{workerId}")
    @Operation(
            summary = "获取设备详情",
            description = """
                    返回设备当前配置。超频分两份：ocConfig 为按当前飞行表/方案应当生效的配置，
                    appliedOcConfig 为设备回报成功后实际生效的配置；ocInSync=false 表示设备尚未拉取或执行超频指令。
                    """
    )
    public ApiResponse<DeviceVo> getDevice(@PathVariable Long farmId,
                                           @Parameter(description = "设备ID", required = true, example = "1001")
                                           @PathVariable Long workerId) {
        return ApiResponse.ok(deviceRegistryService.getDeviceDetail(farmId, workerId));
    }

    @GetMapping("/{workerId}/messages")
    @Operation(summary = "设备消息列表（分页）", description = "指令执行结果等设备消息，按时间倒序。")
    public ApiResponse<PageVo<DeviceMessageVo>> listMessages(@PathVariable Long farmId,
                                                             @PathVariable Long workerId,
                                                             @Parameter(description = "页码，从 1 开始", example = "1")
                                                             @RequestParam(defaultValue = "1") int page,
                                                             @Parameter(description = "每页条数，最大 100", example = "20")
                                                             @RequestParam(defaultValue = "20") int size) {
        return ApiResponse.ok(deviceRegistryService.listMessages(farmId, workerId, page, size));
    }

    @PostMapping("/{workerId}/messages/read")
    @Operation(summary = "设备消息全部标记已读")
    public ApiResponse<Integer> markMessagesRead(@PathVariable Long farmId, @PathVariable Long workerId) {
        return ApiResponse.ok(deviceRegistryService.markMessagesRead(farmId, workerId));
    }
}
