package com.slb.fleet_backend.modules.container.controller;

import com.slb.fleet_backend.common.api.ApiResponse;
import com.slb.fleet_backend.modules.container.dto.ContainerCellDto;
import com.slb.fleet_backend.modules.container.dto.ContainerCreateDto;
import com.slb.fleet_backend.modules.container.service.ContainerService;
import com.slb.fleet_backend.modules.container.vo.ContainerVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/farms/{farmId}/containers")
@Tag(name = "运维端/容器", description = "网格容器（机架/货柜）的维护，格子可放设备或嵌套子容器")
public class ContainerController {

    private final ContainerService containerService;

    public ContainerController(ContainerService containerService) {
        this.containerService = containerService;
    }

    @PostMapping
    @Operation(summary = "创建容器")
    public ApiResponse<ContainerVo> create(@PathVariable Long farmId,
                                           @Valid @RequestBody ContainerCreateDto dto) {
        return ApiResponse.ok(containerService.create(farmId, dto));
    }

    @GetMapping
    @Operation(summary = "容器列表")
    public ApiResponse<List<ContainerVo>> list(@PathVariable Long farmId) {
        return ApiResponse.ok(containerService.list(farmId));
    }

    @GetMapping("/{containerId}")
    @Operation(summary = "容器详情（含格子）")
    public ApiResponse<ContainerVo> get(@PathVariable Long farmId, @PathVariable Long containerId) {
        return ApiResponse.ok(containerService.get(farmId, containerId));
    }

    @PutMapping("/{containerId}/cells/{x}/{y}")
    @Operation(
            summary = "写入格子",
            description = """
                    请求体中 deviceId 与 containerId 二选一。挂载子容器时会检查嵌套关系，
                    若子容器已（直接或间接）包含当前容器则返回 409 CONTAINER_CYCLE。
                    """
    )
    public ApiResponse<ContainerVo> putCell(@PathVariable Long farmId,
                                            @PathVariable Long containerId,
                                            @Parameter(description = "行坐标，从 0 开始") @PathVariable int x,
                                            @Parameter(description = "列坐标，从 0 开始") @PathVariable int y,
                                            @RequestBody ContainerCellDto dto) {
        return ApiResponse.ok(containerService.putCell(farmId, containerId, x, y, dto));
    }

    @DeleteMapping("/{containerId}/cells/{x}/{y}")
    @Operation(summary = "清空格子")
    public ApiResponse<ContainerVo> clearCell(@PathVariable Long farmId,
                                              @PathVariable Long containerId,
                                              @PathVariable int x,
                                              @PathVariable int y) {
        return ApiResponse.ok(containerService.clearCell(farmId, containerId, x, y));
    }

    @GetMapping("/{containerId}/members")
    @Operation(summary = "展开容器成员设备", description = "递归展开嵌套子容器，返回按 id 升序的设备ID列表。")
    public ApiResponse<List<Long>> members(@PathVariable Long farmId, @PathVariable Long containerId) {
        return ApiResponse.ok(containerService.resolveMembers(farmId, containerId));
    }
}
