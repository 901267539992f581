package com.slb.fleet_backend.modules.schedule.controller;

import com.slb.fleet_backend.common.api.ApiResponse;
import com.slb.fleet_backend.common.security.OperatorPrincipal;
import com.slb.fleet_backend.modules.schedule.dto.ScheduleSaveDto;
import com.slb.fleet_backend.modules.schedule.service.ScheduleService;
import com.slb.fleet_backend.modules.schedule.vo.ScheduleVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/v1/farms/{farmId}/schedules")
@Tag(name = "运维端/计划任务", description = "按时间或重复规则自动对标签/容器内设备执行动作")
public class ScheduleController {

    private final ScheduleService scheduleService;

    public ScheduleController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @PostMapping
    @Operation(
            summary = "创建计划",
            description = """
                    tagIds 与 containerId 二选一；目标设备在每次触发时重新解析。
                    rrule 为空表示只执行一次。每次触发都会生成一个异步请求，可在详情的 lastRequestId 中查看。

                    示例请求 (JSON):
                    {
                      "name": "每晚重启",
                      "tagIds": [3],
                      "action": {"commands": [{"type": "reboot"}]},
                      "launchAt": "2026-11-01T03:00:00",
                      "rrule": "FREQ=DAILY",
                      "timezone": "Asia/Shanghai"
                    }
                    """
    )
    public ApiResponse<ScheduleVo> create(@PathVariable Long farmId,
                                          @Valid @RequestBody ScheduleSaveDto dto,
                                          @Parameter(hidden = true)
                                          @AuthenticationPrincipal OperatorPrincipal operator) {
        return ApiResponse.ok(scheduleService.create(farmId, operator.getUserId(), dto));
    }

    @GetMapping
    @Operation(summary = "计划列表")
    public ApiResponse<List<ScheduleVo>> list(@PathVariable Long farmId) {
        return ApiResponse.ok(scheduleService.list(farmId));
    }

    @GetMapping("/{scheduleId}")
    @Operation(summary = "计划详情")
    public ApiResponse<ScheduleVo> get(@PathVariable Long farmId, @PathVariable Long scheduleId) {
        return ApiResponse.ok(scheduleService.get(farmId, scheduleId));
    }

    @PutMapping("/{scheduleId}")
    @Operation(summary = "修改计划", description = "修改后按新规则重新计算下一次触发时间，已触发过的时间点不会重复执行。")
    public ApiResponse<ScheduleVo> update(@PathVariable Long farmId,
                                          @PathVariable Long scheduleId,
                                          @Valid @RequestBody ScheduleSaveDto dto) {
        return ApiResponse.ok(scheduleService.update(farmId, scheduleId, dto));
    }

    @PostMapping("/{scheduleId}/activate")
    @Operation(summary = "启用计划")
    public ApiResponse<ScheduleVo> activate(@PathVariable Long farmId, @PathVariable Long scheduleId) {
        return ApiResponse.ok(scheduleService.activate(farmId, scheduleId));
    }

    @PostMapping("/{scheduleId}/deactivate")
    @Operation(summary = "停用计划")
    public ApiResponse<ScheduleVo> deactivate(@PathVariable Long farmId, @PathVariable Long scheduleId) {
        return ApiResponse.ok(scheduleService.deactivate(farmId, scheduleId));
    }

    @DeleteMapping("/{scheduleId}")
    @Operation(summary = "删除计划")
    public ApiResponse<Void> delete(@PathVariable Long farmId, @PathVariable Long scheduleId) {
        scheduleService.delete(farmId, scheduleId);
        return ApiResponse.ok();
    }

    @GetMapping("/{scheduleId}/occurrences")
    @Operation(summary = "预览触发时间", description = "返回接下来的若干次触发时间（计划时区）。")
    public ApiResponse<List<LocalDateTime>> occurrences(@PathVariable Long farmId,
                                                        @PathVariable Long scheduleId,
                                                        @RequestParam(defaultValue = "10") int limit) {
        return ApiResponse.ok(scheduleService.preview(farmId, scheduleId, limit));
    }
}
