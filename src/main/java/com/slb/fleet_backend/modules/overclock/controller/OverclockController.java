package com.slb.fleet_backend.modules.overclock.controller;

import com.slb.fleet_backend.common.api.ApiResponse;
import com.slb.fleet_backend.modules.overclock.domain.OcConfig;
import com.slb.fleet_backend.modules.overclock.dto.OverclockProfileSaveDto;
import com.slb.fleet_backend.modules.overclock.service.OverclockProfileService;
import com.slb.fleet_backend.modules.overclock.vo.OverclockProfileVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/farms/{farmId}/overclocks")
@Tag(name = "运维端/超频方案", description = "超频方案（默认块 + 按算法覆盖块）的维护与预览")
public class OverclockController {

    private final OverclockProfileService profileService;

    public OverclockController(OverclockProfileService profileService) {
        this.profileService = profileService;
    }

    @PostMapping
    @Operation(summary = "创建超频方案")
    public ApiResponse<OverclockProfileVo> create(@PathVariable Long farmId,
                                                  @Valid @RequestBody OverclockProfileSaveDto dto) {
        return ApiResponse.ok(profileService.create(farmId, dto));
    }

    @PutMapping("/{ocId}")
    @Operation(summary = "更新超频方案", description = "更新后不会自动重新下发；如需生效请对目标设备再次执行超频下发。")
    public ApiResponse<OverclockProfileVo> update(@PathVariable Long farmId,
                                                  @PathVariable Long ocId,
                                                  @Valid @RequestBody OverclockProfileSaveDto dto) {
        return ApiResponse.ok(profileService.update(farmId, ocId, dto));
    }

    @GetMapping
    @Operation(summary = "超频方案列表")
    public ApiResponse<List<OverclockProfileVo>> list(@PathVariable Long farmId) {
        return ApiResponse.ok(profileService.list(farmId));
    }

    @GetMapping("/{ocId}")
    @Operation(summary = "超频方案详情")
    public ApiResponse<OverclockProfileVo> get(@PathVariable Long farmId, @PathVariable Long ocId) {
        return ApiResponse.ok(profileService.get(farmId, ocId));
    }

    @GetMapping("/{ocId}/resolve")
    @Operation(
            summary = "预览指定算法下的有效超频配置",
            description = """
                    默认块叠加 algo 匹配的覆盖块：品牌子块按字段覆盖，tweaker 规则按工具名拼接（同一显卡最后一条生效）。
                    没有默认块且无匹配覆盖块时返回空配置，表示"不改动超频"。
                    """
    )
    public ApiResponse<OcConfig> resolve(@PathVariable Long farmId,
                                         @PathVariable Long ocId,
                                         @Parameter(description = "算法名", example = "ethash")
                                         @RequestParam String algo) {
        return ApiResponse.ok(profileService.preview(farmId, ocId, algo));
    }
}
