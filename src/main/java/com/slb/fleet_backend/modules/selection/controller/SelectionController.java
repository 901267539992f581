package com.slb.fleet_backend.modules.selection.controller;

import com.slb.fleet_backend.common.api.ApiResponse;
import com.slb.fleet_backend.common.security.OperatorPrincipal;
import com.slb.fleet_backend.modules.selection.domain.SelectionSpec;
import com.slb.fleet_backend.modules.selection.service.SelectionResolver;
import com.slb.fleet_backend.modules.selection.vo.SelectionSnapshotVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/farms/{farmId}/selections")
@Tag(name = "运维端/设备筛选", description = "筛选设备并生成快照（searchId），批量操作引用快照以保证预览与执行作用于同一批设备")
public class SelectionController {

    private final SelectionResolver selectionResolver;

    public SelectionController(SelectionResolver selectionResolver) {
        this.selectionResolver = selectionResolver;
    }

    @PostMapping
    @Operation(
            summary = "筛选设备并生成快照",
            description = """
                    返回 searchId 及设备ID列表。快照按当前登录运维人员隔离，在 TTL 内引用 searchId
                    总是得到同一批设备，即便标签/容器随后发生变化；过期后返回 410 SNAPSHOT_EXPIRED。
                    """
    )
    public ApiResponse<SelectionSnapshotVo> snapshot(@PathVariable Long farmId,
                                                     @RequestBody SelectionSpec spec,
                                                     @Parameter(hidden = true)
                                                     @AuthenticationPrincipal OperatorPrincipal operator) {
        return ApiResponse.ok(selectionResolver.snapshot(farmId, operator.getUserId(), spec));
    }

    @GetMapping("/{searchId}")
    @Operation(summary = "读取快照中的设备ID")
    public ApiResponse<List<Long>> get(@PathVariable Long farmId,
                                       @PathVariable String searchId,
                                       @Parameter(hidden = true)
                                       @AuthenticationPrincipal OperatorPrincipal operator) {
        SelectionSpec spec = new SelectionSpec();
        spec.setSearchId(searchId);
        return ApiResponse.ok(selectionResolver.resolve(farmId, operator.getUserId(), spec));
    }
}
