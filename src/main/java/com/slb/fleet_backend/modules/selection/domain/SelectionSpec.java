package com.slb.fleet_backend.modules.selection.domain;

import com.slb.fleet_backend.modules.selection.enums.TagMatch;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.List;

/**
 * 设备选择条件：ids / tagIds / searchId / containerId 四选一。
 */
@Data
@Schema(description = "设备选择条件，ids、tagIds、searchId、containerId 必须且只能填写一种")
public class SelectionSpec {

    @Schema(description = "显式设备ID列表")
    private List<Long> ids;

    @Schema(description = "标签ID列表")
    private List<Long> tagIds;

    @Schema(description = "标签匹配方式，缺省为配置的默认值（ANY）")
    private TagMatch tagMatch;

    @Schema(description = "之前生成的筛选快照ID")
    private String searchId;

    @Schema(description = "容器ID，展开嵌套子容器")
    private Long containerId;

    public static SelectionSpec ofIds(List<Long> ids) {
        SelectionSpec spec = new SelectionSpec();
        spec.setIds(ids);
        return spec;
    }

    public static SelectionSpec ofTags(List<Long> tagIds, TagMatch tagMatch) {
        SelectionSpec spec = new SelectionSpec();
        spec.setTagIds(tagIds);
        spec.setTagMatch(tagMatch);
        return spec;
    }

    public static SelectionSpec ofContainer(Long containerId) {
        SelectionSpec spec = new SelectionSpec();
        spec.setContainerId(containerId);
        return spec;
    }
}
