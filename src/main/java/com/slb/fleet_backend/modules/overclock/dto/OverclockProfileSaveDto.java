package com.slb.fleet_backend.modules.overclock.dto;

import com.slb.fleet_backend.modules.overclock.domain.AlgoOcConfig;
import com.slb.fleet_backend.modules.overclock.domain.OcConfig;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 创建/更新超频方案请求
 */
@Data
@Schema(description = "超频方案保存请求 / Overclock profile save request")
public class OverclockProfileSaveDto {

    @NotBlank(message = "方案名称不能为空")
    @Size(max = 64, message = "方案名称不能超过64个字符")
    @Schema(description = "方案名称 / Profile name", example = "3070 LHR")
    private String name;

    @Schema(description = "默认超频块，未匹配到算法块时使用 / Default block")
    private OcConfig defaultConfig;

    @Schema(description = "按算法覆盖块，按顺序叠加，同字段后者优先 / Per-algorithm overrides, later wins")
    private List<AlgoOcConfig> byAlgo = new ArrayList<>();
}
