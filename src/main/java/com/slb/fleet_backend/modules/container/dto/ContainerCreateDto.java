package com.slb.fleet_backend.modules.container.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ContainerCreateDto {

    @NotBlank(message = "容器名称不能为空")
    private String name;

    @Schema(description = "网格行数", example = "4")
    @NotNull(message = "行数不能为空")
    @Min(value = 1, message = "行数至少为 1")
    @Max(value = 64, message = "行数不能超过 64")
    private Integer rows;

    @Schema(description = "网格列数", example = "8")
    @NotNull(message = "列数不能为空")
    @Min(value = 1, message = "列数至少为 1")
    @Max(value = 64, message = "列数不能超过 64")
    private Integer cols;
}
