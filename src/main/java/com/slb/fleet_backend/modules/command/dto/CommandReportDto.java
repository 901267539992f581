package com.slb.fleet_backend.modules.command.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 设备回报指令执行结果或主动上报消息
 */
@Data
public class CommandReportDto {

    @Schema(description = "对应的指令ID；为空表示设备主动上报的消息", example = "1024")
    private Long commandId;

    @Schema(description = "消息级别：success / info / warning / danger / file，无法识别时按 info 处理", example = "success")
    private String type;

    @Size(max = 255, message = "标题不能超过255个字符")
    private String title;

    @Schema(description = "结果内容（文本或 JSON 字符串）")
    private String payload;
}
