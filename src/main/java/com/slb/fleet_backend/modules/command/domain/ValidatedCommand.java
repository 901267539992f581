package com.slb.fleet_backend.modules.command.domain;

import com.slb.fleet_backend.modules.command.enums.CommandType;

import java.util.Map;

/**
 * 校验通过、可直接入队的指令
 */
public record ValidatedCommand(
        CommandType type,
        Map<String, Object> payload
) {
}
