package com.slb.fleet_backend.modules.command.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * 单台设备的下发结果。status 为 ok 时 commandIds 为本次入队（或刷新）的指令，为 error 时 error 为原因。
 */
public record FanOutItem(
        Long deviceId,
        String status,
        List<Long> commandIds,
        String error
) {

    public static final String OK = "ok";
    public static final String ERROR = "error";

    public static FanOutItem ok(Long deviceId, List<Long> commandIds) {
        return new FanOutItem(deviceId, OK, commandIds, null);
    }

    public static FanOutItem error(Long deviceId, String error) {
        return new FanOutItem(deviceId, ERROR, List.of(), error);
    }

    @JsonIgnore
    public boolean isOk() {
        return OK.equals(status);
    }
}
