package com.slb.fleet_backend.modules.device.enums;

/**
 * 设备消息级别，与设备端上报的 type 字段一一对应
 */
public enum MessageType {
    SUCCESS,
    INFO,
    WARNING,
    DANGER,
    FILE;

    public static MessageType fromWire(String raw, MessageType fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        for (MessageType type : values()) {
            if (type.name().equalsIgnoreCase(raw.trim())) {
                return type;
            }
        }
        return fallback;
    }
}
