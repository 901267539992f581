package com.slb.fleet_backend.modules.command.enums;

import java.util.Locale;

/**
 * 设备指令类型
 */
public enum CommandType {
    REBOOT,           // 重启设备
    SHUTDOWN,         // 关机
    UPGRADE,          // 升级客户端，可选 version
    MINER,            // 挖矿进程控制：start | stop | restart
    EXEC,             // 执行 shell 命令
    ROM_FLASH,        // 刷写显卡 BIOS
    CONFIG_APPLY,     // 通知设备重新拉取配置
    OVERCLOCK_APPLY;  // 下发解析后的超频配置

    /**
     * 解析外部传入的指令类型，大小写不敏感，支持 "rom-flash" 这类写法；无法识别返回 null。
     */
    public static CommandType fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (CommandType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
