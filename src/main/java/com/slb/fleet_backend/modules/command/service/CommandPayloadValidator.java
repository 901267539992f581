package com.slb.fleet_backend.modules.command.service;

import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.modules.command.domain.CommandSpec;
import com.slb.fleet_backend.modules.command.domain.ValidatedCommand;
import com.slb.fleet_backend.modules.command.enums.CommandType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 按指令类型校验载荷，并规整成入队时使用的形式（只保留该类型认识的字段）。
 */
@Component
public class CommandPayloadValidator {

    private static final Set<String> MINER_ACTIONS = Set.of("start", "stop", "restart");
    private static final int MAX_EXEC_LENGTH = 4096;

    public List<ValidatedCommand> validate(List<CommandSpec> specs) {
        List<ValidatedCommand> result = new ArrayList<>();
        if (specs == null) {
            return result;
        }
        Map<String, String> errors = new LinkedHashMap<>();
        for (int i = 0; i < specs.size(); i++) {
            CommandSpec spec = specs.get(i);
            String prefix = "commands[" + i + "]";
            if (spec == null) {
                errors.put(prefix, "指令不能为空");
                continue;
            }
            CommandType type = CommandType.fromWire(spec.getType());
            if (type == null) {
                errors.put(prefix + ".type", "不支持的指令类型: " + spec.getType());
                continue;
            }
            if (type == CommandType.OVERCLOCK_APPLY) {
                errors.put(prefix + ".type", "超频请通过 overclock 字段下发");
                continue;
            }
            Map<String, Object> normalized = normalize(type, spec.getPayload(), prefix + ".payload", errors);
            result.add(new ValidatedCommand(type, normalized));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("指令参数错误", errors);
        }
        return result;
    }

    public ValidatedCommand validate(CommandSpec spec) {
        return validate(List.of(spec)).get(0);
    }

    private Map<String, Object> normalize(CommandType type, Map<String, Object> payload,
                                          String prefix, Map<String, String> errors) {
        Map<String, Object> raw = payload == null ? Map.of() : payload;
        Map<String, Object> out = new LinkedHashMap<>();
        switch (type) {
            case UPGRADE -> {
                Object version = raw.get("version");
                if (version != null) {
                    if (!(version instanceof String s) || s.isBlank()) {
                        errors.put(prefix + ".version", "version 必须是非空字符串");
                    } else {
                        out.put("version", s.trim());
                    }
                }
            }
            case MINER -> {
                Object action = raw.get("action");
                String normalized = action instanceof String s ? s.trim().toLowerCase(Locale.ROOT) : null;
                if (normalized == null || !MINER_ACTIONS.contains(normalized)) {
                    errors.put(prefix + ".action", "action 必须是 start、stop 或 restart");
                } else {
                    out.put("action", normalized);
                }
            }
            case EXEC -> {
                Object command = raw.get("command");
                if (!(command instanceof String s) || s.isBlank()) {
                    errors.put(prefix + ".command", "command 不能为空");
                } else if (s.length() > MAX_EXEC_LENGTH) {
                    errors.put(prefix + ".command", "command 长度不能超过 " + MAX_EXEC_LENGTH);
                } else {
                    out.put("command", s);
                }
            }
            case ROM_FLASH -> {
                List<Integer> gpus = readGpuIndexes(raw.get("gpus"));
                if (gpus == null) {
                    errors.put(prefix + ".gpus", "gpus 必须是非负整数组成的非空列表");
                } else {
                    out.put("gpus", gpus);
                }
                Object url = raw.get("url");
                if (!(url instanceof String s) || !(s.startsWith("http://") || s.startsWith("https://"))) {
                    errors.put(prefix + ".url", "url 必须是 http(s) 地址");
                } else {
                    out.put("url", s);
                }
                if (Boolean.TRUE.equals(raw.get("force"))) {
                    out.put("force", true);
                }
            }
            default -> {
                // REBOOT / SHUTDOWN / CONFIG_APPLY 不带参数
            }
        }
        return out;
    }

    private List<Integer> readGpuIndexes(Object value) {
        if (!(value instanceof List<?> list) || list.isEmpty()) {
            return null;
        }
        List<Integer> indexes = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Number n) || n.intValue() < 0 || n.doubleValue() != n.intValue()) {
                return null;
            }
            if (!indexes.contains(n.intValue())) {
                indexes.add(n.intValue());
            }
        }
        return indexes;
    }
}
