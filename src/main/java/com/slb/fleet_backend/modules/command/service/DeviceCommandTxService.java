package com.slb.fleet_backend.modules.command.service;

import com.slb.fleet_backend.common.exception.NotFoundException;
import com.slb.fleet_backend.common.service.JsonColumnService;
import com.slb.fleet_backend.modules.command.domain.OverclockPayload;
import com.slb.fleet_backend.modules.command.domain.PreparedAction;
import com.slb.fleet_backend.modules.command.domain.ValidatedCommand;
import com.slb.fleet_backend.modules.command.entity.DeviceCommand;
import com.slb.fleet_backend.modules.command.enums.CommandStatus;
import com.slb.fleet_backend.modules.command.enums.CommandType;
import com.slb.fleet_backend.modules.command.event.DeviceMessageEvent;
import com.slb.fleet_backend.modules.command.mapper.DeviceCommandMapper;
import com.slb.fleet_backend.modules.device.entity.Device;
import com.slb.fleet_backend.modules.device.entity.DeviceMessage;
import com.slb.fleet_backend.modules.device.enums.MessageType;
import com.slb.fleet_backend.modules.device.mapper.DeviceMapper;
import com.slb.fleet_backend.modules.device.mapper.DeviceMessageMapper;
import com.slb.fleet_backend.modules.device.service.DeviceRegistryService;
import com.slb.fleet_backend.modules.flightsheet.entity.FlightSheet;
import com.slb.fleet_backend.modules.overclock.domain.OcConfig;
import com.slb.fleet_backend.modules.overclock.domain.OcProfile;
import com.slb.fleet_backend.modules.overclock.enums.OcApplyMode;
import com.slb.fleet_backend.modules.overclock.service.OverclockProfileService;
import com.slb.fleet_backend.modules.overclock.service.OverclockResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 单台设备上的队列/配置变更（确保 @Transactional 真实生效：public 方法 + 由外部 Bean 调用）。
 *
 * <p>每个方法先对设备行加锁（SELECT ... FOR UPDATE），同一设备上的入队、拉取、回报因此串行；
 * 不同设备之间互不影响，批量下发时逐台各自提交。</p>
 */
@Service
@Slf4j
public class DeviceCommandTxService {

    private final DeviceMapper deviceMapper;
    private final DeviceCommandMapper commandMapper;
    private final DeviceMessageMapper messageMapper;
    private final DeviceRegistryService deviceRegistryService;
    private final JsonColumnService jsonColumnService;
    private final OverclockResolver overclockResolver;
    private final OverclockProfileService overclockProfileService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public DeviceCommandTxService(DeviceMapper deviceMapper,
                                  DeviceCommandMapper commandMapper,
                                  DeviceMessageMapper messageMapper,
                                  DeviceRegistryService deviceRegistryService,
                                  JsonColumnService jsonColumnService,
                                  OverclockResolver overclockResolver,
                                  OverclockProfileService overclockProfileService,
                                  ApplicationEventPublisher eventPublisher,
                                  Clock clock) {
        this.deviceMapper = deviceMapper;
        this.commandMapper = commandMapper;
        this.messageMapper = messageMapper;
        this.deviceRegistryService = deviceRegistryService;
        this.jsonColumnService = jsonColumnService;
        this.overclockResolver = overclockResolver;
        this.overclockProfileService = overclockProfileService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * 入队一条指令，不去重：重复调用会产生重复的队列项。
     */
    @Transactional
    public Long enqueue(Long deviceId, CommandType type, Object payload) {
        lockDevice(deviceId);
        return insertCommand(deviceId, type, payload);
    }

    /**
     * 对单台设备执行批量动作：飞行表 -> 超频 -> 附加指令。返回本次入队或刷新的指令 id。
     */
    @Transactional
    public List<Long> apply(Long deviceId, PreparedAction action) {
        Device device = lockDevice(deviceId);
        if (action.farmId() != null && !Objects.equals(action.farmId(), device.getFarmId())) {
            throw NotFoundException.of("设备", deviceId);
        }
        List<Long> commandIds = new ArrayList<>();
        if (action.flightSheet() != null) {
            applyFlightSheet(device, action.flightSheet(), commandIds);
        }
        if (action.hasOverclock()) {
            OcConfig effective;
            if (action.ocProfile() != null) {
                device.setOcId(action.ocProfile().getId());
                effective = overclockResolver.resolve(action.ocProfile(), device.getAlgorithm());
            } else {
                device.setOcId(null);
                effective = action.inlineOc().copy();
            }
            device.setOcApplyMode(action.ocMode() == null ? OcApplyMode.REPLACE : action.ocMode());
            applyResolvedOverclock(device, effective, commandIds);
        }
        for (ValidatedCommand command : action.commands()) {
            commandIds.add(insertCommand(deviceId, command.type(), command.payload()));
        }
        return commandIds;
    }

    /**
     * 设备轮询：返回未回报的全部指令（不清空），并把其中 PENDING 的置为 DELIVERED，同时刷新心跳。
     */
    @Transactional
    public PulledQueue pull(Long deviceId) {
        Device device = lockDevice(deviceId);
        LocalDateTime now = LocalDateTime.now(clock);
        List<DeviceCommand> queue = commandMapper.findUnresolvedByDeviceId(deviceId);
        if (queue.stream().anyMatch(c -> c.getStatus() == CommandStatus.PENDING)) {
            commandMapper.markDelivered(deviceId, now);
            for (DeviceCommand command : queue) {
                if (command.getStatus() == CommandStatus.PENDING) {
                    command.setStatus(CommandStatus.DELIVERED);
                    command.setDeliveredAt(now);
                }
            }
        }
        deviceRegistryService.recordHeartbeat(deviceId);
        return new PulledQueue(device, queue);
    }

    /**
     * 设备回报。commandId 为空表示设备主动上报的消息；commandId 不存在或不属于该设备时记 warn 并忽略。
     *
     * @return 是否落了消息
     */
    @Transactional
    public boolean report(Long deviceId, Long commandId, MessageType type, String title, String payload) {
        Device device = lockDevice(deviceId);
        DeviceCommand command = null;
        if (commandId != null) {
            command = commandMapper.findById(commandId).orElse(null);
            if (command == null || !Objects.equals(command.getDeviceId(), deviceId)) {
                log.warn("Ignore report for unknown command. deviceId={}, commandId={}", deviceId, commandId);
                return false;
            }
            int resolved = commandMapper.resolve(commandId, type, payload, LocalDateTime.now(clock));
            if (resolved == 0) {
                log.warn("Ignore duplicate report for resolved command. deviceId={}, commandId={}", deviceId, commandId);
                return false;
            }
            if (command.getCommandType() == CommandType.OVERCLOCK_APPLY && type == MessageType.SUCCESS) {
                OverclockPayload applied = jsonColumnService.read(command.getPayload(), OverclockPayload.class);
                if (applied != null) {
                    deviceMapper.updateAppliedOverclock(deviceId, jsonColumnService.write(applied.getConfig()), applied.getAlgo());
                }
            }
        }

        DeviceMessage message = new DeviceMessage();
        message.setDeviceId(deviceId);
        message.setCommandId(commandId);
        message.setType(type);
        message.setTitle(StringUtils.hasText(title) ? title.trim() : defaultTitle(command, type));
        message.setPayload(payload);
        message.setIsRead(false);
        message.setCreatedAt(LocalDateTime.now(clock));
        messageMapper.insert(message);
        deviceMapper.incrementUnreadMessages(deviceId);
        eventPublisher.publishEvent(new DeviceMessageEvent(device.getFarmId(), deviceId, message.getId(),
                commandId, type, message.getTitle()));
        return true;
    }

    private void applyFlightSheet(Device device, FlightSheet sheet, List<Long> commandIds) {
        boolean algoChanged = !Objects.equals(device.getAlgorithm(), sheet.getAlgorithm());
        device.setFlightSheetId(sheet.getId());
        device.setAlgorithm(sheet.getAlgorithm());
        device.setMinerConfig(sheet.getConfig());
        deviceMapper.updateFlightSheet(device);

        DeviceCommand pending = commandMapper.findFirstPendingByType(device.getId(), CommandType.CONFIG_APPLY);
        if (pending != null) {
            commandIds.add(pending.getId());
        } else {
            commandIds.add(insertCommand(device.getId(), CommandType.CONFIG_APPLY, null));
        }

        // 算法变化后按新算法重新解析已绑定的超频方案
        if (algoChanged && device.getOcId() != null) {
            OcProfile profile = overclockProfileService.loadProfile(device.getOcId());
            applyResolvedOverclock(device, overclockResolver.resolve(profile, device.getAlgorithm()), commandIds);
        }
    }

    /**
     * 空配置表示"不改动超频"。否则以当前 resolved 配置为基础按模式合并，并保证设备上最多一条未拉取的 OVERCLOCK_APPLY。
     * 已 DELIVERED 的那条保持原载荷（设备回报成功时按它记录实际超频），新配置另起一条。
     */
    private void applyResolvedOverclock(Device device, OcConfig effective, List<Long> commandIds) {
        if (effective == null || effective.isEmpty()) {
            log.debug("Empty effective overclock for device {}, algo={}, keep current", device.getId(), device.getAlgorithm());
            return;
        }
        String baseJson = StringUtils.hasText(device.getOcConfig()) ? device.getOcConfig() : device.getAppliedOcConfig();
        OcConfig base = jsonColumnService.read(baseJson, OcConfig.class);
        OcConfig next = overclockResolver.applyToDevice(base, effective, device.getOcApplyMode());
        device.setOcConfig(jsonColumnService.write(next));
        device.setOcAlgo(device.getAlgorithm());
        deviceMapper.updateResolvedOverclock(device);

        String payload = jsonColumnService.write(new OverclockPayload(next, device.getAlgorithm()));
        DeviceCommand pending = commandMapper.findFirstPendingByType(device.getId(), CommandType.OVERCLOCK_APPLY);
        if (pending != null && commandMapper.updatePendingPayload(pending.getId(), payload) == 1) {
            commandIds.add(pending.getId());
        } else {
            commandIds.add(insertRawCommand(device.getId(), CommandType.OVERCLOCK_APPLY, payload));
        }
    }

    private Device lockDevice(Long deviceId) {
        if (deviceId == null || deviceMapper.lockByIdForUpdate(deviceId) == null) {
            throw NotFoundException.of("设备", deviceId);
        }
        return deviceMapper.findById(deviceId).orElseThrow(() -> NotFoundException.of("设备", deviceId));
    }

    private Long insertCommand(Long deviceId, CommandType type, Object payload) {
        return insertRawCommand(deviceId, type, payload == null ? null : jsonColumnService.write(payload));
    }

    private Long insertRawCommand(Long deviceId, CommandType type, String payloadJson) {
        DeviceCommand command = new DeviceCommand();
        command.setDeviceId(deviceId);
        command.setCommandType(type);
        command.setPayload(payloadJson);
        command.setStatus(CommandStatus.PENDING);
        command.setCreatedAt(LocalDateTime.now(clock));
        commandMapper.insert(command);
        return command.getId();
    }

    private String defaultTitle(DeviceCommand command, MessageType type) {
        if (command == null) {
            return type.name().toLowerCase();
        }
        return command.getCommandType().name().toLowerCase() + " " + type.name().toLowerCase();
    }

    /**
     * 拉取结果：设备当前配置 + 队列快照
     */
    public record PulledQueue(Device device, List<DeviceCommand> commands) {
    }
}
