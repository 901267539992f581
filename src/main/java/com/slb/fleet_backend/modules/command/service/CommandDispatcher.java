package com.slb.fleet_backend.modules.command.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.slb.fleet_backend.common.exception.BizException;
import com.slb.fleet_backend.common.service.JsonColumnService;
import com.slb.fleet_backend.modules.command.domain.CommandSpec;
import com.slb.fleet_backend.modules.command.domain.FanOutBatch;
import com.slb.fleet_backend.modules.command.domain.FanOutItem;
import com.slb.fleet_backend.modules.command.domain.PreparedAction;
import com.slb.fleet_backend.modules.command.domain.ValidatedCommand;
import com.slb.fleet_backend.modules.command.dto.CommandReportDto;
import com.slb.fleet_backend.modules.command.entity.DeviceCommand;
import com.slb.fleet_backend.modules.command.mapper.DeviceCommandMapper;
import com.slb.fleet_backend.modules.command.vo.CommandVo;
import com.slb.fleet_backend.modules.command.vo.DeviceConfigVo;
import com.slb.fleet_backend.modules.command.vo.DevicePollVo;
import com.slb.fleet_backend.modules.device.entity.Device;
import com.slb.fleet_backend.modules.device.enums.MessageType;
import com.slb.fleet_backend.modules.device.service.DeviceRegistryService;
import com.slb.fleet_backend.modules.overclock.domain.OcConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 设备指令分发：入队、批量下发、设备拉取与回报。
 *
 * <p>设备只会轮询，分发永远不等待设备响应；指令在设备回报前一直留在队列中（至少一次投递）。
 * 批量下发逐台执行，单台失败记录在结果里，不回滚、不阻断其他设备。</p>
 */
@Service
@Slf4j
public class CommandDispatcher {

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private final DeviceCommandTxService txService;
    private final DeviceCommandMapper commandMapper;
    private final CommandPayloadValidator payloadValidator;
    private final DeviceRegistryService deviceRegistryService;
    private final JsonColumnService jsonColumnService;
    private final Clock clock;

    public CommandDispatcher(DeviceCommandTxService txService,
                             DeviceCommandMapper commandMapper,
                             CommandPayloadValidator payloadValidator,
                             DeviceRegistryService deviceRegistryService,
                             JsonColumnService jsonColumnService,
                             Clock clock) {
        this.txService = txService;
        this.commandMapper = commandMapper;
        this.payloadValidator = payloadValidator;
        this.deviceRegistryService = deviceRegistryService;
        this.jsonColumnService = jsonColumnService;
        this.clock = clock;
    }

    /**
     * 单台入队，返回新指令 id。
     */
    public Long enqueue(Long deviceId, CommandSpec spec) {
        ValidatedCommand command = payloadValidator.validate(spec);
        return txService.enqueue(deviceId, command.type(), command.payload());
    }

    /**
     * 同一条指令下发到一批设备。
     */
    public FanOutBatch fanOut(Collection<Long> deviceIds, CommandSpec spec) {
        ValidatedCommand command = payloadValidator.validate(spec);
        return fanOut(deviceIds, deviceId -> List.of(txService.enqueue(deviceId, command.type(), command.payload())));
    }

    /**
     * 对一批设备执行预先准备好的动作（飞行表/超频/指令）。
     */
    public FanOutBatch fanOut(Collection<Long> deviceIds, PreparedAction action) {
        return fanOut(deviceIds, deviceId -> txService.apply(deviceId, action));
    }

    private FanOutBatch fanOut(Collection<Long> deviceIds, Function<Long, List<Long>> perDevice) {
        List<FanOutItem> items = new ArrayList<>();
        for (Long deviceId : deviceIds) {
            try {
                items.add(FanOutItem.ok(deviceId, perDevice.apply(deviceId)));
            } catch (BizException ex) {
                items.add(FanOutItem.error(deviceId, ex.getMessage()));
            } catch (DataAccessException ex) {
                log.warn("Fan-out to device {} failed on storage: {}", deviceId, ex.getMessage());
                items.add(FanOutItem.error(deviceId, "数据库繁忙，请稍后重试"));
            } catch (RuntimeException ex) {
                log.error("Fan-out to device {} failed unexpectedly", deviceId, ex);
                items.add(FanOutItem.error(deviceId, "内部错误"));
            }
        }
        FanOutBatch batch = FanOutBatch.of(items);
        log.info("Fan-out finished. total={}, succeeded={}, failed={}", batch.getTotal(), batch.getSucceeded(), batch.getFailed());
        return batch;
    }

    /**
     * 设备轮询：返回当前配置与未回报的指令，不清空队列。
     */
    public DevicePollVo pull(Long deviceId) {
        DeviceCommandTxService.PulledQueue pulled = txService.pull(deviceId);
        Device device = pulled.device();

        DeviceConfigVo config = new DeviceConfigVo();
        config.setFlightSheetId(device.getFlightSheetId());
        config.setAlgorithm(device.getAlgorithm());
        config.setMinerConfig(jsonColumnService.read(device.getMinerConfig(), OBJECT_MAP));
        config.setOcConfig(jsonColumnService.read(device.getOcConfig(), OcConfig.class));
        config.setOcAlgo(device.getOcAlgo());

        DevicePollVo vo = new DevicePollVo();
        vo.setDeviceId(deviceId);
        vo.setConfig(config);
        vo.setCommands(pulled.commands().stream().map(this::toVo).toList());
        vo.setServerTime(LocalDateTime.now(clock));
        return vo;
    }

    /**
     * 设备回报；未知 commandId 不报错（设备可能在指令被删除后才回报）。
     */
    public boolean report(Long deviceId, CommandReportDto dto) {
        MessageType type = MessageType.fromWire(dto.getType(), MessageType.INFO);
        return txService.report(deviceId, dto.getCommandId(), type, dto.getTitle(), dto.getPayload());
    }

    /**
     * 运维查看设备上未回报的指令
     */
    public List<CommandVo> listQueue(Long farmId, Long deviceId) {
        deviceRegistryService.requireDeviceInFarm(farmId, deviceId);
        return commandMapper.findUnresolvedByDeviceId(deviceId).stream().map(this::toVo).toList();
    }

    private CommandVo toVo(DeviceCommand command) {
        CommandVo vo = new CommandVo();
        vo.setId(command.getId());
        vo.setDeviceId(command.getDeviceId());
        vo.setType(command.getCommandType());
        vo.setStatus(command.getStatus());
        vo.setPayload(jsonColumnService.read(command.getPayload(), OBJECT_MAP));
        vo.setCreatedAt(command.getCreatedAt());
        vo.setDeliveredAt(command.getDeliveredAt());
        vo.setResolvedAt(command.getResolvedAt());
        vo.setResultType(command.getResultType());
        return vo;
    }
}
