package com.slb.fleet_backend.modules.command.service;

import com.slb.fleet_backend.common.exception.NotFoundException;
import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.modules.command.domain.FanOutBatch;
import com.slb.fleet_backend.modules.command.domain.FleetAction;
import com.slb.fleet_backend.modules.command.domain.FleetActionJob;
import com.slb.fleet_backend.modules.command.domain.OverclockAction;
import com.slb.fleet_backend.modules.command.domain.PreparedAction;
import com.slb.fleet_backend.modules.command.domain.ValidatedCommand;
import com.slb.fleet_backend.modules.command.dto.FleetCommandDto;
import com.slb.fleet_backend.modules.flightsheet.entity.FlightSheet;
import com.slb.fleet_backend.modules.flightsheet.mapper.FlightSheetMapper;
import com.slb.fleet_backend.modules.overclock.domain.OcConfig;
import com.slb.fleet_backend.modules.overclock.domain.OcProfile;
import com.slb.fleet_backend.modules.overclock.service.OverclockProfileService;
import com.slb.fleet_backend.modules.selection.service.SelectionResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * 批量动作：解析目标设备、预加载飞行表/超频方案、校验指令，然后逐台下发。
 */
@Service
@Slf4j
public class FleetActionService {

    public static final String ASYNC_OPERATION = "fleet-action";

    private final SelectionResolver selectionResolver;
    private final CommandDispatcher commandDispatcher;
    private final CommandPayloadValidator payloadValidator;
    private final FlightSheetMapper flightSheetMapper;
    private final OverclockProfileService overclockProfileService;

    public FleetActionService(SelectionResolver selectionResolver,
                              CommandDispatcher commandDispatcher,
                              CommandPayloadValidator payloadValidator,
                              FlightSheetMapper flightSheetMapper,
                              OverclockProfileService overclockProfileService) {
        this.selectionResolver = selectionResolver;
        this.commandDispatcher = commandDispatcher;
        this.payloadValidator = payloadValidator;
        this.flightSheetMapper = flightSheetMapper;
        this.overclockProfileService = overclockProfileService;
    }

    /**
     * 同步执行，返回逐台结果
     */
    public FanOutBatch execute(Long farmId, Long operatorId, FleetCommandDto dto) {
        List<Long> deviceIds = selectionResolver.resolve(farmId, operatorId, dto.getTarget());
        return executeOn(farmId, deviceIds, dto.getAction());
    }

    /**
     * 异步执行前的准备：目标设备与动作先在当前线程解析、校验，错误立即返回给调用方。
     */
    public FleetActionJob prepareJob(Long farmId, Long operatorId, FleetCommandDto dto) {
        List<Long> deviceIds = selectionResolver.resolve(farmId, operatorId, dto.getTarget());
        prepare(farmId, dto.getAction());
        return new FleetActionJob(farmId, deviceIds, dto.getAction());
    }

    public FanOutBatch executeOn(Long farmId, List<Long> deviceIds, FleetAction action) {
        PreparedAction prepared = prepare(farmId, action);
        log.info("Executing fleet action on {} devices in farm {}. flightSheet={}, overclock={}, commands={}",
                deviceIds.size(), farmId, action.getFlightSheetId(), prepared.hasOverclock(), prepared.commands().size());
        return commandDispatcher.fanOut(deviceIds, prepared);
    }

    /**
     * 校验动作并预加载批内共用的数据。
     */
    public PreparedAction prepare(Long farmId, FleetAction action) {
        if (action == null || action.isEmpty()) {
            throw new ValidationException("action", "飞行表、超频、指令至少需要一项");
        }
        FlightSheet sheet = null;
        if (action.getFlightSheetId() != null) {
            sheet = flightSheetMapper.findById(action.getFlightSheetId())
                    .filter(s -> Objects.equals(s.getFarmId(), farmId))
                    .orElseThrow(() -> NotFoundException.of("飞行表", action.getFlightSheetId()));
        }
        OcProfile profile = null;
        OcConfig inline = null;
        OverclockAction overclock = action.getOverclock();
        if (overclock != null) {
            boolean hasProfile = overclock.getOcId() != null;
            boolean hasInline = overclock.getConfig() != null;
            if (hasProfile == hasInline) {
                throw new ValidationException("action.overclock", "ocId 与 config 必须且只能填写一个");
            }
            if (hasProfile) {
                profile = overclockProfileService.loadProfileInFarm(farmId, overclock.getOcId());
            } else {
                inline = overclock.getConfig();
            }
        }
        List<ValidatedCommand> commands = payloadValidator.validate(action.getCommands());
        return new PreparedAction(farmId, sheet, profile, inline, overclock == null ? null : overclock.getMode(), commands);
    }
}
