package com.slb.fleet_backend.modules.command.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.fleet_backend.common.exception.NotFoundException;
import com.slb.fleet_backend.common.service.JsonColumnService;
import com.slb.fleet_backend.modules.command.domain.OverclockPayload;
import com.slb.fleet_backend.modules.command.domain.PreparedAction;
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
import com.slb.fleet_backend.modules.overclock.domain.NvidiaOcConfig;
import com.slb.fleet_backend.modules.overclock.domain.OcConfig;
import com.slb.fleet_backend.modules.overclock.enums.OcApplyMode;
import com.slb.fleet_backend.modules.overclock.service.OverclockProfileService;
import com.slb.fleet_backend.modules.overclock.service.OverclockResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DeviceCommandTxServiceTest {

    private static final Long FARM = 1L;
    private static final Long DEVICE = 9L;

    @Mock
    private DeviceMapper deviceMapper;
    @Mock
    private DeviceCommandMapper commandMapper;
    @Mock
    private DeviceMessageMapper messageMapper;
    @Mock
    private DeviceRegistryService deviceRegistryService;
    @Mock
    private OverclockProfileService overclockProfileService;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final JsonColumnService json = new JsonColumnService(new ObjectMapper().findAndRegisterModules());
    private DeviceCommandTxService txService;
    private Device device;
    private long nextCommandId = 100L;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-01T00:00:00Z"), ZoneId.of("Asia/Shanghai"));
        txService = new DeviceCommandTxService(deviceMapper, commandMapper, messageMapper, deviceRegistryService, json,
                new OverclockResolver(), overclockProfileService, eventPublisher, clock);

        device = new Device();
        device.setId(DEVICE);
        device.setFarmId(FARM);
        device.setAlgorithm("ethash");
        when(deviceMapper.lockByIdForUpdate(DEVICE)).thenReturn(DEVICE);
        when(deviceMapper.findById(DEVICE)).thenReturn(Optional.of(device));
        doAnswer(inv -> {
            inv.<DeviceCommand>getArgument(0).setId(nextCommandId++);
            return null;
        }).when(commandMapper).insert(any(DeviceCommand.class));
    }

    @Test
    void enqueue_unknownDevice_throwsNotFound() {
        when(deviceMapper.lockByIdForUpdate(404L)).thenReturn(null);

        assertThrows(NotFoundException.class, () -> txService.enqueue(404L, CommandType.REBOOT, null));
        verify(commandMapper, never()).insert(any());
    }

    @Test
    void pull_marksPendingDeliveredButKeepsEverythingQueued() {
        DeviceCommand delivered = command(1L, CommandType.REBOOT, CommandStatus.DELIVERED);
        DeviceCommand pending = command(2L, CommandType.MINER, CommandStatus.PENDING);
        when(commandMapper.findUnresolvedByDeviceId(DEVICE)).thenReturn(List.of(delivered, pending));

        DeviceCommandTxService.PulledQueue pulled = txService.pull(DEVICE);

        assertThat(pulled.commands()).extracting(DeviceCommand::getId).containsExactly(1L, 2L);
        assertEquals(CommandStatus.DELIVERED, pending.getStatus());
        verify(commandMapper).markDelivered(eq(DEVICE), any(LocalDateTime.class));
        verify(deviceRegistryService).recordHeartbeat(DEVICE);
    }

    @Test
    void pull_emptyQueue_stillRecordsHeartbeat() {
        when(commandMapper.findUnresolvedByDeviceId(DEVICE)).thenReturn(List.of());

        DeviceCommandTxService.PulledQueue pulled = txService.pull(DEVICE);

        assertThat(pulled.commands()).isEmpty();
        verify(commandMapper, never()).markDelivered(any(), any());
        verify(deviceRegistryService).recordHeartbeat(DEVICE);
    }

    @Test
    void report_unknownCommand_isIgnored() {
        when(commandMapper.findById(55L)).thenReturn(Optional.empty());

        assertFalse(txService.report(DEVICE, 55L, MessageType.SUCCESS, null, "done"));
        verify(messageMapper, never()).insert(any());
        verify(eventPublisher, never()).publishEvent(any());
    }

    @Test
    void report_commandOfAnotherDevice_isIgnored() {
        DeviceCommand foreign = command(56L, CommandType.REBOOT, CommandStatus.DELIVERED);
        foreign.setDeviceId(10L);
        when(commandMapper.findById(56L)).thenReturn(Optional.of(foreign));

        assertFalse(txService.report(DEVICE, 56L, MessageType.SUCCESS, null, null));
        verify(commandMapper, never()).resolve(anyLong(), any(), any(), any());
    }

    @Test
    void report_duplicate_isIgnored() {
        when(commandMapper.findById(57L)).thenReturn(Optional.of(command(57L, CommandType.REBOOT, CommandStatus.RESOLVED)));
        when(commandMapper.resolve(eq(57L), any(), any(), any())).thenReturn(0);

        assertFalse(txService.report(DEVICE, 57L, MessageType.SUCCESS, null, null));
        verify(messageMapper, never()).insert(any());
    }

    @Test
    void report_overclockSuccess_updatesAppliedConfigAndStoresMessage() {
        OcConfig config = new OcConfig();
        NvidiaOcConfig nvidia = new NvidiaOcConfig();
        nvidia.setCoreClock("100");
        config.setNvidia(nvidia);
        DeviceCommand oc = command(58L, CommandType.OVERCLOCK_APPLY, CommandStatus.DELIVERED);
        oc.setPayload(json.write(new OverclockPayload(config, "ethash")));
        when(commandMapper.findById(58L)).thenReturn(Optional.of(oc));
        when(commandMapper.resolve(eq(58L), eq(MessageType.SUCCESS), any(), any())).thenReturn(1);

        assertTrue(txService.report(DEVICE, 58L, MessageType.SUCCESS, null, null));

        verify(deviceMapper).updateAppliedOverclock(DEVICE, json.write(config), "ethash");
        ArgumentCaptor<DeviceMessage> message = ArgumentCaptor.forClass(DeviceMessage.class);
        verify(messageMapper).insert(message.capture());
        assertEquals("overclock_apply success", message.getValue().getTitle());
        verify(deviceMapper).incrementUnreadMessages(DEVICE);
        verify(eventPublisher).publishEvent(any(DeviceMessageEvent.class));
    }

    @Test
    void apply_flightSheet_reusesPendingConfigApply() {
        when(commandMapper.findFirstPendingByType(DEVICE, CommandType.CONFIG_APPLY))
                .thenReturn(command(70L, CommandType.CONFIG_APPLY, CommandStatus.PENDING));

        List<Long> ids = txService.apply(DEVICE, new PreparedAction(FARM, sheet("ethash"), null, null, null, List.of()));

        assertEquals(List.of(70L), ids);
        verify(deviceMapper).updateFlightSheet(device);
        verify(commandMapper, never()).insert(any());
    }

    @Test
    void apply_inlineOverclock_refreshesPendingOverclockInsteadOfQueueingAnother() {
        when(commandMapper.findFirstPendingByType(DEVICE, CommandType.OVERCLOCK_APPLY))
                .thenReturn(command(71L, CommandType.OVERCLOCK_APPLY, CommandStatus.PENDING));
        when(commandMapper.updatePendingPayload(eq(71L), anyString())).thenReturn(1);
        OcConfig inline = new OcConfig();
        NvidiaOcConfig nvidia = new NvidiaOcConfig();
        nvidia.setPowerLimit("120");
        inline.setNvidia(nvidia);

        List<Long> ids = txService.apply(DEVICE, new PreparedAction(FARM, null, null, inline, OcApplyMode.MERGE, List.of()));

        assertEquals(List.of(71L), ids);
        verify(commandMapper).updatePendingPayload(eq(71L), contains("\"powerLimit\":\"120\""));
        verify(deviceMapper).updateResolvedOverclock(device);
        verify(commandMapper, never()).insert(any());
    }

    @Test
    void apply_inlineOverclock_deliveredOverclockKeepsItsPayloadAndNewOneIsQueued() {
        DeviceCommand delivered = command(71L, CommandType.OVERCLOCK_APPLY, CommandStatus.DELIVERED);
        delivered.setPayload(json.write(new OverclockPayload(nvidiaPower("100"), "ethash")));
        List<DeviceCommand> rows = List.of(delivered);
        when(commandMapper.findFirstPendingByType(DEVICE, CommandType.OVERCLOCK_APPLY)).thenAnswer(inv -> rows.stream()
                .filter(c -> c.getStatus() == CommandStatus.PENDING)
                .findFirst()
                .orElse(null));
        when(commandMapper.findById(71L)).thenReturn(Optional.of(delivered));
        when(commandMapper.resolve(eq(71L), eq(MessageType.SUCCESS), any(), any())).thenReturn(1);

        List<Long> ids = txService.apply(DEVICE,
                new PreparedAction(FARM, null, null, nvidiaPower("150"), OcApplyMode.REPLACE, List.of()));

        assertEquals(List.of(100L), ids);
        verify(commandMapper, never()).updatePendingPayload(anyLong(), anyString());
        ArgumentCaptor<DeviceCommand> queued = ArgumentCaptor.forClass(DeviceCommand.class);
        verify(commandMapper).insert(queued.capture());
        assertEquals(CommandType.OVERCLOCK_APPLY, queued.getValue().getCommandType());
        assertThat(queued.getValue().getPayload()).contains("\"powerLimit\":\"150\"");

        // 设备回报的是它已执行的那条，实际超频应为旧载荷
        assertTrue(txService.report(DEVICE, 71L, MessageType.SUCCESS, null, null));
        verify(deviceMapper).updateAppliedOverclock(DEVICE, json.write(nvidiaPower("100")), "ethash");
    }

    @Test
    void apply_emptyOverclock_changesNothing() {
        List<Long> ids = txService.apply(DEVICE, new PreparedAction(FARM, null, null, OcConfig.empty(), OcApplyMode.REPLACE, List.of()));

        assertThat(ids).isEmpty();
        verify(deviceMapper, never()).updateResolvedOverclock(any());
    }

    @Test
    void apply_deviceOfAnotherFarm_isNotFound() {
        assertThrows(NotFoundException.class,
                () -> txService.apply(DEVICE, new PreparedAction(2L, sheet("kawpow"), null, null, null, List.of())));
        verify(deviceMapper, never()).updateFlightSheet(any());
    }

    private static DeviceCommand command(Long id, CommandType type, CommandStatus status) {
        DeviceCommand command = new DeviceCommand();
        command.setId(id);
        command.setDeviceId(DEVICE);
        command.setCommandType(type);
        command.setStatus(status);
        return command;
    }

    private static OcConfig nvidiaPower(String powerLimit) {
        OcConfig config = new OcConfig();
        NvidiaOcConfig nvidia = new NvidiaOcConfig();
        nvidia.setPowerLimit(powerLimit);
        config.setNvidia(nvidia);
        return config;
    }

    private static FlightSheet sheet(String algorithm) {
        FlightSheet sheet = new FlightSheet();
        sheet.setId(3L);
        sheet.setFarmId(FARM);
        sheet.setAlgorithm(algorithm);
        sheet.setMiner("lolminer");
        return sheet;
    }
}
