package com.slb.fleet_backend.modules.command.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.fleet_backend.common.exception.NotFoundException;
import com.slb.fleet_backend.common.service.JsonColumnService;
import com.slb.fleet_backend.modules.command.domain.CommandSpec;
import com.slb.fleet_backend.modules.command.domain.FanOutBatch;
import com.slb.fleet_backend.modules.command.domain.FanOutItem;
import com.slb.fleet_backend.modules.command.dto.CommandReportDto;
import com.slb.fleet_backend.modules.command.entity.DeviceCommand;
import com.slb.fleet_backend.modules.command.enums.CommandStatus;
import com.slb.fleet_backend.modules.command.enums.CommandType;
import com.slb.fleet_backend.modules.command.mapper.DeviceCommandMapper;
import com.slb.fleet_backend.modules.command.vo.DevicePollVo;
import com.slb.fleet_backend.modules.device.entity.Device;
import com.slb.fleet_backend.modules.device.enums.MessageType;
import com.slb.fleet_backend.modules.device.service.DeviceRegistryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommandDispatcherTest {

    @Mock
    private DeviceCommandTxService txService;
    @Mock
    private DeviceCommandMapper commandMapper;
    @Mock
    private DeviceRegistryService deviceRegistryService;

    private CommandDispatcher dispatcher;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-01T00:00:00Z"), ZoneId.of("Asia/Shanghai"));
        dispatcher = new CommandDispatcher(txService, commandMapper, new CommandPayloadValidator(),
                deviceRegistryService, new JsonColumnService(new ObjectMapper()), clock);
    }

    @Test
    void fanOut_oneMissingDevice_doesNotStopTheOthers() {
        when(txService.enqueue(eq(1L), eq(CommandType.REBOOT), any())).thenReturn(101L);
        when(txService.enqueue(eq(2L), eq(CommandType.REBOOT), any())).thenThrow(NotFoundException.of("设备", 2L));
        when(txService.enqueue(eq(3L), eq(CommandType.REBOOT), any())).thenReturn(103L);

        FanOutBatch batch = dispatcher.fanOut(List.of(1L, 2L, 3L), new CommandSpec("reboot", null));

        assertEquals(3, batch.getTotal());
        assertEquals(2, batch.getSucceeded());
        assertEquals(1, batch.getFailed());
        assertThat(batch.getItems()).extracting(FanOutItem::deviceId).containsExactly(1L, 2L, 3L);
        FanOutItem failed = batch.getItems().get(1);
        assertEquals(FanOutItem.ERROR, failed.status());
        assertThat(failed.error()).contains("2");
        assertEquals(List.of(103L), batch.getItems().get(2).commandIds());
    }

    @Test
    void fanOut_storageErrorOnOneDevice_isReportedPerDevice() {
        when(txService.enqueue(eq(1L), any(), any())).thenThrow(new QueryTimeoutException("lock wait timeout"));
        when(txService.enqueue(eq(2L), any(), any())).thenReturn(5L);

        FanOutBatch batch = dispatcher.fanOut(List.of(1L, 2L), new CommandSpec("shutdown", null));

        assertEquals(1, batch.getFailed());
        assertFalse(batch.getItems().get(0).isOk());
        assertTrue(batch.getItems().get(1).isOk());
    }

    @Test
    void fanOut_invalidCommand_rejectedBeforeTouchingDevices() {
        assertThrows(RuntimeException.class,
                () -> dispatcher.fanOut(List.of(1L, 2L), new CommandSpec("miner", Map.of())));
        verifyNoInteractions(txService);
    }

    @Test
    void pull_returnsWholeUnresolvedQueue() {
        Device device = new Device();
        device.setId(9L);
        device.setAlgorithm("ethash");
        device.setMinerConfig("{\"pool\":\"stratum+tcp://pool:4444\"}");
        DeviceCommand first = command(1L, CommandType.REBOOT, CommandStatus.DELIVERED);
        DeviceCommand second = command(2L, CommandType.MINER, CommandStatus.DELIVERED);
        second.setPayload("{\"action\":\"restart\"}");
        when(txService.pull(9L)).thenReturn(new DeviceCommandTxService.PulledQueue(device, List.of(first, second)));

        DevicePollVo vo = dispatcher.pull(9L);

        assertThat(vo.getCommands()).hasSize(2);
        assertEquals("restart", vo.getCommands().get(1).getPayload().get("action"));
        assertEquals("ethash", vo.getConfig().getAlgorithm());
        assertEquals("stratum+tcp://pool:4444", vo.getConfig().getMinerConfig().get("pool"));
    }

    @Test
    void report_unknownType_fallsBackToInfo() {
        CommandReportDto dto = new CommandReportDto();
        dto.setCommandId(77L);
        dto.setType("fancy");
        when(txService.report(9L, 77L, MessageType.INFO, null, null)).thenReturn(false);

        assertFalse(dispatcher.report(9L, dto));
    }

    private static DeviceCommand command(Long id, CommandType type, CommandStatus status) {
        DeviceCommand command = new DeviceCommand();
        command.setId(id);
        command.setDeviceId(9L);
        command.setCommandType(type);
        command.setStatus(status);
        return command;
    }
}
