package com.slb.fleet_backend.modules.device.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.fleet_backend.common.exception.BizException;
import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.common.service.JsonColumnService;
import com.slb.fleet_backend.modules.device.entity.Device;
import com.slb.fleet_backend.modules.device.mapper.DeviceMapper;
import com.slb.fleet_backend.modules.device.mapper.DeviceMessageMapper;
import com.slb.fleet_backend.modules.device.vo.DeviceVo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeviceRegistryServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Shanghai");

    @Mock
    private DeviceMapper deviceMapper;
    @Mock
    private DeviceMessageMapper deviceMessageMapper;
    @Mock
    private PasswordEncoder passwordEncoder;

    private DeviceRegistryService service;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-01T00:00:00Z"), ZONE);
        service = new DeviceRegistryService(deviceMapper, deviceMessageMapper,
                new JsonColumnService(new ObjectMapper().findAndRegisterModules()), passwordEncoder, clock);
    }

    @Test
    void recordHeartbeat_touchesWithCurrentTime() {
        service.recordHeartbeat(9L);

        verify(deviceMapper).touchHeartbeat(9L, LocalDateTime.of(2026, 10, 1, 8, 0));
    }

    @Test
    void findByIds_largeList_queriedInChunks() {
        List<Long> ids = LongStream.rangeClosed(1, 1200).boxed().collect(Collectors.toList());
        when(deviceMapper.findByIds(anyCollection())).thenAnswer(inv -> {
            Collection<Long> chunk = inv.getArgument(0);
            List<Device> devices = new ArrayList<>();
            for (Long id : chunk) {
                devices.add(device(id, 1L));
            }
            return devices;
        });

        List<Device> devices = service.findByIds(ids);

        assertEquals(1200, devices.size());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<Long>> captor = ArgumentCaptor.forClass(Collection.class);
        verify(deviceMapper, times(3)).findByIds(captor.capture());
        assertThat(captor.getAllValues()).extracting(Collection::size).containsExactly(500, 500, 200);
    }

    @Test
    void findByIds_duplicatesQueriedOnce() {
        when(deviceMapper.findByIds(anyCollection())).thenReturn(List.of(device(1L, 1L), device(2L, 1L)));

        service.findByIds(List.of(2L, 1L, 2L));

        verify(deviceMapper).findByIds(List.of(2L, 1L));
    }

    @Test
    void findByIds_empty_noQuery() {
        assertThat(service.findByIds(List.of())).isEmpty();
        verify(deviceMapper, never()).findByIds(any());
    }

    @Test
    void listDevices_skipsOtherFarmsAndSortsById() {
        when(deviceMapper.findByIds(anyCollection()))
                .thenReturn(List.of(device(5L, 1L), device(3L, 2L), device(2L, 1L)));

        List<DeviceVo> devices = service.listDevices(1L, List.of(5L, 3L, 2L, 404L));

        assertThat(devices).extracting(DeviceVo::getId).containsExactly(2L, 5L);
        assertThat(devices).allSatisfy(vo -> assertNull(vo.getTagIds()));
    }

    @Test
    void listDevices_emptyIds_rejected() {
        ValidationException ex = assertThrows(ValidationException.class, () -> service.listDevices(1L, List.of()));

        assertThat(ex.getFieldErrors()).containsKey("ids");
    }

    @Test
    void authenticate_wrongPasswordAndUnknownDevice_sameError() {
        Device device = device(9L, 1L);
        device.setPasswordHash("hash");
        device.setActive(true);
        when(deviceMapper.findById(9L)).thenReturn(Optional.of(device));
        when(deviceMapper.findById(10L)).thenReturn(Optional.empty());
        when(passwordEncoder.matches("bad", "hash")).thenReturn(false);

        BizException wrong = assertThrows(BizException.class, () -> service.authenticate(9L, "bad"));
        BizException unknown = assertThrows(BizException.class, () -> service.authenticate(10L, "bad"));

        assertEquals(wrong.getErrorCode(), unknown.getErrorCode());
        assertEquals(401, unknown.getCode());
    }

    private static Device device(Long id, Long farmId) {
        Device device = new Device();
        device.setId(id);
        device.setFarmId(farmId);
        return device;
    }
}
