package com.slb.fleet_backend.modules.container.service;

import com.slb.fleet_backend.common.exception.CyclicContainerException;
import com.slb.fleet_backend.common.exception.NotFoundException;
import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.modules.container.dto.ContainerCellDto;
import com.slb.fleet_backend.modules.container.entity.Container;
import com.slb.fleet_backend.modules.container.entity.ContainerCell;
import com.slb.fleet_backend.modules.container.mapper.ContainerMapper;
import com.slb.fleet_backend.modules.device.service.DeviceRegistryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ContainerServiceTest {

    private static final Long FARM = 1L;

    @Mock
    private ContainerMapper containerMapper;
    @Mock
    private ContainerTreeResolver treeResolver;
    @Mock
    private DeviceRegistryService deviceRegistryService;

    private ContainerService containerService;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-01T00:00:00Z"), ZoneId.of("Asia/Shanghai"));
        containerService = new ContainerService(containerMapper, treeResolver, deviceRegistryService, clock);
        when(containerMapper.findById(10L)).thenReturn(Optional.of(container(10L, FARM)));
        when(containerMapper.findById(11L)).thenReturn(Optional.of(container(11L, FARM)));
        when(containerMapper.findById(20L)).thenReturn(Optional.of(container(20L, 2L)));
    }

    @Test
    void putDevice_withinBounds_upsertsCell() {
        containerService.putDevice(FARM, 10L, 1, 2, 500L);

        ArgumentCaptor<ContainerCell> captor = ArgumentCaptor.forClass(ContainerCell.class);
        verify(containerMapper).upsertCell(captor.capture());
        assertEquals(500L, captor.getValue().getDeviceId());
        assertNull(captor.getValue().getChildContainerId());
        verify(deviceRegistryService).requireDeviceInFarm(FARM, 500L);
    }

    @Test
    void putDevice_outOfBounds_throwsValidation() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> containerService.putDevice(FARM, 10L, 4, 0, 500L));
        assertTrue(ex.getFieldErrors().containsKey("position"));
        verify(containerMapper, never()).upsertCell(any());
    }

    @Test
    void putCell_bothDeviceAndContainer_rejected() {
        ContainerCellDto dto = new ContainerCellDto();
        dto.setDeviceId(1L);
        dto.setContainerId(11L);

        assertThrows(ValidationException.class, () -> containerService.putCell(FARM, 10L, 0, 0, dto));
    }

    @Test
    void putContainer_self_isCycle() {
        assertThrows(CyclicContainerException.class, () -> containerService.putContainer(FARM, 10L, 0, 0, 10L));
        verify(containerMapper, never()).upsertCell(any());
    }

    @Test
    void putContainer_childAlreadyContainsParent_isCycle() {
        when(treeResolver.reaches(11L, 10L)).thenReturn(true);

        assertThrows(CyclicContainerException.class, () -> containerService.putContainer(FARM, 10L, 0, 0, 11L));
        verify(containerMapper, never()).upsertCell(any());
    }

    @Test
    void putContainer_locksWholeFarmBeforeReadingTree() {
        when(treeResolver.reaches(10L, 11L)).thenReturn(false);

        containerService.putContainer(FARM, 11L, 0, 0, 10L);

        var order = inOrder(containerMapper, treeResolver);
        order.verify(containerMapper).lockByFarmIdForUpdate(FARM);
        order.verify(containerMapper).findById(11L);
        order.verify(treeResolver).reaches(10L, 11L);
        order.verify(containerMapper).upsertCell(any());
    }

    @Test
    void putContainer_edgeCommittedByEarlierAttach_isSeenAfterLock() {
        // 10 -> 11 已存在；另一事务刚提交 11 -> 12，拿到农场锁后的读取应看到它
        Map<Long, List<Long>> edges = new HashMap<>();
        edges.put(10L, List.of(11L));
        when(containerMapper.findById(12L)).thenReturn(Optional.of(container(12L, FARM)));
        when(containerMapper.lockByFarmIdForUpdate(FARM)).thenAnswer(inv -> {
            edges.put(11L, List.of(12L));
            return List.of(10L, 11L, 12L);
        });
        when(containerMapper.existsById(any())).thenReturn(true);
        when(containerMapper.findChildContainerIds(any()))
                .thenAnswer(inv -> edges.getOrDefault(inv.<Long>getArgument(0), List.of()));
        ContainerService service = new ContainerService(containerMapper, new ContainerTreeResolver(containerMapper),
                deviceRegistryService, Clock.systemUTC());

        assertThrows(CyclicContainerException.class, () -> service.putContainer(FARM, 12L, 0, 0, 10L));
        verify(containerMapper, never()).upsertCell(any());
    }

    @Test
    void containerOfOtherFarm_isNotFound() {
        assertThrows(NotFoundException.class, () -> containerService.get(FARM, 20L));
        assertThrows(NotFoundException.class, () -> containerService.putContainer(FARM, 10L, 0, 0, 20L));
    }

    private static Container container(Long id, Long farmId) {
        Container container = new Container();
        container.setId(id);
        container.setFarmId(farmId);
        container.setName("rack-" + id);
        container.setGridRows(4);
        container.setGridCols(6);
        return container;
    }
}
