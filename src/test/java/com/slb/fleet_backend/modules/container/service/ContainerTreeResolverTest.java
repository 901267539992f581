package com.slb.fleet_backend.modules.container.service;

import com.slb.fleet_backend.common.exception.CyclicContainerException;
import com.slb.fleet_backend.common.exception.NotFoundException;
import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.modules.container.entity.ContainerCell;
import com.slb.fleet_backend.modules.container.mapper.ContainerMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.atMost;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ContainerTreeResolverTest {

    @Mock
    private ContainerMapper containerMapper;

    private ContainerTreeResolver resolver;

    /** 容器 id -> 格子内容 */
    private final Map<Long, List<ContainerCell>> grid = new HashMap<>();

    @BeforeEach
    void setup() {
        resolver = new ContainerTreeResolver(containerMapper);
        when(containerMapper.existsById(anyLong())).thenAnswer(inv -> grid.containsKey(inv.<Long>getArgument(0)));
        when(containerMapper.findCells(anyLong()))
                .thenAnswer(inv -> grid.getOrDefault(inv.<Long>getArgument(0), List.of()));
        when(containerMapper.findChildContainerIds(anyLong())).thenAnswer(inv -> {
            List<Long> children = new ArrayList<>();
            for (ContainerCell cell : grid.getOrDefault(inv.<Long>getArgument(0), List.of())) {
                if (cell.getChildContainerId() != null) {
                    children.add(cell.getChildContainerId());
                }
            }
            return children;
        });
    }

    @Test
    void resolveMembers_nestedContainers_collectsAllDevices() {
        container(1L, device(0, 0, 10L), child(0, 1, 2L));
        container(2L, device(0, 0, 20L), device(1, 0, 21L));

        assertThat(resolver.resolveMembers(1L)).containsExactlyInAnyOrder(10L, 20L, 21L);
    }

    @Test
    void resolveMembers_diamond_expandsSharedChildOnce() {
        container(1L, child(0, 0, 2L), child(0, 1, 3L));
        container(2L, child(0, 0, 4L));
        container(3L, child(0, 0, 4L));
        container(4L, device(0, 0, 40L));

        assertThat(resolver.resolveSortedMembers(1L)).containsExactly(40L);
        verify(containerMapper, atMost(1)).findCells(4L);
    }

    @Test
    void resolveMembers_cycle_throws() {
        container(1L, child(0, 0, 2L));
        container(2L, child(0, 0, 1L));

        assertThrows(CyclicContainerException.class, () -> resolver.resolveMembers(1L));
    }

    @Test
    void resolveMembers_missingRoot_throwsNotFound() {
        assertThrows(NotFoundException.class, () -> resolver.resolveMembers(99L));
    }

    @Test
    void resolveMembers_danglingChild_skipped() {
        container(1L, device(0, 0, 10L), child(0, 1, 77L));

        assertThat(resolver.resolveMembers(1L)).containsExactly(10L);
    }

    @Test
    void resolveMembers_tooDeep_throwsValidation() {
        for (long id = 1; id <= ContainerTreeResolver.MAX_DEPTH + 2; id++) {
            container(id, child(0, 0, id + 1));
        }
        container(ContainerTreeResolver.MAX_DEPTH + 3L, device(0, 0, 1L));

        assertThrows(ValidationException.class, () -> resolver.resolveMembers(1L));
    }

    @Test
    void reaches_followsChildren() {
        container(1L, child(0, 0, 2L));
        container(2L, child(0, 0, 3L));
        container(3L);

        assertThat(resolver.reaches(1L, 3L)).isTrue();
        assertThat(resolver.reaches(3L, 1L)).isFalse();
        assertThat(resolver.reaches(2L, 2L)).isTrue();
    }

    @Test
    void reaches_tooDeep_throwsValidationInsteadOfAllowingAttach() {
        for (long id = 1; id <= ContainerTreeResolver.MAX_DEPTH + 2; id++) {
            container(id, child(0, 0, id + 1));
        }
        container(ContainerTreeResolver.MAX_DEPTH + 3L);

        ValidationException ex = assertThrows(ValidationException.class, () -> resolver.reaches(1L, 999L));
        assertThat(ex.getFieldErrors()).containsKey("containerId");
    }

    private void container(Long id, ContainerCell... cells) {
        List<ContainerCell> list = new ArrayList<>();
        for (ContainerCell cell : cells) {
            cell.setContainerId(id);
            list.add(cell);
        }
        grid.put(id, list);
    }

    private static ContainerCell device(int x, int y, Long deviceId) {
        ContainerCell cell = new ContainerCell();
        cell.setPosX(x);
        cell.setPosY(y);
        cell.setDeviceId(deviceId);
        return cell;
    }

    private static ContainerCell child(int x, int y, Long childId) {
        ContainerCell cell = new ContainerCell();
        cell.setPosX(x);
        cell.setPosY(y);
        cell.setChildContainerId(childId);
        return cell;
    }
}
