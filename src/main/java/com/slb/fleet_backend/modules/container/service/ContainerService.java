package com.slb.fleet_backend.modules.container.service;

import com.slb.fleet_backend.common.exception.CyclicContainerException;
import com.slb.fleet_backend.common.exception.NotFoundException;
import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.modules.container.dto.ContainerCellDto;
import com.slb.fleet_backend.modules.container.dto.ContainerCreateDto;
import com.slb.fleet_backend.modules.container.entity.Container;
import com.slb.fleet_backend.modules.container.entity.ContainerCell;
import com.slb.fleet_backend.modules.container.mapper.ContainerMapper;
import com.slb.fleet_backend.modules.container.vo.ContainerCellVo;
import com.slb.fleet_backend.modules.container.vo.ContainerVo;
import com.slb.fleet_backend.modules.device.service.DeviceRegistryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Service
@Slf4j
public class ContainerService {

    private final ContainerMapper containerMapper;
    private final ContainerTreeResolver treeResolver;
    private final DeviceRegistryService deviceRegistryService;
    private final Clock clock;

    public ContainerService(ContainerMapper containerMapper,
                            ContainerTreeResolver treeResolver,
                            DeviceRegistryService deviceRegistryService,
                            Clock clock) {
        this.containerMapper = containerMapper;
        this.treeResolver = treeResolver;
        this.deviceRegistryService = deviceRegistryService;
        this.clock = clock;
    }

    @Transactional
    public ContainerVo create(Long farmId, ContainerCreateDto dto) {
        LocalDateTime now = LocalDateTime.now(clock);
        Container container = new Container();
        container.setFarmId(farmId);
        container.setName(dto.getName().trim());
        container.setGridRows(dto.getRows());
        container.setGridCols(dto.getCols());
        container.setCreatedAt(now);
        container.setUpdatedAt(now);
        containerMapper.insert(container);
        log.info("Created container {} ({}x{}) in farm {}", container.getId(), dto.getRows(), dto.getCols(), farmId);
        return toVo(container);
    }

    public ContainerVo get(Long farmId, Long containerId) {
        return toVo(requireInFarm(farmId, containerId));
    }

    public List<ContainerVo> list(Long farmId) {
        List<ContainerVo> result = new ArrayList<>();
        for (Container container : containerMapper.findByFarmId(farmId)) {
            result.add(toVo(container));
        }
        return result;
    }

    /**
     * 写入格子：设备或子容器二选一，已有内容被覆盖。
     */
    @Transactional
    public ContainerVo putCell(Long farmId, Long containerId, int x, int y, ContainerCellDto dto) {
        boolean hasDevice = dto.getDeviceId() != null;
        boolean hasContainer = dto.getContainerId() != null;
        if (hasDevice == hasContainer) {
            throw new ValidationException("cell", "deviceId 与 containerId 必须且只能填写一个");
        }
        return hasDevice
                ? putDevice(farmId, containerId, x, y, dto.getDeviceId())
                : putContainer(farmId, containerId, x, y, dto.getContainerId());
    }

    @Transactional
    public ContainerVo putDevice(Long farmId, Long containerId, int x, int y, Long deviceId) {
        Container container = requireInFarm(farmId, containerId);
        checkBounds(container, x, y);
        deviceRegistryService.requireDeviceInFarm(farmId, deviceId);
        containerMapper.upsertCell(cell(containerId, x, y, deviceId, null));
        return toVo(container);
    }

    /**
     * 挂载子容器。先锁住农场内全部容器行，再读取并检查子树是否已包含父容器：
     * 同一农场的挂载由此串行，锁之后的读取能看到其他挂载已提交的边，并发挂载也不会成环。
     * 锁必须是事务内的第一条语句，否则 REPEATABLE READ 的快照会早于拿锁时刻。
     */
    @Transactional
    public ContainerVo putContainer(Long farmId, Long containerId, int x, int y, Long childId) {
        containerMapper.lockByFarmIdForUpdate(farmId);
        Container container = requireInFarm(farmId, containerId);
        checkBounds(container, x, y);
        requireInFarm(farmId, childId);
        if (Objects.equals(containerId, childId)) {
            throw new CyclicContainerException(containerId);
        }
        if (treeResolver.reaches(childId, containerId)) {
            throw new CyclicContainerException(containerId);
        }
        containerMapper.upsertCell(cell(containerId, x, y, null, childId));
        return toVo(container);
    }

    @Transactional
    public ContainerVo clearCell(Long farmId, Long containerId, int x, int y) {
        Container container = requireInFarm(farmId, containerId);
        checkBounds(container, x, y);
        containerMapper.deleteCell(containerId, x, y);
        return toVo(container);
    }

    /**
     * 成员设备（按 id 升序）
     */
    public List<Long> resolveMembers(Long farmId, Long containerId) {
        requireInFarm(farmId, containerId);
        return treeResolver.resolveSortedMembers(containerId);
    }

    private Container requireInFarm(Long farmId, Long containerId) {
        Container container = containerMapper.findById(containerId)
                .orElseThrow(() -> NotFoundException.of("容器", containerId));
        if (!Objects.equals(container.getFarmId(), farmId)) {
            throw NotFoundException.of("容器", containerId);
        }
        return container;
    }

    private void checkBounds(Container container, int x, int y) {
        if (x < 0 || y < 0 || x >= container.getGridRows() || y >= container.getGridCols()) {
            throw new ValidationException("position",
                    "格子坐标越界: (" + x + "," + y + ")，网格为 " + container.getGridRows() + "x" + container.getGridCols());
        }
    }

    private ContainerCell cell(Long containerId, int x, int y, Long deviceId, Long childId) {
        ContainerCell cell = new ContainerCell();
        cell.setContainerId(containerId);
        cell.setPosX(x);
        cell.setPosY(y);
        cell.setDeviceId(deviceId);
        cell.setChildContainerId(childId);
        return cell;
    }

    private ContainerVo toVo(Container container) {
        ContainerVo vo = new ContainerVo();
        vo.setId(container.getId());
        vo.setFarmId(container.getFarmId());
        vo.setName(container.getName());
        vo.setRows(container.getGridRows());
        vo.setCols(container.getGridCols());
        vo.setUpdatedAt(container.getUpdatedAt());
        List<ContainerCellVo> cells = new ArrayList<>();
        if (container.getId() != null) {
            for (ContainerCell cell : containerMapper.findCells(container.getId())) {
                cells.add(new ContainerCellVo(cell.getPosX(), cell.getPosY(), cell.getDeviceId(), cell.getChildContainerId()));
            }
        }
        vo.setCells(cells);
        return vo;
    }
}
