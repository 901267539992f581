package com.slb.fleet_backend.modules.container.service;

import com.slb.fleet_backend.common.exception.CyclicContainerException;
import com.slb.fleet_backend.common.exception.NotFoundException;
import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.modules.container.entity.ContainerCell;
import com.slb.fleet_backend.modules.container.mapper.ContainerMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 把容器网格（可嵌套子容器）展开为成员设备集合。
 *
 * <p>挂载时已做环检测，这里遍历时再防一次：当前路径上重复出现同一容器即判定成环；
 * 同一子容器经不同路径到达（菱形）是合法的，只展开一次。</p>
 */
@Component
@Slf4j
public class ContainerTreeResolver {

    public static final int MAX_DEPTH = 32;

    private final ContainerMapper containerMapper;

    public ContainerTreeResolver(ContainerMapper containerMapper) {
        this.containerMapper = containerMapper;
    }

    /**
     * 成员设备集合，顺序不保证。
     */
    public Set<Long> resolveMembers(Long containerId) {
        if (!containerMapper.existsById(containerId)) {
            throw NotFoundException.of("容器", containerId);
        }
        Set<Long> devices = new HashSet<>();
        walk(containerId, new HashSet<>(), new HashSet<>(), devices, 0);
        return devices;
    }

    /**
     * 按设备 id 升序的成员列表，供需要稳定顺序的调用方使用。
     */
    public List<Long> resolveSortedMembers(Long containerId) {
        List<Long> sorted = new ArrayList<>(resolveMembers(containerId));
        sorted.sort(null);
        return sorted;
    }

    /**
     * 从 fromId 出发沿子容器能否到达 targetId（含 fromId 本身）。子树层级超过上限抛 ValidationException。
     */
    public boolean reaches(Long fromId, Long targetId) {
        return reaches(fromId, targetId, new HashSet<>(), 0);
    }

    private boolean reaches(Long current, Long targetId, Set<Long> visited, int depth) {
        if (current.equals(targetId)) {
            return true;
        }
        if (depth > MAX_DEPTH) {
            throw new ValidationException("containerId", "容器嵌套层级超过上限 " + MAX_DEPTH);
        }
        if (!visited.add(current)) {
            return false;
        }
        for (Long child : containerMapper.findChildContainerIds(current)) {
            if (reaches(child, targetId, visited, depth + 1)) {
                return true;
            }
        }
        return false;
    }

    private void walk(Long containerId, Set<Long> path, Set<Long> expanded, Set<Long> devices, int depth) {
        if (path.contains(containerId)) {
            throw new CyclicContainerException(containerId);
        }
        if (expanded.contains(containerId)) {
            return;
        }
        if (depth > MAX_DEPTH) {
            throw new ValidationException("containerId", "容器嵌套层级超过上限 " + MAX_DEPTH);
        }
        path.add(containerId);
        for (ContainerCell cell : containerMapper.findCells(containerId)) {
            if (cell.getDeviceId() != null) {
                devices.add(cell.getDeviceId());
            } else if (cell.getChildContainerId() != null) {
                Long child = cell.getChildContainerId();
                if (!containerMapper.existsById(child)) {
                    log.warn("Container {} cell ({},{}) references missing container {}, skipped",
                            containerId, cell.getPosX(), cell.getPosY(), child);
                    continue;
                }
                walk(child, path, expanded, devices, depth + 1);
            }
        }
        path.remove(containerId);
        expanded.add(containerId);
    }
}
