package com.slb.fleet_backend.modules.selection.service;

import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.modules.container.service.ContainerService;
import com.slb.fleet_backend.modules.device.service.DeviceRegistryService;
import com.slb.fleet_backend.modules.selection.config.SelectionProperties;
import com.slb.fleet_backend.modules.selection.domain.SelectionSpec;
import com.slb.fleet_backend.modules.selection.enums.TagMatch;
import com.slb.fleet_backend.modules.selection.vo.SelectionSnapshotVo;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * 把选择条件解析成稳定的设备 ID 列表。
 *
 * <p>显式 ids 保持调用方顺序（去重），标签/容器结果按 id 升序，快照原样返回。
 * 显式 ids 不做存在性过滤：不存在的设备在下发时逐台报错，调用方能看到是哪一台。</p>
 */
@Service
public class SelectionResolver {

    private final DeviceRegistryService deviceRegistryService;
    private final ContainerService containerService;
    private final SnapshotCacheService snapshotCacheService;
    private final SelectionProperties properties;

    public SelectionResolver(DeviceRegistryService deviceRegistryService,
                             ContainerService containerService,
                             SnapshotCacheService snapshotCacheService,
                             SelectionProperties properties) {
        this.deviceRegistryService = deviceRegistryService;
        this.containerService = containerService;
        this.snapshotCacheService = snapshotCacheService;
        this.properties = properties;
    }

    public List<Long> resolve(Long farmId, Long ownerId, SelectionSpec spec) {
        validate(spec);
        if (spec.getIds() != null) {
            return new ArrayList<>(new LinkedHashSet<>(spec.getIds()));
        }
        if (spec.getTagIds() != null) {
            TagMatch match = spec.getTagMatch() == null ? properties.getDefaultTagMatch() : spec.getTagMatch();
            List<Long> ids = new ArrayList<>(new LinkedHashSet<>(
                    deviceRegistryService.findIdsByTags(farmId, spec.getTagIds(), match == TagMatch.ALL)));
            ids.sort(null);
            return ids;
        }
        if (spec.getSearchId() != null) {
            return snapshotCacheService.load(ownerId, spec.getSearchId());
        }
        return containerService.resolveMembers(farmId, spec.getContainerId());
    }

    /**
     * 解析并缓存为快照，后续批量操作用 searchId 引用同一批设备。
     */
    public SelectionSnapshotVo snapshot(Long farmId, Long ownerId, SelectionSpec spec) {
        List<Long> ids = resolve(farmId, ownerId, spec);
        String searchId = snapshotCacheService.cacheSnapshot(ownerId, ids);
        return new SelectionSnapshotVo(searchId, ids.size(), ids, snapshotCacheService.ttlSeconds());
    }

    public void validate(SelectionSpec spec) {
        if (spec == null) {
            throw new ValidationException("target", "缺少设备选择条件");
        }
        int kinds = 0;
        if (spec.getIds() != null) {
            kinds++;
            if (spec.getIds().isEmpty() || spec.getIds().stream().anyMatch(Objects::isNull)) {
                throw new ValidationException("ids", "设备ID列表不能为空且不能包含空值");
            }
        }
        if (spec.getTagIds() != null) {
            kinds++;
            if (spec.getTagIds().isEmpty() || spec.getTagIds().stream().anyMatch(Objects::isNull)) {
                throw new ValidationException("tagIds", "标签ID列表不能为空且不能包含空值");
            }
        }
        if (spec.getSearchId() != null) {
            kinds++;
            if (!StringUtils.hasText(spec.getSearchId())) {
                throw new ValidationException("searchId", "searchId 不能为空");
            }
        }
        if (spec.getContainerId() != null) {
            kinds++;
        }
        if (kinds != 1) {
            throw new ValidationException("target", "ids、tagIds、searchId、containerId 必须且只能填写一种");
        }
    }
}
