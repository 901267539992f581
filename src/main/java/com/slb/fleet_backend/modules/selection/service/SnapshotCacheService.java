package com.slb.fleet_backend.modules.selection.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.slb.fleet_backend.common.exception.SnapshotExpiredException;
import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.common.service.JsonColumnService;
import com.slb.fleet_backend.common.service.RedisService;
import com.slb.fleet_backend.modules.selection.config.SelectionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 设备集合快照：按运维人员隔离，存 Redis 并带 TTL。过期由 Redis 负责（读时惰性过期 + 后台定期清理）。
 */
@Service
@Slf4j
public class SnapshotCacheService {

    private static final Pattern SEARCH_ID = Pattern.compile("^[0-9a-f]{32}$");
    private static final TypeReference<List<Long>> ID_LIST = new TypeReference<>() {};

    private final RedisService redisService;
    private final JsonColumnService jsonColumnService;
    private final SelectionProperties properties;

    public SnapshotCacheService(RedisService redisService,
                                JsonColumnService jsonColumnService,
                                SelectionProperties properties) {
        this.redisService = redisService;
        this.jsonColumnService = jsonColumnService;
        this.properties = properties;
    }

    public String cacheSnapshot(Long ownerId, Collection<Long> deviceIds) {
        String searchId = UUID.randomUUID().toString().replace("-", "");
        List<Long> ids = deviceIds == null ? List.of() : new ArrayList<>(deviceIds);
        redisService.set(key(ownerId, searchId), jsonColumnService.write(ids), properties.getSnapshotTtl());
        log.debug("Cached selection snapshot {} for owner {} with {} devices", searchId, ownerId, ids.size());
        return searchId;
    }

    /**
     * 原样返回快照中的设备集合；快照不存在（过期或属于他人）抛 SnapshotExpiredException。
     */
    public List<Long> load(Long ownerId, String searchId) {
        if (!StringUtils.hasText(searchId) || !SEARCH_ID.matcher(searchId).matches()) {
            throw new ValidationException("searchId", "searchId 格式不正确");
        }
        String json = redisService.get(key(ownerId, searchId));
        if (json == null) {
            throw new SnapshotExpiredException(searchId);
        }
        List<Long> ids = jsonColumnService.read(json, ID_LIST);
        return ids == null ? List.of() : ids;
    }

    public long ttlSeconds() {
        return properties.getSnapshotTtl().getSeconds();
    }

    private String key(Long ownerId, String searchId) {
        return properties.getKeyPrefix() + ":" + (ownerId == null ? 0L : ownerId) + ":" + searchId;
    }
}
