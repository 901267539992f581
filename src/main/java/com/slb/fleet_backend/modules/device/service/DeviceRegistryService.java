package com.slb.fleet_backend.modules.device.service;

import com.google.common.collect.Lists;
import com.slb.fleet_backend.common.exception.BizException;
import com.slb.fleet_backend.common.exception.NotFoundException;
import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.common.service.JsonColumnService;
import com.slb.fleet_backend.common.vo.PageVo;
import com.slb.fleet_backend.modules.device.entity.Device;
import com.slb.fleet_backend.modules.device.entity.DeviceMessage;
import com.slb.fleet_backend.modules.device.mapper.DeviceMapper;
import com.slb.fleet_backend.modules.device.mapper.DeviceMessageMapper;
import com.slb.fleet_backend.modules.device.vo.DeviceMessageVo;
import com.slb.fleet_backend.modules.device.vo.DeviceVo;
import com.slb.fleet_backend.modules.overclock.domain.OcConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * 设备注册表：身份、标签、心跳与当前配置的只读视图。设备增删改与标签维护由外部服务负责。
 */
@Service
@Slf4j
public class DeviceRegistryService {

    // IN (...) 查询的分批大小
    private static final int ID_CHUNK_SIZE = 500;
    private static final int MAX_BATCH_LOOKUP = 2000;

    private final DeviceMapper deviceMapper;
    private final DeviceMessageMapper deviceMessageMapper;
    private final JsonColumnService jsonColumnService;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Value("${app.devices.offline-threshold-minutes:5}")
    private long deviceOfflineThresholdMinutes;

    public DeviceRegistryService(DeviceMapper deviceMapper,
                                 DeviceMessageMapper deviceMessageMapper,
                                 JsonColumnService jsonColumnService,
                                 PasswordEncoder passwordEncoder,
                                 Clock clock) {
        this.deviceMapper = deviceMapper;
        this.deviceMessageMapper = deviceMessageMapper;
        this.jsonColumnService = jsonColumnService;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    public Device requireDevice(Long deviceId) {
        return deviceMapper.findById(deviceId)
                .orElseThrow(() -> NotFoundException.of("设备", deviceId));
    }

    public Device requireDeviceInFarm(Long farmId, Long deviceId) {
        Device device = requireDevice(deviceId);
        if (!Objects.equals(device.getFarmId(), farmId)) {
            throw NotFoundException.of("设备", deviceId);
        }
        return device;
    }

    /**
     * 按 id 批量查询，超过 {@value #ID_CHUNK_SIZE} 个时分批走 IN 查询。重复 id 只查一次，不存在的 id 不出现在结果中。
     */
    public List<Device> findByIds(Collection<Long> deviceIds) {
        List<Device> result = new ArrayList<>();
        if (deviceIds == null || deviceIds.isEmpty()) {
            return result;
        }
        for (List<Long> chunk : Lists.partition(new ArrayList<>(new LinkedHashSet<>(deviceIds)), ID_CHUNK_SIZE)) {
            result.addAll(deviceMapper.findByIds(chunk));
        }
        return result;
    }

    /**
     * 运维端批量查看设备概要：只返回属于该矿场的设备，按 id 升序；不含标签列表。
     */
    public List<DeviceVo> listDevices(Long farmId, List<Long> deviceIds) {
        if (deviceIds == null || deviceIds.isEmpty()) {
            throw new ValidationException("ids", "设备ID列表不能为空");
        }
        if (deviceIds.size() > MAX_BATCH_LOOKUP || deviceIds.stream().anyMatch(Objects::isNull)) {
            throw new ValidationException("ids", "设备ID列表不能包含空值，且不能超过 " + MAX_BATCH_LOOKUP + " 个");
        }
        List<DeviceVo> list = new ArrayList<>();
        for (Device device : findByIds(deviceIds)) {
            if (Objects.equals(device.getFarmId(), farmId)) {
                list.add(toVo(device));
            }
        }
        list.sort(Comparator.comparing(DeviceVo::getId));
        return list;
    }

    public List<Long> findIdsByTags(Long farmId, Collection<Long> tagIds, boolean matchAll) {
        if (tagIds == null || tagIds.isEmpty()) {
            return List.of();
        }
        return deviceMapper.findIdsByTags(farmId, tagIds, matchAll);
    }

    /**
     * 设备端鉴权：rig 密码以 BCrypt 存储。设备不存在与密码错误返回同一错误，避免枚举设备 ID。
     */
    public Device authenticate(Long deviceId, String password) {
        Device device = deviceMapper.findById(deviceId).orElse(null);
        if (device == null
                || !StringUtils.hasText(password)
                || !StringUtils.hasText(device.getPasswordHash())
                || !passwordEncoder.matches(password, device.getPasswordHash())) {
            throw new BizException(401, "AUTH_RIG_INVALID", "设备ID或密码错误");
        }
        if (!Boolean.TRUE.equals(device.getActive())) {
            throw new BizException(403, "RIG_INACTIVE", "设备已停用");
        }
        return device;
    }

    /**
     * 设备轮询时刷新心跳：last_online_time = now，is_online = 1。在调用方事务内执行。
     */
    public void recordHeartbeat(Long deviceId) {
        deviceMapper.touchHeartbeat(deviceId, LocalDateTime.now(clock));
    }

    public DeviceVo getDeviceDetail(Long farmId, Long deviceId) {
        Device device = requireDeviceInFarm(farmId, deviceId);
        DeviceVo vo = toVo(device);
        vo.setTagIds(deviceMapper.findTagIds(deviceId));
        return vo;
    }

    private DeviceVo toVo(Device device) {
        DeviceVo vo = new DeviceVo();
        vo.setId(device.getId());
        vo.setFarmId(device.getFarmId());
        vo.setName(device.getName());
        vo.setPlatform(device.getPlatform());
        vo.setActive(device.getActive());
        vo.setOnline(device.getIsOnline() != null && device.getIsOnline() == 1);
        vo.setLastOnlineTime(device.getLastOnlineTime());
        vo.setFlightSheetId(device.getFlightSheetId());
        vo.setAlgorithm(device.getAlgorithm());
        vo.setOcId(device.getOcId());
        vo.setOcApplyMode(device.getOcApplyMode());
        OcConfig resolved = jsonColumnService.read(device.getOcConfig(), OcConfig.class);
        OcConfig applied = jsonColumnService.read(device.getAppliedOcConfig(), OcConfig.class);
        vo.setOcConfig(resolved);
        vo.setOcAlgo(device.getOcAlgo());
        vo.setAppliedOcConfig(applied);
        vo.setAppliedOcAlgo(device.getAppliedOcAlgo());
        vo.setOcInSync(Objects.equals(resolved, applied) && Objects.equals(device.getOcAlgo(), device.getAppliedOcAlgo()));
        vo.setUnreadMessageCount(device.getUnreadMessageCount());
        return vo;
    }

    public PageVo<DeviceMessageVo> listMessages(Long farmId, Long deviceId, int page, int size) {
        requireDeviceInFarm(farmId, deviceId);
        int safePage = Math.max(page, 1);
        int safeSize = Math.min(Math.max(size, 1), 100);
        long total = deviceMessageMapper.countByDeviceId(deviceId);
        List<DeviceMessageVo> list = new ArrayList<>();
        if (total > 0) {
            for (DeviceMessage message : deviceMessageMapper.findByDeviceIdPaginated(deviceId, (safePage - 1) * safeSize, safeSize)) {
                list.add(toMessageVo(message));
            }
        }
        return new PageVo<>(total, safePage, safeSize, list);
    }

    @Transactional
    public int markMessagesRead(Long farmId, Long deviceId) {
        requireDeviceInFarm(farmId, deviceId);
        int affected = deviceMessageMapper.markAllRead(deviceId);
        deviceMapper.resetUnreadMessages(deviceId);
        return affected;
    }

    /**
     * 定时任务：超过阈值未轮询（last_online_time 未刷新）的设备判定为离线。
     */
    @Scheduled(fixedDelayString = "${app.devices.offline-scan-fixed-delay-ms:60000}")
    public void markDevicesOfflineIfHeartbeatExpired() {
        if (deviceOfflineThresholdMinutes <= 0) {
            return;
        }
        LocalDateTime cutoff = LocalDateTime.now(clock).minusMinutes(deviceOfflineThresholdMinutes);
        int affected = deviceMapper.markDevicesOffline(cutoff);
        if (affected > 0) {
            log.info("Marked {} devices offline due to no heartbeat since {}", affected, cutoff);
        }
    }

    private DeviceMessageVo toMessageVo(DeviceMessage message) {
        DeviceMessageVo vo = new DeviceMessageVo();
        vo.setId(message.getId());
        vo.setCommandId(message.getCommandId());
        vo.setType(message.getType());
        vo.setTitle(message.getTitle());
        vo.setPayload(message.getPayload());
        vo.setRead(Boolean.TRUE.equals(message.getIsRead()));
        vo.setCreatedAt(message.getCreatedAt());
        return vo;
    }
}
