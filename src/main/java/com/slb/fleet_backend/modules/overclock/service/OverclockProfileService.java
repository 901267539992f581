package com.slb.fleet_backend.modules.overclock.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.slb.fleet_backend.common.exception.NotFoundException;
import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.common.service.JsonColumnService;
import com.slb.fleet_backend.modules.overclock.domain.AlgoOcConfig;
import com.slb.fleet_backend.modules.overclock.domain.OcConfig;
import com.slb.fleet_backend.modules.overclock.domain.OcProfile;
import com.slb.fleet_backend.modules.overclock.dto.OverclockProfileSaveDto;
import com.slb.fleet_backend.modules.overclock.entity.OverclockProfile;
import com.slb.fleet_backend.modules.overclock.mapper.OverclockProfileMapper;
import com.slb.fleet_backend.modules.overclock.vo.OverclockProfileVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class OverclockProfileService {

    public static final String PROFILE_CACHE = "ocProfiles";

    private static final TypeReference<List<AlgoOcConfig>> ALGO_LIST = new TypeReference<>() {};

    private final OverclockProfileMapper profileMapper;
    private final JsonColumnService jsonColumnService;
    private final OverclockResolver overclockResolver;
    private final Clock clock;

    public OverclockProfileService(OverclockProfileMapper profileMapper,
                                   JsonColumnService jsonColumnService,
                                   OverclockResolver overclockResolver,
                                   Clock clock) {
        this.profileMapper = profileMapper;
        this.jsonColumnService = jsonColumnService;
        this.overclockResolver = overclockResolver;
        this.clock = clock;
    }

    @Transactional
    public OverclockProfileVo create(Long farmId, OverclockProfileSaveDto dto) {
        validate(dto);
        LocalDateTime now = LocalDateTime.now(clock);
        OverclockProfile profile = new OverclockProfile();
        profile.setFarmId(farmId);
        profile.setName(dto.getName().trim());
        profile.setDefaultConfig(jsonColumnService.write(dto.getDefaultConfig()));
        profile.setByAlgo(jsonColumnService.write(dto.getByAlgo() == null ? List.of() : dto.getByAlgo()));
        profile.setCreatedAt(now);
        profile.setUpdatedAt(now);
        profileMapper.insert(profile);
        log.info("Created overclock profile {} in farm {}", profile.getId(), farmId);
        return toVo(profile);
    }

    @Transactional
    @CacheEvict(cacheNames = PROFILE_CACHE, key = "#profileId")
    public OverclockProfileVo update(Long farmId, Long profileId, OverclockProfileSaveDto dto) {
        validate(dto);
        OverclockProfile profile = requireInFarm(farmId, profileId);
        profile.setName(dto.getName().trim());
        profile.setDefaultConfig(jsonColumnService.write(dto.getDefaultConfig()));
        profile.setByAlgo(jsonColumnService.write(dto.getByAlgo() == null ? List.of() : dto.getByAlgo()));
        profile.setUpdatedAt(LocalDateTime.now(clock));
        profileMapper.update(profile);
        return toVo(profile);
    }

    public OverclockProfileVo get(Long farmId, Long profileId) {
        return toVo(requireInFarm(farmId, profileId));
    }

    public List<OverclockProfileVo> list(Long farmId) {
        List<OverclockProfileVo> result = new ArrayList<>();
        for (OverclockProfile profile : profileMapper.findByFarmId(farmId)) {
            result.add(toVo(profile));
        }
        return result;
    }

    /**
     * 供下发流程使用的解析后方案。缓存返回的对象只读，解析器不会修改入参。
     */
    @Cacheable(cacheNames = PROFILE_CACHE, key = "#profileId")
    public OcProfile loadProfile(Long profileId) {
        OverclockProfile profile = profileMapper.findById(profileId)
                .orElseThrow(() -> NotFoundException.of("超频方案", profileId));
        return toDomain(profile);
    }

    /**
     * 校验归属后加载方案（不走缓存），批量下发前调用一次。
     */
    public OcProfile loadProfileInFarm(Long farmId, Long profileId) {
        return toDomain(requireInFarm(farmId, profileId));
    }

    /**
     * 预览某算法下的有效配置，便于运维核对叠加结果。
     */
    public OcConfig preview(Long farmId, Long profileId, String algorithm) {
        return overclockResolver.resolve(toDomain(requireInFarm(farmId, profileId)), algorithm);
    }

    private OverclockProfile requireInFarm(Long farmId, Long profileId) {
        OverclockProfile profile = profileMapper.findById(profileId)
                .orElseThrow(() -> NotFoundException.of("超频方案", profileId));
        if (!profile.getFarmId().equals(farmId)) {
            throw NotFoundException.of("超频方案", profileId);
        }
        return profile;
    }

    private void validate(OverclockProfileSaveDto dto) {
        if (dto.getByAlgo() == null) {
            return;
        }
        Map<String, String> errors = new LinkedHashMap<>();
        for (int i = 0; i < dto.getByAlgo().size(); i++) {
            AlgoOcConfig entry = dto.getByAlgo().get(i);
            if (entry == null || !StringUtils.hasText(entry.getAlgo())) {
                errors.put("byAlgo[" + i + "].algo", "算法名不能为空");
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("超频方案参数错误", errors);
        }
    }

    private OcProfile toDomain(OverclockProfile profile) {
        List<AlgoOcConfig> byAlgo = jsonColumnService.read(profile.getByAlgo(), ALGO_LIST);
        return new OcProfile(
                profile.getId(),
                jsonColumnService.read(profile.getDefaultConfig(), OcConfig.class),
                byAlgo == null ? new ArrayList<>() : byAlgo
        );
    }

    private OverclockProfileVo toVo(OverclockProfile profile) {
        OcProfile domain = toDomain(profile);
        OverclockProfileVo vo = new OverclockProfileVo();
        vo.setId(profile.getId());
        vo.setFarmId(profile.getFarmId());
        vo.setName(profile.getName());
        vo.setDefaultConfig(domain.getDefaultConfig());
        vo.setByAlgo(domain.getByAlgo());
        vo.setUpdatedAt(profile.getUpdatedAt());
        return vo;
    }
}
