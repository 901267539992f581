package com.slb.fleet_backend.modules.overclock.mapper;

import com.slb.fleet_backend.modules.overclock.entity.OverclockProfile;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface OverclockProfileMapper {

    void insert(OverclockProfile profile);

    Optional<OverclockProfile> findById(@Param("id") Long id);

    List<OverclockProfile> findByFarmId(@Param("farmId") Long farmId);

    int update(OverclockProfile profile);
}
