package com.slb.fleet_backend.modules.flightsheet.mapper;

import com.slb.fleet_backend.modules.flightsheet.entity.FlightSheet;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Optional;

@Mapper
public interface FlightSheetMapper {

    Optional<FlightSheet> findById(@Param("id") Long id);
}
