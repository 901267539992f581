package com.slb.fleet_backend.modules.device.mapper;

import com.slb.fleet_backend.modules.device.entity.DeviceMessage;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface DeviceMessageMapper {

    void insert(DeviceMessage message);

    long countByDeviceId(@Param("deviceId") Long deviceId);

    List<DeviceMessage> findByDeviceIdPaginated(@Param("deviceId") Long deviceId,
                                                @Param("offset") int offset,
                                                @Param("size") int size);

    int markAllRead(@Param("deviceId") Long deviceId);
}
