package com.slb.fleet_backend.modules.command.mapper;

import com.slb.fleet_backend.modules.command.entity.DeviceCommand;
import com.slb.fleet_backend.modules.command.enums.CommandType;
import com.slb.fleet_backend.modules.device.enums.MessageType;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 设备指令 Mapper
 */
@Mapper
public interface DeviceCommandMapper {

    /**
     * 插入新指令（回填自增 id）
     */
    void insert(DeviceCommand command);

    Optional<DeviceCommand> findById(@Param("id") Long id);

    /**
     * 设备未回报的指令，按 id 升序（FIFO）
     */
    List<DeviceCommand> findUnresolvedByDeviceId(@Param("deviceId") Long deviceId);

    /**
     * 指定类型、设备尚未拉取（PENDING）的最早一条指令；用于 CONFIG_APPLY 去重与 OVERCLOCK_APPLY 载荷刷新。
     * 已 DELIVERED 的指令设备可能已经执行，不能再改写。
     */
    DeviceCommand findFirstPendingByType(@Param("deviceId") Long deviceId,
                                         @Param("type") CommandType type);

    /**
     * 仅改写仍为 PENDING 的指令载荷，返回 0 表示已被拉取
     */
    int updatePendingPayload(@Param("id") Long id, @Param("payload") String payload);

    /**
     * PENDING -> DELIVERED，已拉取过的不再变更
     */
    int markDelivered(@Param("deviceId") Long deviceId, @Param("now") LocalDateTime now);

    /**
     * 仅未回报的指令可被回报（CAS），重复回报返回 0
     */
    int resolve(@Param("id") Long id,
                @Param("resultType") MessageType resultType,
                @Param("result") String result,
                @Param("now") LocalDateTime now);
}
