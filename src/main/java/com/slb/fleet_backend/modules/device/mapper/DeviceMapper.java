package com.slb.fleet_backend.modules.device.mapper;

import com.slb.fleet_backend.modules.device.entity.Device;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Mapper
public interface DeviceMapper {

    /**
     * 根据设备ID查找设备（不含已软删除的）
     */
    Optional<Device> findById(@Param("id") Long id);

    /**
     * 行锁（SELECT ... FOR UPDATE），用于串行化同一设备上的队列变更；设备不存在返回 null
     */
    Long lockByIdForUpdate(@Param("id") Long id);

    /**
     * 批量查询（IN 列表由调用方分批），结果顺序不保证
     */
    List<Device> findByIds(@Param("ids") Collection<Long> ids);

    /**
     * 标签筛选：matchAll=true 时设备需包含全部标签，否则包含任一标签即可
     */
    List<Long> findIdsByTags(@Param("farmId") Long farmId,
                             @Param("tagIds") Collection<Long> tagIds,
                             @Param("matchAll") boolean matchAll);

    List<Long> findTagIds(@Param("deviceId") Long deviceId);

    /**
     * 设备轮询时刷新心跳
     */
    int touchHeartbeat(@Param("id") Long id, @Param("now") LocalDateTime now);

    /**
     * 定时任务：超过阈值未收到心跳的设备置为离线
     */
    int markDevicesOffline(@Param("cutoff") LocalDateTime cutoff);

    /**
     * 更新飞行表相关字段（flightSheetId / algorithm / minerConfig）
     */
    int updateFlightSheet(Device device);

    /**
     * 更新"应当生效"的超频配置（ocId / ocApplyMode / ocConfig / ocAlgo）
     */
    int updateResolvedOverclock(Device device);

    /**
     * 设备确认超频已生效后，更新实际超频配置
     */
    int updateAppliedOverclock(@Param("id") Long id,
                               @Param("appliedOcConfig") String appliedOcConfig,
                               @Param("appliedOcAlgo") String appliedOcAlgo);

    int incrementUnreadMessages(@Param("id") Long id);

    int resetUnreadMessages(@Param("id") Long id);
}
