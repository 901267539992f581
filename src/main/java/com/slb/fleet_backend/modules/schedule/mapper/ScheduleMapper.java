package com.slb.fleet_backend.modules.schedule.mapper;

import com.slb.fleet_backend.modules.schedule.entity.Schedule;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Mapper
public interface ScheduleMapper {

    void insert(Schedule schedule);

    Optional<Schedule> findById(@Param("id") Long id);

    List<Schedule> findByFarmId(@Param("farmId") Long farmId);

    /**
     * 更新定义（名称/目标/动作/时间规则），同时写入重新计算的 next_launch_at 与 active
     */
    int update(Schedule schedule);

    int updateActivation(@Param("id") Long id,
                         @Param("active") boolean active,
                         @Param("nextLaunchAt") LocalDateTime nextLaunchAt,
                         @Param("now") LocalDateTime now);

    int deleteById(@Param("id") Long id);

    /**
     * 到期的计划：active 且 next_launch_at <= now，按 next_launch_at 升序
     */
    List<Long> findDueIds(@Param("now") LocalDateTime now, @Param("limit") int limit);

    /**
     * 触发后推进游标（CAS：next_launch_at 仍为 expectedNext 才更新），prev = expectedNext
     */
    int advance(@Param("id") Long id,
                @Param("expectedNext") LocalDateTime expectedNext,
                @Param("nextLaunchAt") LocalDateTime nextLaunchAt,
                @Param("active") boolean active,
                @Param("lastRequestId") String lastRequestId,
                @Param("now") LocalDateTime now);
}
