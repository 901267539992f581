package com.slb.fleet_backend.modules.container.mapper;

import com.slb.fleet_backend.modules.container.entity.Container;
import com.slb.fleet_backend.modules.container.entity.ContainerCell;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface ContainerMapper {

    void insert(Container container);

    Optional<Container> findById(@Param("id") Long id);

    boolean existsById(@Param("id") Long id);

    List<Container> findByFarmId(@Param("farmId") Long farmId);

    /**
     * 锁住农场内全部容器行（按 id 升序），挂载嵌套容器时在农场范围内串行
     */
    List<Long> lockByFarmIdForUpdate(@Param("farmId") Long farmId);

    List<ContainerCell> findCells(@Param("containerId") Long containerId);

    List<Long> findChildContainerIds(@Param("containerId") Long containerId);

    /**
     * 写入格子，已有内容直接覆盖
     */
    int upsertCell(ContainerCell cell);

    int deleteCell(@Param("containerId") Long containerId,
                   @Param("posX") int posX,
                   @Param("posY") int posY);
}
