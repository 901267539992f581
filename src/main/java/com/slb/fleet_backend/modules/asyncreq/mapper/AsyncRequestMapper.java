package com.slb.fleet_backend.modules.asyncreq.mapper;

import com.slb.fleet_backend.modules.asyncreq.entity.AsyncRequest;
import com.slb.fleet_backend.modules.asyncreq.enums.AsyncRequestStatus;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Mapper
public interface AsyncRequestMapper {

    void insert(AsyncRequest request);

    Optional<AsyncRequest> findById(@Param("id") String id);

    /**
     * PENDING -> PROCESSING（CAS），截止时间已过的不允许领取
     */
    int claim(@Param("id") String id, @Param("now") LocalDateTime now);

    /**
     * PROCESSING -> DONE/ERROR（CAS）
     */
    int complete(@Param("id") String id,
                 @Param("status") AsyncRequestStatus status,
                 @Param("resultStatus") int resultStatus,
                 @Param("resultHeaders") String resultHeaders,
                 @Param("resultBody") String resultBody,
                 @Param("now") LocalDateTime now);

    /**
     * 仍为 PENDING 且已过截止时间的置为 EXPIRED
     */
    int expirePending(@Param("now") LocalDateTime now);

    /**
     * 领取时间早于 cutoff 仍未完成的请求（执行实例宕机或结果写入失败）
     */
    List<String> findStaleProcessingIds(@Param("cutoff") LocalDateTime cutoff, @Param("limit") int limit);

    /**
     * 超时的 PROCESSING -> ERROR（CAS），同时写入失败结果
     */
    int failStale(@Param("id") String id,
                  @Param("cutoff") LocalDateTime cutoff,
                  @Param("resultStatus") int resultStatus,
                  @Param("resultHeaders") String resultHeaders,
                  @Param("resultBody") String resultBody,
                  @Param("now") LocalDateTime now);

    List<String> findClaimableIds(@Param("now") LocalDateTime now, @Param("limit") int limit);

    int deleteById(@Param("id") String id);

    /**
     * 清理终态且早于 cutoff 的记录
     */
    int purgeFinishedBefore(@Param("cutoff") LocalDateTime cutoff);
}
