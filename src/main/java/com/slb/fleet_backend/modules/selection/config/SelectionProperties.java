package com.slb.fleet_backend.modules.selection.config;

import com.slb.fleet_backend.modules.selection.enums.TagMatch;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 设备筛选与快照配置
 */
@Component
@ConfigurationProperties(prefix = "app.selection")
@Data
public class SelectionProperties {

    /**
     * 快照有效期。预览到执行之间通常只有几分钟，过期后需要重新筛选。
     */
    private Duration snapshotTtl = Duration.ofMinutes(10);

    /**
     * 请求未指定 tagMatch 时的默认方式。
     */
    private TagMatch defaultTagMatch = TagMatch.ANY;

    /**
     * Redis key 前缀，完整 key 为 {prefix}:{ownerId}:{searchId}
     */
    private String keyPrefix = "fleet:selection";
}
