package com.slb.fleet_backend.modules.command.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 一次批量下发的结果，items 与目标设备顺序一致。部分设备失败不影响其他设备。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FanOutBatch {
    private int total;
    private int succeeded;
    private int failed;
    private List<FanOutItem> items;

    public static FanOutBatch of(List<FanOutItem> items) {
        int ok = (int) items.stream().filter(FanOutItem::isOk).count();
        return new FanOutBatch(items.size(), ok, items.size() - ok, items);
    }
}
