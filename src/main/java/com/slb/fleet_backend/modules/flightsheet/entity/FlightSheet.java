package com.slb.fleet_backend.modules.flightsheet.entity;

import lombok.Data;

/**
 * 飞行表（币种/矿池/钱包/挖矿程序配置）。由外部目录服务维护，这里只读。
 */
@Data
public class FlightSheet {
    private Long id;
    private Long farmId;
    private String name;
    private String algorithm;
    private String miner;
    private String config; // JSON
}
