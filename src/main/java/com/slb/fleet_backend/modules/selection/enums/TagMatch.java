package com.slb.fleet_backend.modules.selection.enums;

/**
 * 标签筛选方式
 */
public enum TagMatch {
    ANY,  // 包含任一标签
    ALL   // 包含全部标签
}
