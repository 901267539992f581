package com.slb.fleet_backend.modules.overclock.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 单条 tweaker 规则：units 为设备内显卡序号，为空表示作用于全部显卡。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TweakerRule {
    private List<Integer> units;
    private String params;

    public boolean covers(int unit) {
        return units == null || units.isEmpty() || units.contains(unit);
    }

    public TweakerRule copy() {
        return new TweakerRule(units == null ? null : new ArrayList<>(units), params);
    }
}
