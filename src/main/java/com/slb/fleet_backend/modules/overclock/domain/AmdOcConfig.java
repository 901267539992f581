package com.slb.fleet_backend.modules.overclock.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * AMD 显卡超频参数。多卡取值以空格分隔，按卡序一一对应（如 "1100 1150 1100"）。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AmdOcConfig {
    private String coreClock;
    private String coreState;
    private String coreVddc;
    private String memClock;
    private String memState;
    private String mvdd;
    private String vddci;
    private String socClock;
    private String socVddMax;
    private String fanSpeed;
    private String powerLimit;
    private String tref;
    private Boolean aggressive;

    public AmdOcConfig copy() {
        return overlay(this, null);
    }

    /**
     * 字段级覆盖：override 中非空字段覆盖 base，缺省字段沿用 base。两者都可为 null。
     */
    public static AmdOcConfig overlay(AmdOcConfig base, AmdOcConfig override) {
        if (base == null && override == null) {
            return null;
        }
        AmdOcConfig b = base != null ? base : new AmdOcConfig();
        AmdOcConfig o = override != null ? override : new AmdOcConfig();
        AmdOcConfig result = new AmdOcConfig();
        result.setCoreClock(pick(o.getCoreClock(), b.getCoreClock()));
        result.setCoreState(pick(o.getCoreState(), b.getCoreState()));
        result.setCoreVddc(pick(o.getCoreVddc(), b.getCoreVddc()));
        result.setMemClock(pick(o.getMemClock(), b.getMemClock()));
        result.setMemState(pick(o.getMemState(), b.getMemState()));
        result.setMvdd(pick(o.getMvdd(), b.getMvdd()));
        result.setVddci(pick(o.getVddci(), b.getVddci()));
        result.setSocClock(pick(o.getSocClock(), b.getSocClock()));
        result.setSocVddMax(pick(o.getSocVddMax(), b.getSocVddMax()));
        result.setFanSpeed(pick(o.getFanSpeed(), b.getFanSpeed()));
        result.setPowerLimit(pick(o.getPowerLimit(), b.getPowerLimit()));
        result.setTref(pick(o.getTref(), b.getTref()));
        result.setAggressive(pick(o.getAggressive(), b.getAggressive()));
        return result;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return coreClock == null && coreState == null && coreVddc == null && memClock == null
                && memState == null && mvdd == null && vddci == null && socClock == null
                && socVddMax == null && fanSpeed == null && powerLimit == null && tref == null
                && aggressive == null;
    }

    private static <T> T pick(T override, T base) {
        return override != null ? override : base;
    }
}
