package com.slb.fleet_backend.modules.overclock.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * Nvidia 显卡超频参数，多卡取值同样以空格分隔。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class NvidiaOcConfig {
    private String coreClock;
    private String lockedCoreClock;
    private String memClock;
    private String lockedMemClock;
    private String fanSpeed;
    private String powerLimit;
    private Boolean ohGodAnETHlargementPill;
    private Integer runningDelay;

    public NvidiaOcConfig copy() {
        return overlay(this, null);
    }

    public static NvidiaOcConfig overlay(NvidiaOcConfig base, NvidiaOcConfig override) {
        if (base == null && override == null) {
            return null;
        }
        NvidiaOcConfig b = base != null ? base : new NvidiaOcConfig();
        NvidiaOcConfig o = override != null ? override : new NvidiaOcConfig();
        NvidiaOcConfig result = new NvidiaOcConfig();
        result.setCoreClock(pick(o.getCoreClock(), b.getCoreClock()));
        result.setLockedCoreClock(pick(o.getLockedCoreClock(), b.getLockedCoreClock()));
        result.setMemClock(pick(o.getMemClock(), b.getMemClock()));
        result.setLockedMemClock(pick(o.getLockedMemClock(), b.getLockedMemClock()));
        result.setFanSpeed(pick(o.getFanSpeed(), b.getFanSpeed()));
        result.setPowerLimit(pick(o.getPowerLimit(), b.getPowerLimit()));
        result.setOhGodAnETHlargementPill(pick(o.getOhGodAnETHlargementPill(), b.getOhGodAnETHlargementPill()));
        result.setRunningDelay(pick(o.getRunningDelay(), b.getRunningDelay()));
        return result;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return coreClock == null && lockedCoreClock == null && memClock == null && lockedMemClock == null
                && fanSpeed == null && powerLimit == null && ohGodAnETHlargementPill == null
                && runningDelay == null;
    }

    private static <T> T pick(T override, T base) {
        return override != null ? override : base;
    }
}
