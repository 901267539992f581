package com.slb.fleet_backend.modules.overclock.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 一份完整的超频配置块：AMD / Nvidia 两个品牌子块 + 按工具名分组的 tweaker 规则。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OcConfig {
    private AmdOcConfig amd;
    private NvidiaOcConfig nvidia;
    private Map<String, List<TweakerRule>> tweakers = new LinkedHashMap<>();

    public static OcConfig empty() {
        return new OcConfig();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return (amd == null || amd.isEmpty())
                && (nvidia == null || nvidia.isEmpty())
                && (tweakers == null || tweakers.values().stream().allMatch(rules -> rules == null || rules.isEmpty()));
    }

    /**
     * 深拷贝为普通 OcConfig（子类的附加字段如 algo 不保留）。
     */
    public OcConfig copy() {
        OcConfig copy = new OcConfig();
        copy.setAmd(amd == null ? null : amd.copy());
        copy.setNvidia(nvidia == null ? null : nvidia.copy());
        if (tweakers != null) {
            tweakers.forEach((tool, rules) -> {
                List<TweakerRule> copied = new ArrayList<>();
                if (rules != null) {
                    rules.forEach(rule -> copied.add(rule.copy()));
                }
                copy.getTweakers().put(tool, copied);
            });
        }
        return copy;
    }

    /**
     * 某个工具作用在指定显卡上的最终参数：按列表顺序，最后一条覆盖该显卡的规则生效。
     */
    public Optional<String> tweakerParamsFor(String tool, int unit) {
        if (tweakers == null) {
            return Optional.empty();
        }
        List<TweakerRule> rules = tweakers.get(tool);
        if (rules == null) {
            return Optional.empty();
        }
        String params = null;
        for (TweakerRule rule : rules) {
            if (rule.covers(unit)) {
                params = rule.getParams();
            }
        }
        return Optional.ofNullable(params);
    }
}
