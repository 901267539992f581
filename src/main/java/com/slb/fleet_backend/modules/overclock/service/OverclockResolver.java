package com.slb.fleet_backend.modules.overclock.service;

import com.slb.fleet_backend.modules.overclock.domain.AlgoOcConfig;
import com.slb.fleet_backend.modules.overclock.domain.AmdOcConfig;
import com.slb.fleet_backend.modules.overclock.domain.NvidiaOcConfig;
import com.slb.fleet_backend.modules.overclock.domain.OcConfig;
import com.slb.fleet_backend.modules.overclock.domain.OcProfile;
import com.slb.fleet_backend.modules.overclock.domain.TweakerRule;
import com.slb.fleet_backend.modules.overclock.enums.OcApplyMode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 超频配置解析。两层语义：
 * <ul>
 *     <li>方案层 {@link #resolve}：默认块叠加匹配当前算法的覆盖块，得到有效配置；</li>
 *     <li>设备层 {@link #applyToDevice}：按 REPLACE / MERGE 把有效配置落到设备已有配置上。</li>
 * </ul>
 * 两个方法都是纯函数，不修改入参。
 */
@Component
public class OverclockResolver {

    /**
     * 方案层解析。品牌子块按字段覆盖；tweaker 按工具名合并，同一工具下的规则按"默认在前、算法块在后"拼接，
     * 单卡最终取值由 {@link OcConfig#tweakerParamsFor} 按"最后一条生效"决定。
     * 没有默认块也没有匹配的算法块时返回空配置（调用方视为"不改动超频"）。
     */
    public OcConfig resolve(OcProfile profile, String activeAlgorithm) {
        if (profile == null) {
            return OcConfig.empty();
        }
        OcConfig result = profile.getDefaultConfig() != null ? profile.getDefaultConfig().copy() : OcConfig.empty();
        if (profile.getByAlgo() == null) {
            return result;
        }
        for (AlgoOcConfig entry : profile.getByAlgo()) {
            if (entry != null && entry.matches(activeAlgorithm)) {
                result = overlay(result, entry);
            }
        }
        return result;
    }

    /**
     * 设备层应用。REPLACE 整体替换；MERGE 仅覆盖 effective 中出现的字段，tweaker 以工具为单位替换，
     * 因此同一配置重复 MERGE 的结果与一次相同。effective 为空时保持原配置。
     */
    public OcConfig applyToDevice(OcConfig applied, OcConfig effective, OcApplyMode mode) {
        OcConfig current = applied != null ? applied.copy() : OcConfig.empty();
        if (effective == null || effective.isEmpty()) {
            return current;
        }
        if (mode == null || mode == OcApplyMode.REPLACE) {
            return effective.copy();
        }
        OcConfig merged = new OcConfig();
        merged.setAmd(AmdOcConfig.overlay(current.getAmd(), effective.getAmd()));
        merged.setNvidia(NvidiaOcConfig.overlay(current.getNvidia(), effective.getNvidia()));
        merged.setTweakers(current.getTweakers() != null ? current.getTweakers() : new LinkedHashMap<>());
        if (effective.getTweakers() != null) {
            for (Map.Entry<String, List<TweakerRule>> entry : effective.getTweakers().entrySet()) {
                merged.getTweakers().put(entry.getKey(), copyRules(entry.getValue()));
            }
        }
        return merged;
    }

    private OcConfig overlay(OcConfig base, OcConfig override) {
        OcConfig result = base.copy();
        result.setAmd(AmdOcConfig.overlay(base.getAmd(), override.getAmd()));
        result.setNvidia(NvidiaOcConfig.overlay(base.getNvidia(), override.getNvidia()));
        if (override.getTweakers() != null) {
            for (Map.Entry<String, List<TweakerRule>> entry : override.getTweakers().entrySet()) {
                result.getTweakers()
                        .computeIfAbsent(entry.getKey(), tool -> new ArrayList<>())
                        .addAll(copyRules(entry.getValue()));
            }
        }
        return result;
    }

    private List<TweakerRule> copyRules(List<TweakerRule> rules) {
        List<TweakerRule> copied = new ArrayList<>();
        if (rules != null) {
            for (TweakerRule rule : rules) {
                copied.add(rule.copy());
            }
        }
        return copied;
    }
}
