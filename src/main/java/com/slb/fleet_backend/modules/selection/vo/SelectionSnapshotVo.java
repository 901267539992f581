package com.slb.fleet_backend.modules.selection.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SelectionSnapshotVo {
    private String searchId;
    private Integer count;
    private List<Long> deviceIds;
    private Long expiresInSeconds;
}
