package model.dto.snapshot;

import common.consts.LocationTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 前端展示用的简化地点
 * coordinates 为 x-z 平面坐标，单位百万公里
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LocationSnapshotDto {
    private String name;
    private LocationTypeEnum type;
    private double[] coordinates;
}
