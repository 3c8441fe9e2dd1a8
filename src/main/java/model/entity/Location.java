package model.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import common.consts.LocationTypeEnum;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 地点
 * 名称唯一，加载后不可变
 */
@Getter
@ToString
@EqualsAndHashCode
public class Location {
    private final String name;             // 地点名称 (Key)
    private final LocationTypeEnum type;   // 地点类别
    private final String parent;           // 所属天体，可为空
    private final double x;
    private final double y;
    private final double z;

    @JsonCreator
    public Location(@JsonProperty("name") String name,
                    @JsonProperty("type") LocationTypeEnum type,
                    @JsonProperty("parent") String parent,
                    @JsonProperty("x") double x,
                    @JsonProperty("y") double y,
                    @JsonProperty("z") double z) {
        this.name = name;
        this.type = type;
        this.parent = parent;
        this.x = x;
        this.y = y;
        this.z = z;
    }
}
