package common.consts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 地点类别
 */
@Getter
@AllArgsConstructor
public enum LocationTypeEnum {
    PLANET("planet", "行星"),
    LANDING_ZONE("landing_zone", "着陆区"),
    STATION("station", "空间站"),
    MOON("moon", "卫星"),
    LAGRANGE("lagrange", "拉格朗日点");

    @JsonValue
    private final String code;
    private final String desc;

    @JsonCreator
    public static LocationTypeEnum getByCode(String code) {
        for (LocationTypeEnum value : values()) {
            if (value.getCode().equals(code)) {
                return value;
            }
        }
        return null;
    }
}
