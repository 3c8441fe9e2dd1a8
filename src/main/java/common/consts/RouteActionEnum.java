package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 路线动作类型
 */
@Getter
@AllArgsConstructor
public enum RouteActionEnum {
    PICKUP("Pickup", "装货"),
    DROPOFF("Dropoff", "卸货");

    private final String label; // 写入动作日志的英文标签
    private final String desc;
}
