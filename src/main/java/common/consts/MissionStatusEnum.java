package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 货运任务状态
 * 只能按 PENDING -> IN_PROGRESS -> COMPLETED 单向流转
 */
@Getter
@AllArgsConstructor
public enum MissionStatusEnum {
    PENDING("01", "等待装货"),
    IN_PROGRESS("02", "已装货，卸货未完成"),
    COMPLETED("03", "全部卸货完成");

    private final String code;
    private final String desc;
}
