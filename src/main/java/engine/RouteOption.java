package engine;

import common.consts.RouteActionEnum;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 一个候选动作：对某任务装货或执行其下一个卸货点
 */
@Getter
@ToString
@AllArgsConstructor
public class RouteOption {
    private final RouteActionEnum action;
    private final int missionIndex;
    private final String target;   // 动作发生的地点
    private final double score;
}
