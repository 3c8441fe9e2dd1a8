package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 路线规划失败类型
 * code 同时作为响应 Result 的状态码
 */
@Getter
@AllArgsConstructor
public enum RouteErrorTypeEnum {
    NO_MISSIONS(400, "没有提供任务"),
    INVALID_REQUEST(400, "请求格式不合法"),
    INVALID_LOCATIONS(400, "请求中存在未知地点"),
    LOCATION_DATA_UNAVAILABLE(503, "地点数据不可用"),
    INFEASIBLE(422, "当前载货量下无法完成全部任务"),
    STEP_LIMIT_EXCEEDED(500, "超出最大步数限制");

    private final int code;
    private final String desc;
}
