package model.dto.response;

import common.consts.ErrorCodes;
import common.consts.RouteErrorTypeEnum;
import lombok.Data;

import java.util.List;

/**
 * 规划失败详情
 * 按 type 填充不同字段，未用到的字段为 null 不参与序列化
 */
@Data
public class RouteError {
    private RouteErrorTypeEnum type;
    private String error;

    // INVALID_LOCATIONS
    private List<String> names;
    private List<String> validLocations;

    // INFEASIBLE / STEP_LIMIT_EXCEEDED
    private List<String> routeSoFar;
    private List<String> completedMissions;
    private List<String> remainingMissions;

    public static RouteError of(RouteErrorTypeEnum type, String error) {
        RouteError e = new RouteError();
        e.setType(type);
        e.setError(error);
        return e;
    }

    public static RouteError invalidLocations(List<String> names, List<String> validLocations) {
        RouteError e = of(RouteErrorTypeEnum.INVALID_LOCATIONS,
                ErrorCodes.INVALID_LOCATIONS_PREFIX + String.join(", ", names));
        e.setNames(names);
        e.setValidLocations(validLocations);
        return e;
    }

    /**
     * 规划中途失败，附带已走过的路线与任务完成情况
     */
    public static RouteError partial(RouteErrorTypeEnum type, String error, List<String> routeSoFar,
                                     List<String> completedMissions, List<String> remainingMissions) {
        RouteError e = of(type, error);
        e.setRouteSoFar(routeSoFar);
        e.setCompletedMissions(completedMissions);
        e.setRemainingMissions(remainingMissions);
        return e;
    }
}
