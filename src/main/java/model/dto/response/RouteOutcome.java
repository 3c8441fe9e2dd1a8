package model.dto.response;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 规划结果：成功时 result 非空，失败时 error 非空
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RouteOutcome {
    private final RouteResult result;
    private final RouteError error;

    public static RouteOutcome success(RouteResult result) {
        return new RouteOutcome(result, null);
    }

    public static RouteOutcome failure(RouteError error) {
        return new RouteOutcome(null, error);
    }

    public boolean isSuccess() {
        return result != null;
    }
}
