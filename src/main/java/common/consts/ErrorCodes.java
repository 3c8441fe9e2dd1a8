package common.consts;

/**
 * 全局错误信息与错误码常量池
 */
public class ErrorCodes {
    // 返回给调用方的 msg 统一使用英文
    public static final String SUCCESS = "Success";

    // 基础错误
    public static final String SYSTEM_ERROR = "Internal server error";

    // 请求格式错误
    public static final String EMPTY_REQUEST = "No data provided";
    public static final String NO_MISSIONS = "No missions provided";
    public static final String NO_START_LOCATION = "No start location provided";
    public static final String MISSING_PICKUP_OR_CARGO = "Invalid mission format: missing pickup or cargo_scu";
    public static final String MISSING_DROPOFFS = "Invalid mission format: missing dropoff location(s)";
    public static final String DROPOFFS_NOT_LIST = "Invalid mission format: dropoffs must be a list";
    public static final String EMPTY_DROPOFFS = "Invalid mission format: at least one dropoff location is required";
    public static final String DROPOFF_NOT_TEXT = "Invalid mission format: dropoff locations must be strings";
    public static final String NEGATIVE_CARGO = "Invalid mission format: cargo_scu must not be negative";
    public static final String NEGATIVE_DROPOFF_AMOUNT = "Invalid mission format: dropoff_cargo_amounts must not be negative";
    public static final String NEGATIVE_PAYOUT = "Invalid mission format: payout must not be negative";
    public static final String MALFORMED_BODY = "Malformed request body";

    // 地点数据错误
    public static final String LOCATION_DATA_UNAVAILABLE = "Location data not loaded";
    public static final String INVALID_LOCATIONS_PREFIX = "Invalid locations in request: ";
    public static final String LOCATION_DATA_GENERATION_FAILED = "Failed to generate location data";

    // 路线规划错误
    public static final String INFEASIBLE = "Cannot complete all missions with the given ship capacity";
    public static final String STEP_LIMIT_EXCEEDED = "Route computation exceeded the step limit";
}
