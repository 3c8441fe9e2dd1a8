package common.exception;

/**
 * 距离查询时地点不在距离索引中
 * 调用方应在规划前完成地点校验，正常流程不会抛出
 */
public class UnknownLocationException extends BusinessException {
    private final String locationName;

    public UnknownLocationException(String locationName) {
        super("未知地点: " + locationName);
        this.locationName = locationName;
    }

    public String getLocationName() {
        return locationName;
    }
}
