package common.exception;

/**
 * 地点目录或距离矩阵尚未生成
 */
public class LocationDataUnavailableException extends BusinessException {

    public LocationDataUnavailableException(String message) {
        super(message);
    }

    public LocationDataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
