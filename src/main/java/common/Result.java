package common;

import com.fasterxml.jackson.annotation.JsonIgnore;
import common.consts.ErrorCodes;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 响应结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Result {
    public static final int SUCCESS_CODE = 200;

    private Integer code; // 200成功 其余为失败
    private String msg;   // 消息
    private Object data;  // 数据

    // 成功 (无数据)
    public static Result success() {
        return new Result(SUCCESS_CODE, ErrorCodes.SUCCESS, null);
    }

    // 成功 (带数据)
    public static Result success(Object data) {
        return new Result(SUCCESS_CODE, ErrorCodes.SUCCESS, data);
    }

    // 成功 (带消息和数据)
    public static Result success(String msg, Object data) {
        return new Result(SUCCESS_CODE, msg, data);
    }

    // 失败 (默认 500 状态码)
    public static Result error(String msg) {
        return new Result(500, msg, null);
    }

    // 失败 (带自定义状态码和消息)
    public static Result error(Integer code, String msg) {
        return new Result(code, msg, null);
    }

    // 失败 (带状态码、消息和结构化的失败详情)
    public static Result error(Integer code, String msg, Object data) {
        return new Result(code, msg, data);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return code != null && code == SUCCESS_CODE;
    }
}
