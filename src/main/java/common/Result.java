package common;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 接口统一响应 {code, msg, data}
 * HTTP 状态恒为 200 调用方按 code 判断
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Result<T> {
    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int SERVER_ERROR = 500;
    public static final int BAD_GATEWAY = 502;

    private Integer code;
    private String msg;
    private T data;

    public static <T> Result<T> success(T data) {
        return new Result<>(OK, "操作成功", data);
    }

    public static <T> Result<T> success(String msg, T data) {
        return new Result<>(OK, msg, data);
    }

    // 参数校验失败
    public static <T> Result<T> badRequest(String msg) {
        return new Result<>(BAD_REQUEST, msg, null);
    }

    public static <T> Result<T> notFound(String msg) {
        return new Result<>(NOT_FOUND, msg, null);
    }

    // 远程订单服务不可用或返回错误
    public static <T> Result<T> badGateway(String msg) {
        return new Result<>(BAD_GATEWAY, msg, null);
    }

    public static <T> Result<T> error(String msg) {
        return new Result<>(SERVER_ERROR, msg, null);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return code != null && code == OK;
    }
}
