package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 单行处理状态
 * PENDING -> SITES_RESOLVED -> ORDER_CREATED -> [DRIVER_ASSIGNED] -> DONE
 * 任意状态均可转入 FAILED
 */
@Getter
@AllArgsConstructor
public enum LineStateEnum {
    PENDING("01", "等待处理"),
    SITES_RESOLVED("02", "站点已解析"),
    ORDER_CREATED("03", "订单已创建"),
    DRIVER_ASSIGNED("04", "司机已指派"),
    DONE("05", "处理完成"),
    FAILED("06", "处理失败");

    private final String code;
    private final String desc;
}
