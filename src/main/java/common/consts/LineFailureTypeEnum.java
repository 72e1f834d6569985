package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 单行失败原因分类
 */
@Getter
@AllArgsConstructor
public enum LineFailureTypeEnum {
    MISSING_CUSTOMER("未指定客户"),
    DUPLICATE_ORDER_CODE("订单编号重复"),
    REMOTE_FAILURE("远程服务失败"),
    CANCELLED("批次已取消");

    private final String desc;
}
