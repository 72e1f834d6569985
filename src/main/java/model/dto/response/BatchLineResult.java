package model.dto.response;

import common.consts.LineFailureTypeEnum;
import common.consts.LineStateEnum;
import lombok.Builder;
import lombok.Value;

/**
 * 单行处理结果
 * success 仅取决于建单是否成功 与司机指派结果无关
 */
@Value
@Builder
public class BatchLineResult {
    int lineNumber;
    boolean success;
    String orderCode;
    String orderId;
    String errorMessage;
    LineFailureTypeEnum failureType;
    LineStateEnum state;
    boolean driverAssigned;
}
