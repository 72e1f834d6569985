package common.exception;

/**
 * 订单编号重复 (租户内 order_code 唯一约束冲突)
 */
public class DuplicateOrderCodeException extends RemoteServiceException {
    private final String orderCode;

    public DuplicateOrderCodeException(String orderCode, String remoteMessage, int httpStatus) {
        super(remoteMessage, httpStatus);
        this.orderCode = orderCode;
    }

    public String getOrderCode() {
        return orderCode;
    }
}
