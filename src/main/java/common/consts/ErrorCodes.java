package common.consts;

/**
 * 全局错误信息常量池
 */
public class ErrorCodes {
    // 基础错误
    public static final String SYSTEM_ERROR = "系统内部错误";

    // 单行结果信息 (直接展示给操作员)
    public static final String MISSING_CUSTOMER = "missing customer";
    public static final String DUPLICATE_ORDER_CODE = "duplicate order code";
    public static final String BATCH_CANCELLED = "batch cancelled";
    public static final String UNKNOWN_REMOTE_ERROR = "unknown error";

    // 参数错误
    public static final String EMPTY_TEXT = "调度文本为空";
    public static final String EMPTY_LINES = "没有可提交的行";
    public static final String BATCH_NOT_FOUND = "指定的批次不存在或已结束";
    public static final String BATCH_ID_IN_USE = "批次ID正在使用中";
}
