package common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 批量快速建单配置
 * 均有缺省值 可通过 Spring 配置文件覆盖：
 *
 * tms.quick-order.worker-count
 * tms.quick-order.default-customer-code
 * tms.quick-order.zone
 */
@ConfigurationProperties(prefix = "tms.quick-order")
@Data
public class QuickOrderProperties {

    /**
     * 单个批次并发处理的行数上限 (1 即逐行顺序处理)
     */
    private int workerCount = 4;

    /**
     * 找不到客户编码时使用的订单编号前缀
     */
    private String defaultCustomerCode = "ORD";

    /**
     * 解析日期时取 "当前年份" 所用的时区
     */
    private String zone = "Asia/Ho_Chi_Minh";

    /**
     * 共享线程池大小 (所有批次共用)
     */
    private int executorPoolSize = 8;
}
