package common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 远程订单服务连接配置
 *
 * tms.order-service.base-url
 * tms.order-service.api-token
 * tms.order-service.connect-timeout
 * tms.order-service.read-timeout
 */
@ConfigurationProperties(prefix = "tms.order-service")
@Data
public class OrderServiceProperties {

    /**
     * 订单服务根地址 (如 http://localhost:8000/api/v1)
     */
    private String baseUrl = "http://localhost:8000/api/v1";

    /**
     * 调用凭证 为空时不携带 Authorization 头
     */
    private String apiToken;

    private Duration connectTimeout = Duration.ofSeconds(3);

    private Duration readTimeout = Duration.ofSeconds(10);
}
