package common.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

/**
 * 远程订单服务 RestTemplate
 */
@Configuration
public class OrderServiceClientConfig {

    @Bean("orderServiceRestTemplate")
    public RestTemplate orderServiceRestTemplate(RestTemplateBuilder builder,
                                                 OrderServiceProperties properties,
                                                 ObjectMapper objectMapper) {
        RestTemplateBuilder configured = builder
                .rootUri(properties.getBaseUrl())
                .setConnectTimeout(properties.getConnectTimeout())
                .setReadTimeout(properties.getReadTimeout())
                .messageConverters(new MappingJackson2HttpMessageConverter(objectMapper));

        if (StringUtils.hasText(properties.getApiToken())) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiToken());
        }
        return configured.build();
    }
}
