package service.remote.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import common.consts.ErrorCodes;
import common.consts.SiteTypeEnum;
import common.exception.DuplicateOrderCodeException;
import common.exception.RemoteServiceException;
import lombok.extern.slf4j.Slf4j;
import model.dto.request.DriverAssignReq;
import model.dto.request.OrderCreateReq;
import model.dto.request.SiteFindOrCreateReq;
import model.dto.response.OrderCreateResp;
import model.dto.response.SiteFindOrCreateResp;
import model.entity.Customer;
import model.entity.Driver;
import model.entity.Location;
import model.entity.Site;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import service.remote.OrderServiceApi;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 订单服务 REST 客户端 (JSON 字段为 snake_case)
 */
@Slf4j
@Service
public class OrderServiceRestClient implements OrderServiceApi {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public OrderServiceRestClient(@Qualifier("orderServiceRestTemplate") RestTemplate restTemplate,
                                  ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Driver> listDrivers() {
        return getList("/drivers", new ParameterizedTypeReference<List<Driver>>() {});
    }

    @Override
    public List<Site> listSites() {
        return getList("/sites", new ParameterizedTypeReference<List<Site>>() {});
    }

    @Override
    public List<Location> listLocations() {
        return getList("/locations", new ParameterizedTypeReference<List<Location>>() {});
    }

    @Override
    public List<Customer> listCustomers() {
        return getList("/customers", new ParameterizedTypeReference<List<Customer>>() {});
    }

    @Override
    public SiteFindOrCreateResp findOrCreateSite(String searchText, SiteTypeEnum siteType) {
        try {
            SiteFindOrCreateResp resp = restTemplate.postForObject("/sites/find-or-create",
                    new SiteFindOrCreateReq(searchText, siteType), SiteFindOrCreateResp.class);
            if (resp != null && resp.isCreated() && resp.getSite() != null) {
                log.info("新建站点: text={}, type={}, siteId={}", searchText, siteType, resp.getSite().getId());
            }
            return resp != null ? resp : new SiteFindOrCreateResp();
        } catch (RestClientException e) {
            throw translate("/sites/find-or-create", e);
        }
    }

    @Override
    public OrderCreateResp createOrder(OrderCreateReq req) {
        OrderCreateResp resp;
        try {
            resp = restTemplate.postForObject("/orders", req, OrderCreateResp.class);
        } catch (HttpStatusCodeException e) {
            String detail = extractDetail(e);
            if (isDuplicateOrderCode(e.getStatusCode().value(), detail)) {
                throw new DuplicateOrderCodeException(req.getOrderCode(), detail, e.getStatusCode().value());
            }
            throw new RemoteServiceException(detail, e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw translate("/orders", e);
        }
        if (resp == null || resp.getId() == null) {
            throw new RemoteServiceException("订单服务返回空响应", HttpStatus.OK.value());
        }
        return resp;
    }

    @Override
    public void assignDriver(String orderId, DriverAssignReq req) {
        try {
            restTemplate.postForEntity("/orders/{orderId}/accept", req, Void.class, orderId);
        } catch (RestClientException e) {
            throw translate("/orders/" + orderId + "/accept", e);
        }
    }

    private <T> List<T> getList(String path, ParameterizedTypeReference<List<T>> type) {
        try {
            ResponseEntity<List<T>> response = restTemplate.exchange(path, HttpMethod.GET, HttpEntity.EMPTY, type);
            List<T> body = response.getBody();
            return body != null ? body : Collections.emptyList();
        } catch (RestClientException e) {
            throw translate(path, e);
        }
    }

    /**
     * 订单编号冲突：唯一键冲突 (远程把数据库错误原样带回: duplicate key ... order_code)
     * 或 409 且错误信息指向订单编号。与订单编号无关的 409 按普通远程错误处理
     */
    static boolean isDuplicateOrderCode(int status, String detail) {
        if (detail == null) return false;
        String lower = detail.toLowerCase(Locale.ROOT);
        boolean mentionsOrderCode = lower.contains("order_code") || lower.contains("order code");
        if (status == HttpStatus.CONFLICT.value()) return mentionsOrderCode;
        return lower.contains("duplicate key") && lower.contains("order_code");
    }

    private RemoteServiceException translate(String path, RestClientException e) {
        if (e instanceof HttpStatusCodeException) {
            HttpStatusCodeException httpError = (HttpStatusCodeException) e;
            String detail = extractDetail(httpError);
            log.warn("订单服务调用失败: path={}, status={}, detail={}", path, httpError.getStatusCode().value(), detail);
            return new RemoteServiceException(detail, httpError.getStatusCode().value(), e);
        }
        if (e instanceof ResourceAccessException) {
            log.warn("订单服务无法访问: path={}, error={}", path, e.getMessage());
        }
        String message = e.getMessage() != null ? e.getMessage() : ErrorCodes.UNKNOWN_REMOTE_ERROR;
        return new RemoteServiceException(message, 0, e);
    }

    /**
     * 取远程错误文本 优先 {"detail": "..."} 其次原始响应体 最后状态描述
     */
    private String extractDetail(HttpStatusCodeException e) {
        String body = e.getResponseBodyAsString();
        if (body != null && !body.isBlank()) {
            try {
                JsonNode node = objectMapper.readTree(body);
                JsonNode detail = node.get("detail");
                if (detail != null && !detail.isNull()) {
                    return detail.isTextual() ? detail.asText() : detail.toString();
                }
            } catch (JsonProcessingException parseError) {
                log.debug("订单服务错误响应不是 JSON: {}", body);
            }
            return body;
        }
        return e.getStatusText() != null && !e.getStatusText().isBlank()
                ? e.getStatusText()
                : "HTTP " + e.getStatusCode().value();
    }
}
