package model.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * 建单请求 (OrderDraft) 每行构建一次 提交一次 提交后不可修改
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OrderCreateReq {
    String customerId;
    String orderCode;          // 如 ADG-185
    String pickupSiteId;
    String deliverySiteId;
    String pickupText;
    String deliveryText;
    String equipment;          // 20 / 40 / 45
    @Builder.Default
    int qty = 1;
    String containerCode;
    String cargoNote;
    LocalDate customerRequestedDate;
}
