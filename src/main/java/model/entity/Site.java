package model.entity;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 站点 提/送货的标准物理地点
 * (companyName, locationId) 唯一确定一个站点
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Site {
    private String id;
    private String code;          // 站点编码
    private String companyName;   // 公司/站点名称
    private String locationId;    // 所属地区
    private String siteType;      // PICKUP / DELIVERY / CUSTOMER ...
    private String status;        // ACTIVE / INACTIVE

    public boolean isActive() {
        return status == null || "ACTIVE".equalsIgnoreCase(status);
    }
}
