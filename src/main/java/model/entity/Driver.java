package model.entity;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import common.consts.DriverSourceEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 司机 (只读 由司机花名册服务维护)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Driver {
    private String id;

    @JsonAlias("name")
    private String fullName;        // 全名 如 Nguyễn Văn Tuyến
    private String shortName;       // 简称
    private String phone;
    private DriverSourceEnum source;

    public Driver(String id, String fullName) {
        this.id = id;
        this.fullName = fullName;
    }
}
