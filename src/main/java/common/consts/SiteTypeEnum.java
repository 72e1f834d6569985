package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 站点类型 (按需创建站点时使用)
 */
@Getter
@AllArgsConstructor
public enum SiteTypeEnum {
    PICKUP("提货点"),
    DELIVERY("送货点");

    private final String desc;
}
