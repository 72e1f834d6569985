package model.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import model.entity.Site;

/**
 * 站点查找或创建响应 site 为空表示远程未能匹配也未创建
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SiteFindOrCreateResp {
    private Site site;
    private boolean created;
}
