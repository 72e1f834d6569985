package model.dto.response;

import lombok.Data;
import model.bo.ParsedLine;

/**
 * 解析预览 附带司机匹配与已知站点提示 供操作员提交前核对
 */
@Data
public class QuickOrderPreviewResp {
    private ParsedLine line;
    private String matchedDriverId;
    private String matchedDriverName;
    private String pickupSiteCode;    // 已存在的提货站点编码 为空表示将新建
    private String deliverySiteCode;  // 已存在的送货站点编码 为空表示将新建
}
