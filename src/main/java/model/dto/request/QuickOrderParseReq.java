package model.dto.request;

import lombok.Data;

/**
 * 解析预览请求 text 为操作员粘贴的整段调度单
 */
@Data
public class QuickOrderParseReq {
    private String text;
}
