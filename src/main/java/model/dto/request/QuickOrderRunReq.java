package model.dto.request;

import lombok.Data;
import model.bo.ParsedLine;

import java.util.List;

/**
 * 批量建单请求
 * 行上未指定 customerId 的 统一使用 defaultCustomerId
 */
@Data
public class QuickOrderRunReq {
    // 批次ID 可选 用于中途取消
    private String batchId;

    private String defaultCustomerId;

    // 已解析 (可能经操作员修改) 的行
    private List<ParsedLine> lines;

    // 未传 lines 时直接解析该文本
    private String text;
}
