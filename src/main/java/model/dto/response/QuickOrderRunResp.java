package model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * 批量建单响应 report 为逐行 ✓/✗ 文本
 */
@Data
@AllArgsConstructor
public class QuickOrderRunResp {
    private BatchResult result;
    private List<String> report;
}
