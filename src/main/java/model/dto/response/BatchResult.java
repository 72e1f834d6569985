package model.dto.response;

import lombok.Value;

import java.util.List;

/**
 * 批次结果 与输入行一一对应 顺序与输入一致
 */
@Value
public class BatchResult {
    String batchId;
    List<BatchLineResult> lines;
    boolean cancelled;

    public long successCount() {
        return lines.stream().filter(BatchLineResult::isSuccess).count();
    }

    public long failureCount() {
        return lines.size() - successCount();
    }

    public boolean isAllSuccess() {
        return !lines.isEmpty() && failureCount() == 0;
    }
}
