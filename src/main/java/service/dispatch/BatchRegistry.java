package service.dispatch;

import common.consts.ErrorCodes;
import common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import model.bo.BatchControl;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 运行中的批次登记 供操作员按批次ID取消
 */
@Slf4j
@Component
public class BatchRegistry {

    private final Map<String, BatchControl> running = new ConcurrentHashMap<>();

    /**
     * 登记批次 未指定ID时自动生成
     */
    public BatchControl register(String batchId) {
        String id = batchId != null && !batchId.isBlank() ? batchId : UUID.randomUUID().toString();
        BatchControl control = new BatchControl(id);
        if (running.putIfAbsent(id, control) != null) {
            throw new BusinessException(ErrorCodes.BATCH_ID_IN_USE + ": " + id);
        }
        return control;
    }

    public void unregister(BatchControl control) {
        running.remove(control.getBatchId(), control);
    }

    /**
     * 取消批次
     * @return false 表示批次不存在或已结束
     */
    public boolean cancel(String batchId) {
        BatchControl control = batchId != null ? running.get(batchId) : null;
        if (control == null) return false;
        if (control.cancel()) {
            log.info("操作员取消批次: batchId={}", batchId);
        }
        return true;
    }

    public int runningCount() {
        return running.size();
    }
}
