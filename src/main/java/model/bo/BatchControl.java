package model.bo;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 批次控制句柄
 * 取消后不再派发新行 已在处理中的行会走完当前步骤
 */
public class BatchControl {

    private final String batchId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public BatchControl(String batchId) {
        this.batchId = batchId;
    }

    public String getBatchId() {
        return batchId;
    }

    /**
     * @return true 表示本次调用触发了取消
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
