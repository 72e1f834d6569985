package service.dispatch;

import common.consts.LineFailureTypeEnum;
import lombok.Data;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 批量建单错误日志
 * 记录行失败以及不影响结果的站点/指派失败 供操作员查询
 */
@Component
public class BatchErrorLog {

    private static final int DEFAULT_CAPACITY = 500;

    private final Deque<ErrorLogEntry> errorBuffer = new ArrayDeque<>(DEFAULT_CAPACITY);

    /**
     * 记录导致整行失败的错误
     */
    public synchronized void recordLineFailure(String batchId, int lineNumber, String orderCode,
                                               LineFailureTypeEnum failureType, String message) {
        ErrorLogEntry entry = newEntry(batchId, lineNumber, Stage.ORDER, message);
        entry.setOrderCode(orderCode);
        entry.setFailureType(failureType);
        entry.setFatal(true);
        addEntry(entry);
    }

    /**
     * 记录不影响行结果的错误 (站点解析失败 / 司机指派失败)
     */
    public synchronized void recordNonFatal(String batchId, int lineNumber, String orderCode,
                                            Stage stage, String message, Throwable cause) {
        ErrorLogEntry entry = newEntry(batchId, lineNumber, stage, message);
        entry.setOrderCode(orderCode);
        entry.setCause(cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : null);
        entry.setFatal(false);
        addEntry(entry);
    }

    /**
     * 记录接口层异常
     */
    public synchronized void recordRequestError(String message, Throwable cause) {
        ErrorLogEntry entry = newEntry(null, 0, Stage.REQUEST, message);
        entry.setCause(cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : null);
        entry.setFatal(true);
        addEntry(entry);
    }

    private ErrorLogEntry newEntry(String batchId, int lineNumber, Stage stage, String message) {
        ErrorLogEntry entry = new ErrorLogEntry();
        entry.setBatchId(batchId);
        entry.setLineNumber(lineNumber);
        entry.setStage(stage);
        entry.setMessage(message);
        entry.setTimestamp(System.currentTimeMillis());
        return entry;
    }

    private void addEntry(ErrorLogEntry entry) {
        if (errorBuffer.size() >= DEFAULT_CAPACITY) {
            errorBuffer.removeFirst();
        }
        errorBuffer.addLast(entry);
    }

    /**
     * 查询指定时间 (毫秒时间戳) 之后的错误日志
     */
    public synchronized List<ErrorLogEntry> listSince(long sinceMillis) {
        List<ErrorLogEntry> result = new ArrayList<>();
        for (ErrorLogEntry entry : errorBuffer) {
            if (entry.getTimestamp() >= sinceMillis) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * 查询某个批次的错误日志
     */
    public synchronized List<ErrorLogEntry> listByBatch(String batchId) {
        List<ErrorLogEntry> result = new ArrayList<>();
        for (ErrorLogEntry entry : errorBuffer) {
            if (batchId != null && batchId.equals(entry.getBatchId())) {
                result.add(entry);
            }
        }
        return result;
    }

    public synchronized List<ErrorLogEntry> listAll() {
        return new ArrayList<>(errorBuffer);
    }

    /**
     * 出错环节
     */
    public enum Stage {
        SITE,     // 站点解析
        ORDER,    // 建单
        ASSIGN,   // 司机指派
        REQUEST   // 接口层
    }

    /**
     * 错误日志条目
     */
    @Data
    public static class ErrorLogEntry {
        private String batchId;
        private int lineNumber;
        private String orderCode;
        private Stage stage;
        private LineFailureTypeEnum failureType;
        private String message;
        private String cause;
        private boolean fatal;     // 是否导致整行失败
        private long timestamp;
    }
}
