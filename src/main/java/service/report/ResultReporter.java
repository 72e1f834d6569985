package service.report;

import model.dto.response.BatchLineResult;
import model.dto.response.BatchResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 批次结果转为逐行 ✓/✗ 文本
 * 失败行原样保留远程错误信息 便于操作员修改后只重贴失败行
 */
@Component
public class ResultReporter {

    static final String OK = "✓";
    static final String FAIL = "✗";

    public List<String> render(BatchResult result) {
        List<String> report = new ArrayList<>();
        for (BatchLineResult line : result.getLines()) {
            report.add(renderLine(line));
        }
        report.add(summary(result));
        return report;
    }

    public String renderLine(BatchLineResult line) {
        if (line.isSuccess()) {
            String text = OK + " " + line.getOrderCode();
            return line.isDriverAssigned() ? text : text + " (no driver)";
        }
        return FAIL + " Line " + line.getLineNumber() + ": " + line.getErrorMessage();
    }

    public String summary(BatchResult result) {
        String text = result.successCount() + "/" + result.getLines().size() + " OK";
        return result.isCancelled() ? text + " (cancelled)" : text;
    }
}
