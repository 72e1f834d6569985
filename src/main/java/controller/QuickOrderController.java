package controller;

import common.Result;
import common.consts.ErrorCodes;
import lombok.extern.slf4j.Slf4j;
import model.dto.request.QuickOrderParseReq;
import model.dto.request.QuickOrderRunReq;
import model.dto.response.QuickOrderPreviewResp;
import model.dto.response.QuickOrderRunResp;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.QuickOrderService;
import service.dispatch.BatchErrorLog;

import java.util.List;

/**
 * 快速建单接口 (粘贴调度单 -> 批量建单)
 */
@RestController
@RequestMapping("/quick-orders")
@Slf4j
public class QuickOrderController {

    private final QuickOrderService quickOrderService;
    private final BatchErrorLog errorLog;

    @Autowired
    public QuickOrderController(QuickOrderService quickOrderService, BatchErrorLog errorLog) {
        this.quickOrderService = quickOrderService;
        this.errorLog = errorLog;
    }

    // 解析预览: POST /quick-orders/parse
    @PostMapping("/parse")
    public Result<List<QuickOrderPreviewResp>> parse(@RequestBody QuickOrderParseReq req) {
        List<QuickOrderPreviewResp> previews = quickOrderService.preview(req.getText());
        return Result.success("解析完成", previews);
    }

    // 批量建单: POST /quick-orders/run
    @PostMapping("/run")
    public Result<QuickOrderRunResp> run(@RequestBody QuickOrderRunReq req) {
        log.info("收到批量建单请求, batchId: {}, 行数: {}", req.getBatchId(),
                req.getLines() != null ? req.getLines().size() : 0);
        QuickOrderRunResp resp = quickOrderService.run(req);
        return Result.success(resp.getResult().isAllSuccess() ? "全部成功" : "部分行失败", resp);
    }

    /**
     * 取消运行中的批次 已在处理的行会处理完当前步骤
     */
    @PostMapping("/{batchId}/cancel")
    public Result<String> cancel(@PathVariable String batchId) {
        if (!quickOrderService.cancel(batchId)) {
            return Result.notFound(ErrorCodes.BATCH_NOT_FOUND);
        }
        return Result.success("已取消", batchId);
    }

    /**
     * 查询错误日志 since 为毫秒时间戳 batchId 优先
     */
    @GetMapping("/errors")
    public Result<List<BatchErrorLog.ErrorLogEntry>> errors(@RequestParam(required = false) Long since,
                         @RequestParam(required = false) String batchId) {
        if (batchId != null) {
            return Result.success(errorLog.listByBatch(batchId));
        }
        return Result.success(since != null ? errorLog.listSince(since) : errorLog.listAll());
    }
}
