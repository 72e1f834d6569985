package service;

import common.consts.ErrorCodes;
import common.exception.BusinessException;
import common.util.TextUtil;
import lombok.extern.slf4j.Slf4j;
import model.bo.BatchControl;
import model.bo.DispatchSnapshot;
import model.bo.ParsedLine;
import model.dto.request.QuickOrderRunReq;
import model.dto.response.BatchResult;
import model.dto.response.QuickOrderPreviewResp;
import model.dto.response.QuickOrderRunResp;
import model.entity.Driver;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import service.dispatch.BatchOrchestrator;
import service.dispatch.BatchRegistry;
import service.match.DriverMatcher;
import service.parse.LineGrammar;
import service.report.ResultReporter;
import service.site.KnownSiteIndex;
import service.sync.RosterSnapshotService;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 快速建单服务
 * 负责连接 Controller 与 解析/编排/报告 各组件
 */
@Service
@Slf4j
public class QuickOrderService {

    private final LineGrammar lineGrammar;
    private final DriverMatcher driverMatcher;
    private final RosterSnapshotService snapshotService;
    private final BatchOrchestrator orchestrator;
    private final BatchRegistry batchRegistry;
    private final ResultReporter resultReporter;

    @Autowired
    public QuickOrderService(LineGrammar lineGrammar,
                             DriverMatcher driverMatcher,
                             RosterSnapshotService snapshotService,
                             BatchOrchestrator orchestrator,
                             BatchRegistry batchRegistry,
                             ResultReporter resultReporter) {
        this.lineGrammar = lineGrammar;
        this.driverMatcher = driverMatcher;
        this.snapshotService = snapshotService;
        this.orchestrator = orchestrator;
        this.batchRegistry = batchRegistry;
        this.resultReporter = resultReporter;
    }

    /**
     * 解析预览 不产生任何远程写操作
     */
    public List<QuickOrderPreviewResp> preview(String text) {
        if (TextUtil.isBlank(text)) throw new BusinessException(ErrorCodes.EMPTY_TEXT);

        List<ParsedLine> lines = lineGrammar.parse(text);
        DispatchSnapshot snapshot = snapshotService.loadSnapshot();
        KnownSiteIndex siteIndex = new KnownSiteIndex(snapshot);

        List<QuickOrderPreviewResp> previews = new ArrayList<>();
        for (ParsedLine line : lines) {
            QuickOrderPreviewResp preview = new QuickOrderPreviewResp();
            preview.setLine(line);

            Optional<Driver> driver = driverMatcher.match(line.getDriverName(), snapshot.getDrivers());
            driver.ifPresent(d -> {
                preview.setMatchedDriverId(d.getId());
                preview.setMatchedDriverName(d.getFullName());
            });
            siteIndex.find(line.getPickupText()).ifPresent(s -> preview.setPickupSiteCode(s.getCode()));
            siteIndex.find(line.getDeliveryText()).ifPresent(s -> preview.setDeliverySiteCode(s.getCode()));
            previews.add(preview);
        }
        return previews;
    }

    /**
     * 执行批量建单
     */
    public QuickOrderRunResp run(QuickOrderRunReq req) {
        List<ParsedLine> lines = req.getLines();
        if (lines == null || lines.isEmpty()) {
            lines = TextUtil.isBlank(req.getText()) ? List.of() : lineGrammar.parse(req.getText());
        }
        if (lines.isEmpty()) throw new BusinessException(ErrorCodes.EMPTY_LINES);

        List<ParsedLine> assigned = applyCustomer(lines, req.getDefaultCustomerId());
        DispatchSnapshot snapshot = snapshotService.loadSnapshot();

        BatchControl control = batchRegistry.register(req.getBatchId());
        try {
            BatchResult result = orchestrator.run(assigned, snapshot, control);
            return new QuickOrderRunResp(result, resultReporter.render(result));
        } finally {
            batchRegistry.unregister(control);
        }
    }

    public boolean cancel(String batchId) {
        return batchRegistry.cancel(batchId);
    }

    /**
     * "所有行使用同一客户" 与 "逐行指定客户" 在此合并：行上已有客户的保留 其余使用缺省客户
     */
    static List<ParsedLine> applyCustomer(List<ParsedLine> lines, String defaultCustomerId) {
        List<ParsedLine> result = new ArrayList<>(lines.size());
        for (ParsedLine line : lines) {
            if (TextUtil.isBlank(line.getCustomerId()) && !TextUtil.isBlank(defaultCustomerId)) {
                result.add(line.toBuilder().customerId(defaultCustomerId).build());
            } else {
                result.add(line);
            }
        }
        return result;
    }
}
