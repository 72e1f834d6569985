package service.dispatch;

import common.config.QuickOrderProperties;
import common.consts.DeliveryShiftEnum;
import common.consts.EquipmentSizeEnum;
import common.consts.ErrorCodes;
import common.consts.LineFailureTypeEnum;
import common.consts.LineStateEnum;
import common.consts.SiteTypeEnum;
import common.exception.DuplicateOrderCodeException;
import common.util.TextUtil;
import common.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;
import model.bo.BatchControl;
import model.bo.DispatchSnapshot;
import model.bo.ParsedLine;
import model.dto.request.DriverAssignReq;
import model.dto.request.OrderCreateReq;
import model.dto.response.BatchLineResult;
import model.dto.response.BatchResult;
import model.dto.response.OrderCreateResp;
import model.entity.Driver;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import service.match.DriverMatcher;
import service.order.OrderCodeGenerator;
import service.remote.OrderServiceApi;
import service.site.SiteResolutionSession;
import service.site.SiteResolver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 批量建单编排
 *
 * 每行独立走完 解析站点 -> 建单 -> (指派司机) 任何一行失败都不影响其他行 也不回滚已成功的行。
 * 多个工作线程从同一个游标取行 每行把结果写入预分配数组中自己的下标 输出顺序即输入顺序。
 */
@Slf4j
@Service
public class BatchOrchestrator {

    private final DriverMatcher driverMatcher;
    private final SiteResolver siteResolver;
    private final OrderCodeGenerator orderCodeGenerator;
    private final OrderServiceApi orderServiceApi;
    private final BatchErrorLog errorLog;
    private final Executor executor;
    private final QuickOrderProperties properties;

    @Autowired
    public BatchOrchestrator(DriverMatcher driverMatcher,
                             SiteResolver siteResolver,
                             OrderCodeGenerator orderCodeGenerator,
                             OrderServiceApi orderServiceApi,
                             BatchErrorLog errorLog,
                             @Qualifier("quickOrderExecutor") Executor executor,
                             QuickOrderProperties properties) {
        this.driverMatcher = driverMatcher;
        this.siteResolver = siteResolver;
        this.orderCodeGenerator = orderCodeGenerator;
        this.orderServiceApi = orderServiceApi;
        this.errorLog = errorLog;
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * 执行一个批次
     *
     * @param lines    已指定客户的解析行
     * @param snapshot 司机/客户快照
     * @param control  取消句柄 取消后未开始的行记为 CANCELLED
     */
    public BatchResult run(List<ParsedLine> lines, DispatchSnapshot snapshot, BatchControl control) {
        int total = lines.size();
        BatchLineResult[] slots = new BatchLineResult[total];
        if (total == 0) {
            return new BatchResult(control.getBatchId(), new ArrayList<>(), control.isCancelled());
        }

        long start = System.currentTimeMillis();
        SiteResolutionSession siteSession = siteResolver.newSession();
        AtomicInteger cursor = new AtomicInteger();
        int workers = Math.max(1, Math.min(properties.getWorkerCount(), total));

        log.info("批次开始: batchId={}, 行数={}, 并发={}", control.getBatchId(), total, workers);

        CompletableFuture<?>[] futures = new CompletableFuture<?>[workers];
        for (int w = 0; w < workers; w++) {
            futures[w] = CompletableFuture.runAsync(() -> {
                // 取消只阻止派发新行 已取到的行会处理到终态
                while (!control.isCancelled()) {
                    int index = cursor.getAndIncrement();
                    if (index >= total) break;
                    slots[index] = processGuarded(lines.get(index), snapshot, siteSession, control.getBatchId());
                }
            }, executor);
        }
        CompletableFuture.allOf(futures).join();

        for (int i = 0; i < total; i++) {
            if (slots[i] == null) {
                slots[i] = cancelled(lines.get(i));
            }
        }

        BatchResult result = new BatchResult(control.getBatchId(), Arrays.asList(slots), control.isCancelled());
        log.info("批次结束: batchId={}, 成功={}, 失败={}, 新解析站点={}, 耗时:{}ms",
                control.getBatchId(), result.successCount(), result.failureCount(),
                siteSession.cachedCount(), System.currentTimeMillis() - start);
        return result;
    }

    /**
     * 单行处理 所有异常在此转换为行结果
     */
    BatchLineResult processLine(ParsedLine line, DispatchSnapshot snapshot,
                                SiteResolutionSession siteSession, String batchId) {
        LineStateEnum state = LineStateEnum.PENDING;
        String orderCode = null;
        try {
            if (TextUtil.isBlank(line.getCustomerId())) {
                return failed(batchId, line, null, LineFailureTypeEnum.MISSING_CUSTOMER, ErrorCodes.MISSING_CUSTOMER);
            }

            Optional<Driver> driver = driverMatcher.match(line.getDriverName(), snapshot.getDrivers());

            //  站点解析失败不终止本行 仅以原文建单
            String pickupSiteId = resolveSiteQuietly(siteSession, line, line.getPickupText(), SiteTypeEnum.PICKUP, batchId);
            String deliverySiteId = resolveSiteQuietly(siteSession, line, line.getDeliveryText(), SiteTypeEnum.DELIVERY, batchId);
            state = LineStateEnum.SITES_RESOLVED;

            //  建单
            orderCode = orderCodeGenerator.generate(customerCodeOf(line, snapshot), line.getLineNumber());
            OrderCreateResp created = orderServiceApi.createOrder(buildDraft(line, orderCode, pickupSiteId, deliverySiteId));
            state = LineStateEnum.ORDER_CREATED;
            String finalCode = created.getOrderCode() != null ? created.getOrderCode() : orderCode;

            //  指派司机 失败不影响建单结果
            boolean assigned = driver.isPresent() && assignQuietly(created.getId(), finalCode, driver.get(), line, batchId);
            if (assigned) {
                state = LineStateEnum.DRIVER_ASSIGNED;
            }

            log.debug("行处理完成: line={}, orderCode={}, 最后状态={}", line.getLineNumber(), finalCode, state);
            return BatchLineResult.builder()
                    .lineNumber(line.getLineNumber())
                    .success(true)
                    .orderCode(finalCode)
                    .orderId(created.getId())
                    .driverAssigned(assigned)
                    .state(LineStateEnum.DONE)
                    .build();
        } catch (DuplicateOrderCodeException e) {
            String code = e.getOrderCode() != null ? e.getOrderCode() : orderCode;
            return failed(batchId, line, code, LineFailureTypeEnum.DUPLICATE_ORDER_CODE,
                    ErrorCodes.DUPLICATE_ORDER_CODE + ": " + code);
        } catch (RuntimeException e) {
            log.debug("行处理失败: line={}, 失败前状态={}", line.getLineNumber(), state);
            String message = e.getMessage() != null ? e.getMessage() : ErrorCodes.UNKNOWN_REMOTE_ERROR;
            return failed(batchId, line, orderCode, LineFailureTypeEnum.REMOTE_FAILURE, message);
        }
    }

    /**
     * 兜住 processLine 未转换的 Error 每行都有结果 工作线程不提前退出
     */
    BatchLineResult processGuarded(ParsedLine line, DispatchSnapshot snapshot,
                                   SiteResolutionSession siteSession, String batchId) {
        try {
            return processLine(line, snapshot, siteSession, batchId);
        } catch (Throwable t) {
            log.error("行处理异常: batchId={}, line={}", batchId, line.getLineNumber(), t);
            String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
            return failed(batchId, line, null, LineFailureTypeEnum.REMOTE_FAILURE, message);
        }
    }

    OrderCreateReq buildDraft(ParsedLine line, String orderCode, String pickupSiteId, String deliverySiteId) {
        return OrderCreateReq.builder()
                .customerId(line.getCustomerId())
                .orderCode(orderCode)
                .pickupSiteId(pickupSiteId)
                .deliverySiteId(deliverySiteId)
                .pickupText(emptyToNull(line.getPickupText()))
                .deliveryText(emptyToNull(line.getDeliveryText()))
                .equipment(equipmentOf(line).getCode())
                .qty(1)
                .containerCode(emptyToNull(line.getContainerCode()))
                .cargoNote(emptyToNull(line.getCargoNote()))
                .customerRequestedDate(line.getDeliveryDate())
                .build();
    }

    /**
     * 提货一律按早班 送货按解析出的班次
     */
    DriverAssignReq buildAssignment(Driver driver, ParsedLine line) {
        return new DriverAssignReq(driver.getId(),
                TimeUtil.etaOf(line.getPickupDate(), DeliveryShiftEnum.MORNING),
                TimeUtil.etaOf(line.getDeliveryDate(), line.getDeliveryShift()));
    }

    private String customerCodeOf(ParsedLine line, DispatchSnapshot snapshot) {
        String code = snapshot.customerCodeOf(line.getCustomerId());
        return TextUtil.isBlank(code) ? properties.getDefaultCustomerCode() : code;
    }

    private String resolveSiteQuietly(SiteResolutionSession session, ParsedLine line, String text,
                                      SiteTypeEnum type, String batchId) {
        try {
            return session.resolveOrCreate(text, type);
        } catch (RuntimeException e) {
            log.warn("站点解析失败, 以原文建单: line={}, type={}, text={}, error={}",
                    line.getLineNumber(), type, text, e.getMessage());
            errorLog.recordNonFatal(batchId, line.getLineNumber(), null, BatchErrorLog.Stage.SITE,
                    "站点解析失败: " + text, e);
            return null;
        }
    }

    private boolean assignQuietly(String orderId, String orderCode, Driver driver, ParsedLine line, String batchId) {
        try {
            orderServiceApi.assignDriver(orderId, buildAssignment(driver, line));
            return true;
        } catch (RuntimeException e) {
            log.warn("司机指派失败, 订单已创建: orderCode={}, driverId={}, error={}",
                    orderCode, driver.getId(), e.getMessage());
            errorLog.recordNonFatal(batchId, line.getLineNumber(), orderCode, BatchErrorLog.Stage.ASSIGN,
                    "司机指派失败: " + driver.getFullName(), e);
            return false;
        }
    }

    private BatchLineResult failed(String batchId, ParsedLine line, String orderCode,
                                   LineFailureTypeEnum type, String message) {
        log.warn("行处理失败: batchId={}, line={}, type={}, message={}", batchId, line.getLineNumber(), type, message);
        errorLog.recordLineFailure(batchId, line.getLineNumber(), orderCode, type, message);
        return BatchLineResult.builder()
                .lineNumber(line.getLineNumber())
                .success(false)
                .orderCode(orderCode)
                .errorMessage(message)
                .failureType(type)
                .state(LineStateEnum.FAILED)
                .build();
    }

    private BatchLineResult cancelled(ParsedLine line) {
        return BatchLineResult.builder()
                .lineNumber(line.getLineNumber())
                .success(false)
                .errorMessage(ErrorCodes.BATCH_CANCELLED)
                .failureType(LineFailureTypeEnum.CANCELLED)
                .state(LineStateEnum.FAILED)
                .build();
    }

    private static EquipmentSizeEnum equipmentOf(ParsedLine line) {
        return line.getEquipmentSize() != null ? line.getEquipmentSize() : EquipmentSizeEnum.DEFAULT;
    }

    private static String emptyToNull(String value) {
        return TextUtil.isBlank(value) ? null : value;
    }
}
