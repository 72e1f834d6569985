package service.dispatch;

import common.config.QuickOrderProperties;
import common.consts.DeliveryShiftEnum;
import common.consts.ErrorCodes;
import common.consts.LineFailureTypeEnum;
import common.consts.LineStateEnum;
import common.exception.DuplicateOrderCodeException;
import common.exception.RemoteServiceException;
import model.bo.BatchControl;
import model.bo.DispatchSnapshot;
import model.bo.ParsedLine;
import model.dto.request.DriverAssignReq;
import model.dto.request.OrderCreateReq;
import model.dto.response.BatchLineResult;
import model.dto.response.BatchResult;
import model.dto.response.OrderCreateResp;
import model.dto.response.SiteFindOrCreateResp;
import model.entity.Customer;
import model.entity.Driver;
import model.entity.Site;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import service.match.DriverMatcher;
import service.order.OrderCodeGenerator;
import service.remote.OrderServiceApi;
import service.site.SiteResolver;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * 批量建单编排测试
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("批量建单编排测试")
class BatchOrchestratorTest {

    private static final String CUSTOMER_ID = "C1";

    @Mock
    private OrderServiceApi orderServiceApi;

    private BatchErrorLog errorLog;
    private QuickOrderProperties properties;
    private DispatchSnapshot snapshot;

    @BeforeEach
    void setUp() {
        errorLog = new BatchErrorLog();
        properties = new QuickOrderProperties();
        snapshot = new DispatchSnapshot(
                List.of(new Driver("D1", "Nguyễn Văn Tuyến"), new Driver("D2", "Trần Văn Vụ")),
                List.of(new Customer(CUSTOMER_ID, "ADG", "An Dương Group")),
                List.of(), List.of());
    }

    /**
     * 同步执行器 便于断言调用顺序
     */
    private BatchOrchestrator orchestrator() {
        return orchestrator(Runnable::run);
    }

    private BatchOrchestrator orchestrator(java.util.concurrent.Executor executor) {
        return new BatchOrchestrator(new DriverMatcher(), new SiteResolver(orderServiceApi),
                new OrderCodeGenerator(), orderServiceApi, errorLog, executor, properties);
    }

    @Test
    @DisplayName("第2行订单编号重复 其余行成功")
    void testPartialFailureIsolation() {
        stubSites();
        when(orderServiceApi.createOrder(any())).thenAnswer(invocation -> {
            OrderCreateReq req = invocation.getArgument(0);
            if ("ADG-2".equals(req.getOrderCode())) {
                throw new DuplicateOrderCodeException("ADG-2", "duplicate key value violates unique constraint order_code", 500);
            }
            return new OrderCreateResp("O-" + req.getOrderCode(), req.getOrderCode());
        });

        BatchResult result = orchestrator().run(
                List.of(line(1, "A Khoa"), line(2, "A Khoa"), line(3, "A Khoa")), snapshot, new BatchControl("B1"));

        assertEquals(3, result.getLines().size());
        assertEquals(1, result.failureCount());

        BatchLineResult first = result.getLines().get(0);
        assertTrue(first.isSuccess());
        assertEquals("ADG-1", first.getOrderCode());
        assertEquals(LineStateEnum.DONE, first.getState());

        BatchLineResult second = result.getLines().get(1);
        assertFalse(second.isSuccess());
        assertEquals(2, second.getLineNumber());
        assertEquals(LineFailureTypeEnum.DUPLICATE_ORDER_CODE, second.getFailureType());
        assertTrue(second.getErrorMessage().startsWith(ErrorCodes.DUPLICATE_ORDER_CODE));
        assertEquals(LineStateEnum.FAILED, second.getState());

        BatchLineResult third = result.getLines().get(2);
        assertTrue(third.isSuccess());
        assertEquals("ADG-3", third.getOrderCode());

        assertEquals(1, errorLog.listByBatch("B1").size());
    }

    @Test
    @DisplayName("未指定客户的行直接失败 不调用远程")
    void testMissingCustomer() {
        ParsedLine noCustomer = line(5, "A Tuyến").toBuilder().customerId(null).build();

        BatchResult result = orchestrator().run(List.of(noCustomer), snapshot, new BatchControl("B2"));

        BatchLineResult entry = result.getLines().get(0);
        assertFalse(entry.isSuccess());
        assertEquals(ErrorCodes.MISSING_CUSTOMER, entry.getErrorMessage());
        assertEquals(LineFailureTypeEnum.MISSING_CUSTOMER, entry.getFailureType());
        verifyNoInteractions(orderServiceApi);
    }

    @Test
    @DisplayName("站点解析失败时仍以原文建单")
    void testSiteFailureIsNonFatal() {
        when(orderServiceApi.findOrCreateSite(anyString(), any())).thenThrow(new RemoteServiceException("site down", 503));
        when(orderServiceApi.createOrder(any())).thenReturn(new OrderCreateResp("O1", "ADG-7"));

        BatchResult result = orchestrator().run(List.of(line(7, "A Khoa")), snapshot, new BatchControl("B3"));

        assertTrue(result.getLines().get(0).isSuccess());
        ArgumentCaptor<OrderCreateReq> captor = ArgumentCaptor.forClass(OrderCreateReq.class);
        verify(orderServiceApi).createOrder(captor.capture());
        OrderCreateReq draft = captor.getValue();
        assertNull(draft.getPickupSiteId());
        assertNull(draft.getDeliverySiteId());
        assertEquals("CHÙA VẼ", draft.getPickupText());
        assertEquals("An Tảo, Hưng Yên", draft.getDeliveryText());
        assertEquals(2, errorLog.listByBatch("B3").stream().filter(e -> e.getStage() == BatchErrorLog.Stage.SITE).count());
    }

    @Test
    @DisplayName("建单请求字段")
    void testDraftFields() {
        stubSites();
        when(orderServiceApi.createOrder(any())).thenReturn(new OrderCreateResp("O1", "ADG-185"));

        orchestrator().run(List.of(line(185, "A Khoa")), snapshot, new BatchControl("B4"));

        ArgumentCaptor<OrderCreateReq> captor = ArgumentCaptor.forClass(OrderCreateReq.class);
        verify(orderServiceApi).createOrder(captor.capture());
        OrderCreateReq draft = captor.getValue();
        assertEquals(CUSTOMER_ID, draft.getCustomerId());
        assertEquals("ADG-185", draft.getOrderCode());
        assertEquals("SITE-CHÙA VẼ", draft.getPickupSiteId());
        assertEquals("SITE-An Tảo, Hưng Yên", draft.getDeliverySiteId());
        assertEquals("40", draft.getEquipment());
        assertEquals(1, draft.getQty());
        assertEquals("GAOU6458814", draft.getContainerCode());
        assertEquals("HDPE-VN H5604F", draft.getCargoNote());
        assertEquals(LocalDate.of(2026, 12, 24), draft.getCustomerRequestedDate());
    }

    @Test
    @DisplayName("匹配到司机时按班次时刻指派")
    void testDriverAssignmentEta() {
        stubSites();
        when(orderServiceApi.createOrder(any())).thenReturn(new OrderCreateResp("O1", "ADG-185"));
        ParsedLine afternoon = line(185, "A Tuyến").toBuilder().deliveryShift(DeliveryShiftEnum.AFTERNOON).build();

        BatchResult result = orchestrator().run(List.of(afternoon), snapshot, new BatchControl("B5"));

        assertTrue(result.getLines().get(0).isDriverAssigned());
        ArgumentCaptor<DriverAssignReq> captor = ArgumentCaptor.forClass(DriverAssignReq.class);
        verify(orderServiceApi).assignDriver(eq("O1"), captor.capture());
        DriverAssignReq assign = captor.getValue();
        assertEquals("D1", assign.getDriverId());
        assertEquals(LocalDateTime.of(2026, 12, 23, 8, 0), assign.getEtaPickupAt());
        assertEquals(LocalDateTime.of(2026, 12, 24, 13, 0), assign.getEtaDeliveryAt());
    }

    @Test
    @DisplayName("未匹配到司机时不调用指派")
    void testNoDriverNoAssignment() {
        stubSites();
        when(orderServiceApi.createOrder(any())).thenReturn(new OrderCreateResp("O1", "ADG-185"));

        BatchResult result = orchestrator().run(List.of(line(185, "A Khoa")), snapshot, new BatchControl("B6"));

        assertTrue(result.getLines().get(0).isSuccess());
        assertFalse(result.getLines().get(0).isDriverAssigned());
        verify(orderServiceApi, never()).assignDriver(anyString(), any());
    }

    @Test
    @DisplayName("指派失败不影响行成功")
    void testAssignmentFailureKeepsSuccess() {
        stubSites();
        when(orderServiceApi.createOrder(any())).thenReturn(new OrderCreateResp("O1", "ADG-185"));
        doThrow(new RemoteServiceException("Cannot accept order in status ASSIGNED", 400))
                .when(orderServiceApi).assignDriver(anyString(), any());

        BatchResult result = orchestrator().run(List.of(line(185, "A Vụ")), snapshot, new BatchControl("B7"));

        BatchLineResult entry = result.getLines().get(0);
        assertTrue(entry.isSuccess());
        assertFalse(entry.isDriverAssigned());
        assertEquals("ADG-185", entry.getOrderCode());
        assertEquals(1, errorLog.listByBatch("B7").stream().filter(e -> e.getStage() == BatchErrorLog.Stage.ASSIGN).count());
    }

    @Test
    @DisplayName("远程错误信息原样返回")
    void testRemoteFailureMessageVerbatim() {
        stubSites();
        when(orderServiceApi.createOrder(any())).thenThrow(new RemoteServiceException("Customer not found", 404));

        BatchLineResult entry = orchestrator().run(List.of(line(9, "A Khoa")), snapshot, new BatchControl("B8"))
                .getLines().get(0);

        assertFalse(entry.isSuccess());
        assertEquals("Customer not found", entry.getErrorMessage());
        assertEquals(LineFailureTypeEnum.REMOTE_FAILURE, entry.getFailureType());
        assertEquals("ADG-9", entry.getOrderCode());
    }

    @Test
    @DisplayName("客户不在快照中时使用缺省编码")
    void testUnknownCustomerUsesDefaultCode() {
        stubSites();
        when(orderServiceApi.createOrder(any())).thenAnswer(invocation -> {
            OrderCreateReq req = invocation.getArgument(0);
            return new OrderCreateResp("O1", req.getOrderCode());
        });
        ParsedLine other = line(42, "A Khoa").toBuilder().customerId("C-unknown").build();

        BatchLineResult entry = orchestrator().run(List.of(other), snapshot, new BatchControl("B9")).getLines().get(0);

        assertEquals("ORD-42", entry.getOrderCode());
    }

    @Test
    @DisplayName("取消后不再派发新行 已开始的行处理完")
    void testCancellationMidBatch() {
        stubSites();
        BatchControl control = new BatchControl("B10");
        when(orderServiceApi.createOrder(any())).thenAnswer(invocation -> {
            // 第一行建单时操作员取消
            control.cancel();
            OrderCreateReq req = invocation.getArgument(0);
            return new OrderCreateResp("O1", req.getOrderCode());
        });

        BatchResult result = orchestrator().run(
                List.of(line(1, "A Tuyến"), line(2, "A Tuyến"), line(3, "A Tuyến")), snapshot, control);

        assertTrue(result.isCancelled());
        assertTrue(result.getLines().get(0).isSuccess());
        assertTrue(result.getLines().get(0).isDriverAssigned(), "已开始的行走完指派");
        assertEquals(LineFailureTypeEnum.CANCELLED, result.getLines().get(1).getFailureType());
        assertEquals(LineFailureTypeEnum.CANCELLED, result.getLines().get(2).getFailureType());
        assertEquals(3, result.getLines().get(2).getLineNumber());
        verify(orderServiceApi, times(1)).createOrder(any());
    }

    @Test
    @DisplayName("已取消的批次不调用远程")
    void testCancelledBeforeStart() {
        BatchControl control = new BatchControl("B11");
        control.cancel();

        BatchResult result = orchestrator().run(List.of(line(1, "A Tuyến")), snapshot, control);

        assertEquals(1, result.getLines().size());
        assertFalse(result.getLines().get(0).isSuccess());
        verifyNoInteractions(orderServiceApi);
    }

    @Test
    @DisplayName("并发处理时结果顺序与输入一致 重复编号仍报重复")
    void testConcurrentOrderingAndDuplicates() {
        properties.setWorkerCount(4);
        stubSites();
        Set<String> existingCodes = ConcurrentHashMap.newKeySet();
        when(orderServiceApi.createOrder(any())).thenAnswer(invocation -> {
            OrderCreateReq req = invocation.getArgument(0);
            Thread.sleep(ThreadLocalRandom.current().nextInt(1, 10));
            if (!existingCodes.add(req.getOrderCode())) {
                throw new DuplicateOrderCodeException(req.getOrderCode(), "duplicate key order_code", 409);
            }
            return new OrderCreateResp("O-" + req.getOrderCode(), req.getOrderCode());
        });

        List<ParsedLine> lines = new ArrayList<>();
        for (int i = 1; i <= 20; i++) {
            lines.add(line(i, "A Khoa"));
        }
        // 两行行号相同
        lines.add(line(5, "A Khoa"));

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            BatchResult result = orchestrator(pool).run(lines, snapshot, new BatchControl("B12"));

            assertEquals(21, result.getLines().size());
            for (int i = 0; i < 20; i++) {
                assertEquals(i + 1, result.getLines().get(i).getLineNumber());
            }
            assertEquals(5, result.getLines().get(20).getLineNumber());

            long duplicates = result.getLines().stream()
                    .filter(r -> r.getFailureType() == LineFailureTypeEnum.DUPLICATE_ORDER_CODE)
                    .count();
            assertEquals(1, duplicates);
            assertEquals(20, result.successCount());
        } finally {
            pool.shutdown();
        }
    }

    @Test
    @DisplayName("建单抛出 Error 只影响本行")
    @Timeout(10)
    void testErrorIsolatedToLine() {
        stubSites();
        when(orderServiceApi.createOrder(any())).thenAnswer(invocation -> {
            OrderCreateReq req = invocation.getArgument(0);
            if ("ADG-2".equals(req.getOrderCode())) {
                throw new StackOverflowError("boom");
            }
            return new OrderCreateResp("O-" + req.getOrderCode(), req.getOrderCode());
        });

        BatchResult result = orchestrator().run(
                List.of(line(1, "A Khoa"), line(2, "A Khoa"), line(3, "A Khoa")), snapshot, new BatchControl("B14"));

        assertEquals(3, result.getLines().size());
        assertTrue(result.getLines().get(0).isSuccess());
        BatchLineResult failed = result.getLines().get(1);
        assertFalse(failed.isSuccess());
        assertEquals("boom", failed.getErrorMessage());
        assertEquals(LineStateEnum.FAILED, failed.getState());
        assertTrue(result.getLines().get(2).isSuccess());
    }

    @Test
    @DisplayName("站点解析抛出 Error 时并发批次不挂起")
    @Timeout(10)
    void testSiteErrorDoesNotHangBatch() {
        properties.setWorkerCount(4);
        when(orderServiceApi.findOrCreateSite(anyString(), any())).thenAnswer(invocation -> {
            Thread.sleep(50);
            throw new StackOverflowError("site boom");
        });

        List<ParsedLine> lines = new ArrayList<>();
        for (int i = 1; i <= 8; i++) {
            lines.add(line(i, "A Khoa"));
        }

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            BatchResult result = orchestrator(pool).run(lines, snapshot, new BatchControl("B15"));

            assertEquals(8, result.getLines().size());
            assertEquals(0, result.successCount());
            result.getLines().forEach(r -> assertEquals(LineFailureTypeEnum.REMOTE_FAILURE, r.getFailureType()));
            verify(orderServiceApi, never()).createOrder(any());
        } finally {
            pool.shutdown();
        }
    }

    @Test
    @DisplayName("空批次")
    void testEmptyBatch() {
        BatchResult result = orchestrator().run(List.of(), snapshot, new BatchControl("B13"));
        assertTrue(result.getLines().isEmpty());
        verifyNoInteractions(orderServiceApi);
    }

    private void stubSites() {
        when(orderServiceApi.findOrCreateSite(anyString(), any())).thenAnswer(invocation -> {
            String text = invocation.getArgument(0);
            SiteFindOrCreateResp resp = new SiteFindOrCreateResp();
            resp.setSite(new Site("SITE-" + text, text, text, "L1", "PICKUP", "ACTIVE"));
            return resp;
        });
    }

    private static ParsedLine line(int lineNumber, String driverName) {
        return ParsedLine.builder()
                .lineNumber(lineNumber)
                .driverName(driverName)
                .pickupText("CHÙA VẼ")
                .deliveryText("An Tảo, Hưng Yên")
                .containerCode("GAOU6458814")
                .cargoNote("HDPE-VN H5604F")
                .pickupDate(LocalDate.of(2026, 12, 23))
                .deliveryDate(LocalDate.of(2026, 12, 24))
                .customerId(CUSTOMER_ID)
                .build();
    }
}
