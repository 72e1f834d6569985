package service.sync;

import lombok.extern.slf4j.Slf4j;
import model.bo.DispatchSnapshot;
import model.entity.Customer;
import model.entity.Driver;
import model.entity.Location;
import model.entity.Site;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import service.remote.OrderServiceApi;

import java.util.List;

/**
 * 批次开始前从订单服务拉取全量快照
 */
@Service
@Slf4j
public class RosterSnapshotService {

    private final OrderServiceApi orderServiceApi;

    @Autowired
    public RosterSnapshotService(OrderServiceApi orderServiceApi) {
        this.orderServiceApi = orderServiceApi;
    }

    /**
     * 拉取司机 客户 站点 地区 任一失败则整体失败 (批次尚未开始 不会产生副作用)
     */
    public DispatchSnapshot loadSnapshot() {
        long start = System.currentTimeMillis();

        List<Driver> drivers = orderServiceApi.listDrivers();
        List<Customer> customers = orderServiceApi.listCustomers();
        List<Site> sites = orderServiceApi.listSites();
        List<Location> locations = orderServiceApi.listLocations();

        DispatchSnapshot snapshot = new DispatchSnapshot(drivers, customers, sites, locations);

        long cost = System.currentTimeMillis() - start;
        log.info("快照同步完成! 耗时:{}ms. Driver[{}], Customer[{}], Site[{}], Location[{}]",
                cost,
                snapshot.getDrivers().size(),
                snapshot.getCustomerMap().size(),
                snapshot.getSites().size(),
                snapshot.getLocations().size());
        return snapshot;
    }
}
