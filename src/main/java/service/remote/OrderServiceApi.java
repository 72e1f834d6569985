package service.remote;

import common.consts.SiteTypeEnum;
import model.dto.request.DriverAssignReq;
import model.dto.request.OrderCreateReq;
import model.dto.response.OrderCreateResp;
import model.dto.response.SiteFindOrCreateResp;
import model.entity.Customer;
import model.entity.Driver;
import model.entity.Location;
import model.entity.Site;

import java.util.List;

/**
 * 远程订单服务接口
 * 调用失败统一抛出 {@link common.exception.RemoteServiceException}
 */
public interface OrderServiceApi {

    /** 快照 司机花名册 */
    List<Driver> listDrivers();

    /** 快照 站点 */
    List<Site> listSites();

    /** 快照 地区 */
    List<Location> listLocations();

    /** 快照 客户 */
    List<Customer> listCustomers();

    /** 按文本查找站点 找不到时由远程新建 */
    SiteFindOrCreateResp findOrCreateSite(String searchText, SiteTypeEnum siteType);

    /**
     * 建单
     * @throws common.exception.DuplicateOrderCodeException 订单编号已存在
     */
    OrderCreateResp createOrder(OrderCreateReq req);

    /** 接单并指派司机与 ETA */
    void assignDriver(String orderId, DriverAssignReq req);
}
