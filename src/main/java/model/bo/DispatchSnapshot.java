package model.bo;

import lombok.Getter;
import model.entity.Customer;
import model.entity.Driver;
import model.entity.Location;
import model.entity.Site;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 批次开始前拉取的只读快照：司机花名册 客户 站点 地区
 * 每个批次持有自己的快照 不在批次间共享可变状态
 */
@Getter
public class DispatchSnapshot {

    // 保持远程返回顺序 司机匹配依赖该顺序
    private final List<Driver> drivers;
    private final Map<String, Customer> customerMap;
    private final List<Site> sites;
    private final List<Location> locations;

    public DispatchSnapshot(List<Driver> drivers, List<Customer> customers,
                            List<Site> sites, List<Location> locations) {
        this.drivers = drivers != null ? List.copyOf(drivers) : Collections.emptyList();
        this.sites = sites != null ? List.copyOf(sites) : Collections.emptyList();
        this.locations = locations != null ? List.copyOf(locations) : Collections.emptyList();

        Map<String, Customer> map = new LinkedHashMap<>();
        if (customers != null) {
            for (Customer c : customers) {
                if (c.getId() != null) {
                    map.put(c.getId(), c);
                }
            }
        }
        this.customerMap = Collections.unmodifiableMap(map);
    }

    public static DispatchSnapshot empty() {
        return new DispatchSnapshot(null, null, null, null);
    }

    /**
     * 根据客户ID取客户编码 找不到时返回 null
     */
    public String customerCodeOf(String customerId) {
        if (customerId == null) return null;
        Customer customer = customerMap.get(customerId);
        return customer != null ? customer.getCode() : null;
    }
}
