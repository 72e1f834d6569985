package service.site;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import service.remote.OrderServiceApi;

/**
 * 站点解析
 * 站点的匹配与创建规则由远程服务负责 本地只保证同一批次内相同文本只调用一次
 */
@Component
public class SiteResolver {

    private final OrderServiceApi orderServiceApi;

    @Autowired
    public SiteResolver(OrderServiceApi orderServiceApi) {
        this.orderServiceApi = orderServiceApi;
    }

    /**
     * 每个批次开启一个新会话 缓存不跨批次
     */
    public SiteResolutionSession newSession() {
        return new SiteResolutionSession(orderServiceApi);
    }
}
