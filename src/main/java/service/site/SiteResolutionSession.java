package service.site;

import common.consts.SiteTypeEnum;
import common.util.TextUtil;
import lombok.extern.slf4j.Slf4j;
import model.dto.response.SiteFindOrCreateResp;
import service.remote.OrderServiceApi;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 单批次站点解析会话
 *
 * 缓存键为规范化文本 (去空白 小写 NFC)。
 * 同一文本被多个工作线程同时解析时 只有第一个线程发起远程调用 其余线程等待它的结果。
 * 远程调用失败不进缓存 下一次出现同一文本时重新调用。
 */
@Slf4j
public class SiteResolutionSession {

    private final OrderServiceApi orderServiceApi;
    // 规范化文本 -> 站点ID (远程未返回站点时为 null)
    private final ConcurrentMap<String, CompletableFuture<String>> cache = new ConcurrentHashMap<>();

    SiteResolutionSession(OrderServiceApi orderServiceApi) {
        this.orderServiceApi = orderServiceApi;
    }

    /**
     * 查找或创建站点
     *
     * @return 站点ID 空文本或远程未返回站点时为 null
     * @throws common.exception.RemoteServiceException 远程调用失败
     */
    public String resolveOrCreate(String searchText, SiteTypeEnum siteType) {
        if (TextUtil.isBlank(searchText)) return null;

        String key = TextUtil.normalizeKey(searchText);
        CompletableFuture<String> mine = new CompletableFuture<>();
        CompletableFuture<String> existing = cache.putIfAbsent(key, mine);
        if (existing != null) {
            return await(existing);
        }

        try {
            SiteFindOrCreateResp resp = orderServiceApi.findOrCreateSite(searchText.trim(), siteType);
            String siteId = resp.getSite() != null ? resp.getSite().getId() : null;
            mine.complete(siteId);
            return siteId;
        } catch (RuntimeException | Error e) {
            // 等待同一文本的线程必须被唤醒 否则整个批次挂起
            cache.remove(key, mine);
            mine.completeExceptionally(e);
            throw e;
        }
    }

    public int cachedCount() {
        return cache.size();
    }

    private String await(CompletableFuture<String> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            if (e.getCause() instanceof Error) {
                throw (Error) e.getCause();
            }
            throw e;
        }
    }
}
