package service.site;

import common.util.TextUtil;
import model.bo.DispatchSnapshot;
import model.entity.Location;
import model.entity.Site;

import java.util.Locale;
import java.util.Optional;

/**
 * 解析预览用的本地站点查找 只读 不创建
 *
 * 查找顺序与订单服务 find-or-create 一致：
 * <ol>
 *   <li>站点编码与文本 (大写) 完全相同</li>
 *   <li>公司名与文本互相包含 或编码包含文本</li>
 *   <li>地区编码相同或地区名与文本互相包含 取该地区下的第一个站点</li>
 * </ol>
 * 批次执行时仍以远程结果为准。
 */
public class KnownSiteIndex {

    private final DispatchSnapshot snapshot;

    public KnownSiteIndex(DispatchSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    public Optional<Site> find(String searchText) {
        if (TextUtil.isBlank(searchText)) return Optional.empty();

        String text = TextUtil.nfc(searchText).trim();
        String upper = text.toUpperCase(Locale.ROOT);
        String lower = text.toLowerCase(Locale.ROOT);

        for (Site site : snapshot.getSites()) {
            if (site.isActive() && upper.equals(site.getCode())) {
                return Optional.of(site);
            }
        }

        for (Site site : snapshot.getSites()) {
            if (!site.isActive()) continue;
            String company = TextUtil.lower(site.getCompanyName());
            boolean companyMatch = !company.isEmpty() && (company.contains(lower) || lower.contains(company));
            boolean codeMatch = site.getCode() != null && site.getCode().contains(upper);
            if (companyMatch || codeMatch) {
                return Optional.of(site);
            }
        }

        for (Location location : snapshot.getLocations()) {
            if (Boolean.FALSE.equals(location.getIsActive())) continue;
            String name = TextUtil.lower(location.getName());
            boolean matched = upper.equals(location.getCode())
                    || (!name.isEmpty() && (name.contains(lower) || lower.contains(name)));
            if (matched) {
                return snapshot.getSites().stream()
                        .filter(Site::isActive)
                        .filter(s -> location.getId() != null && location.getId().equals(s.getLocationId()))
                        .findFirst();
            }
        }
        return Optional.empty();
    }
}
