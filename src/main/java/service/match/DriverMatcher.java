package service.match;

import common.util.TextUtil;
import model.entity.Driver;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 司机名模糊匹配
 *
 * 调度单里的司机多为简称 ("A Tuyến" 对应 "Nguyễn Văn Tuyến")。
 * 按花名册顺序返回第一个满足任一条件的司机 (忽略大小写 保留声调)：
 * <ul>
 *   <li>全名包含片段</li>
 *   <li>片段包含全名最后一个词 (越南语姓名中的名)</li>
 * </ul>
 * 多个司机同时命中时结果依赖花名册顺序 这是现有调度员习惯的行为 不做打分改造。
 * <p>
 * 与旧版前端逐字匹配的差异：空片段不匹配任何司机。旧版里空串被任何全名 "包含"
 * 会把行指派给花名册第一个司机 此处有意改为不指派。
 */
@Component
public class DriverMatcher {

    public Optional<Driver> match(String fragment, List<Driver> roster) {
        if (TextUtil.isBlank(fragment) || roster == null) return Optional.empty();

        String fragmentLower = TextUtil.lower(fragment).trim();
        for (Driver driver : roster) {
            if (TextUtil.isBlank(driver.getFullName())) continue;

            String nameLower = TextUtil.lower(driver.getFullName()).trim();
            String lastName = TextUtil.lastToken(nameLower);

            if (nameLower.contains(fragmentLower) || fragmentLower.contains(lastName)) {
                return Optional.of(driver);
            }
        }
        return Optional.empty();
    }
}
