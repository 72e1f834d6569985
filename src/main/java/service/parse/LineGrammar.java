package service.parse;

import common.util.TextUtil;
import lombok.extern.slf4j.Slf4j;
import model.bo.ParsedLine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import service.parse.rule.CargoNoteRule;
import service.parse.rule.ContainerCodeRule;
import service.parse.rule.DeliveryAddressRule;
import service.parse.rule.DeliveryDateRule;
import service.parse.rule.EquipmentRule;
import service.parse.rule.LocationTokensRule;
import service.parse.rule.PickupDateRule;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 调度单行语法解析器
 *
 * 每行格式: {@code 185) A Tuyến: CHÙA VẼ - An Tảo, Hưng Yên- GAOU6458814- Lấy 23/12, giao sáng 24/12- 01x40 HDPE-VN H5604F}
 *
 * 行级判定 (决定是否跳过) 由本类完成：
 * <ol>
 *   <li>日期分隔行 {@code -----23/12-----} 跳过</li>
 *   <li>不以 "数字)" 开头的行跳过 数字即行号</li>
 *   <li>")" 与第一个 ":" 之间为司机名</li>
 * </ol>
 * 字段抽取由 {@link #RULES} 按顺序执行 均作用于第一个冒号之后的剩余文本。
 * 新增规则时追加到列表末尾 后面的规则可以覆盖前面规则写入的字段。
 */
@Slf4j
@Component
public class LineGrammar {

    private static final Pattern DATE_HEADER = Pattern.compile("^-+\\d{1,2}/\\d{1,2}-+$");
    private static final Pattern LINE_NUMBER = Pattern.compile("^(\\d+)\\)");
    private static final Pattern DRIVER_NAME = Pattern.compile("\\)\\s*([^:]+):");

    /**
     * 字段规则 顺序即执行顺序
     */
    public static final List<LineRule> RULES = List.of(
            new LocationTokensRule(),
            new ContainerCodeRule(),
            new PickupDateRule(),
            new DeliveryDateRule(),
            new EquipmentRule(),
            new CargoNoteRule(),
            new DeliveryAddressRule()
    );

    private final Clock clock;

    @Autowired
    public LineGrammar(Clock clock) {
        this.clock = clock;
    }

    /**
     * 解析整段文本 不匹配语法的行直接丢弃 不视为错误
     */
    public List<ParsedLine> parse(String text) {
        List<ParsedLine> lines = new ArrayList<>();
        if (TextUtil.isBlank(text)) return lines;

        int year = LocalDate.now(clock).getYear();
        for (String raw : TextUtil.nfc(text).split("\\r?\\n")) {
            if (raw.trim().isEmpty()) continue;
            parseLine(raw, year).ifPresent(lines::add);
        }
        log.info("调度单解析完成: 有效行数={}", lines.size());
        return lines;
    }

    /**
     * 解析单行 跳过行返回 empty
     */
    public Optional<ParsedLine> parseLine(String line, int year) {
        if (isDateHeader(line)) return Optional.empty();

        Matcher numberMatcher = LINE_NUMBER.matcher(line);
        if (!numberMatcher.find()) return Optional.empty();

        try {
            ParsedLine.ParsedLineBuilder builder = ParsedLine.builder()
                    .lineNumber(Integer.parseInt(numberMatcher.group(1)));

            Matcher driverMatcher = DRIVER_NAME.matcher(line);
            if (driverMatcher.find()) {
                builder.driverName(driverMatcher.group(1).trim());
            }

            // 没有冒号时 indexOf 为 -1 剩余文本即整行
            LineContext context = new LineContext(line.substring(line.indexOf(':') + 1), year);
            for (LineRule rule : RULES) {
                rule.apply(context, builder);
            }
            return Optional.of(builder.build());
        } catch (RuntimeException e) {
            // 行号超出 int 范围等异常行 按无法解析处理
            log.warn("调度单行解析失败, 已跳过: {}", line, e);
            return Optional.empty();
        }
    }

    private boolean isDateHeader(String line) {
        return DATE_HEADER.matcher(line.replaceAll("\\s", "")).matches();
    }
}
