package service.parse.rule;

import common.util.TimeUtil;
import model.bo.ParsedLine;
import service.parse.LineContext;
import service.parse.LineRule;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 提货日期 "Lấy 23/12"
 */
public class PickupDateRule implements LineRule {

    private static final Pattern PICKUP_DATE = Pattern.compile(
            "lấy\\s*(\\d{1,2})/(\\d{1,2})", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    @Override
    public void apply(LineContext context, ParsedLine.ParsedLineBuilder target) {
        Matcher m = PICKUP_DATE.matcher(context.getRemainder());
        if (m.find()) {
            target.pickupDate(TimeUtil.dayMonthOf(context.getYear(), m.group(1), m.group(2)));
        }
    }
}
