package service.parse.rule;

import common.consts.DeliveryShiftEnum;
import common.util.TimeUtil;
import model.bo.ParsedLine;
import service.parse.LineContext;
import service.parse.LineRule;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 送货日期与班次 "giao sáng 24/12" 未写班次时为早班
 */
public class DeliveryDateRule implements LineRule {

    private static final Pattern DELIVERY_DATE = Pattern.compile(
            "giao\\s*(sáng|chiều|tối)?\\s*(\\d{1,2})/(\\d{1,2})",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    @Override
    public void apply(LineContext context, ParsedLine.ParsedLineBuilder target) {
        Matcher m = DELIVERY_DATE.matcher(context.getRemainder());
        if (m.find()) {
            target.deliveryShift(DeliveryShiftEnum.getByKeyword(m.group(1)));
            target.deliveryDate(TimeUtil.dayMonthOf(context.getYear(), m.group(2), m.group(3)));
        }
    }
}
