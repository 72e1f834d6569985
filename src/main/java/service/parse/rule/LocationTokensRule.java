package service.parse.rule;

import model.bo.ParsedLine;
import service.parse.LineContext;
import service.parse.LineRule;

import java.util.ArrayList;
import java.util.List;

/**
 * 按 "-" 或 "–" 切分 第1段为提货地 第2段为送货地
 */
public class LocationTokensRule implements LineRule {

    @Override
    public void apply(LineContext context, ParsedLine.ParsedLineBuilder target) {
        List<String> parts = new ArrayList<>();
        for (String part : context.getRemainder().split("[-–]")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        if (parts.size() > 0) target.pickupText(parts.get(0));
        if (parts.size() > 1) target.deliveryText(parts.get(1));
    }
}
