package service.parse.rule;

import model.bo.ParsedLine;
import service.parse.LineContext;
import service.parse.LineRule;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 行尾 ": 地址 (联系人)" 括号未闭合时不抽取
 */
public class DeliveryAddressRule implements LineRule {

    private static final Pattern ADDRESS = Pattern.compile(":\\s*([^(]+)\\s*\\(([^)]+)\\)\\s*$");

    @Override
    public void apply(LineContext context, ParsedLine.ParsedLineBuilder target) {
        Matcher m = ADDRESS.matcher(context.getRemainder());
        if (m.find()) {
            target.deliveryAddress(m.group(1).trim());
            target.deliveryContact(m.group(2).trim());
        }
    }
}
