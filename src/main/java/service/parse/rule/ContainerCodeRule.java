package service.parse.rule;

import model.bo.ParsedLine;
import service.parse.LineContext;
import service.parse.LineRule;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 箱号：4位大写字母 + 7位数字 位置不固定 在整段剩余文本中查找
 */
public class ContainerCodeRule implements LineRule {

    private static final Pattern CONTAINER_CODE = Pattern.compile("[A-Z]{4}\\d{7}");

    @Override
    public void apply(LineContext context, ParsedLine.ParsedLineBuilder target) {
        Matcher m = CONTAINER_CODE.matcher(context.getRemainder());
        if (m.find()) {
            target.containerCode(m.group());
        }
    }
}
