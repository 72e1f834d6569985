package service.parse;

import model.bo.ParsedLine;

/**
 * 行语法规则 每条规则只负责填充一个或一组字段
 * 规则找不到对应内容时保持字段缺省值 不得抛出异常
 */
public interface LineRule {

    void apply(LineContext context, ParsedLine.ParsedLineBuilder target);
}
