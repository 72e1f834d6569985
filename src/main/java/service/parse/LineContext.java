package service.parse;

import lombok.Value;

/**
 * 单行解析上下文
 */
@Value
public class LineContext {
    // 司机名后第一个冒号之后的文本
    String remainder;
    // 补全 "日/月" 时使用的年份
    int year;
}
