package service.order;

import org.springframework.stereotype.Component;

/**
 * 订单编号生成 "{客户编码}-{行号}" 如 ADG-185
 * 同客户同行号必然得到同一编号 重复由建单接口的唯一约束拦截
 */
@Component
public class OrderCodeGenerator {

    public String generate(String customerCode, int lineNumber) {
        return customerCode + "-" + lineNumber;
    }
}
