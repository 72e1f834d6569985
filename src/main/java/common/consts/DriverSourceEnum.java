package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 司机来源
 */
@Getter
@AllArgsConstructor
public enum DriverSourceEnum {
    INTERNAL("自有司机"),
    EXTERNAL("外协司机");

    private final String desc;
}
