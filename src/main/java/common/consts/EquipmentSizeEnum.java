package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 集装箱尺寸 (尺)
 */
@Getter
@AllArgsConstructor
public enum EquipmentSizeEnum {
    TWENTY("20", "20尺箱"),
    FORTY("40", "40尺箱"),
    FORTY_FIVE("45", "45尺箱");

    // 未写箱型时的缺省尺寸
    public static final EquipmentSizeEnum DEFAULT = FORTY;

    private final String code;
    private final String desc;

    //  根据 code 获取枚举对象
    public static EquipmentSizeEnum getByCode(String code) {
        for (EquipmentSizeEnum value : values()) {
            if (value.getCode().equals(code)) {
                return value;
            }
        }
        return null;
    }
}
