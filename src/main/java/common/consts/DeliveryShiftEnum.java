package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalTime;
import java.util.Locale;

/**
 * 送货班次
 * keyword 为调度单中紧跟 "giao" 的越南语时段词
 */
@Getter
@AllArgsConstructor
public enum DeliveryShiftEnum {
    MORNING("sáng", LocalTime.of(8, 0)),
    AFTERNOON("chiều", LocalTime.of(13, 0)),
    EVENING("tối", LocalTime.of(18, 0));

    private final String keyword;
    // 班次对应的固定 ETA 时刻
    private final LocalTime clockTime;

    /**
     * 根据越南语时段词获取班次 未写或无法识别时为早班
     */
    public static DeliveryShiftEnum getByKeyword(String keyword) {
        if (keyword == null) return MORNING;
        String lower = keyword.trim().toLowerCase(Locale.ROOT);
        for (DeliveryShiftEnum value : values()) {
            if (value.getKeyword().equals(lower)) {
                return value;
            }
        }
        return MORNING;
    }
}
