package common.util;

import common.consts.DeliveryShiftEnum;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 调度单日期与 ETA 转换工具
 */
public final class TimeUtil {

    private TimeUtil() {}

    /**
     * 将调度单中的 "日/月" 补全为指定年份的日期
     * 非法日期 (如 31/2) 返回 null
     */
    public static LocalDate dayMonthOf(int year, String day, String month) {
        try {
            return LocalDate.of(year, Integer.parseInt(month), Integer.parseInt(day));
        } catch (DateTimeException | NumberFormatException e) {
            return null;
        }
    }

    /**
     * 日期 + 班次 -> ETA 时间点 日期为空时返回 null
     */
    public static LocalDateTime etaOf(LocalDate date, DeliveryShiftEnum shift) {
        if (date == null) return null;
        DeliveryShiftEnum actual = shift != null ? shift : DeliveryShiftEnum.MORNING;
        return date.atTime(actual.getClockTime());
    }
}
