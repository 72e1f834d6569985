package model.bo;

import common.consts.DeliveryShiftEnum;
import common.consts.EquipmentSizeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 调度单中的一行 解析后的结构化运单
 * 字符串字段未解析到时为空串 日期/箱号等可选字段为 null
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ParsedLine {
    private int lineNumber;            // 行首序号 "185)" -> 185

    @Builder.Default
    private String driverName = "";    // 司机简称 如 "A Tuyến"
    @Builder.Default
    private String pickupText = "";    // 提货地原文
    @Builder.Default
    private String deliveryText = "";  // 送货地原文

    private String containerCode;      // 箱号 (ISO 6346 形式)
    @Builder.Default
    private EquipmentSizeEnum equipmentSize = EquipmentSizeEnum.DEFAULT;
    @Builder.Default
    private String cargoNote = "";     // 货物说明

    private LocalDate pickupDate;
    private LocalDate deliveryDate;
    @Builder.Default
    private DeliveryShiftEnum deliveryShift = DeliveryShiftEnum.MORNING;

    private String deliveryAddress;    // 送货详细地址
    private String deliveryContact;    // 收货联系人
    private String customerId;         // 由操作员指定 解析时为空
}
