package service.parse.rule;

import common.consts.EquipmentSizeEnum;
import model.bo.ParsedLine;
import service.parse.LineContext;
import service.parse.LineRule;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 箱型 "01x40" 取尺寸部分 未写或不认识的尺寸按 40 尺
 */
public class EquipmentRule implements LineRule {

    static final Pattern EQUIPMENT = Pattern.compile("(\\d+)x(\\d{2})");

    @Override
    public void apply(LineContext context, ParsedLine.ParsedLineBuilder target) {
        Matcher m = EQUIPMENT.matcher(context.getRemainder());
        if (m.find()) {
            EquipmentSizeEnum size = EquipmentSizeEnum.getByCode(m.group(2));
            target.equipmentSize(size != null ? size : EquipmentSizeEnum.DEFAULT);
        }
    }
}
