package service.parse.rule;

import model.bo.ParsedLine;
import service.parse.LineContext;
import service.parse.LineRule;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 货物说明：箱型之后到第一个 "(" 之前
 * 去掉末尾的 "; giao ..." 送货子句和多余分号
 */
public class CargoNoteRule implements LineRule {

    private static final Pattern CARGO = Pattern.compile("\\d+x\\d{2}\\s+([^(]+)");
    private static final Pattern TRAILING_DELIVERY = Pattern.compile(
            ";\\s*giao\\s+.*$", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern TRAILING_SEMICOLON = Pattern.compile(";\\s*$");

    @Override
    public void apply(LineContext context, ParsedLine.ParsedLineBuilder target) {
        Matcher m = CARGO.matcher(context.getRemainder());
        if (!m.find()) return;

        String note = m.group(1).trim();
        note = TRAILING_DELIVERY.matcher(note).replaceFirst("");
        note = TRAILING_SEMICOLON.matcher(note).replaceFirst("");
        target.cargoNote(note.trim());
    }
}
