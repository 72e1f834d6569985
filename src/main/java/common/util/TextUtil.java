package common.util;

import java.text.Normalizer;
import java.util.Locale;

/**
 * 越南语文本处理工具
 * 粘贴来源不同 同一个带声调的字符可能是组合形式 统一转为 NFC 后再比较
 */
public final class TextUtil {

    private TextUtil() {}

    public static String nfc(String text) {
        if (text == null) return null;
        return Normalizer.normalize(text, Normalizer.Form.NFC);
    }

    /** 小写比较用 保留声调 */
    public static String lower(String text) {
        if (text == null) return "";
        return nfc(text).toLowerCase(Locale.ROOT);
    }

    /** 缓存键：去首尾空白 合并连续空白 小写 */
    public static String normalizeKey(String text) {
        if (text == null) return "";
        return lower(text).trim().replaceAll("\\s+", " ");
    }

    public static boolean isBlank(String text) {
        return text == null || text.trim().isEmpty();
    }

    /** 最后一个空白分隔的词 */
    public static String lastToken(String text) {
        if (isBlank(text)) return "";
        String[] tokens = text.trim().split("\\s+");
        return tokens[tokens.length - 1];
    }
}
