package com.etpassist.types.common;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 用户文本归一化：小写、去除重音、折叠空白。
 * <p>
 * 所有关键词/正则匹配都在归一化后的文本上进行，因此关键词表也应使用无重音写法。
 * </p>
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String stripped = StringUtils.stripAccents(lower);
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * 判断归一化文本中是否包含任一关键词（子串匹配）。
     */
    public static boolean containsAny(String normalized, String... keywords) {
        if (StringUtils.isEmpty(normalized) || keywords == null) {
            return false;
        }
        for (String keyword : keywords) {
            if (keyword != null && normalized.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 判断归一化文本中是否以整词形式出现任一短语。
     */
    public static boolean containsAnyWord(String normalized, String... phrases) {
        if (StringUtils.isEmpty(normalized) || phrases == null) {
            return false;
        }
        for (String phrase : phrases) {
            if (phrase == null) {
                continue;
            }
            Pattern pattern = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(phrase) + "(?![\\p{L}\\p{N}])");
            if (pattern.matcher(normalized).find()) {
                return true;
            }
        }
        return false;
    }
}
