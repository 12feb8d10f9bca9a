package com.articlegate.core.rank;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 검색어 토큰화.
 * - 공백(전각 공백 포함) 기준 분리
 * - 토큰이 하나뿐이고 CJK 문자를 포함하며 4자 이상이면 2글자 겹침 조각(bigram)을 추가
 *   (띄어쓰기 없는 CJK 한 단어 질의가 아무것도 못 맞추는 문제 대응)
 * - 결과는 소문자, 중복 제거, 등장 순서 유지
 */
public final class QueryTokenizer {

    public static final int CJK_MIN_LENGTH = 4;
    public static final int MAX_BIGRAMS = 32;

    private static final Pattern WS = Pattern.compile("[\\s\\u3000]+");

    private QueryTokenizer() {}

    public static Set<String> tokenize(String query) {
        Set<String> out = new LinkedHashSet<>();
        if (query == null) return out;
        String q = query.strip();
        if (q.isEmpty()) return out;

        List<String> raw = new ArrayList<>();
        for (String t : WS.split(q)) {
            if (!t.isEmpty()) raw.add(t);
        }
        for (String t : raw) out.add(fold(t));

        if (raw.size() == 1) {
            String only = raw.get(0);
            if (containsCjk(only) && only.codePointCount(0, only.length()) >= CJK_MIN_LENGTH) {
                out.addAll(bigrams(fold(only)));
            }
        }
        return out;
    }

    /** 코드포인트 기준 2글자 겹침 조각, 최대 MAX_BIGRAMS 개 */
    static List<String> bigrams(String token) {
        int[] cps = token.codePoints().toArray();
        List<String> out = new ArrayList<>();
        for (int i = 0; i + 1 < cps.length && out.size() < MAX_BIGRAMS; i++) {
            out.add(new String(cps, i, 2));
        }
        return out;
    }

    static boolean containsCjk(String s) {
        return s.codePoints().anyMatch(QueryTokenizer::isCjk);
    }

    /** CJK 통합 한자(확장 A, 호환 포함), 히라가나, 가타카나(반각 포함), CJK 기호/구두점 */
    static boolean isCjk(int cp) {
        return (cp >= 0x3000 && cp <= 0x303F)      // CJK 기호와 구두점
                || (cp >= 0x3040 && cp <= 0x309F)  // 히라가나
                || (cp >= 0x30A0 && cp <= 0x30FF)  // 가타카나
                || (cp >= 0x31F0 && cp <= 0x31FF)  // 가타카나 음성 확장
                || (cp >= 0x3400 && cp <= 0x4DBF)  // 확장 A
                || (cp >= 0x4E00 && cp <= 0x9FFF)  // 통합 한자
                || (cp >= 0xF900 && cp <= 0xFAFF)  // 호환 한자
                || (cp >= 0xFF66 && cp <= 0xFF9F)  // 반각 가타카나
                || (cp >= 0x20000 && cp <= 0x2FA1F); // 확장 B 이후
    }

    static String fold(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
