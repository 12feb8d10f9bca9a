package com.articlegate.core.service;

import com.articlegate.core.model.ArticleDocument;

import java.util.List;

/** 하위 분석 단계로 넘기는 텍스트 묶음 */
public final class ResearchDigest {

    static final String SEPARATOR = "---";

    private ResearchDigest() {}

    public static String render(List<ArticleDocument> docs) {
        if (docs == null || docs.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < docs.size(); i++) {
            ArticleDocument d = docs.get(i);
            if (i > 0) sb.append('\n').append(SEPARATOR).append("\n\n");
            sb.append("[source] ").append(d.sourceUrl()).append('\n');
            sb.append("[title] ").append(d.title()).append("\n\n");
            sb.append(d.text()).append('\n');
        }
        return sb.toString();
    }
}
