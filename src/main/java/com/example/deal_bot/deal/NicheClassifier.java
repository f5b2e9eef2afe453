package com.example.deal_bot.deal;

import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.example.deal_bot.pipeline.PipelineProperties;

/**
 * ニッチ（既定: ビューティ）判定。カテゴリ名・タイトル・ブランドのいずれかが語彙に含まれれば一致。
 */
@Component
public class NicheClassifier {

    private final List<String> categoryKeywords;
    private final List<String> titleKeywords;
    private final List<String> brands;

    public NicheClassifier(PipelineProperties props) {
        PipelineProperties.Niche n = props.getNiche();
        this.categoryKeywords = lower(n.getCategoryKeywords());
        this.titleKeywords = lower(n.getTitleKeywords());
        this.brands = lower(n.getBrands());
    }

    public boolean matches(Candidate c) {
        String category = lower(c.categoryName());
        String title = lower(c.title());
        String brand = lower(c.brand());

        if (!category.isEmpty() && categoryKeywords.stream().anyMatch(category::contains)) {
            return true;
        }
        if (!title.isEmpty() && titleKeywords.stream().anyMatch(title::contains)) {
            return true;
        }
        return !brand.isEmpty() && brands.stream().anyMatch(brand::contains);
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }

    private static List<String> lower(List<String> words) {
        return words.stream().map(NicheClassifier::lower).filter(w -> !w.isBlank()).toList();
    }
}
