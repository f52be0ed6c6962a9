package com.sitedigest.core.classify;

import com.sitedigest.core.model.Category;
import com.sitedigest.core.model.ExtractedPage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CategorizerTest {

    private final Categorizer categorizer = new Categorizer();

    private static ExtractedPage page(String url, String title, String h1, String meta, String... headings) {
        return new ExtractedPage(url, title, meta, h1, List.of(headings), "", null);
    }

    private static ExtractedPage blank(String url) {
        return page(url, "", "", "");
    }

    @Test
    void pricing_path_without_content_keywords() {
        assertThat(categorizer.categorize(blank("https://acme.test/pricing"))).isEqualTo(Category.PRICING);
    }

    @Test
    @DisplayName("짧은 알파벳 경로(로케일)는 홈")
    void short_locale_prefix_is_home() {
        assertThat(categorizer.categorize(blank("https://acme.test/fr"))).isEqualTo(Category.HOME);
        assertThat(categorizer.categorize(blank("https://acme.test/de/"))).isEqualTo(Category.HOME);
        assertThat(categorizer.categorize(blank("https://acme.test/v2"))).isNotEqualTo(Category.HOME);
    }

    @ParameterizedTest
    @CsvSource({
            "https://acme.test, home",
            "https://acme.test/index.html, home",
            "https://acme.test/Pricing/, pricing",
            "https://acme.test/fr/pricing, pricing",
            "https://acme.test/pricing-features, pricing",
            "https://acme.test/customers/case-studies, case-study",
            "https://acme.test/legal/privacy, legal",
            "https://acme.test/careers, careers",
            "https://acme.test/developers, api"
    })
    void url_keywords_classify_in_table_order(String url, String slug) {
        assertThat(categorizer.categorize(blank(url)).slug()).isEqualTo(slug);
    }

    @Test
    void homepage_wins_over_content_keywords() {
        ExtractedPage p = page("https://acme.test/", "Pricing plans", "Simple pricing", "Plans per month");
        assertThat(categorizer.categorize(p)).isEqualTo(Category.HOME);
    }

    @Test
    void content_keywords_apply_when_path_is_silent() {
        ExtractedPage p = page("https://acme.test/company", "Acme", "Who we are", "");
        assertThat(categorizer.categorize(p)).isEqualTo(Category.ABOUT);

        ExtractedPage q = page("https://acme.test/start", "", "", "", "Frequently asked questions");
        assertThat(categorizer.categorize(q)).isEqualTo(Category.FAQ);
    }

    @Test
    void product_segment_prefixes_are_the_last_resort() {
        assertThat(categorizer.categorize(blank("https://acme.test/why-acme"))).isEqualTo(Category.PRODUCT);
        assertThat(categorizer.categorize(blank("https://acme.test/en/demo-video"))).isEqualTo(Category.PRODUCT);
        assertThat(categorizer.categorize(blank("https://acme.test/something"))).isEqualTo(Category.OTHER);
    }

    @Test
    void classification_is_deterministic() {
        ExtractedPage p = page("https://acme.test/company", "Our story", "", "Founded in 2012");
        Category first = categorizer.categorize(p);
        for (int i = 0; i < 5; i++) {
            assertThat(categorizer.categorize(p)).isEqualTo(first);
        }
        assertThat(categorizer.categorize("https://acme.test/company", p)).isEqualTo(first);
    }
}
