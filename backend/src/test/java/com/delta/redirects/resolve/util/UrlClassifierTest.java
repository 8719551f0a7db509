package com.delta.redirects.resolve.util;

import com.delta.redirects.resolve.model.UrlCategory;
import com.delta.redirects.resolve.model.UrlClassification;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlClassifierTest {

    @Test
    void productUrlYieldsProductCode() {
        UrlClassification classification = UrlClassifier.classify("https://site/product/ABC-123");
        assertThat(classification.category()).isEqualTo(UrlCategory.PRODUCT);
        assertThat(classification.code()).isEqualTo("ABC-123");
        assertThat(classification.isResolvable()).isTrue();
    }

    @Test
    void trailingSlashIsStrippedOnce() {
        UrlClassification classification = UrlClassifier.classify("https://site/catalog/x/");
        assertThat(classification.category()).isEqualTo(UrlCategory.CATALOG);
        assertThat(classification.code()).isEqualTo("x");

        assertThat(UrlClassifier.classify("https://site/product/ABC//").code()).isNull();
    }

    @Test
    void unknownSectionHasCodeButNoCategory() {
        UrlClassification classification = UrlClassifier.classify("https://site/other/x");
        assertThat(classification.category()).isNull();
        assertThat(classification.code()).isEqualTo("x");
        assertThat(classification.isResolvable()).isFalse();
        assertThat(classification.decodeFailed()).isFalse();
    }

    @Test
    void productMarkerTakesPrecedence() {
        assertThat(UrlClassifier.categoryOf("https://site/catalog/product/abc")).isEqualTo(UrlCategory.PRODUCT);
        assertThat(UrlClassifier.categoryOf("https://site/products/abc")).isNull();
    }

    @Test
    void percentEncodedCodesAreDecoded() {
        assertThat(UrlClassifier.classify("https://site/product/%D0%BB%D0%B0%D0%BC%D0%BF%D0%B0").code())
            .isEqualTo("лампа");
        assertThat(UrlClassifier.classify("https://site/product/a+b").code()).isEqualTo("a+b");
        assertThat(UrlClassifier.classify("https://site/catalog/a%2Fb").code()).isEqualTo("b");
    }

    @Test
    void malformedEncodingIsReportedAsDecodeFailure() {
        UrlClassification classification = UrlClassifier.classify("https://site/product/%E0%A4%A");
        assertThat(classification.decodeFailed()).isTrue();
        assertThat(classification.category()).isNull();
        assertThat(classification.code()).isNull();
        assertThat(UrlClassifier.classify("https://site/product/%zz").decodeFailed()).isTrue();
    }

    @Test
    void escapesThatAreNotUtf8AreDecodeFailures() {
        assertThat(UrlClassifier.classify("https://site/product/AB%FF").decodeFailed()).isTrue();
        assertThat(UrlClassifier.classify("https://site/catalog/%C3").decodeFailed()).isTrue();
        assertThat(UrlClassifier.classify("https://site/catalog/%ED%A0%80").decodeFailed()).isTrue();
        assertThat(UrlClassifier.classify("https://site/product/A+B%C3%A9").code()).isEqualTo("A+Bé");
    }

    @Test
    void blankUrlIsUnclassified() {
        assertThat(UrlClassifier.classify("  ").isResolvable()).isFalse();
        assertThat(UrlClassifier.classify(null).decodeFailed()).isFalse();
    }
}
