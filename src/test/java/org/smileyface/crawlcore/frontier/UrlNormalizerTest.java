package org.smileyface.crawlcore.frontier;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class UrlNormalizerTest {

    @ParameterizedTest
    @CsvSource({
            "HTTPS://Example.COM/Path,             https://example.com/Path",
            "https://example.com,                  https://example.com/",
            "http://example.com:80/a#top,          http://example.com/a",
            "https://example.com:8443/a,           https://example.com:8443/a",
            "https://example.com/search?q=Shoes,   https://example.com/search?q=Shoes"
    })
    void normalizesSchemeHostPortAndFragment(String raw, String expected) {
        assertThat(UrlNormalizer.normalize(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "ftp://example.com/file", "/relative/path", "javascript:void(0)", "http://"})
    void rejectsWhatCannotBeCrawled(String raw) {
        assertThat(UrlNormalizer.normalize(raw)).isNull();
    }

    @Test
    void fingerprintIsStableHexSha256() {
        String fp = UrlNormalizer.fingerprint("https://example.com/");

        assertThat(fp).hasSize(64).matches("[0-9a-f]+");
        assertThat(UrlNormalizer.fingerprint("https://example.com/")).isEqualTo(fp);
        assertThat(UrlNormalizer.fingerprint("https://example.com/a")).isNotEqualTo(fp);
    }

    @Test
    void domainOfReturnsTheHost() {
        assertThat(UrlNormalizer.domainOf("https://shop.example.com:8443/a?b=c")).isEqualTo("shop.example.com");
    }
}
