package com.ryuqq.uploadgate.adapter.http;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HttpAdapterConfig 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class HttpAdapterConfigTest {

    @Test
    void 기본값() {
        // when
        HttpAdapterConfig config = new HttpAdapterConfig();

        // then
        assertThat(config.platformBaseUrl()).isEqualTo("http://localhost:8082");
        assertThat(config.searchScheme()).isEqualTo("https");
        assertThat(config.hasToken()).isFalse();
        assertThat(config.timeoutMs()).isEqualTo(10000);
    }

    @Test
    void 끝의_슬래시는_제거() {
        assertThat(new HttpAdapterConfig().withPlatformBaseUrl("http://jpd:8082/").platformBaseUrl())
            .isEqualTo("http://jpd:8082");
    }

    @Test
    void toString은_토큰을_가림() {
        assertThat(new HttpAdapterConfig().withToken("secret").toString())
            .doesNotContain("secret")
            .contains("****");
    }

    @Test
    void 잘못된_값은_예외() {
        assertThatThrownBy(() -> new HttpAdapterConfig().withSearchScheme("ftp"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("searchScheme");
        assertThatThrownBy(() -> new HttpAdapterConfig().withTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HttpAdapterConfig().withPlatformBaseUrl(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
