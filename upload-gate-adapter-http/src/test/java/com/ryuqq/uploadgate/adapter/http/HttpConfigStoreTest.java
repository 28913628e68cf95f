package com.ryuqq.uploadgate.adapter.http;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * HttpConfigStore 통합 테스트 (WireMock).
 *
 * <p>설정 로드 실패는 모두 빈 문자열로 처리되어야 합니다 (fail-open).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class HttpConfigStoreTest {

    private static final String KEY = "worker-config/blocker-config.json";
    private static final String CONFIG_PATH = "/artifactory/" + KEY;

    private WireMockServer server;
    private HttpConfigStore store;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(options().dynamicPort());
        server.start();
        store = new HttpConfigStore(new HttpAdapterConfig()
            .withPlatformBaseUrl("http://localhost:" + server.port() + "/")
            .withToken("secret-token")
            .withTimeoutMs(2000));
    }

    @AfterEach
    void tearDown() {
        if (server.isRunning()) {
            server.stop();
        }
    }

    @Test
    void 설정_문서를_읽음() {
        // given
        String body = "{\"jpds\":[{\"url\":\"a\",\"repos\":[\"r\"]}],\"action\":\"block\"}";
        server.stubFor(get(urlEqualTo(CONFIG_PATH)).willReturn(ok(body)));

        // when
        String text = store.getText(KEY);

        // then
        assertThat(text).isEqualTo(body);
        server.verify(getRequestedFor(urlEqualTo(CONFIG_PATH))
            .withHeader("Authorization", equalTo("Bearer secret-token")));
    }

    @Test
    void 문서가_없으면_빈_문자열() {
        // given
        server.stubFor(get(urlEqualTo(CONFIG_PATH)).willReturn(notFound()));

        // when & then
        assertThat(store.getText(KEY)).isEmpty();
    }

    @Test
    void 서버_오류면_빈_문자열() {
        // given
        server.stubFor(get(urlEqualTo(CONFIG_PATH)).willReturn(serverError()));

        // when & then
        assertThat(store.getText(KEY)).isEmpty();
    }

    @Test
    void 연결_실패면_빈_문자열() {
        // given
        server.stop();

        // when & then
        assertThat(store.getText(KEY)).isEmpty();
    }

    @Test
    void 빈_키는_요청_없이_빈_문자열() {
        // when & then
        assertThat(store.getText(" ")).isEmpty();
        assertThat(server.getAllServeEvents()).isEmpty();
    }
}
