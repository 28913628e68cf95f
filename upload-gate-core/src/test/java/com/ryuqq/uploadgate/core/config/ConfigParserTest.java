package com.ryuqq.uploadgate.core.config;

import com.ryuqq.uploadgate.core.model.FederationConfig;
import com.ryuqq.uploadgate.core.model.FederationTarget;
import com.ryuqq.uploadgate.core.model.RepoScope;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConfigParser 테스트.
 *
 * <p>정상 문서, 형식 오류(fail-open), 부분 오류(진단 목록) 케이스를 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ConfigParserTest {

    private final ConfigParser parser = new ConfigParser();

    // ============================================================
    // 1. 정상 문서
    // ============================================================

    @Test
    void parse_FullDocument_BuildsOrderedModel() {
        // Given
        String raw = "{\"jpds\":["
            + "{\"url\":\"jpd-a.example.com\",\"repos\":[\"libs\",{\"name\":\"r\",\"paths\":[\"immutable\",\"release\"]}]},"
            + "{\"url\":\"jpd-b.example.com\"}"
            + "],\"action\":\"block\"}";

        // When
        ConfigParseResult result = parser.parse(raw);

        // Then
        assertTrue(result.isParsed());
        ConfigParseResult.Parsed parsed = (ConfigParseResult.Parsed) result;
        assertTrue(parsed.diagnostics().isEmpty());

        FederationConfig config = parsed.config();
        assertEquals("block", config.action());
        assertEquals(2, config.targets().size());

        FederationTarget first = config.targets().get(0);
        assertEquals("jpd-a.example.com", first.url());
        assertEquals(List.of(RepoScope.wholeRepo("libs"), RepoScope.of("r", List.of("immutable", "release"))),
            first.repos());

        FederationTarget second = config.targets().get(1);
        assertEquals("jpd-b.example.com", second.url());
        assertTrue(second.matchesAnyRepo());
    }

    @Test
    void parse_RepoObjectWithoutPaths_IsWholeRepo() {
        // When
        FederationConfig config = parser.parseOrDefault(
            "{\"jpds\":[{\"url\":\"a\",\"repos\":[{\"name\":\"r\"}]}],\"action\":\"warn\"}");

        // Then
        RepoScope scope = config.targets().get(0).repos().get(0);
        assertEquals("r", scope.repoName());
        assertFalse(scope.hasPathRoots());
    }

    // ============================================================
    // 2. 형식 오류 → 기본 설정 (fail-open)
    // ============================================================

    @Test
    void parse_MalformedJson_Rejected() {
        // When
        ConfigParseResult result = parser.parse("{not json");

        // Then
        assertFalse(result.isParsed());
        assertTrue(((ConfigParseResult.Rejected) result).reason().startsWith("Malformed config JSON"));
        FederationConfig config = result.configOrDefault();
        assertTrue(config.isEmpty());
        assertEquals("warn", config.action());
    }

    @Test
    void parse_EmptyText_Rejected() {
        assertFalse(parser.parse("").isParsed());
        assertFalse(parser.parse("   ").isParsed());
        assertFalse(parser.parse(null).isParsed());
        assertEquals(FederationConfig.empty(), parser.parseOrDefault(null));
    }

    @Test
    void parse_NonObjectRoot_Rejected() {
        assertFalse(parser.parse("[1,2,3]").isParsed());
        assertFalse(parser.parse("\"text\"").isParsed());
    }

    // ============================================================
    // 3. 부분 오류 → 항목 제외 + 진단
    // ============================================================

    @Test
    void parse_TargetWithoutUrl_DroppedWithDiagnostic() {
        // Given
        String raw = "{\"jpds\":[{\"repos\":[\"r\"]},{\"url\":\"  \"},{\"url\":\"b\"}],\"action\":\"block\"}";

        // When
        ConfigParseResult.Parsed parsed = (ConfigParseResult.Parsed) parser.parse(raw);

        // Then
        assertEquals(1, parsed.config().targets().size());
        assertEquals("b", parsed.config().targets().get(0).url());
        assertEquals(List.of("jpds[0] has no url", "jpds[1] has no url"), parsed.diagnostics());
    }

    @Test
    void parse_InvalidRepoEntries_DroppedWithDiagnostic() {
        // Given
        String raw = "{\"jpds\":[{\"url\":\"a\",\"repos\":[42,{\"paths\":[\"x\"]},\"r\"]}],\"action\":\"block\"}";

        // When
        ConfigParseResult.Parsed parsed = (ConfigParseResult.Parsed) parser.parse(raw);

        // Then
        assertEquals(List.of(RepoScope.wholeRepo("r")), parsed.config().targets().get(0).repos());
        assertEquals(2, parsed.diagnostics().size());
        assertTrue(parsed.diagnostics().get(0).startsWith("jpds[0].repos[0]"));
    }

    @Test
    void parse_NonStringPaths_Dropped() {
        // Given
        String raw = "{\"jpds\":[{\"url\":\"a\",\"repos\":[{\"name\":\"r\",\"paths\":[\"ok\",7,null]}]}],\"action\":\"block\"}";

        // When
        ConfigParseResult.Parsed parsed = (ConfigParseResult.Parsed) parser.parse(raw);

        // Then
        assertEquals(List.of("ok"), parsed.config().targets().get(0).repos().get(0).pathRoots());
        assertEquals(2, parsed.diagnostics().size());
    }

    @Test
    void parse_MissingJpds_NoTargetsButActionKept() {
        // When
        ConfigParseResult.Parsed parsed = (ConfigParseResult.Parsed) parser.parse("{\"action\":\"block\"}");

        // Then
        assertTrue(parsed.config().isEmpty());
        assertEquals("block", parsed.config().action());
        assertEquals(List.of("jpds is missing or not an array"), parsed.diagnostics());
    }

    @Test
    void parse_MissingAction_NullActionWithDiagnostic() {
        // When
        ConfigParseResult.Parsed parsed = (ConfigParseResult.Parsed) parser.parse("{\"jpds\":[]}");

        // Then
        assertNull(parsed.config().action());
        assertEquals(List.of("action is missing or not a string"), parsed.diagnostics());
    }

    @Test
    void parse_UnknownAction_KeptVerbatim() {
        // When
        FederationConfig config = parser.parseOrDefault("{\"jpds\":[],\"action\":\"Block\"}");

        // Then
        assertEquals("Block", config.action());
    }
}
