package com.docverify.service.impl;

import com.docverify.exception.DocVerifyException;
import com.docverify.model.Assertion;
import com.docverify.model.AssertionKind;
import com.docverify.model.Severity;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssertionResponseParserTest {

    private final AssertionResponseParser parser = new AssertionResponseParser(Jackson2ObjectMapperBuilder.json()
            .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS).build());

    @Test
    void parse_shouldAcceptFencedArrayOfMixedKinds() {
        String raw = """
                ```json
                [
                  {"id": "a-1", "claim": "Login returns tokens", "severity": "critical", "type": "api",
                   "test": {"method": "POST", "path": "/api/v1/auth/login", "expect": {"status": 200}}},
                  {"id": "a-2", "claim": "Sites store a timezone", "type": "sql",
                   "test": {"query": "timezone of site {siteId}", "expect": "UTC"}},
                  {"id": "a-3", "claim": "Devices page lists devices", "severity": "warning", "type": "ui",
                   "test": {"navigate": "/devices", "verify": "a device table"}}
                ]
                ```
                """;

        List<Assertion> assertions = parser.parse(raw);

        assertThat(assertions).extracting(Assertion::getId).containsExactly("a-1", "a-2", "a-3");
        assertThat(assertions).extracting(Assertion::getKind)
                .containsExactly(AssertionKind.API, AssertionKind.SQL, AssertionKind.UI);
        assertThat(assertions.get(1).getSeverity()).isEqualTo(Severity.INFO);
    }

    @Test
    void parse_shouldAcceptWrappedObjectAndEmptyList() {
        assertThat(parser.parse("{\"assertions\": []}")).isEmpty();
        assertThat(parser.parse("[]")).isEmpty();
    }

    @Test
    void parse_shouldRejectDuplicateIds() {
        String raw = """
                [
                  {"id": "dup", "claim": "one", "type": "sql", "test": {"query": "q", "expect": "e"}},
                  {"id": "dup", "claim": "two", "type": "sql", "test": {"query": "q", "expect": "e"}}
                ]
                """;

        assertThatThrownBy(() -> parser.parse(raw))
                .isInstanceOf(DocVerifyException.class)
                .hasMessageContaining("Duplicate assertion id 'dup'");
    }

    @Test
    void parse_shouldRejectIncompleteTests() {
        String raw = "[{\"id\": \"x\", \"claim\": \"c\", \"type\": \"api\", \"test\": {\"method\": \"GET\"}}]";

        assertThatThrownBy(() -> parser.parse(raw))
                .isInstanceOf(DocVerifyException.class)
                .hasMessageContaining("incomplete api test");
    }

    @Test
    void parse_shouldRejectProse() {
        assertThatThrownBy(() -> parser.parse("I could not find any testable claims."))
                .isInstanceOf(DocVerifyException.class);
        assertThatThrownBy(() -> parser.parse("  "))
                .isInstanceOf(DocVerifyException.class);
    }

    @Test
    void parse_shouldRejectUnknownType() {
        String raw = "[{\"id\": \"x\", \"claim\": \"c\", \"type\": \"grpc\", \"test\": {}}]";

        assertThatThrownBy(() -> parser.parse(raw)).isInstanceOf(DocVerifyException.class);
    }
}
