package io.clientmock.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.clientmock.core.error.ParameterNotFoundException;
import io.clientmock.core.naming.ResolvedParameter;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link RequestDescriptor}. */
@DisplayName("RequestDescriptor")
class RequestDescriptorTest {

    @Test
    @DisplayName("is a snapshot: later changes to the source map are not visible")
    void snapshot() {
        Map<String, Object> source = new HashMap<>();
        source.put("fund-id", "abc");
        var request = new RequestDescriptor(HttpMethod.GET, "/api/funds/{fund-id}", source);
        source.put("fund-id", "changed");

        assertThat(request.pathParameters()).containsEntry("fund-id", "abc");
        assertThatThrownBy(() -> request.pathParameters().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("keeps null values")
    void nullValues() {
        Map<String, Object> source = new HashMap<>();
        source.put("cursor", null);
        var request = new RequestDescriptor(HttpMethod.GET, "/api/pages/{cursor}", source);

        assertThat(request.pathParameters()).containsKey("cursor");
        assertThat(request.pathParameter("cursor")).isNull();
    }

    @Test
    @DisplayName("defaults: no query parameters, no headers, no body")
    void defaults() {
        var request = new RequestDescriptor(HttpMethod.DELETE, "/api/funds/{id}", null);

        assertThat(request.pathParameters()).isEmpty();
        assertThat(request.queryParameters()).isEmpty();
        assertThat(request.headers().isEmpty()).isTrue();
        assertThat(request.hasBody()).isFalse();
    }

    @Test
    @DisplayName("normalizedTemplate uses the default base URL marker")
    void normalizedTemplate() {
        var request = new RequestDescriptor(HttpMethod.GET, "{+baseurl}/api/funds/{fund%2Did}{?%24select}", Map.of());
        assertThat(request.normalizedTemplate()).isEqualTo("/api/funds/{pathParam1}{?queryParam1}");
    }

    @Test
    @DisplayName("logical lookups go through naming variations")
    void logicalLookups() {
        var request = RequestDescriptor.builder(HttpMethod.GET, "/api/funds/{fund%2Did}{?%24top}")
                .pathParameter("fund%2Did", "abc")
                .queryParameter("%24top", 10)
                .build();

        assertThat(request.pathParameter("fundId")).isEqualTo("abc");
        assertThat(request.queryParameter("top")).isEqualTo(10);
        assertThat(request.findPathParameter("portfolioId")).isEmpty();
        assertThat(request.findQueryParameter("top").map(ResolvedParameter::key)).contains("%24top");
        assertThatThrownBy(() -> request.pathParameter("portfolioId")).isInstanceOf(ParameterNotFoundException.class);
    }

    @Test
    @DisplayName("method is required")
    void methodRequired() {
        assertThatThrownBy(() -> new RequestDescriptor(null, "/x", Map.of())).isInstanceOf(NullPointerException.class);
    }
}
