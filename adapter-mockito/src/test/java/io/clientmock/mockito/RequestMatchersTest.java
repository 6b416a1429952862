package io.clientmock.mockito;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;

import io.clientmock.core.config.MockSettings;
import io.clientmock.core.model.Expectation;
import io.clientmock.core.model.HttpMethod;
import io.clientmock.core.model.RequestDescriptor;
import io.clientmock.core.predicate.RequestPredicate;
import io.clientmock.core.predicate.RequestPredicates;
import io.clientmock.core.spi.RequestDispatcher;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatcher;
import org.mockito.exceptions.verification.WantedButNotInvoked;

/** Tests for {@link RequestMatchers}. */
class RequestMatchersTest {

    private static final String ITEM_TEMPLATE = "{+baseurl}/api/funds/{fund%2Did}{?%24select}";

    private static RequestDescriptor request(HttpMethod method, String fundId) {
        return new RequestDescriptor(
                method, ITEM_TEMPLATE, Map.of("baseurl", "https://funds.example.test", "fund%2Did", fundId));
    }

    @Test
    @DisplayName("toString is the predicate description")
    void toStringIsDescription() {
        RequestPredicate predicate = RequestPredicates.methodIs(HttpMethod.GET)
                .and(RequestPredicates.pathParameterEquals("fundId", "abc"));

        assertThat(RequestMatchers.matching(predicate)).hasToString(predicate.describe());
        assertThat(RequestMatchers.request(HttpMethod.GET, "/api/funds/{id}"))
                .hasToString("(method == GET AND template ~ /api/funds/{pathParam1})");
    }

    @Test
    @DisplayName("request matcher follows the settings it is given")
    void requestMatcherWithSettings() {
        var hostMarker = MockSettings.builder().baseUrlMarker("{+host}").build();
        var hostRequest = RequestDescriptor.builder(HttpMethod.GET, "{+host}/api/funds/{fund-id}")
                .pathParameter("host", "https://funds.example.test")
                .pathParameter("fund-id", "abc")
                .build();
        var caseSensitive = MockSettings.builder().ignoreCase(false).build();

        assertThat(RequestMatchers.request(HttpMethod.GET, "/api/funds/{id}", hostMarker).matches(hostRequest))
                .isTrue();
        assertThat(RequestMatchers.request(HttpMethod.GET, "/api/funds/{id}").matches(hostRequest))
                .isFalse();
        assertThat(RequestMatchers.request(HttpMethod.GET, "/API/funds/{id}", caseSensitive)
                        .matches(request(HttpMethod.GET, "abc")))
                .isFalse();
        assertThat(RequestMatchers.request(HttpMethod.GET, "/API/funds/{id}").matches(request(HttpMethod.GET, "abc")))
                .isTrue();
    }

    @Test
    @DisplayName("null arguments never match")
    void nullNeverMatches() {
        assertThat(RequestMatchers.matching(RequestPredicates.always()).matches(null)).isFalse();
    }

    @Test
    @DisplayName("request matcher compares method and structure")
    void requestMatcher() {
        ArgumentMatcher<RequestDescriptor> getItem = RequestMatchers.request(HttpMethod.GET, "/api/funds/{fundId}");
        ArgumentMatcher<RequestDescriptor> anyItem = RequestMatchers.request(null, "/api/funds/{fundId}");

        assertThat(getItem.matches(request(HttpMethod.GET, "abc"))).isTrue();
        assertThat(getItem.matches(request(HttpMethod.POST, "abc"))).isFalse();
        assertThat(anyItem.matches(request(HttpMethod.POST, "abc"))).isTrue();
        assertThat(RequestMatchers.request(null, "/api/funds").matches(request(HttpMethod.GET, "abc"))).isFalse();
    }

    @Test
    @DisplayName("expectation matcher applies the settings")
    void expectationMatcher() {
        Expectation upperCase = Expectation.forTemplate(HttpMethod.GET, "/API/Funds/{id}").build();
        MockSettings caseSensitive = MockSettings.builder().ignoreCase(false).build();

        assertThat(RequestMatchers.expectation(upperCase, MockSettings.defaults()).matches(request(HttpMethod.GET, "abc")))
                .isTrue();
        assertThat(RequestMatchers.expectation(upperCase, caseSensitive).matches(request(HttpMethod.GET, "abc")))
                .isFalse();
    }

    @Test
    @DisplayName("expectation matcher for a builder compares parameter values")
    void builderExpectationMatcher() {
        Expectation forAbc = Expectation.forBuilder(
                        HttpMethod.GET, ITEM_TEMPLATE, Map.of("baseurl", "https://other.example.test", "fund%2Did", "abc"))
                .build();
        ArgumentMatcher<RequestDescriptor> matcher = RequestMatchers.expectation(forAbc, MockSettings.defaults());

        assertThat(matcher.matches(request(HttpMethod.GET, "abc"))).isTrue();
        assertThat(matcher.matches(request(HttpMethod.GET, "xyz"))).isFalse();
    }

    @Test
    @DisplayName("verification failures show the expected condition")
    void verificationMessage() {
        RequestDispatcher dispatcher = MockableClients.mockDispatcher(MockSettings.defaults());

        assertThatThrownBy(() -> verify(dispatcher)
                        .send(argThat(RequestMatchers.request(HttpMethod.GET, "/api/funds/{id}")), any()))
                .isInstanceOf(WantedButNotInvoked.class)
                .hasMessageContaining("template ~ /api/funds/{pathParam1}");
    }
}
