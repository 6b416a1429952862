package io.clientmock.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.clientmock.core.config.MockSettings;
import io.clientmock.core.error.ClientMockException;
import io.clientmock.core.error.UnmatchedRequestException;
import io.clientmock.core.model.Expectation;
import io.clientmock.core.model.HttpMethod;
import io.clientmock.core.model.MatchResult;
import io.clientmock.core.model.RequestDescriptor;
import io.clientmock.core.model.ResponseKind;
import io.clientmock.core.predicate.RequestPredicates;
import io.clientmock.core.spi.ApiException;
import io.clientmock.core.testkit.Fund;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link StubEngine}.
 */
@DisplayName("StubEngine")
class StubEngineTest {

    private static final Fund ABC = new Fund("abc", "Alpha");
    private static final Fund XYZ = new Fund("xyz", "Omega");

    private static RequestDescriptor getFund(String fundId) {
        return new RequestDescriptor(HttpMethod.GET, "{+baseurl}/api/funds/{fund-id}", Map.of("fund-id", fundId));
    }

    @Nested
    @DisplayName("End-to-end scenario")
    class EndToEnd {

        @Test
        @DisplayName("GET /api/funds/{fundId} with fundId == abc answers abc and nothing else")
        void fundScenario() {
            var engine = new StubEngine();
            engine.register(Expectation.forTemplate(HttpMethod.GET, "/api/funds/{fundId}")
                    .responseType(Fund.class)
                    .returning(ABC)
                    .when(RequestPredicates.pathParameterEquals("fundId", "abc"))
                    .build());

            assertThat(engine.findMatch(getFund("abc"), ResponseKind.OBJECT, Fund.class)).isPresent();
            assertThat(engine.resolve(getFund("abc"), ResponseKind.OBJECT, Fund.class)).isEqualTo(ABC);
            assertThat(engine.findMatch(getFund("xyz"), ResponseKind.OBJECT, Fund.class)).isEmpty();
            assertThat(engine.resolve(getFund("xyz"), ResponseKind.OBJECT, Fund.class)).isNull();
        }
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("first registration wins among matching expectations")
        void firstRegistrationWins() {
            var engine = new StubEngine();
            engine.register(Expectation.forTemplate(HttpMethod.GET, "/api/funds/{id}")
                    .returning(ABC)
                    .build());
            engine.register(Expectation.forTemplate(HttpMethod.GET, "/api/funds/{id}")
                    .returning(XYZ)
                    .build());

            assertThat(engine.resolve(getFund("any"), ResponseKind.OBJECT, Fund.class)).isEqualTo(ABC);
        }

        @Test
        @DisplayName("predicates select between expectations for the same template")
        void predicatesSelect() {
            var engine = new StubEngine();
            engine.register(Expectation.forTemplate(HttpMethod.GET, "/api/funds/{id}")
                    .returning(ABC)
                    .when(RequestPredicates.pathParameterEquals("fundId", "abc"))
                    .build());
            engine.register(Expectation.forTemplate(HttpMethod.GET, "/api/funds/{id}")
                    .returning(XYZ)
                    .when(RequestPredicates.pathParameterEquals("fundId", "xyz"))
                    .build());

            assertThat(engine.resolve(getFund("abc"), ResponseKind.OBJECT, Fund.class)).isEqualTo(ABC);
            assertThat(engine.resolve(getFund("xyz"), ResponseKind.OBJECT, Fund.class)).isEqualTo(XYZ);
        }

        @Test
        @DisplayName("response kind and type must agree")
        void kindAndType() {
            var engine = new StubEngine();
            engine.register(Expectation.forTemplate(HttpMethod.GET, "/api/funds/{id}")
                    .kind(ResponseKind.COLLECTION)
                    .responseType(Fund.class)
                    .returning(List.of(ABC))
                    .build());

            assertThat(engine.findMatch(getFund("abc"), ResponseKind.OBJECT, Fund.class)).isEmpty();
            assertThat(engine.findMatch(getFund("abc"), ResponseKind.COLLECTION, String.class)).isEmpty();
            assertThat(engine.findMatch(getFund("abc"), ResponseKind.COLLECTION, Fund.class)).isPresent();
        }

        @Test
        @DisplayName("expectation without response type answers any type")
        void anyType() {
            var engine = new StubEngine();
            engine.register(Expectation.forTemplate(HttpMethod.GET, "/api/funds/{id}")
                    .returning("raw")
                    .build());

            assertThat(engine.findMatch(getFund("abc"), ResponseKind.OBJECT, Fund.class)).isPresent();
        }

        @Test
        @DisplayName("error outcome is thrown")
        void errorOutcome() {
            var engine = new StubEngine();
            engine.register(Expectation.forTemplate(HttpMethod.GET, "/api/funds/{id}")
                    .throwing(new ApiException("Fund not found", 404))
                    .build());

            assertThatThrownBy(() -> engine.resolve(getFund("nope"), ResponseKind.OBJECT, Fund.class))
                    .isInstanceOfSatisfying(
                            ApiException.class, e -> assertThat(e.responseStatusCode()).isEqualTo(404));
        }
    }

    @Nested
    @DisplayName("Unmatched requests")
    class Unmatched {

        @Test
        @DisplayName("return-default yields null, an empty list, or nothing")
        void returnDefault() {
            var engine = new StubEngine();

            assertThat(engine.resolve(getFund("abc"), ResponseKind.OBJECT, Fund.class)).isNull();
            assertThat(engine.resolve(getFund("abc"), ResponseKind.COLLECTION, Fund.class))
                    .isEqualTo(List.of());
            assertThat(engine.resolve(getFund("abc"), ResponseKind.NO_CONTENT, null)).isNull();
        }

        @Test
        @DisplayName("fail policy lists every expectation and why it was rejected")
        void failPolicy() {
            var engine = new StubEngine(MockSettings.builder()
                    .unmatched(MockSettings.UnmatchedPolicy.FAIL)
                    .build());
            engine.register(Expectation.forTemplate(HttpMethod.POST, "/api/funds/{id}").build());
            engine.register(Expectation.forTemplate(HttpMethod.GET, "/api/funds/{id}/activities")
                    .build());

            assertThatThrownBy(() -> engine.resolve(getFund("abc"), ResponseKind.OBJECT, Fund.class))
                    .isInstanceOf(UnmatchedRequestException.class)
                    .hasMessageContaining("No expectation matches GET {+baseurl}/api/funds/{fund-id}")
                    .hasMessageContaining("POST /api/funds/{id}")
                    .hasMessageContaining("method: expected POST but was GET")
                    .hasMessageContaining("template: expected /api/funds/{pathParam1}/activities")
                    .isInstanceOfSatisfying(
                            ClientMockException.class,
                            e -> assertThat(e.phase()).isEqualTo(ClientMockException.Phase.DISPATCH));
        }

        @Test
        @DisplayName("fail policy with no expectations says so")
        void failPolicyEmpty() {
            var engine = new StubEngine(MockSettings.builder()
                    .unmatched(MockSettings.UnmatchedPolicy.FAIL)
                    .build());

            assertThatThrownBy(() -> engine.resolve(getFund("abc"), ResponseKind.NO_CONTENT, null))
                    .isInstanceOf(UnmatchedRequestException.class)
                    .hasMessageContaining("No expectations are registered");
        }
    }

    @Test
    @DisplayName("explain reports every expectation in registration order")
    void explain() {
        var engine = new StubEngine();
        var matching = Expectation.forTemplate(HttpMethod.GET, "/api/funds/{id}").build();
        var unknownParameter = Expectation.forTemplate(HttpMethod.GET, "/api/funds/{id}")
                .when(RequestPredicates.pathParameterEquals("portfolioId", "p"))
                .build();
        engine.register(matching);
        engine.register(unknownParameter);

        List<MatchReport> reports = engine.explain(getFund("abc"));

        assertThat(reports).extracting(MatchReport::expectation).containsExactly(matching, unknownParameter);
        assertThat(reports.get(0).result()).isEqualTo(MatchResult.success());
        assertThat(reports.get(1).result().reason()).contains("portfolioId");
        assertThat(reports.get(0)).hasToString(matching.describe() + " -> matched");
    }
}
