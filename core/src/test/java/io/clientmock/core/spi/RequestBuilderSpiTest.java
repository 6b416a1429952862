package io.clientmock.core.spi;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import io.clientmock.core.engine.StubRequestDispatcher;
import io.clientmock.core.model.Expectation;
import io.clientmock.core.model.HttpMethod;
import io.clientmock.core.model.ResponseKind;
import io.clientmock.core.testkit.FundsClient;
import org.junit.jupiter.api.Test;

/** The builder capability interface as seen through {@link BaseRequestBuilder}. */
class RequestBuilderSpiTest {

    @Test
    void childBuilderCopiesParentParameters() {
        FundsClient client = new FundsClient(new StubRequestDispatcher());

        RequestBuilder item = client.byFundId("abc");

        assertThat(item.urlTemplate()).isEqualTo("{+baseurl}/api/funds/{fund%2Did}{?%24select}");
        assertThat(item.pathParameters())
                .containsExactly(entry("baseurl", FundsClient.BASE_URL), entry("fund%2Did", "abc"));
        assertThat(client.pathParameters()).containsOnlyKeys("baseurl");
        assertThat(item.requestDispatcher()).isSameAs(client.requestDispatcher());
    }

    @Test
    void pathParametersAreReadOnly() {
        RequestBuilder item = new FundsClient(new StubRequestDispatcher()).byFundId("abc");

        assertThatThrownBy(() -> item.pathParameters().put("fund%2Did", "xyz"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void requestsCarryBuilderState() {
        StubRequestDispatcher dispatcher = new StubRequestDispatcher();
        dispatcher.expect(Expectation.forTemplate(HttpMethod.DELETE, "/api/funds/{id}")
                .kind(ResponseKind.NO_CONTENT)
                .throwing(new ApiException(409))
                .build());

        var item = new FundsClient(dispatcher).byFundId("abc");

        assertThatThrownBy(item::delete)
                .isInstanceOfSatisfying(ApiException.class, e -> assertThat(e.responseStatusCode()).isEqualTo(409))
                .hasMessage("API request failed with status 409");
        assertThat(item.toString()).startsWith("FundItemRequestBuilder[{+baseurl}/api/funds/{fund%2Did}");
    }

    @Test
    void nullTemplateOrDispatcherRejected() {
        assertThatThrownBy(() -> new FundsClient(null)).isInstanceOf(NullPointerException.class);
    }
}
