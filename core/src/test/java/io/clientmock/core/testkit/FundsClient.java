package io.clientmock.core.testkit;

import io.clientmock.core.model.HttpMethod;
import io.clientmock.core.spi.BaseRequestBuilder;
import io.clientmock.core.spi.RequestDispatcher;
import java.util.List;
import java.util.Map;

/**
 * Hand-written stand-in for a generated client: {@code /api/funds} with an item builder whose
 * path parameter uses the generator's percent-encoded spelling.
 */
public final class FundsClient extends BaseRequestBuilder {

    public static final String BASE_URL = "https://api.example.test";

    public FundsClient(RequestDispatcher dispatcher) {
        super("{+baseurl}/api/funds{?top}", Map.of("baseurl", BASE_URL), dispatcher);
    }

    public FundItemRequestBuilder byFundId(String fundId) {
        return new FundItemRequestBuilder(withParameter("fund%2Did", fundId), requestDispatcher());
    }

    public List<Fund> list() {
        return requestDispatcher().sendCollection(newRequest(HttpMethod.GET).build(), Fund.class);
    }

    public List<Fund> list(int top) {
        return requestDispatcher()
                .sendCollection(newRequest(HttpMethod.GET).queryParameter("top", top).build(), Fund.class);
    }

    public Fund create(Fund fund) {
        return requestDispatcher().send(newRequest(HttpMethod.POST).body(true).build(), Fund.class);
    }

    /** Builder for {@code /api/funds/{fund-id}}. */
    public static final class FundItemRequestBuilder extends BaseRequestBuilder {

        FundItemRequestBuilder(Map<String, Object> pathParameters, RequestDispatcher dispatcher) {
            super("{+baseurl}/api/funds/{fund%2Did}{?%24select}", pathParameters, dispatcher);
        }

        public Fund get() {
            return requestDispatcher().send(newRequest(HttpMethod.GET).build(), Fund.class);
        }

        public Fund get(String select) {
            return requestDispatcher()
                    .send(newRequest(HttpMethod.GET).queryParameter("%24select", select).build(), Fund.class);
        }

        public String name() {
            return requestDispatcher().sendPrimitive(newRequest(HttpMethod.GET).build(), String.class);
        }

        public void delete() {
            requestDispatcher().sendNoContent(newRequest(HttpMethod.DELETE).build());
        }
    }
}
