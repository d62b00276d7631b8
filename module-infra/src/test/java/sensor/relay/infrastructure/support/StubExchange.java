package sensor.relay.infrastructure.support;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Builds a real {@link WebClient} whose transport is replaced by a canned response.
 *
 * <p>Unlike a Mockito chain, status handling and body decoding still run through WebClient.
 */
public final class StubExchange {

  private final List<ClientRequest> requests = new ArrayList<>();
  private final Function<ClientRequest, Mono<ClientResponse>> responder;

  private StubExchange(Function<ClientRequest, Mono<ClientResponse>> responder) {
    this.responder = responder;
  }

  public static StubExchange json(HttpStatus status, String body) {
    return new StubExchange(
        request ->
            Mono.just(
                ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build()));
  }

  public static StubExchange failing(Throwable error) {
    return new StubExchange(request -> Mono.error(error));
  }

  public WebClient webClient(String baseUrl) {
    ExchangeFunction exchange =
        request -> {
          requests.add(request);
          return responder.apply(request);
        };
    return WebClient.builder().baseUrl(baseUrl).exchangeFunction(exchange).build();
  }

  public List<ClientRequest> requests() {
    return requests;
  }
}
