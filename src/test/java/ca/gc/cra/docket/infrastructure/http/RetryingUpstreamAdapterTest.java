package ca.gc.cra.docket.infrastructure.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.docket.application.port.UpstreamPort;
import ca.gc.cra.docket.application.port.UpstreamRequest;
import ca.gc.cra.docket.application.port.UpstreamResponse;
import ca.gc.cra.docket.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RetryingUpstreamAdapterTest {
  private static final UpstreamRequest REQUEST =
      UpstreamRequest.get(URI.create("https://api.example.test/v2/projects/7/notes"), Map.of());

  private final List<Long> sleeps = new ArrayList<>();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void retriesServerErrorsWithLinearBackoff() throws Exception {
    Scripted delegate = new Scripted(new UpstreamResponse(503, ""), new UpstreamResponse(502, ""),
        new UpstreamResponse(200, "[]"));
    RetryingUpstreamAdapter adapter = new RetryingUpstreamAdapter(delegate, 2, 100, sleeps::add, metrics);

    UpstreamResponse response = adapter.send(REQUEST);

    assertEquals(200, response.status());
    assertEquals(3, delegate.calls);
    assertEquals(List.of(100L, 200L), sleeps);
    assertEquals(2, metrics.count("upstream.retry"));
  }

  @Test
  void returnsLastServerErrorWhenBudgetIsSpent() throws Exception {
    Scripted delegate = new Scripted(new UpstreamResponse(500, "a"), new UpstreamResponse(500, "b"));
    RetryingUpstreamAdapter adapter = new RetryingUpstreamAdapter(delegate, 1, 10, sleeps::add, metrics);

    UpstreamResponse response = adapter.send(REQUEST);

    assertEquals(500, response.status());
    assertEquals("b", response.body());
    assertEquals(2, delegate.calls);
  }

  @Test
  void clientErrorsAreNotRetried() throws Exception {
    Scripted delegate = new Scripted(new UpstreamResponse(404, ""));
    RetryingUpstreamAdapter adapter = new RetryingUpstreamAdapter(delegate, 3, 10, sleeps::add, metrics);

    assertEquals(404, adapter.send(REQUEST).status());
    assertEquals(1, delegate.calls);
    assertEquals(List.of(), sleeps);
  }

  @Test
  void transportFailuresBecomeTransientNetworkException() {
    Scripted delegate = new Scripted(new IOException("reset"), new IOException("reset again"));
    RetryingUpstreamAdapter adapter = new RetryingUpstreamAdapter(delegate, 1, 0, sleeps::add, metrics);

    TransientNetworkException ex = assertThrows(TransientNetworkException.class, () -> adapter.send(REQUEST));

    assertEquals(2, ex.attempts());
    assertEquals("reset again", ex.getCause().getMessage());
    assertEquals(2, delegate.calls);
  }

  @Test
  void recoversAfterTransportFailure() throws Exception {
    Scripted delegate = new Scripted(new IOException("reset"), new UpstreamResponse(200, "ok"));
    RetryingUpstreamAdapter adapter = new RetryingUpstreamAdapter(delegate, 2, 50, sleeps::add, metrics);

    assertEquals("ok", adapter.send(REQUEST).body());
    assertEquals(List.of(50L), sleeps);
  }

  @Test
  void rejectsInvalidBudget() {
    Scripted delegate = new Scripted();
    assertThrows(IllegalArgumentException.class,
        () -> new RetryingUpstreamAdapter(delegate, 11, 0, sleeps::add, metrics));
    assertThrows(IllegalArgumentException.class,
        () -> new RetryingUpstreamAdapter(delegate, 1, -1, sleeps::add, metrics));
  }

  private static final class Scripted implements UpstreamPort {
    private final Deque<Object> replies = new ArrayDeque<>();
    private int calls;

    Scripted(Object... replies) {
      this.replies.addAll(List.of(replies));
    }

    @Override
    public UpstreamResponse send(UpstreamRequest request) throws IOException {
      calls++;
      Object next = replies.removeFirst();
      if (next instanceof IOException ex) {
        throw ex;
      }
      return (UpstreamResponse) next;
    }
  }
}
