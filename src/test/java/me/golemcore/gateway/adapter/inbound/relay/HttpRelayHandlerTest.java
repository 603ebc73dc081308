package me.golemcore.gateway.adapter.inbound.relay;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.domain.model.InboundMessage;
import me.golemcore.gateway.domain.model.OutboundMessage;
import me.golemcore.gateway.port.outbound.MessageBusPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.web.reactive.server.FluxExchangeResult;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HttpRelayHandlerTest {

    private static final String FAILURE_NOTICE = "I could not process this message. Please retry.";
    private static final String TIMEOUT_NOTICE = "Upstream response timed out.";
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE = new ParameterizedTypeReference<>() {
    };

    private CorrelationRegistry registry;
    private RelayOutboundDispatcher dispatcher;
    private MessageBusPort messageBus;
    private AtomicBoolean accepting;
    private Supplier<String> requestIdGenerator;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        registry = new CorrelationRegistry();
        dispatcher = new RelayOutboundDispatcher(registry);
        messageBus = mock(MessageBusPort.class);
        accepting = new AtomicBoolean(true);
        requestIdGenerator = RelayMetadata::newRequestId;
        bindClient(Duration.ofSeconds(900));
    }

    @Test
    void shouldStreamProgressThenResponseAndReleaseRegistryEntry() throws Exception {
        CountDownLatch progressSeen = new CountDownLatch(1);
        AtomicInteger pendingWhileOpen = new AtomicInteger(-1);
        doAnswer(invocation -> {
            InboundMessage inbound = invocation.getArgument(0);
            String requestId = requestIdOf(inbound);
            CompletableFuture.runAsync(() -> {
                dispatcher.deliver(reply(requestId, "thinking...", true));
                await(progressSeen);
                pendingWhileOpen.set(registry.size());
                dispatcher.deliver(reply(requestId, "hello back", false));
            });
            return null;
        }).when(messageBus).publishInbound(any());

        FluxExchangeResult<ServerSentEvent<String>> result = post(Map.of(
                "sender_id", "u1", "chat_id", "c1", "content", "hi"))
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .expectHeader().valueEquals("Cache-Control", "no-cache")
                .expectHeader().valueEquals("X-Accel-Buffering", "no")
                .returnResult(SSE_TYPE);

        StepVerifier.create(result.getResponseBody())
                .assertNext(event -> {
                    assertEquals("progress", event.event());
                    assertEquals("{\"content\":\"thinking...\"}", event.data());
                })
                .then(progressSeen::countDown)
                .assertNext(event -> {
                    assertEquals("response", event.event());
                    assertEquals("{\"content\":\"hello back\"}", event.data());
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertEquals(1, pendingWhileOpen.get());
        assertEquals(0, registry.size());
    }

    @Test
    void shouldPublishInboundWithMergedMetadata() {
        ArgumentCaptor<InboundMessage> captor = ArgumentCaptor.forClass(InboundMessage.class);
        doAnswer(invocation -> {
            InboundMessage inbound = invocation.getArgument(0);
            dispatcher.deliver(reply(requestIdOf(inbound), "ok", false));
            return null;
        }).when(messageBus).publishInbound(captor.capture());

        List<ServerSentEvent<String>> events = post(Map.of(
                "senderId", "u1",
                "chatId", "c1",
                "content", "hi",
                "metadata", Map.of("trace", "t-1", "http_relay", Map.of("origin", "router"))))
                .expectStatus().isOk()
                .returnResult(SSE_TYPE)
                .getResponseBody()
                .collectList()
                .block(Duration.ofSeconds(5));

        assertEquals(1, events.size());
        InboundMessage inbound = captor.getValue();
        assertEquals("http_relay", inbound.getChannel());
        assertEquals("u1", inbound.getSenderId());
        assertEquals("c1", inbound.getChatId());
        assertEquals("hi", inbound.getContent());
        assertTrue(inbound.getMedia().isEmpty());
        assertEquals("t-1", inbound.getMetadata().get("trace"));
        Map<?, ?> relay = (Map<?, ?>) inbound.getMetadata().get("http_relay");
        assertEquals("router", relay.get("origin"));
        assertTrue(((String) relay.get("request_id")).matches("[0-9a-f]{32}"));
    }

    @Test
    void shouldRejectMissingContentWithoutOpeningStream() {
        post(Map.of("sender_id", "u1", "chat_id", "c1"))
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Missing sender_id/chat_id/content");

        verify(messageBus, never()).publishInbound(any());
        assertEquals(0, registry.size());
    }

    @Test
    void shouldRejectMalformedJson() {
        webTestClient.post()
                .uri("/message")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{oops")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Invalid JSON body");

        verify(messageBus, never()).publishInbound(any());
    }

    @Test
    void shouldRejectNonObjectPayload() {
        webTestClient.post()
                .uri("/message")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("[\"a\"]")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Payload must be an object");
    }

    @Test
    void shouldRejectRequestsWhileNotAccepting() {
        accepting.set(false);

        post(Map.of("sender_id", "u1", "chat_id", "c1", "content", "hi"))
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("Relay is not accepting requests");

        verify(messageBus, never()).publishInbound(any());
    }

    @Test
    void shouldEmitFailureNoticeWhenPublishFails() {
        doThrow(new IllegalStateException("agent unreachable")).when(messageBus).publishInbound(any());

        List<ServerSentEvent<String>> events = collect(Map.of("sender_id", "u1", "chat_id", "c1", "content", "hi"));

        assertEquals(1, events.size());
        assertEquals("response", events.get(0).event());
        assertEquals("{\"content\":\"" + FAILURE_NOTICE + "\"}", events.get(0).data());
        assertEquals(0, registry.size());
    }

    @Test
    void shouldEmitTimeoutNoticeWhenBackendStaysSilent() {
        bindClient(Duration.ofMillis(300));
        AtomicInteger pendingAtPublish = new AtomicInteger(-1);
        doAnswer(invocation -> {
            pendingAtPublish.set(registry.size());
            return null;
        }).when(messageBus).publishInbound(any());

        List<ServerSentEvent<String>> events = collect(Map.of("sender_id", "u1", "chat_id", "c1", "content", "hi"));

        assertEquals(1, events.size());
        assertEquals("response", events.get(0).event());
        assertEquals("{\"content\":\"" + TIMEOUT_NOTICE + "\"}", events.get(0).data());
        assertEquals(1, pendingAtPublish.get());
        assertEquals(0, registry.size());
    }

    @Test
    void shouldIgnoreUnrelatedAndLateMessages() {
        doAnswer(invocation -> {
            InboundMessage inbound = invocation.getArgument(0);
            String requestId = requestIdOf(inbound);
            dispatcher.deliver(OutboundMessage.builder().channel("email").content("not for relay").build());
            dispatcher.deliver(reply("someone-else", "wrong request", false));
            dispatcher.deliver(reply(requestId, "mine", false));
            dispatcher.deliver(reply(requestId, "after the end", false));
            return null;
        }).when(messageBus).publishInbound(any());

        List<ServerSentEvent<String>> events = collect(Map.of("sender_id", "u1", "chat_id", "c1", "content", "hi"));

        assertEquals(1, events.size());
        assertEquals("{\"content\":\"mine\"}", events.get(0).data());
        assertEquals(0, registry.size());
    }

    @Test
    void shouldKeepConcurrentRequestsApart() {
        doAnswer(invocation -> {
            InboundMessage inbound = invocation.getArgument(0);
            String requestId = requestIdOf(inbound);
            CompletableFuture.runAsync(() -> {
                dispatcher.deliver(reply(requestId, "progress for " + inbound.getChatId(), true));
                dispatcher.deliver(reply(requestId, "answer for " + inbound.getChatId(), false));
            });
            return null;
        }).when(messageBus).publishInbound(any());

        CompletableFuture<List<ServerSentEvent<String>>> first = CompletableFuture
                .supplyAsync(() -> collect(Map.of("sender_id", "u1", "chat_id", "chat-A", "content", "a")));
        CompletableFuture<List<ServerSentEvent<String>>> second = CompletableFuture
                .supplyAsync(() -> collect(Map.of("sender_id", "u2", "chat_id", "chat-B", "content", "b")));

        List<ServerSentEvent<String>> eventsA = first.join();
        List<ServerSentEvent<String>> eventsB = second.join();

        assertEquals(List.of("{\"content\":\"progress for chat-A\"}", "{\"content\":\"answer for chat-A\"}"),
                eventsA.stream().map(ServerSentEvent::data).toList());
        assertEquals(List.of("{\"content\":\"progress for chat-B\"}", "{\"content\":\"answer for chat-B\"}"),
                eventsB.stream().map(ServerSentEvent::data).toList());
        assertEquals(0, registry.size());
    }

    @Test
    void shouldAcceptLargeContentBelowBodyLimit() {
        String content = "x".repeat(300_000);
        ArgumentCaptor<InboundMessage> captor = ArgumentCaptor.forClass(InboundMessage.class);
        doAnswer(invocation -> {
            InboundMessage inbound = invocation.getArgument(0);
            dispatcher.deliver(reply(requestIdOf(inbound), "got it", false));
            return null;
        }).when(messageBus).publishInbound(captor.capture());

        List<ServerSentEvent<String>> events = collect(Map.of("sender_id", "u1", "chat_id", "c1", "content", content));

        assertEquals(1, events.size());
        assertEquals("{\"content\":\"got it\"}", events.get(0).data());
        assertEquals(content, captor.getValue().getContent());
    }

    @Test
    void shouldRejectBodyAboveLimitWithPayloadTooLarge() {
        String content = "x".repeat(HttpRelayHandler.MAX_BODY_BYTES + 1);

        post(Map.of("sender_id", "u1", "chat_id", "c1", "content", content))
                .expectStatus().isEqualTo(413)
                .expectBody()
                .jsonPath("$.error").isEqualTo("Payload too large");

        verify(messageBus, never()).publishInbound(any());
        assertEquals(0, registry.size());
    }

    @Test
    void shouldEmitFailureNoticeOnDuplicateRequestIdAndKeepExistingEntry() {
        DeliveryChannel existing = registry.register("fixed-id");
        requestIdGenerator = () -> "fixed-id";

        List<ServerSentEvent<String>> events = collect(Map.of("sender_id", "u1", "chat_id", "c1", "content", "hi"));

        assertEquals(1, events.size());
        assertEquals("response", events.get(0).event());
        assertEquals("{\"content\":\"" + FAILURE_NOTICE + "\"}", events.get(0).data());
        verify(messageBus, never()).publishInbound(any());
        assertEquals(1, registry.size());
        assertSame(existing, registry.lookup("fixed-id").orElseThrow());
        assertTrue(existing.isOpen());
    }

    @Test
    void shouldEmitFailureNoticeWhenStreamFailsUnexpectedly() {
        RelayStreamEmitter failingEmitter = mock(RelayStreamEmitter.class);
        when(failingEmitter.stream(any(), any())).thenReturn(Flux.error(new IllegalStateException("broken pipe")));
        bindClient(failingEmitter);

        List<ServerSentEvent<String>> events = collect(Map.of("sender_id", "u1", "chat_id", "c1", "content", "hi"));

        assertEquals(1, events.size());
        assertEquals("response", events.get(0).event());
        assertEquals("{\"content\":\"" + FAILURE_NOTICE + "\"}", events.get(0).data());
        verify(messageBus).publishInbound(any());
        assertEquals(0, registry.size());
    }

    private void bindClient(Duration timeout) {
        bindClient(new RelayStreamEmitter(timeout, TIMEOUT_NOTICE, "Relay channel stopped."));
    }

    private void bindClient(RelayStreamEmitter streamEmitter) {
        ObjectMapper objectMapper = new ObjectMapper();
        HttpRelayHandler handler = new HttpRelayHandler(
                registry,
                messageBus,
                new RelayRequestReader(objectMapper),
                streamEmitter,
                new RelayEventWriter(objectMapper),
                accepting::get,
                FAILURE_NOTICE,
                () -> requestIdGenerator.get());
        webTestClient = WebTestClient.bindToRouterFunction(handler.routes("/message"))
                .handlerStrategies(HttpRelayHandler.handlerStrategies())
                .configureClient()
                .responseTimeout(Duration.ofSeconds(5))
                .build();
    }

    private WebTestClient.ResponseSpec post(Map<String, Object> body) {
        return webTestClient.post()
                .uri("/message")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    private List<ServerSentEvent<String>> collect(Map<String, Object> body) {
        return post(body)
                .expectStatus().isOk()
                .returnResult(SSE_TYPE)
                .getResponseBody()
                .collectList()
                .block(Duration.ofSeconds(5));
    }

    private static String requestIdOf(InboundMessage inbound) {
        return RelayMetadata.resolveRequestId(inbound.getMetadata()).orElseThrow();
    }

    private static OutboundMessage reply(String requestId, String content, boolean progress) {
        return OutboundMessage.builder()
                .channel("http_relay")
                .content(content)
                .metadata(Map.of("progress", Map.of("is_progress", progress, "request_id", requestId)))
                .build();
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
