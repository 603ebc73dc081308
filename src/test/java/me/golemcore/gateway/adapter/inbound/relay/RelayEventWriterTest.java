package me.golemcore.gateway.adapter.inbound.relay;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RelayEventWriterTest {

    private final RelayEventWriter writer = new RelayEventWriter(new ObjectMapper());

    @Test
    void shouldEncodeProgressEvent() {
        RelayEvent event = new RelayEvent(RelayEventType.PROGRESS, "thinking...", RelayEvent.Origin.MESSAGE);

        assertEquals("event: progress\ndata: {\"content\":\"thinking...\"}\n\n", writer.encode(event));
    }

    @Test
    void shouldEncodeResponseEvent() {
        RelayEvent event = RelayEvent.notice("Upstream response timed out.", RelayEvent.Origin.TIMEOUT);

        assertEquals("event: response\ndata: {\"content\":\"Upstream response timed out.\"}\n\n",
                writer.encode(event));
    }

    @Test
    void shouldKeepNonAsciiAndEscapeNewlines() {
        RelayEvent event = new RelayEvent(RelayEventType.RESPONSE, "привет\nмир", RelayEvent.Origin.MESSAGE);

        assertEquals("event: response\ndata: {\"content\":\"привет\\nмир\"}\n\n", writer.encode(event));
    }

    @Test
    void shouldEncodeNullContent() {
        RelayEvent event = new RelayEvent(RelayEventType.RESPONSE, null, RelayEvent.Origin.MESSAGE);

        assertEquals("event: response\ndata: {\"content\":null}\n\n", writer.encode(event));
    }
}
