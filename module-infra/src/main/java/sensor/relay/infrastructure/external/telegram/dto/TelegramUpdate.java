package sensor.relay.infrastructure.external.telegram.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One entry of getUpdates. Only plain messages are read; other update kinds are skipped. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramUpdate(
    @JsonProperty("update_id") long updateId, @JsonProperty("message") TelegramMessage message) {}
