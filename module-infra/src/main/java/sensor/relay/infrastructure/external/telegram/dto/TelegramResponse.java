package sensor.relay.infrastructure.external.telegram.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Envelope of every Bot API response. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramResponse<T>(
    @JsonProperty("ok") boolean ok,
    @JsonProperty("result") T result,
    @JsonProperty("error_code") Integer errorCode,
    @JsonProperty("description") String description) {}
