package sensor.relay.infrastructure.external.telegram.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramMessage(
    @JsonProperty("message_id") long messageId,
    @JsonProperty("chat") TelegramChat chat,
    @JsonProperty("text") String text) {

  public boolean isCommand() {
    return chat != null && text != null && text.startsWith("/");
  }
}
