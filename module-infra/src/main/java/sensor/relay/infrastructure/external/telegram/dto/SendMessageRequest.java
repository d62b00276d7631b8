package sensor.relay.infrastructure.external.telegram.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SendMessageRequest(
    @JsonProperty("chat_id") long chatId,
    @JsonProperty("text") String text,
    @JsonProperty("parse_mode") String parseMode) {

  public static SendMessageRequest of(long chatId, String text, boolean markdown) {
    return new SendMessageRequest(chatId, text, markdown ? "Markdown" : null);
  }
}
