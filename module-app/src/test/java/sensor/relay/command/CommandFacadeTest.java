package sensor.relay.command;

import static org.assertj.core.api.Assertions.assertThat;
import static sensor.relay.support.Readings.temperature;

import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import sensor.relay.config.SensorDisplayProperties;
import sensor.relay.config.StatusProperties;
import sensor.relay.domain.model.AlertFlagKey;
import sensor.relay.domain.model.Bound;
import sensor.relay.domain.model.ThresholdKey;
import sensor.relay.domain.service.AlertFlagTable;
import sensor.relay.domain.service.ThresholdStore;
import sensor.relay.error.exception.FetchFailure;
import sensor.relay.error.exception.SensorFetchException;
import sensor.relay.sensor.SensorDirectory;
import sensor.relay.service.status.StatusRenderer;
import sensor.relay.support.ScriptedSensorFeed;
import sensor.relay.support.TestLogicExecutors;

@DisplayName("CommandFacade")
class CommandFacadeTest {

  private static final long CHAT = 42L;
  private static final ThresholdKey TEMP_MAX = ThresholdKey.of("sensor1", "temperature", Bound.MAX);

  private ThresholdStore store;
  private AlertFlagTable flags;
  private ScriptedSensorFeed feed;
  private CommandFacade facade;

  @BeforeEach
  void setUp() {
    store = new ThresholdStore();
    flags = new AlertFlagTable();
    feed = new ScriptedSensorFeed();
    SensorDirectory directory =
        new SensorDirectory(new SensorDisplayProperties(Map.of("sensor1", "Lounge")));
    facade =
        new CommandFacade(
            new BotCommandParser(directory),
            store,
            flags,
            feed,
            new StatusRenderer(directory, new StatusProperties("UTC")),
            directory,
            TestLogicExecutors.plain());
  }

  @Nested
  @DisplayName("thresholds")
  class Thresholds {

    @Test
    @DisplayName("/set stores the bound and confirms it")
    void setStoresBound() {
      CommandReply reply = facade.handle(CHAT, "/set Lounge temperature max 25");

      assertThat(store.get(CHAT).find(TEMP_MAX)).hasValue(25.0);
      assertThat(reply.text()).isEqualTo("🔺 MAX threshold for temperature at Lounge: 25.0");
      assertThat(reply.markdown()).isFalse();
    }

    @Test
    @DisplayName("a second /set replaces the value")
    void setReplaces() {
      facade.handle(CHAT, "/set sensor1 temperature max 25");
      facade.handle(CHAT, "/set sensor1 temperature max 27,5");

      assertThat(store.get(CHAT).find(TEMP_MAX)).hasValue(27.5);
      assertThat(store.get(CHAT).size()).isEqualTo(1);
    }

    @Test
    @DisplayName("/clear removes the bound and lowers its flag")
    void clearRemovesBoundAndFlag() {
      store.set(CHAT, TEMP_MAX, 25.0);
      flags.raise(AlertFlagKey.of(CHAT, TEMP_MAX));

      CommandReply reply = facade.handle(CHAT, "/clear sensor1 temperature max");

      assertThat(store.get(CHAT).isEmpty()).isTrue();
      assertThat(flags.isAlerting(AlertFlagKey.of(CHAT, TEMP_MAX))).isFalse();
      assertThat(reply.text()).startsWith("🗑 Removed MAX threshold");
    }

    @Test
    void clearUnknownBound() {
      CommandReply reply = facade.handle(CHAT, "/clear sensor1 temperature min");

      assertThat(reply.text()).isEqualTo("No MIN threshold for temperature at Lounge was set.");
    }

    @Test
    @DisplayName("/thresholds lists only the caller's bounds")
    void listsOwnBounds() {
      store.set(CHAT, TEMP_MAX, 25.0);
      store.set(7L, ThresholdKey.of("sensor1", "humidity", Bound.MIN), 30.0);

      CommandReply reply = facade.handle(CHAT, "/thresholds");

      assertThat(reply.text()).isEqualTo("Your thresholds:\n• Lounge temperature max: 25.0");
    }

    @Test
    void listWhenEmpty() {
      assertThat(facade.handle(CHAT, "/thresholds").text()).startsWith("You have no thresholds");
    }
  }

  @Nested
  @DisplayName("/status")
  class Status {

    @Test
    void rendersCurrentReadings() {
      feed.thenReturn(temperature("sensor1", 21.0));

      CommandReply reply = facade.handle(CHAT, "/status");

      assertThat(reply.markdown()).isTrue();
      assertThat(reply.text()).contains("📍 *Lounge* - Temperature: *21.0 °C*");
    }

    @Test
    @DisplayName("a failed fetch yields the unavailable text and leaves the stores alone")
    void fetchFailure() {
      store.set(CHAT, TEMP_MAX, 25.0);
      feed.thenFail(new SensorFetchException(FetchFailure.TRANSPORT, "timeout"));

      CommandReply reply = facade.handle(CHAT, "/status");

      assertThat(reply.text()).isEqualTo(CommandFacade.STATUS_UNAVAILABLE);
      assertThat(store.get(CHAT).find(TEMP_MAX)).hasValue(25.0);
      assertThat(flags.size()).isZero();
    }
  }

  @Nested
  @DisplayName("rejections")
  class Rejections {

    @Test
    void invalidCommandMessageIsReturned() {
      CommandReply reply = facade.handle(CHAT, "/set sensor1 temperature max warm");

      assertThat(reply.text()).isEqualTo("❌ Threshold value must be a finite number, got: warm");
      assertThat(store.get(CHAT).isEmpty()).isTrue();
    }

    @Test
    void unknownCommand() {
      assertThat(facade.handle(CHAT, "/reboot").text()).isEqualTo("❌ Unknown command: /reboot");
    }
  }

  @Test
  @DisplayName("/help lists every command with its usage")
  void helpListsCommands() {
    CommandReply reply = facade.handle(CHAT, "/help");

    assertThat(reply.markdown()).isTrue();
    for (CommandType type : CommandType.values()) {
      assertThat(reply.text()).contains("`" + type.usage() + "` - " + type.description());
    }
  }

  @Test
  void startGreets() {
    assertThat(facade.handle(CHAT, "/start").text()).startsWith("👋 Welcome!");
  }
}
