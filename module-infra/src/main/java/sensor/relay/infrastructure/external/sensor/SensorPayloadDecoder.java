package sensor.relay.infrastructure.external.sensor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import sensor.relay.domain.model.Reading;
import sensor.relay.error.exception.FetchFailure;
import sensor.relay.error.exception.SensorFetchException;
import sensor.relay.infrastructure.external.sensor.dto.SensorDataResponse;

/**
 * Decodes the two payload shapes the feed is deployed with.
 *
 * <pre>
 * [{"device_id":"sensor1","sensor_type":"temperature","value":26.3,"timestamp":1717000000}, ...]
 * {"temperature": 26.3, "humidity": 55.0}
 * </pre>
 *
 * The flat object belongs to a single sensor; its readings get the configured default sensor id
 * and the current time.
 */
@RequiredArgsConstructor
public class SensorPayloadDecoder {

  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final String defaultSensorId;

  /**
   * @throws JsonProcessingException when the body is not JSON
   * @throws SensorFetchException with {@link FetchFailure#DECODE} when the JSON has the wrong shape
   */
  public List<Reading> decode(String body) throws JsonProcessingException {
    if (body == null || body.isBlank()) {
      throw new SensorFetchException(FetchFailure.DECODE, "empty body");
    }
    JsonNode root = objectMapper.readTree(body);
    if (root.isArray()) {
      return decodeArray(root);
    }
    if (root.isObject()) {
      return decodeFlat(root);
    }
    throw new SensorFetchException(
        FetchFailure.DECODE, "expected array or object, got " + root.getNodeType());
  }

  private List<Reading> decodeArray(JsonNode root) throws JsonProcessingException {
    List<Reading> readings = new ArrayList<>(root.size());
    for (int i = 0; i < root.size(); i++) {
      JsonNode element = root.get(i);
      if (!element.isObject()) {
        throw new SensorFetchException(FetchFailure.DECODE, "element " + i + " is not an object");
      }
      SensorDataResponse data = objectMapper.treeToValue(element, SensorDataResponse.class);
      readings.add(toReading(data, i));
    }
    return readings;
  }

  private Reading toReading(SensorDataResponse data, int index) {
    if (isBlank(data.deviceId())
        || isBlank(data.sensorType())
        || data.value() == null
        || data.timestamp() == null) {
      throw new SensorFetchException(
          FetchFailure.DECODE,
          "element " + index + " misses device_id, sensor_type, value or timestamp");
    }
    if (!Double.isFinite(data.value())) {
      throw new SensorFetchException(
          FetchFailure.DECODE, "element " + index + " has no finite value");
    }
    return new Reading(data.deviceId(), data.sensorType(), data.value(), data.timestamp());
  }

  private List<Reading> decodeFlat(JsonNode root) {
    long now = clock.instant().getEpochSecond();
    List<Reading> readings = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      // non-numeric fields (labels, units) and unnamed values are not readings
      if (field.getValue().isNumber() && !isBlank(field.getKey())) {
        readings.add(
            new Reading(defaultSensorId, field.getKey(), field.getValue().doubleValue(), now));
      }
    }
    if (readings.isEmpty()) {
      throw new SensorFetchException(FetchFailure.DECODE, "object has no numeric fields");
    }
    return readings;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
