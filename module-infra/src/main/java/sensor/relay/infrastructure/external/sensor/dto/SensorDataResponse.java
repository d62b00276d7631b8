package sensor.relay.infrastructure.external.sensor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One element of the multi-sensor feed array. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SensorDataResponse(
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("sensor_type") String sensorType,
    @JsonProperty("value") Double value,
    @JsonProperty("timestamp") Long timestamp) {}
