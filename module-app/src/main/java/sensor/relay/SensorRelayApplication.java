package sensor.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SensorRelayApplication {

  public static void main(String[] args) {
    SpringApplication.run(SensorRelayApplication.class, args);
  }
}
