package tw.gc.forecaster;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FeatureForecasterApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeatureForecasterApplication.class, args);
    }
}
