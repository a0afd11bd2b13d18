package tw.gc.forecaster.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tw.gc.forecaster.regression.Regressor;
import tw.gc.forecaster.validation.WalkForwardValidator;

@Slf4j
@Configuration
public class ForecasterConfiguration {

    @Bean
    public Regressor regressor(ForecasterProperties properties) {
        Regressor regressor = properties.getRegressor().getType().create(properties.getRegressor().getAlpha());
        log.info("Base regressor: {}", regressor.name());
        return regressor;
    }

    @Bean
    public WalkForwardValidator walkForwardValidator(ForecasterProperties properties) {
        ForecasterProperties.Validation validation = properties.getValidation();
        return new WalkForwardValidator(validation.getFolds(), validation.getMetric());
    }
}
