package com.phillippitts.providerrouter;

import com.phillippitts.providerrouter.config.properties.CatalogProperties;
import com.phillippitts.providerrouter.config.properties.DispatchProperties;
import com.phillippitts.providerrouter.config.properties.HealthProperties;
import com.phillippitts.providerrouter.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        CatalogProperties.class,
        HealthProperties.class,
        DispatchProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class ProviderRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProviderRouterApplication.class, args);
    }

}
