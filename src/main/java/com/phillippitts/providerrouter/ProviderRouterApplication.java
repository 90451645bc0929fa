package com.phillippitts.providerrouter;

import com.phillippitts.providerrouter.config.properties.RoutingProperties;
import com.phillippitts.providerrouter.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        RoutingProperties.class,
        ThreadPoolProperties.class
})
public class ProviderRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProviderRouterApplication.class, args);
    }

}
