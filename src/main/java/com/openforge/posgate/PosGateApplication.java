package com.openforge.posgate;

import com.openforge.posgate.config.AuditProperties;
import com.openforge.posgate.config.AuthProperties;
import com.openforge.posgate.config.BootstrapProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AuthProperties.class,
        AuditProperties.class,
        BootstrapProperties.class
})
public class PosGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(PosGateApplication.class, args);
    }
}
