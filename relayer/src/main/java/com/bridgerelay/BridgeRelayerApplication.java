package com.bridgerelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class BridgeRelayerApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(BridgeRelayerApplication.class);
        application.setRegisterShutdownHook(false);
        ConfigurableApplicationContext context = application.run(args);
        RelayShutdownHook.install(context);
    }
}
