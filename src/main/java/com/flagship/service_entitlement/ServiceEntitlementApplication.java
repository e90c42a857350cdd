package com.flagship.service_entitlement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ServiceEntitlementApplication {

    public static void main(String[] args) {
        SpringApplication.run(ServiceEntitlementApplication.class, args);
    }
}
