package com.signalmachine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SignalMachineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalMachineApplication.class, args);
    }
}
