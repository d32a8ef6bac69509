package net.schedra.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SchedraApplication {
    public static void main(String[] args) {
        SpringApplication.run(SchedraApplication.class, args);
    }
}
