package se.ironpass_be;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class IronpassBeApplication {

    public static void main(String[] args) {
        SpringApplication.run(IronpassBeApplication.class, args);
    }

}
