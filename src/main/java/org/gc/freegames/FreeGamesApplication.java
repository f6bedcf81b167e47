package org.gc.freegames;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.gc")
public class FreeGamesApplication {

    public static void main(String[] args) {
        SpringApplication.run(FreeGamesApplication.class, args);
    }

}
