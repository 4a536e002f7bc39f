package uy.gub.bps.pocketzombies;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PocketZombiesApplication {

    public static void main(String[] args) {
        SpringApplication.run(PocketZombiesApplication.class, args);
    }
}
