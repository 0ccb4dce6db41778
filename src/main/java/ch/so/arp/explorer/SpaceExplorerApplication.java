package ch.so.arp.explorer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpaceExplorerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpaceExplorerApplication.class, args);
    }
}
