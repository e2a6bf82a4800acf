package net.layerline.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LayerlineApplication {
    public static void main(String[] args) {
        SpringApplication.run(LayerlineApplication.class, args);
    }
}
