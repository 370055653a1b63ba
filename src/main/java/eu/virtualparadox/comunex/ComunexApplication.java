package eu.virtualparadox.comunex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ComunexApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComunexApplication.class, args);
    }
}
