package eu.virtualparadox.docassist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocAssistApplication {

    public static void main(final String[] args) {
        SpringApplication.run(DocAssistApplication.class, args);
    }
}
