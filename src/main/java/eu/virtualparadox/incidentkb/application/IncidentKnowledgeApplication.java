package eu.virtualparadox.incidentkb.application;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "eu.virtualparadox.incidentkb")
public class IncidentKnowledgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(IncidentKnowledgeApplication.class, args);
    }
}
