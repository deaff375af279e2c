package io.shortcast.demo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Shortcast demo: the starter wires everything from {@code application.yml} and the
 * collaborator beans in {@link DemoCollaborators}.
 *
 * <p>Run with: mvn install -DskipTests && mvn -f samples/shortcast-demo/pom.xml spring-boot:run
 *
 * <p>Modes:
 * <pre>
 * --mode=run-once --force-fetch   fetch now, publish one item, exit
 * --mode=fetch-only               fetch if the cooldown allows, exit
 * (no arguments)                  run the daily schedule until stopped
 * </pre>
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
