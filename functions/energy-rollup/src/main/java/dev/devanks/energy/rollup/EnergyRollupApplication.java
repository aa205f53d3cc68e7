package dev.devanks.energy.rollup;

import com.google.cloud.spring.data.firestore.repository.config.EnableReactiveFirestoreRepositories;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@EnableReactiveFirestoreRepositories
public class EnergyRollupApplication {
    public static void main(String[] args) {
        SpringApplication.run(EnergyRollupApplication.class, args);
    }
}
