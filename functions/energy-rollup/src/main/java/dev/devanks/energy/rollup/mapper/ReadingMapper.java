package dev.devanks.energy.rollup.mapper;

import dev.devanks.energy.rollup.entity.EnergyReadingEntity;
import dev.devanks.energy.rollup.model.EnergyReading;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class ReadingMapper {

    public EnergyReadingEntity mapToEntity(EnergyReading reading) {
        // readings are not unique per timestamp, so the id only needs to sort roughly by time
        String documentId = reading.getTimestamp() + "-" + UUID.randomUUID();

        return EnergyReadingEntity.builder()
                .id(documentId)
                .timestamp(reading.getTimestamp())
                .home(reading.getHome())
                .grid(reading.getGrid())
                .car(reading.getCar())
                .solar(reading.getSolar())
                .build();
    }

    public EnergyReading mapToModel(EnergyReadingEntity entity) {
        return EnergyReading.builder()
                .timestamp(entity.getTimestamp())
                .home(entity.getHome())
                .grid(entity.getGrid())
                .car(entity.getCar())
                .solar(entity.getSolar())
                .build();
    }
}
