package com.dealplatform.negotiation.catalog.repository;

import com.dealplatform.negotiation.catalog.entity.VehicleEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface VehicleRepository extends ReactiveCrudRepository<VehicleEntity, Long> {

    Flux<VehicleEntity> findByInStockTrueOrderByIdAsc();
}
