package com.dealplatform.negotiation.catalog;

import com.dealplatform.common.model.ClientProfile;
import com.dealplatform.common.model.MarketSnapshotKey;
import com.dealplatform.common.model.Vehicle;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read-only access to vehicles and clients. The negotiation core never writes through it.
 */
public interface Catalog {

    Mono<Vehicle> findVehicle(Long vehicleId);

    Mono<ClientProfile> findClient(Long clientId);

    Flux<Vehicle> findInStockVehicles();

    /** Every catalog vehicle of the segment, in stock or not. */
    Flux<Vehicle> findBySegment(MarketSnapshotKey segment);
}
