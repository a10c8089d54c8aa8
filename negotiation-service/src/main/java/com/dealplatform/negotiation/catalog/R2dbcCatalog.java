package com.dealplatform.negotiation.catalog;

import com.dealplatform.common.model.ClientProfile;
import com.dealplatform.common.model.FuelType;
import com.dealplatform.common.model.MarketSnapshotKey;
import com.dealplatform.common.model.OfferPreference;
import com.dealplatform.common.model.Transmission;
import com.dealplatform.common.model.Vehicle;
import com.dealplatform.common.model.VehicleCondition;
import com.dealplatform.negotiation.catalog.entity.ClientEntity;
import com.dealplatform.negotiation.catalog.entity.VehicleEntity;
import com.dealplatform.negotiation.catalog.repository.ClientRepository;
import com.dealplatform.negotiation.catalog.repository.VehicleRepository;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Component
public class R2dbcCatalog implements Catalog {

    private final VehicleRepository vehicleRepository;
    private final ClientRepository clientRepository;

    public R2dbcCatalog(VehicleRepository vehicleRepository, ClientRepository clientRepository) {
        this.vehicleRepository = vehicleRepository;
        this.clientRepository = clientRepository;
    }

    @Override
    public Mono<Vehicle> findVehicle(Long vehicleId) {
        return vehicleRepository.findById(vehicleId).map(R2dbcCatalog::toVehicle);
    }

    @Override
    public Mono<ClientProfile> findClient(Long clientId) {
        return clientRepository.findById(clientId).map(R2dbcCatalog::toClient);
    }

    @Override
    public Flux<Vehicle> findInStockVehicles() {
        return vehicleRepository.findByInStockTrueOrderByIdAsc().map(R2dbcCatalog::toVehicle);
    }

    @Override
    public Flux<Vehicle> findBySegment(MarketSnapshotKey segment) {
        return vehicleRepository.findAll()
            .map(R2dbcCatalog::toVehicle)
            .filter(v -> v.segment().equals(segment));
    }

    static Vehicle toVehicle(VehicleEntity e) {
        return new Vehicle(
            e.getId(),
            e.getVin(),
            e.getMake(),
            e.getModel(),
            e.getYear(),
            e.getVersion(),
            FuelType.valueOf(e.getFuelType()),
            Transmission.valueOf(e.getTransmission()),
            e.getMileage() != null ? e.getMileage() : 0,
            e.getPowerHp() != null ? e.getPowerHp() : 0,
            VehicleCondition.valueOf(e.getVehicleCondition()),
            e.getMarketValue(),
            e.getCostBasis(),
            Boolean.TRUE.equals(e.getInStock()));
    }

    static ClientProfile toClient(ClientEntity e) {
        return new ClientProfile(
            e.getId(),
            e.getFirstName(),
            e.getLastName(),
            e.getBudgetMin(),
            e.getBudgetMax(),
            e.getPreferredFuel() != null ? FuelType.valueOf(e.getPreferredFuel()) : null,
            e.getPreferredTransmission() != null ? Transmission.valueOf(e.getPreferredTransmission()) : null,
            e.getOfferPreference() != null ? OfferPreference.valueOf(e.getOfferPreference()) : OfferPreference.FLEXIBLE,
            e.getLoyaltyScore() != null ? e.getLoyaltyScore() : 0.0,
            e.getRiskScore() != null ? e.getRiskScore() : 0.5);
    }
}
