package com.dealplatform.agents;

import com.dealplatform.common.model.ClientProfile;
import com.dealplatform.common.model.FuelType;
import com.dealplatform.common.model.MarketSnapshot;
import com.dealplatform.common.model.MarketStats;
import com.dealplatform.common.model.OfferPreference;
import com.dealplatform.common.model.Transmission;
import com.dealplatform.common.model.Vehicle;
import com.dealplatform.common.model.VehicleCondition;

import java.time.Instant;

/** Shared vehicles, clients and snapshots for the agent tests. */
public final class AgentFixtures {

    public static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private AgentFixtures() {}

    /** 2023 Peugeot 3008 listed at 32 000, acquired at 26 000. */
    public static Vehicle target() {
        return new Vehicle(1L, "VF3MCYHZRPS000001", "Peugeot", "3008", 2023, "GT BlueHDi 130",
            FuelType.DIESEL, Transmission.AUTOMATIC, 8_000, 130, VehicleCondition.EXCELLENT,
            32_000, 26_000, true);
    }

    /** 2018 Renault Clio with 120 000 km. */
    public static Vehicle tradeIn() {
        return new Vehicle(7L, "VF15RBJ0A60000007", "Renault", "Clio", 2018, "dCi 90",
            FuelType.DIESEL, Transmission.MANUAL, 120_000, 90, VehicleCondition.GOOD,
            11_000, 9_000, false);
    }

    public static ClientProfile client(double budgetMin, double budgetMax) {
        return new ClientProfile(1L, "Claire", "Martin", budgetMin, budgetMax, FuelType.DIESEL,
            Transmission.AUTOMATIC, OfferPreference.PURCHASE, 0.8, 0.2);
    }

    public static ClientProfile client() {
        return client(25_000, 40_000);
    }

    public static MarketSnapshot snapshot(Vehicle vehicle, double avg, int listings) {
        return MarketSnapshot.of(vehicle.segment(),
            new MarketStats(avg, avg * 0.9, avg * 1.1, listings, 0.8), NOW);
    }
}
