package com.dealplatform.marketdata.controller;

import com.dealplatform.common.model.FuelType;
import com.dealplatform.common.model.MarketSnapshot;
import com.dealplatform.common.model.MarketSnapshotKey;
import com.dealplatform.marketdata.cache.MarketSnapshotCache;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/market-data")
public class MarketDataController {

    private final MarketSnapshotCache cache;

    public MarketDataController(MarketSnapshotCache cache) {
        this.cache = cache;
    }

    @GetMapping("/snapshot")
    public Mono<ResponseEntity<MarketSnapshot>> snapshot(@RequestParam String make,
                                                         @RequestParam String model,
                                                         @RequestParam int year,
                                                         @RequestParam FuelType fuel) {
        return cache.get(MarketSnapshotKey.of(make, model, year, fuel))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
