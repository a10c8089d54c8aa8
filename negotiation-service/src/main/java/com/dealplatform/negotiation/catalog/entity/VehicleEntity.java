package com.dealplatform.negotiation.catalog.entity;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

@Data
@NoArgsConstructor
@Table("vehicles")
public class VehicleEntity {

    @Id
    private Long id;

    private String vin;

    private String make;

    private String model;

    @Column("model_year")
    private Integer year;

    private String version;

    private String fuelType;

    private String transmission;

    private Integer mileage;

    private Integer powerHp;

    private String vehicleCondition;

    private Double marketValue;

    private Double costBasis;

    private Boolean inStock;
}
