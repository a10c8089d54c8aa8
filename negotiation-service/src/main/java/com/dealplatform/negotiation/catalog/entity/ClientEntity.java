package com.dealplatform.negotiation.catalog.entity;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Client profile row. Preferences are stored as enum names; a {@code null} fuel or
 * transmission preference means "any".
 */
@Data
@NoArgsConstructor
@Table("clients")
public class ClientEntity {

    @Id
    private Long id;

    private String firstName;

    private String lastName;

    private Double budgetMin;

    private Double budgetMax;

    private String preferredFuel;

    private String preferredTransmission;

    private String offerPreference;

    private Double loyaltyScore;

    private Double riskScore;
}
