package com.dealplatform.negotiation.catalog.repository;

import com.dealplatform.negotiation.catalog.entity.ClientEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ClientRepository extends ReactiveCrudRepository<ClientEntity, Long> {
}
