package com.lendingengine.store;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PoolStateRepository extends JpaRepository<PoolState, String> {
}
